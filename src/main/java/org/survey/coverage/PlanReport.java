package org.survey.coverage;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/* Resumen final de una planificación. */
public final class PlanReport {
    int    vertices;
    int    angleSamples;
    double spacingM;
    double angleDeg;
    int    sweepLines;
    int    waypoints;
    double lengthM;
    double areaM2;
    long   tiempoMs;

    static PlanReport of(Candidate best, PlannerConfig cfg, int vertices, double area, long millis) {
        PlanReport r = new PlanReport();
        r.vertices = vertices;
        r.angleSamples = cfg.angleSamples;
        r.spacingM = cfg.spacingM;
        r.angleDeg = best.angleDeg;
        r.sweepLines = best.sweepLines;
        r.waypoints = best.path.size();
        r.lengthM = best.length;
        r.areaM2 = area;
        r.tiempoMs = millis;
        return r;
    }

    // líneas del resumen, una por entrada del logger
    String[] formatResumen() {
        // Números con miles y 3 decimales, estilo 1,468,792.762
        DecimalFormatSymbols sym = new DecimalFormatSymbols(Locale.US);
        DecimalFormat f3 = new DecimalFormat("#,##0.000", sym);
        DecimalFormat f0 = new DecimalFormat("#,##0", sym);

        return new String[] {
            "------------------------------",
            "RESUMEN FINAL (COBERTURA)",
            "Vértices           : " + vertices,
            "Espaciado          : " + f3.format(spacingM) + " m",
            "Ángulos muestreados: " + angleSamples,
            "Mejor ángulo       : " + f3.format(angleDeg) + " °",
            "Líneas de barrido  : " + sweepLines,
            "Waypoints          : " + waypoints,
            "Largo de la ruta   : " + f3.format(lengthM) + " m",
            "Área del polígono  : " + f3.format(areaM2) + " m²",
            "Tiempo total       : " + f0.format(tiempoMs) + " ms (" + f3.format(tiempoMs / 1000.0) + " s)",
            "------------------------------"
        };
    }

    void logTo(PlanLogger log) {
        if (log == null) return;
        for (String line : formatResumen()) log.log(line);
    }
}
