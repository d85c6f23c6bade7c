package org.survey.coverage;

/**
 * Proyección geodésica local. El planificador nunca la llama: el que invoca
 * proyecta antes y después. forward(inverse(p)) debe ser p con error submétrico
 * sobre el área planificada.
 */
public interface Projector {

    Point forward(double lat, double lon);

    // devuelve {lat, lon} en grados
    double[] inverse(Point p);
}
