package org.survey.coverage;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Uso: {@code CoverageCli [input.csv|-] [spacing_m] [angle_samples] [output.csv|-] [log.txt]}
 */
public class CoverageCli {

    // polígono de ejemplo (lat, lon), San Francisco
    static final double[][] DEMO_LAT_LON = {
            {37.7749, -122.4194},
            {37.7749, -122.4184},
            {37.7740, -122.4184},
            {37.7740, -122.4194},
            {37.7741, -122.4196},
    };

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != 0) System.exit(code);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        String inputCsv  = args.length >= 1 ? args[0] : "-";
        String outputCsv = args.length >= 4 && !"-".equals(args[3]) ? args[3] : null;
        String logFile   = args.length >= 5 ? args[4] : null;
        PlannerConfig cfg;
        try {
            double spacing = args.length >= 2 ? Double.parseDouble(args[1]) : PlannerConfig.CLI_SPACING_M;
            int samples    = args.length >= 3 ? Integer.parseInt(args[2]) : PlannerConfig.DEFAULT_ANGLE_SAMPLES;
            cfg = new PlannerConfig(spacing, samples);
        } catch (IllegalArgumentException e) {
            err.println("Argumentos inválidos: " + e.getMessage());
            err.println("Uso: CoverageCli [input.csv|-] [spacing_m] [angle_samples] [output.csv|-] [log.txt]");
            return 2;
        }

        Projector projector = new WebMercatorProjector();
        try (PlanLogger log = logFile != null ? PlanLogger.toFile(logFile) : PlanLogger.to(err)) {
            // 1) Leer el polígono (CSV o ejemplo)
            List<VertexRow> rows = "-".equals(inputCsv) ? demoRows() : PolygonCsvReader.readCsv(inputCsv);
            boolean geodetic = PolygonCsvReader.isGeodetic(rows);
            List<Point> ring = PolygonCsvReader.toRing(rows, projector);
            log.logf("Entrada: %s (%d vértices, %s)", inputCsv, ring.size(), geodetic ? "lat,lon" : "x,y");

            // 2) Planificar
            List<Point> path = CoveragePlanner.plan(ring, cfg, log).path;

            // 3) Exportar
            String csv;
            out.println("Generated " + path.size() + " waypoints:");
            if (geodetic) {
                List<double[]> ll = new ArrayList<>(path.size());
                for (Point p : path) ll.add(projector.inverse(p));
                for (double[] w : ll) out.println(String.format(Locale.US, "%.6f,%.6f", w[0], w[1]));
                csv = WaypointCsvWriter.toLatLonCsv(ll);
            } else {
                for (Point p : path) out.println(String.format(Locale.US, "%.3f,%.3f", p.x, p.y));
                csv = WaypointCsvWriter.toCsv(path);
            }
            if (outputCsv != null) {
                WaypointCsvWriter.write(outputCsv, csv);
                log.log("CSV generado en: " + outputCsv);
            }
            return 0;
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static List<VertexRow> demoRows() {
        List<VertexRow> rows = new ArrayList<>();
        for (int i = 0; i < DEMO_LAT_LON.length; i++) {
            VertexRow r = new VertexRow();
            r.pointIdx = i;
            r.lat = DEMO_LAT_LON[i][0];
            r.lon = DEMO_LAT_LON[i][1];
            rows.add(r);
        }
        return rows;
    }
}
