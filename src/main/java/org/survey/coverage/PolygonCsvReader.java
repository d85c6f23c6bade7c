package org.survey.coverage;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class PolygonCsvReader {

    // función para leer un CSV y devolver los vértices ordenados por point_idx
    static List<VertexRow> readCsv(String path) throws IOException {
        List<VertexRow> out = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8))) {
            String header = br.readLine();
            if (header == null) throw new IOException("CSV vacío: " + path);
            String[] h = VertexRow.splitCsv(header);
            String line;
            while ((line = br.readLine()) != null) {
                if (line.trim().isEmpty()) continue;
                String[] v = VertexRow.splitCsv(line);
                out.add(VertexRow.fromCsv(h, v));
            }
        }
        out.sort(Comparator.comparingInt(r -> r.pointIdx));
        return out;
    }

    // anillo plano; los vértices lat/lon pasan por el proyector
    static List<Point> toRing(List<VertexRow> rows, Projector projector) {
        boolean geo = isGeodetic(rows);
        List<Point> ring = new ArrayList<>(rows.size());
        for (VertexRow r : rows) {
            if (geo) {
                ring.add(projector.forward(r.lat, r.lon));
            } else if (r.x == null || r.y == null) {
                throw new IllegalArgumentException("CSV mezcla vértices lat,lon y x,y (point_idx=" + r.pointIdx + ")");
            } else {
                ring.add(new Point(r.x, r.y));
            }
        }
        return ring;
    }

    static boolean isGeodetic(List<VertexRow> rows) {
        return !rows.isEmpty() && rows.stream().allMatch(VertexRow::isGeodetic);
    }
}
