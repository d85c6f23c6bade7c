package org.survey.coverage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

// une las cuerdas de cada línea en una ruta serpenteante continua
final class PathStitcher {

    // de arriba hacia abajo; sort estable, así los empates conservan el orden de descubrimiento
    static final Comparator<Segment> TOP_FIRST = Comparator.comparingDouble(Segment::midY).reversed();

    private PathStitcher() {}

    static List<Point> stitch(List<List<Segment>> lines) {
        List<Point> path = new ArrayList<>();
        int strip = 0;
        for (List<Segment> line : lines) {
            if (line == null || line.isEmpty()) continue;
            List<Point> flat = flatten(line);
            if (strip % 2 == 1) Collections.reverse(flat);
            path.addAll(flat);
            strip++;
        }
        return path;
    }

    // entrada, salida, entrada, salida... con cada cuerda recorrida de arriba hacia abajo
    static List<Point> flatten(List<Segment> line) {
        List<Segment> sorted = new ArrayList<>(line);
        sorted.sort(TOP_FIRST);
        List<Point> flat = new ArrayList<>(sorted.size() * 2);
        for (Segment s : sorted) {
            flat.add(s.top);
            flat.add(s.bottom);
        }
        return flat;
    }
}
