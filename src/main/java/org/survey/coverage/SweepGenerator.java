package org.survey.coverage;

import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.List;

// genera las líneas de barrido verticales y sus cuerdas sobre el anillo ya rotado
final class SweepGenerator {

    private SweepGenerator() {}

    // offsets x desde minX - spacing, paso spacing, mientras x <= maxX + spacing
    static List<Double> offsets(Envelope env, double spacing) {
        List<Double> xs = new ArrayList<>();
        if (env == null || env.isNull()) return xs;
        double start = env.getMinX() - spacing;
        double end   = env.getMaxX() + spacing;
        for (int i = 0; ; i++) {
            double x = start + i * spacing;
            if (x > end) break;
            xs.add(x);
        }
        return xs;
    }

    /**
     * Cuerdas por línea de barrido, en orden de x creciente. Las líneas que no
     * cortan el polígono se omiten, así que cada lista devuelta es no vacía.
     */
    static List<List<Segment>> sweep(List<Point> ring, Envelope env, double spacing) {
        List<List<Segment>> lines = new ArrayList<>();
        if (env == null || env.isNull()) return lines;
        double yMin = env.getMinY() - spacing;
        double yMax = env.getMaxY() + spacing;
        for (double x : offsets(env, spacing)) {
            List<Segment> segs = GeomKernel.intersectVerticalLine(ring, x, yMin, yMax);
            if (!segs.isEmpty()) lines.add(segs);
        }
        return lines;
    }
}
