package org.survey.coverage;

import java.util.Collections;
import java.util.List;

/**
 * Ruta boustrophedon calculada para una orientación de barrido.
 * Inmutable; el optimizador conserva sólo la mejor.
 */
public final class Candidate {
    public final int angleIndex;
    public final double angleDeg;
    public final List<Point> path;      // en el marco original
    public final double length;
    public final int sweepLines;        // líneas no vacías

    Candidate(int angleIndex, double angleDeg, List<Point> path, int sweepLines) {
        this.angleIndex = angleIndex;
        this.angleDeg = angleDeg;
        this.path = Collections.unmodifiableList(path);
        this.length = GeomKernel.pathLength(path);
        this.sweepLines = sweepLines;
    }

    public boolean isEmpty() {
        return path.isEmpty();
    }

    // regla del pliegue: gana el estrictamente más corto; empates para el índice menor
    static Candidate better(Candidate best, Candidate c) {
        if (c == null || c.isEmpty()) return best;
        if (best == null || c.length < best.length) return c;
        return best;
    }
}
