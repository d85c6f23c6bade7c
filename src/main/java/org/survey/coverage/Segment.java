package org.survey.coverage;

// cuerda de una línea de barrido dentro del polígono, orientada de arriba hacia abajo
public final class Segment {
    public final Point top;
    public final Point bottom;

    public Segment(Point top, Point bottom) {
        this.top = top;
        this.bottom = bottom;
    }

    // crea el segmento ordenando los extremos por y descendente
    static Segment between(Point a, Point b) {
        return a.y >= b.y ? new Segment(a, b) : new Segment(b, a);
    }

    public double midY() {
        return (top.y + bottom.y) / 2.0;
    }

    @Override public String toString() {
        return top + " -> " + bottom;
    }
}
