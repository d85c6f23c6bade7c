package org.survey.coverage;

import java.util.Locale;

// punto plano inmutable (metros)
public final class Point {
    public final double x, y;

    public Point(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double distance(Point o) {
        double dx = o.x - x, dy = o.y - y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Point p)) return false;
        return Double.compare(x, p.x) == 0 && Double.compare(y, p.y) == 0;
    }

    @Override public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override public String toString() {
        return String.format(Locale.US, "(%.3f, %.3f)", x, y);
    }
}
