package org.survey.coverage;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Primitivas geométricas sobre listas de puntos planos. Un anillo es una lista de
 * vértices sin repetir el primero al final; el último conecta con el primero.
 */
public final class GeomKernel {

    static final GeometryFactory GF = new GeometryFactory(new PrecisionModel(PrecisionModel.FLOATING), 0);

    // cuerdas más cortas que esto se consideran un toque y se descartan
    static final double EPS_CHORD = 1e-9;

    private GeomKernel() {}

    // rota todos los puntos alrededor de origin; rotate(rotate(p, -a, o), a, o) == p salvo redondeo
    public static List<Point> rotate(List<Point> pts, double angleDeg, Point origin) {
        AffineTransformation at = AffineTransformation.rotationInstance(Math.toRadians(angleDeg), origin.x, origin.y);
        List<Point> out = new ArrayList<>(pts.size());
        Coordinate dst = new Coordinate();
        for (Point p : pts) {
            at.transform(new Coordinate(p.x, p.y), dst);
            out.add(new Point(dst.x, dst.y));
        }
        return out;
    }

    public static Envelope boundingBox(List<Point> pts) {
        Envelope env = new Envelope();
        for (Point p : pts) env.expandToInclude(p.x, p.y);
        return env;
    }

    // centroide de área del anillo (pivote fijo para la rotación de ida y vuelta)
    public static Point centroid(List<Point> ring) {
        Coordinate c = toPolygon(ring).getCentroid().getCoordinate();
        if (c == null) throw new InvalidPolygonException("No se pudo calcular el centroide de un polígono vacío");
        return new Point(c.x, c.y);
    }

    public static double area(List<Point> ring) {
        return toPolygon(ring).getArea();
    }

    public static double pathLength(List<Point> pts) {
        double total = 0.0;
        for (int i = 1; i < pts.size(); i++) total += pts.get(i - 1).distance(pts.get(i));
        return total;
    }

    /**
     * Cuerdas donde la recta vertical {@code x} atraviesa el interior del anillo,
     * recortadas a {@code [yMin, yMax]} y en orden de y ascendente.
     * Una arista cuenta como cruce si x cae en [min(ax,bx), max(ax,bx)); las
     * verticales no cuentan. Los cruces ordenados por y se emparejan par-impar.
     */
    public static List<Segment> intersectVerticalLine(List<Point> ring, double x, double yMin, double yMax) {
        int n = ring.size();
        double[] ys = new double[n];
        int k = 0;
        for (int i = 0; i < n; i++) {
            Point a = ring.get(i);
            Point b = ring.get((i + 1) % n);
            if ((a.x <= x && x < b.x) || (b.x <= x && x < a.x)) {
                double t = (x - a.x) / (b.x - a.x);
                ys[k++] = a.y + t * (b.y - a.y);
            }
        }
        Arrays.sort(ys, 0, k);

        List<Segment> out = new ArrayList<>();
        for (int i = 0; i + 1 < k; i += 2) {
            double lo = Math.max(ys[i], yMin);
            double hi = Math.min(ys[i + 1], yMax);
            if (hi - lo <= EPS_CHORD) continue;   // toque o fuera del recorte
            out.add(Segment.between(new Point(x, lo), new Point(x, hi)));
        }
        return out;
    }

    // convierte el anillo en un arreglo de coordenadas cerrado (último = primero)
    static Coordinate[] toClosedCoords(List<Point> pts) {
        if (pts.size() < 3) throw new InvalidPolygonException("Polígono requiere >=3 puntos, recibidos " + pts.size());
        Coordinate[] c = new Coordinate[pts.size() + 1];
        for (int i = 0; i < pts.size(); i++) c[i] = new Coordinate(pts.get(i).x, pts.get(i).y);
        c[c.length - 1] = new Coordinate(pts.get(0).x, pts.get(0).y);
        return c;
    }

    static Polygon toPolygon(List<Point> ring) {
        LinearRing shell = GF.createLinearRing(toClosedCoords(ring));
        return GF.createPolygon(shell);
    }

    // anillo exterior de un polígono JTS, sin el vértice de cierre
    static List<Point> exteriorRing(Polygon poly) {
        Coordinate[] c = poly.getExteriorRing().getCoordinates();
        List<Point> out = new ArrayList<>(Math.max(0, c.length - 1));
        for (int i = 0; i < c.length - 1; i++) out.add(new Point(c[i].x, c[i].y));
        return out;
    }
}
