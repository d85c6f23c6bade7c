package org.survey.coverage;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;

import java.util.List;

// repara anillos auto-intersectados con buffer(0); el planificador asume un polígono simple
final class PolygonRepair {

    private PolygonRepair() {}

    static List<Point> repair(List<Point> ring, PlanLogger log) {
        Polygon poly = GeomKernel.toPolygon(ring);
        if (poly.isValid()) return ring;

        Polygon fixed = largest(poly.buffer(0));
        if (fixed == null || fixed.isEmpty() || fixed.getArea() <= 0)
            throw new InvalidPolygonException("Polígono vacío tras la reparación");

        if (log != null) {
            log.logf("Polígono inválido reparado: %d -> %d vértices, área=%.3f",
                    ring.size(), fixed.getExteriorRing().getNumPoints() - 1, fixed.getArea());
            if (fixed.getNumInteriorRing() > 0)
                log.logf("Aviso: se descartan %d huecos (no soportados)", fixed.getNumInteriorRing());
        }
        return GeomKernel.exteriorRing(fixed);
    }

    // si la reparación genera varios polígonos, escoge el mayor
    static Polygon largest(Geometry g) {
        if (g instanceof Polygon p) return p;
        if (g instanceof MultiPolygon mp && mp.getNumGeometries() > 0) {
            Polygon best = null; double area = -1;
            for (int i = 0; i < mp.getNumGeometries(); i++) {
                Polygon p = (Polygon) mp.getGeometryN(i);
                if (p.getArea() > area) { area = p.getArea(); best = p; }
            }
            return best;
        }
        return null;
    }
}
