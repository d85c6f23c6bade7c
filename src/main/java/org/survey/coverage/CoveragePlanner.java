package org.survey.coverage;

import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Planificador de cobertura boustrophedon: recibe un polígono simple en metros y
 * devuelve los waypoints que barren su interior con líneas separadas spacingM, en
 * la orientación de menor recorrido. Falla con InvalidPolygonException o
 * PlanningFailedException.
 */
public final class CoveragePlanner {

    private CoveragePlanner() {}

    public static List<Point> planCoverage(List<Point> polygon) {
        return planCoverage(polygon, PlannerConfig.defaults());
    }

    public static List<Point> planCoverage(List<Point> polygon, double spacingM, int angleSamples) {
        return planCoverage(polygon, new PlannerConfig(spacingM, angleSamples));
    }

    public static List<Point> planCoverage(List<Point> polygon, PlannerConfig cfg) {
        return plan(polygon, cfg, null).path;
    }

    // igual que planCoverage pero devuelve el candidato ganador completo (ángulo, largo, líneas)
    public static Candidate plan(List<Point> polygon, PlannerConfig cfg, PlanLogger log) {
        return plan(polygon, cfg, log, GeomKernel::boundingBox);
    }

    static Candidate plan(List<Point> polygon, PlannerConfig cfg, PlanLogger log,
                          Function<List<Point>, Envelope> bounds) {
        if (cfg == null) throw new IllegalArgumentException("config requerido");
        long t0 = System.currentTimeMillis();

        List<Point> ring = prepare(polygon, cfg, log);
        Candidate best = new AngleOptimizer(cfg, bounds, log).optimize(ring);

        PlanReport.of(best, cfg, ring.size(), GeomKernel.area(ring), System.currentTimeMillis() - t0).logTo(log);
        return best;
    }

    // valida la entrada, quita el vértice de cierre repetido y repara si corresponde
    static List<Point> prepare(List<Point> polygon, PlannerConfig cfg, PlanLogger log) {
        if (polygon == null) throw new InvalidPolygonException("Polígono nulo");
        if (polygon.size() < 3)
            throw new InvalidPolygonException("Polígono requiere >=3 vértices, recibidos " + polygon.size());

        List<Point> ring = new ArrayList<>(polygon.size());
        for (Point p : polygon) {
            if (p == null || !p.isFinite())
                throw new InvalidPolygonException("Vértice inválido: " + p);
            ring.add(p);
        }
        if (ring.size() > 3 && ring.get(0).equals(ring.get(ring.size() - 1))) ring.remove(ring.size() - 1);
        if (ring.size() < 3)
            throw new InvalidPolygonException("Polígono requiere >=3 vértices distintos al cierre");

        return cfg.repairInvalid ? PolygonRepair.repair(ring, log) : ring;
    }
}
