package org.survey.coverage;

import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Prueba {@code angleSamples} orientaciones uniformes en [0, 180) y se queda con
 * la ruta más corta. Cada ángulo rota el anillo por -angle alrededor del centroide,
 * barre, une y rota de vuelta por +angle con el mismo pivote. El pliegue recorre
 * los resultados en orden de índice: ante empates exactos gana el índice menor.
 */
final class AngleOptimizer {

    private final PlannerConfig cfg;
    private final Function<List<Point>, Envelope> bounds;
    private final PlanLogger log;

    AngleOptimizer(PlannerConfig cfg, PlanLogger log) {
        this(cfg, GeomKernel::boundingBox, log);
    }

    AngleOptimizer(PlannerConfig cfg, Function<List<Point>, Envelope> bounds, PlanLogger log) {
        this.cfg = cfg;
        this.bounds = bounds;
        this.log = log;
    }

    Candidate optimize(List<Point> ring) {
        final List<Point> poly = List.copyOf(ring);
        final Point pivot = GeomKernel.centroid(poly);

        if (log != null) log.logf("==== Cobertura | START ==== vértices=%d spacing=%.3f samples=%d hilos=%d",
                poly.size(), cfg.spacingM, cfg.angleSamples, Math.min(cfg.parallelism, cfg.angleSamples));

        List<Candidate> results = (cfg.parallelism == 1 || cfg.angleSamples == 1)
                ? evaluateSequential(poly, pivot)
                : evaluateParallel(poly, pivot);

        Candidate best = null;
        for (Candidate c : results) {
            if (log != null) log.logf("ángulo %7.3f° | líneas=%d | puntos=%d | largo=%.3f",
                    c.angleDeg, c.sweepLines, c.path.size(), c.length);
            best = Candidate.better(best, c);
        }

        if (best == null)
            throw new PlanningFailedException("No se pudo calcular una ruta de cobertura: ninguno de los "
                    + cfg.angleSamples + " ángulos produjo líneas de barrido dentro del polígono");

        if (log != null) log.logf("BEST -> ángulo=%.3f° largo=%.3f puntos=%d",
                best.angleDeg, best.length, best.path.size());
        return best;
    }

    // una orientación completa: rotar, barrer, unir, rotar de vuelta
    Candidate evaluate(List<Point> ring, Point pivot, int i) {
        double angle = cfg.angleAt(i);
        List<Point> work = GeomKernel.rotate(ring, -angle, pivot);
        List<List<Segment>> lines = SweepGenerator.sweep(work, bounds.apply(work), cfg.spacingM);
        List<Point> path = PathStitcher.stitch(lines);
        return new Candidate(i, angle, GeomKernel.rotate(path, angle, pivot), lines.size());
    }

    private List<Candidate> evaluateSequential(List<Point> ring, Point pivot) {
        List<Candidate> out = new ArrayList<>(cfg.angleSamples);
        for (int i = 0; i < cfg.angleSamples; i++) {
            try {
                out.add(evaluate(ring, pivot, i));
            } catch (RuntimeException e) {
                throw evaluationFailed(e);
            }
        }
        return out;
    }

    private List<Candidate> evaluateParallel(List<Point> ring, Point pivot) {
        int threads = Math.min(cfg.parallelism, cfg.angleSamples);
        ExecutorService pool = Executors.newFixedThreadPool(threads, workerFactory());
        try {
            List<CompletableFuture<Candidate>> futures = new ArrayList<>(cfg.angleSamples);
            for (int i = 0; i < cfg.angleSamples; i++) {
                final int idx = i;
                futures.add(CompletableFuture.supplyAsync(() -> evaluate(ring, pivot, idx), pool));
            }
            List<Candidate> out = new ArrayList<>(futures.size());
            for (CompletableFuture<Candidate> f : futures) {
                try {
                    out.add(f.join());
                } catch (CompletionException e) {
                    throw evaluationFailed(e.getCause() != null ? e.getCause() : e);
                }
            }
            return out;
        } finally {
            pool.shutdownNow();
        }
    }

    // mismo error con uno o varios hilos
    private static PlanningFailedException evaluationFailed(Throwable cause) {
        return new PlanningFailedException("Falló la evaluación de un ángulo: " + cause.getMessage(), cause);
    }

    private static ThreadFactory workerFactory() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "coverage-angle-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
