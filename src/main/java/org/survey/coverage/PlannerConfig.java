package org.survey.coverage;

/**
 * Parámetros del planificador: distancia entre líneas, orientaciones probadas en
 * [0, 180) y tamaño del pool que evalúa los ángulos.
 */
public final class PlannerConfig {
    public static final double DEFAULT_SPACING_M   = 20.0;
    public static final double CLI_SPACING_M       = 10.0;
    public static final int    DEFAULT_ANGLE_SAMPLES = 36;

    public final double  spacingM;
    public final int     angleSamples;
    public final int     parallelism;
    public final boolean repairInvalid;

    public PlannerConfig(double spacingM, int angleSamples) {
        this(spacingM, angleSamples, Runtime.getRuntime().availableProcessors(), true);
    }

    public PlannerConfig(double spacingM, int angleSamples, int parallelism, boolean repairInvalid) {
        if (!(spacingM > 0) || !Double.isFinite(spacingM))
            throw new IllegalArgumentException("spacing_m debe ser > 0: " + spacingM);
        if (angleSamples < 1)
            throw new IllegalArgumentException("angle_samples debe ser >= 1: " + angleSamples);
        if (parallelism < 1)
            throw new IllegalArgumentException("parallelism debe ser >= 1: " + parallelism);
        this.spacingM = spacingM;
        this.angleSamples = angleSamples;
        this.parallelism = parallelism;
        this.repairInvalid = repairInvalid;
    }

    public static PlannerConfig defaults() {
        return new PlannerConfig(DEFAULT_SPACING_M, DEFAULT_ANGLE_SAMPLES);
    }

    public PlannerConfig withParallelism(int p) {
        return new PlannerConfig(spacingM, angleSamples, p, repairInvalid);
    }

    public PlannerConfig withRepair(boolean repair) {
        return new PlannerConfig(spacingM, angleSamples, parallelism, repair);
    }

    // ángulo i-ésimo, en grados, uniformemente en [0, 180)
    double angleAt(int i) {
        return (180.0 * i) / angleSamples;
    }

    @Override public String toString() {
        return "PlannerConfig{spacing=" + spacingM + ", samples=" + angleSamples
                + ", parallelism=" + parallelism + ", repair=" + repairInvalid + "}";
    }
}
