package beambench.domain.report;

/**
 * Veredicto de resistencia a partir del coeficiente de seguridad.
 */
public enum Verdict {
    /** Coeficiente de seguridad &lt; 1: se supera el límite elástico. */
    UNSAFE,
    /** 1 ≤ coeficiente &lt; 1.5: por debajo del margen recomendado. */
    MARGINAL,
    /** Coeficiente ≥ 1.5. */
    SAFE;

    public static final double RECOMMENDED_SAFETY_FACTOR = 1.5;

    public static Verdict fromSafetyFactor(double safetyFactor) {
        if (safetyFactor < 1.0) return UNSAFE;
        if (safetyFactor < RECOMMENDED_SAFETY_FACTOR) return MARGINAL;
        return SAFE;
    }
}
