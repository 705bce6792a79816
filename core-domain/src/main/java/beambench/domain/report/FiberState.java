package beambench.domain.report;

/**
 * Estado de la fibra superior en la sección crítica.
 */
public enum FiberState {
    TENSION,
    COMPRESSION,
    NEUTRAL;

    /**
     * Con σ = −M·y/I, un flector positivo (cóncavo) comprime la fibra superior.
     */
    public static FiberState topFiberFor(double moment) {
        if (moment > 0) return COMPRESSION;
        if (moment < 0) return TENSION;
        return NEUTRAL;
    }
}
