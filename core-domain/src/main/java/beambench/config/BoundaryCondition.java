package beambench.config;

/**
 * Condiciones de contorno de la viga.
 */
public enum BoundaryCondition {
    /**
     * Empotrada en x=0 y libre en x=L.
     */
    CANTILEVER,

    /**
     * Apoyo fijo en x=0 y apoyo deslizante en x=L.
     */
    SIMPLY_SUPPORTED,

    /**
     * Dos apoyos en posiciones arbitrarias (supportA, supportB) con voladizos a ambos lados.
     */
    OVERHANGING;

    public boolean hasFixedEnd() {
        return this == CANTILEVER;
    }
}
