package beambench.physics.solver;

/**
 * Contrato común de todos los componentes de cálculo.
 */
public interface SolverComponent {
    /**
     * Nombre identificativo del algoritmo (para logs e informes).
     */
    String getName();
}
