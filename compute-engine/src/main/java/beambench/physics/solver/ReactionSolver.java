package beambench.physics.solver;

import beambench.config.BeamConfig;
import beambench.domain.beam.ReactionSet;
import beambench.domain.load.LoadDefinition;

import java.util.List;

public interface ReactionSolver extends SolverComponent {
    /**
     * Resuelve el equilibrio estático (ΣF = 0, ΣM = 0) de la viga bajo la lista de cargas.
     *
     * @param config Configuración de la viga (condición de contorno y apoyos).
     * @param loads  Cargas ya resueltas.
     * @return Reacciones de apoyo.
     */
    ReactionSet solveReactions(BeamConfig config, List<LoadDefinition> loads);
}
