package beambench.physics.solver;

import beambench.config.BeamConfig;
import beambench.config.DiscretizationConfig;
import beambench.domain.beam.BeamFieldResult;
import beambench.domain.beam.SectionProperties;

public interface BeamFieldSolver extends SolverComponent {
    /**
     * Evalúa flecha, giro, flector y tensión bajo la carga puntual base y construye la malla
     * de visualización.
     */
    BeamFieldResult solveField(BeamConfig config, SectionProperties section, DiscretizationConfig discretization);
}
