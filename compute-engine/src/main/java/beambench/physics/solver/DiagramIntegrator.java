package beambench.physics.solver;

import beambench.config.BeamConfig;
import beambench.domain.beam.DiagramData;
import beambench.domain.beam.ReactionSet;
import beambench.domain.load.LoadDefinition;

import java.util.List;

public interface DiagramIntegrator extends SolverComponent {
    /**
     * Barre la viga en {@code samples + 1} estaciones acumulando V(x) y M(x).
     */
    DiagramData integrate(BeamConfig config, List<LoadDefinition> loads, ReactionSet reactions, int samples);
}
