package beambench.physics.solver;

import beambench.config.BeamConfig;
import beambench.domain.beam.PiecewiseSegment;
import beambench.domain.beam.ReactionSet;
import beambench.domain.load.LoadDefinition;

import java.util.List;

public interface PiecewisePolynomialBuilder extends SolverComponent {
    /**
     * Divide la viga en tramos contiguos que cubren [0, L] y obtiene V(x) y M(x) exactos en cada uno.
     */
    List<PiecewiseSegment> buildSegments(BeamConfig config, List<LoadDefinition> loads, ReactionSet reactions);
}
