package beambench.physics.solver.impl;

import beambench.config.BeamConfig;
import beambench.config.BoundaryCondition;
import beambench.domain.beam.ReactionSet;
import beambench.domain.load.LoadDefinition;
import beambench.physics.solver.ReactionSolver;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Resuelve las reacciones por equilibrio estático.
 * <p>
 * Se acumulan ΣFy y ΣM respecto al apoyo A (x=0 en voladizo y biapoyada, supportA en vigas con
 * voladizos). Cada carga aporta su resultante aplicada en su centroide; un momento puro sólo
 * aporta a ΣM.
 * <ul>
 * <li><b>Voladizo:</b> isostático por inspección, Ra = −ΣFy y Ma = −ΣM.</li>
 * <li><b>Dos apoyos:</b> Rb = −ΣM / (xB − xA), Ra = −ΣFy − Rb.</li>
 * </ul>
 */
@Slf4j
public class StaticEquilibriumReactionSolver implements ReactionSolver {

    /**
     * Luz por debajo de la cual se considera que los dos apoyos coinciden.
     */
    private static final double MIN_SPAN = 1e-6;

    @Override
    public String getName() {
        return "Reactions_StaticEquilibrium";
    }

    @Override
    public ReactionSet solveReactions(BeamConfig config, List<LoadDefinition> loads) {
        final BoundaryCondition bc = config.boundaryCondition();
        final double supportA = config.effectiveSupportA();
        final double supportB = config.effectiveSupportB();

        double sumFy = 0.0;
        double sumM = 0.0;
        for (LoadDefinition load : loads) {
            sumFy += load.resultantForce();
            sumM += load.momentAbout(supportA);
        }

        if (bc.hasFixedEnd()) {
            return new ReactionSet(bc, -sumFy, 0.0, -sumM, supportA, supportB, false);
        }

        double span = supportB - supportA;
        boolean degenerate = false;
        if (Math.abs(span) < MIN_SPAN) {
            // Apoyos coincidentes: el sistema es un mecanismo. Se sustituye la luz por 1.
            log.warn("Apoyos coincidentes en x={}. Resultado degenerado (luz sustituida por 1).", supportA);
            span = 1.0;
            degenerate = true;
        }

        double rb = -sumM / span;
        double ra = -sumFy - rb;
        return new ReactionSet(bc, ra, rb, 0.0, supportA, supportB, degenerate);
    }
}
