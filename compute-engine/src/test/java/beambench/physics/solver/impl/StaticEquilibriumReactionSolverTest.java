package beambench.physics.solver.impl;

import beambench.config.BeamConfig;
import beambench.config.BoundaryCondition;
import beambench.domain.beam.ReactionSet;
import beambench.domain.load.AppliedMoment;
import beambench.domain.load.LoadDefinition;
import beambench.factory.LoadSetFactory;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class StaticEquilibriumReactionSolverTest {

    private StaticEquilibriumReactionSolver solver;

    @BeforeEach
    void setUp() {
        solver = new StaticEquilibriumReactionSolver();
    }

    @Test
    @DisplayName("Escenario A: biapoyada con carga centrada reparte 25 kN en cada apoyo")
    void solveReactions_simplySupportedCentralLoad_shouldSplitEvenly() {
        // ARRANGE
        BeamConfig config = BeamFixtures.scenarioA();

        // ACT
        ReactionSet r = solver.solveReactions(config, LoadSetFactory.resolve(config));
        log.info("Escenario A: Ra={}, Rb={}", r.ra(), r.rb());

        // ASSERT
        assertEquals(25000.0, r.ra(), 1e-6);
        assertEquals(25000.0, r.rb(), 1e-6);
        assertEquals(0.0, r.ma());
        assertFalse(r.degenerate());
    }

    @Test
    @DisplayName("Escenario B: voladizo con carga en el extremo, Ra = 1000 N y Ma = 5000 N·m")
    void solveReactions_cantileverTipLoad_shouldProduceWallMoment() {
        BeamConfig config = BeamFixtures.scenarioB();

        ReactionSet r = solver.solveReactions(config, LoadSetFactory.resolve(config));

        assertEquals(1000.0, r.ra(), 1e-9);
        assertEquals(0.0, r.rb());
        assertEquals(5000.0, r.ma(), 1e-9);
        assertEquals(0.0, r.supportA());
    }

    @ParameterizedTest(name = "Equilibrio global con cargas mixtas: {0}")
    @EnumSource(BoundaryCondition.class)
    void solveReactions_mixedLoads_shouldSatisfyGlobalEquilibrium(BoundaryCondition bc) {
        // ARRANGE
        BeamConfig config = BeamFixtures.mixed(bc);
        List<LoadDefinition> loads = LoadSetFactory.resolve(config);

        // ACT
        ReactionSet r = solver.solveReactions(config, loads);

        // ASSERT
        double totalLoad = loads.stream().mapToDouble(LoadDefinition::resultantForce).sum();
        double scale = Math.abs(totalLoad) * config.length();
        assertEquals(0.0, r.totalVerticalReaction() + totalLoad, 1e-6 * Math.abs(totalLoad), "ΣFy ≠ 0");

        for (double pivot : new double[]{0.0, 3.3, 7.0, config.length(), -4.0}) {
            double sumM = r.momentAbout(pivot);
            for (LoadDefinition load : loads) {
                sumM += load.momentAbout(pivot);
            }
            log.info("[{}] ΣM respecto a {} = {}", bc, pivot, sumM);
            assertEquals(0.0, sumM, 1e-6 * scale, "ΣM ≠ 0 respecto a " + pivot);
        }
    }

    @Test
    @DisplayName("Apoyos coincidentes: resultado finito marcado como degenerado")
    void solveReactions_coincidentSupports_shouldFlagDegenerate() {
        BeamConfig config = BeamConfig.getTestingBeam()
                .withBoundaryCondition(BoundaryCondition.OVERHANGING)
                .withSupportA(4.0)
                .withSupportB(4.0);

        ReactionSet r = solver.solveReactions(config, LoadSetFactory.resolve(config));

        assertTrue(r.degenerate());
        assertTrue(Double.isFinite(r.ra()) && Double.isFinite(r.rb()));
    }

    @Test
    @DisplayName("Un momento puro sólo aporta a ΣM")
    void solveReactions_pureCouple_shouldProduceOpposingReactions() {
        BeamConfig config = BeamConfig.getTestingBeam()
                .withCustomLoads(List.of(new AppliedMoment("M", 3.0, 8000.0)));

        ReactionSet r = solver.solveReactions(config, LoadSetFactory.resolve(config));

        // Rb·L = −C → Rb = −1000, Ra = +1000
        assertEquals(-1000.0, r.rb(), 1e-9);
        assertEquals(1000.0, r.ra(), 1e-9);
        assertEquals(0.0, r.totalVerticalReaction(), 1e-9);
    }
}
