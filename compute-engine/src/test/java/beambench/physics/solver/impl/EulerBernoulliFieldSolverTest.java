package beambench.physics.solver.impl;

import beambench.config.BeamConfig;
import beambench.config.BoundaryCondition;
import beambench.config.DiscretizationConfig;
import beambench.domain.beam.BeamFieldResult;
import beambench.domain.beam.FieldSample;
import beambench.domain.beam.MeshCell;
import beambench.domain.beam.SectionProperties;
import beambench.physics.model.SectionPropertyCalculator;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Comparator;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class EulerBernoulliFieldSolverTest {

    private EulerBernoulliFieldSolver solver;
    private DiscretizationConfig discretization;

    @BeforeEach
    void setUp() {
        solver = new EulerBernoulliFieldSolver();
        discretization = DiscretizationConfig.defaults();
    }

    private BeamFieldResult solve(BeamConfig config, DiscretizationConfig disc) {
        SectionProperties props = SectionPropertyCalculator.calculate(config.section());
        return solver.solveField(config, props, disc);
    }

    /** Nodo superior (y = +h/2) de la columna más cercana a x. */
    private static FieldSample topNodeNear(BeamFieldResult field, double x) {
        return field.cells().stream()
                .flatMap(c -> c.nodes().stream())
                .filter(n -> n.y() > 0)
                .min(Comparator.comparingDouble((FieldSample n) -> Math.abs(n.x() - x))
                        .thenComparingDouble(n -> -n.y()))
                .orElseThrow();
    }

    @Test
    @DisplayName("Escenario A: σmax = M·c/I ≈ 1.2e7 Pa y flecha P·L³/(48EI)")
    void solveField_scenarioA_shouldMatchHandCalculation() {
        // ARRANGE
        BeamConfig config = BeamFixtures.scenarioA();
        double inertia = 0.2 * Math.pow(0.5, 3) / 12.0;
        double expectedStress = 100000.0 * 0.25 / inertia;
        double expectedDeflection = 50000.0 * Math.pow(8.0, 3) / (48.0 * 200e9 * inertia);

        // ACT
        BeamFieldResult field = solve(config, discretization);
        log.info("σmax={} Pa (esperado {}), vmax={} m (esperado {})",
                field.maxStress(), expectedStress, field.maxDeflection(), expectedDeflection);

        // ASSERT
        assertTrue(field.closedForm());
        assertEquals(40 * 8, field.cells().size());
        assertEquals(expectedStress, field.maxStress(), expectedStress * 1e-6);
        assertEquals(1.2e7, field.maxStress(), 1e3);
        assertEquals(expectedDeflection, field.maxDeflection(), expectedDeflection * 1e-6);
    }

    @Test
    @DisplayName("Biapoyada con carga descendente: fibra superior comprimida, inferior traccionada")
    void solveField_simplySupported_shouldCompressTopFiber() {
        BeamFieldResult field = solve(BeamFixtures.scenarioA(), discretization);

        FieldSample top = topNodeNear(field, 4.0);
        assertEquals(0.25, top.y(), 1e-12);
        assertTrue(top.stress() < 0, "Fibra superior debe estar comprimida");
        assertTrue(top.moment() > 0, "Flector positivo (cóncavo)");
        assertTrue(top.deflection() < 0, "La viga baja");

        FieldSample bottom = field.cells().stream()
                .flatMap(c -> c.nodes().stream())
                .filter(n -> Math.abs(n.x() - 4.0) < 1e-9 && n.y() < 0)
                .min(Comparator.comparingDouble(FieldSample::y))
                .orElseThrow();
        assertTrue(bottom.stress() > 0, "Fibra inferior debe estar traccionada");
    }

    @Test
    @DisplayName("Voladizo con carga descendente: fibra superior traccionada en el empotramiento y flecha P·L³/(3EI)")
    void solveField_cantilever_shouldTensionTopFiberAtWall() {
        // ARRANGE
        BeamConfig config = BeamFixtures.scenarioB();
        SectionProperties props = SectionPropertyCalculator.calculate(config.section());
        double ei = config.youngsModulus() * props.momentOfInertia();

        // ACT
        BeamFieldResult field = solver.solveField(config, props, discretization);

        // ASSERT
        FieldSample wallTop = topNodeNear(field, 0.0);
        assertEquals(0.0, wallTop.x());
        assertTrue(wallTop.stress() > 0, "Fibra superior en tracción junto al empotramiento");
        assertEquals(-5000.0, wallTop.moment(), 1e-9);

        FieldSample tip = topNodeNear(field, 5.0);
        assertEquals(-1000.0 * 125.0 / (3.0 * ei), tip.deflection(), 1e-15);
        assertEquals(1000.0 * 125.0 / (3.0 * ei), field.maxDeflection(), 1e-15);
        assertEquals(0.0, tip.moment(), 1e-9);
    }

    @Test
    @DisplayName("Voladizo con carga intermedia: tramo recto y sin flector más allá de la carga")
    void solveField_cantileverIntermediateLoad_shouldBeStraightBeyondLoad() {
        BeamConfig config = BeamFixtures.scenarioB().withLoadPosition(2.5);

        BeamFieldResult field = solve(config, discretization);

        FieldSample mid = topNodeNear(field, 3.75);
        FieldSample tip = topNodeNear(field, 5.0);
        assertEquals(0.0, mid.moment());
        assertEquals(mid.slope(), tip.slope(), 1e-18);
        assertTrue(tip.deflection() < mid.deflection());
    }

    @Test
    @DisplayName("Vigas con voladizos: malla sin deformar y campos nulos")
    void solveField_overhanging_shouldReturnUndeformedMesh() {
        BeamConfig config = BeamConfig.getTestingBeam().withBoundaryCondition(BoundaryCondition.OVERHANGING);

        BeamFieldResult field = solve(config, discretization);

        assertFalse(field.closedForm());
        assertEquals(0.0, field.maxStress());
        assertEquals(0.0, field.maxDeflection());
        for (MeshCell cell : field.cells()) {
            for (FieldSample n : cell.nodes()) {
                assertEquals(n.x(), n.displacedX());
                assertEquals(n.y(), n.displacedY());
            }
        }
    }

    @Test
    @DisplayName("Escala de deformación nula: posiciones sin desplazar pero tensiones intactas")
    void solveField_zeroScale_shouldKeepGeometryButNotStress() {
        BeamFieldResult field = solve(BeamFixtures.scenarioA(), discretization.withDeformationScale(0.0));

        FieldSample top = topNodeNear(field, 4.0);
        assertEquals(top.y(), top.displacedY());
        assertEquals(top.x(), top.displacedX());
        assertEquals(1.2e7, field.maxStress(), 1e3);
    }

    @Test
    @DisplayName("Celdas: nodos en orden (i,j), (i+1,j), (i+1,j+1), (i,j+1) y tensión media")
    void solveField_cellsShouldFollowNodeOrder() {
        BeamFieldResult field = solve(BeamFixtures.scenarioA(),
                discretization.withMeshDensityX(4).withMeshDensityY(2));

        MeshCell cell = field.cells().get(0);
        assertEquals(0, cell.i());
        assertEquals(0, cell.j());
        assertEquals(0.0, cell.nodes().get(0).x());
        assertEquals(2.0, cell.nodes().get(1).x(), 1e-12);
        assertEquals(cell.nodes().get(1).x(), cell.nodes().get(2).x());
        assertTrue(cell.nodes().get(2).y() > cell.nodes().get(1).y());
        double avg = cell.nodes().stream().mapToDouble(FieldSample::stress).average().orElseThrow();
        assertEquals(avg, cell.averageStress(), 1e-6);
    }
}
