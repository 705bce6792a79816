package beambench.physics.solver.impl;

import beambench.config.BeamConfig;
import beambench.config.BoundaryCondition;
import beambench.config.DiscretizationConfig;
import beambench.domain.beam.BeamFieldResult;
import beambench.domain.beam.FieldSample;
import beambench.domain.beam.MeshCell;
import beambench.domain.beam.SectionProperties;
import beambench.physics.solver.BeamFieldSolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Solución cerrada de Euler–Bernoulli para una carga puntual P (con signo) en x = a.
 * <p>
 * <b>Voladizo</b> (empotrado en x=0):
 * <ul>
 * <li>x ≤ a: v = P·x²·(3a − x)/(6EI), θ = P·x·(2a − x)/(2EI), M = P·(a − x).</li>
 * <li>x &gt; a: la deformada continúa recta con el giro en a; M = 0.</li>
 * </ul>
 * <b>Biapoyada</b> (b = L − a):
 * <ul>
 * <li>x ≤ a: v = P·b·x·(L² − b² − x²)/(6LEI), M = −P·b·x/L.</li>
 * <li>x &gt; a: fórmulas simétricas medidas desde el apoyo derecho.</li>
 * </ul>
 * El flector es positivo a flexión cóncava, así que σ = −M·y/I comprime la fibra superior
 * de una biapoyada cargada hacia abajo y tracciona la superior del empotramiento de un voladizo.
 * Las vigas con voladizos no tienen solución cerrada aquí: se devuelve la malla sin deformar.
 */
@Slf4j
public class EulerBernoulliFieldSolver implements BeamFieldSolver {

    @Override
    public String getName() {
        return "Field_EulerBernoulli_ClosedForm";
    }

    @Override
    public BeamFieldResult solveField(BeamConfig config, SectionProperties section, DiscretizationConfig discretization) {
        final int nx = discretization.meshDensityX();
        final int ny = discretization.meshDensityY();
        final double length = config.length();
        final double height = config.section().height();
        final double dxStep = length / nx;
        final double dyStep = height / ny;

        final BoundaryCondition bc = config.boundaryCondition();
        final boolean closedForm = bc != BoundaryCondition.OVERHANGING;
        if (!closedForm) {
            log.debug("Sin solución cerrada para {}: se genera la malla sin deformar.", bc);
        }

        final LoadCase loadCase = new LoadCase(
                config.baseForce(),
                config.clampedLoadPosition(),
                length,
                config.youngsModulus() * section.momentOfInertia());

        // 1. Nodos: (nx + 1) × (ny + 1), cada uno evaluado una sola vez
        FieldSample[][] nodes = new FieldSample[nx + 1][ny + 1];
        double maxStress = 0.0;
        double maxDeflection = 0.0;

        for (int i = 0; i <= nx; i++) {
            final double x = i * dxStep;
            final double[] state = closedForm ? loadCase.evaluate(bc, x) : new double[3];
            final double v = state[0];
            final double theta = state[1];
            final double moment = state[2];

            for (int j = 0; j <= ny; j++) {
                final double y = j * dyStep - height / 2.0;
                nodes[i][j] = buildNode(x, y, v, theta, moment, section.momentOfInertia(),
                        discretization.deformationScale());

                maxStress = Math.max(maxStress, Math.abs(nodes[i][j].stress()));
            }
            maxDeflection = Math.max(maxDeflection, Math.abs(v));
        }

        // 2. Celdas cuadriláteras
        List<MeshCell> cells = new ArrayList<>(nx * ny);
        for (int i = 0; i < nx; i++) {
            for (int j = 0; j < ny; j++) {
                cells.add(MeshCell.of(i, j, nodes[i][j], nodes[i + 1][j], nodes[i + 1][j + 1], nodes[i][j + 1]));
            }
        }

        return new BeamFieldResult(cells, maxStress, maxDeflection, closedForm);
    }

    private FieldSample buildNode(double x, double y, double v, double theta, double moment,
                                  double inertia, double scale) {
        // Hipótesis de secciones planas: u = −y·θ
        final double u = -y * theta;
        final double stress = -moment * y / inertia;
        return new FieldSample(x, y, x + u * scale, y + v * scale, v, theta, moment, stress);
    }

    /**
     * Carga puntual P en a sobre una viga de longitud L y rigidez EI.
     */
    private record LoadCase(double p, double a, double length, double ei) {

        /**
         * @return {v, θ, M} en la posición x.
         */
        double[] evaluate(BoundaryCondition bc, double x) {
            return bc == BoundaryCondition.CANTILEVER ? cantilever(x) : simplySupported(x);
        }

        private double[] cantilever(double x) {
            if (x <= a) {
                double v = p * x * x * (3 * a - x) / (6 * ei);
                double theta = p * x * (2 * a - x) / (2 * ei);
                double moment = p * (a - x);
                return new double[]{v, theta, moment};
            }
            double vA = p * a * a * a / (3 * ei);
            double thetaA = p * a * a / (2 * ei);
            return new double[]{vA + thetaA * (x - a), thetaA, 0.0};
        }

        private double[] simplySupported(double x) {
            final double l = length;
            if (x <= a) {
                double b = l - a;
                double k = p * b / (6 * l * ei);
                double v = k * x * (l * l - b * b - x * x);
                double theta = k * (l * l - b * b - 3 * x * x);
                double moment = -p * b * x / l;
                return new double[]{v, theta, moment};
            }
            double xr = l - x;
            double k = p * a / (6 * l * ei);
            double v = k * xr * (l * l - a * a - xr * xr);
            double theta = -k * (l * l - a * a - 3 * xr * xr);
            double moment = -p * a * xr / l;
            return new double[]{v, theta, moment};
        }
    }
}
