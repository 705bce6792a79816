package beambench.physics.solver.impl;

import beambench.config.BeamConfig;
import beambench.config.BoundaryCondition;
import beambench.domain.beam.PiecewiseSegment;
import beambench.domain.beam.ReactionSet;
import beambench.domain.load.AppliedMoment;
import beambench.domain.load.LoadDefinition;
import beambench.domain.load.PeakSide;
import beambench.domain.load.PointLoad;
import beambench.domain.load.TriangularLoad;
import beambench.domain.load.UniformLoad;
import beambench.domain.math.Polynomial;
import beambench.physics.solver.PiecewisePolynomialBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Construye V(x) y M(x) exactos por tramos mediante superposición.
 * <p>
 * Los límites de tramo son los extremos de la viga, los apoyos y todas las discontinuidades
 * de carga (posiciones de cargas puntuales y momentos, extremos de cargas repartidas),
 * ordenados y sin duplicados. En cada tramo [xA, xB) se suman las contribuciones de toda
 * reacción o carga que actúe a la izquierda de xA o que cubra el tramo completo:
 * <ul>
 * <li>Fuerza F en p: V += F, M += F·(x − p).</li>
 * <li>Momento C en p: M −= C.</li>
 * <li>Repartida q que cubre el tramo: V += q·(x − x1), M += q·(x − x1)²/2.</li>
 * <li>Triangular que cubre el tramo: términos de hasta grado 2 en V y 3 en M,
 * distintos según el extremo del pico.</li>
 * <li>Repartida o triangular completamente a la izquierda: su resultante en el centroide.</li>
 * </ul>
 */
@Slf4j
public class SuperpositionPolynomialBuilder implements PiecewisePolynomialBuilder {

    private static final double RELATIVE_TOLERANCE = 1e-9;

    @Override
    public String getName() {
        return "Segments_Superposition";
    }

    @Override
    public List<PiecewiseSegment> buildSegments(BeamConfig config, List<LoadDefinition> loads, ReactionSet reactions) {
        final double length = config.length();
        final double tol = RELATIVE_TOLERANCE * Math.max(1.0, length);

        List<Double> boundaries = collectBoundaries(config, loads, tol);
        List<PiecewiseSegment> segments = new ArrayList<>(boundaries.size() - 1);

        for (int i = 0; i < boundaries.size() - 1; i++) {
            double xA = boundaries.get(i);
            double xB = boundaries.get(i + 1);
            segments.add(buildSegment(xA, xB, loads, reactions, tol));
        }

        verifyCoverage(segments, length);
        log.debug("{} tramos generados para L={}", segments.size(), length);
        return segments;
    }

    /**
     * Puntos de corte ordenados y sin duplicados (con tolerancia). Incluye siempre 0 y L.
     */
    private List<Double> collectBoundaries(BeamConfig config, List<LoadDefinition> loads, double tol) {
        final double length = config.length();
        TreeSet<Double> raw = new TreeSet<>();
        raw.add(0.0);
        raw.add(length);
        if (config.boundaryCondition() == BoundaryCondition.OVERHANGING) {
            raw.add(config.effectiveSupportA());
            raw.add(config.effectiveSupportB());
        }
        for (LoadDefinition load : loads) {
            for (double p : load.breakpoints()) {
                raw.add(Math.max(0.0, Math.min(p, length)));
            }
        }

        List<Double> merged = new ArrayList<>();
        for (double p : raw) {
            if (merged.isEmpty() || p - merged.get(merged.size() - 1) > tol) {
                merged.add(p);
            }
        }
        // El último punto debe ser exactamente L
        if (length - merged.get(merged.size() - 1) <= tol) {
            merged.set(merged.size() - 1, length);
        }
        return merged;
    }

    private PiecewiseSegment buildSegment(double xA, double xB, List<LoadDefinition> loads,
                                          ReactionSet reactions, double tol) {
        CoefficientAccumulator acc = new CoefficientAccumulator();

        // --- Reacciones ---
        if (reactions.boundaryCondition().hasFixedEnd()) {
            acc.addForce(reactions.ra(), reactions.supportA());
            acc.addCouple(reactions.ma());
        } else {
            if (reactions.supportA() <= xA + tol) {
                acc.addForce(reactions.ra(), reactions.supportA());
            }
            if (reactions.supportB() <= xA + tol) {
                acc.addForce(reactions.rb(), reactions.supportB());
            }
        }

        // --- Cargas ---
        for (LoadDefinition load : loads) {
            if (load instanceof PointLoad point) {
                if (point.x() <= xA + tol) {
                    acc.addForce(point.magnitude(), point.x());
                }
            } else if (load instanceof AppliedMoment moment) {
                if (moment.x() <= xA + tol) {
                    acc.addCouple(moment.magnitude());
                }
            } else if (load instanceof UniformLoad uniform) {
                addUniform(acc, uniform, xA, tol);
            } else if (load instanceof TriangularLoad triangular) {
                addTriangular(acc, triangular, xA, tol);
            } else {
                throw new IllegalStateException("Tipo de carga no soportado: " + load.getClass().getSimpleName());
            }
        }

        return PiecewiseSegment.of(xA, xB, acc.shear(), acc.moment());
    }

    private void addUniform(CoefficientAccumulator acc, UniformLoad load, double xA, double tol) {
        if (load.x2() <= xA + tol) {
            acc.addForce(load.resultantForce(), load.centroid());
        } else if (load.x1() <= xA + tol) {
            // El tramo está dentro de la carga (los extremos de la carga son límites de tramo)
            double q = load.magnitude();
            acc.addShear(q, load.x1(), 1);
            acc.addMoment(q / 2.0, load.x1(), 2);
        }
    }

    private void addTriangular(CoefficientAccumulator acc, TriangularLoad load, double xA, double tol) {
        if (load.x2() <= xA + tol) {
            acc.addForce(load.resultantForce(), load.centroid());
            return;
        }
        if (load.x1() > xA + tol) {
            return;
        }
        final double w = load.peakMagnitude();
        final double span = load.span();
        final double x1 = load.x1();

        if (load.peakSide() == PeakSide.RIGHT) {
            // q(x) = w·(x − x1)/s
            acc.addShear(w / (2.0 * span), x1, 2);
            acc.addMoment(w / (6.0 * span), x1, 3);
        } else {
            // q(x) = w·(1 − (x − x1)/s)
            acc.addShear(w, x1, 1);
            acc.addShear(-w / (2.0 * span), x1, 2);
            acc.addMoment(w / 2.0, x1, 2);
            acc.addMoment(-w / (6.0 * span), x1, 3);
        }
    }

    private void verifyCoverage(List<PiecewiseSegment> segments, double length) {
        if (segments.isEmpty()) {
            throw new IllegalStateException("La lista de tramos está vacía.");
        }
        if (segments.get(0).xA() != 0.0 || segments.get(segments.size() - 1).xB() != length) {
            throw new IllegalStateException("Los tramos no cubren exactamente [0, L].");
        }
        for (int i = 0; i < segments.size(); i++) {
            PiecewiseSegment s = segments.get(i);
            if (!(s.xA() < s.xB())) {
                throw new IllegalStateException("Tramo vacío o invertido: [" + s.xA() + ", " + s.xB() + ")");
            }
            if (i > 0 && segments.get(i - 1).xB() != s.xA()) {
                throw new IllegalStateException("Tramos no contiguos en x=" + s.xA());
            }
        }
    }

    /**
     * Acumulador local de coeficientes. Cada tramo usa uno nuevo y lo congela en polinomios
     * inmutables al terminar.
     */
    private static final class CoefficientAccumulator {
        private final double[] v = new double[3];
        private final double[] m = new double[4];

        /**
         * Fuerza concentrada F en p: V += F, M += F·(x − p).
         */
        void addForce(double force, double position) {
            addShear(force, position, 0);
            addMoment(force, position, 1);
        }

        /**
         * Par C antihorario: M −= C.
         */
        void addCouple(double couple) {
            m[0] -= couple;
        }

        void addShear(double coefficient, double origin, int power) {
            addShiftedPower(v, coefficient, origin, power);
        }

        void addMoment(double coefficient, double origin, int power) {
            addShiftedPower(m, coefficient, origin, power);
        }

        Polynomial shear() {
            return Polynomial.of(v);
        }

        Polynomial moment() {
            return Polynomial.of(m);
        }

        /**
         * Suma c·(x − o)^k desarrollado por el binomio de Newton.
         */
        private static void addShiftedPower(double[] target, double c, double origin, int power) {
            double binomial = 1.0;
            for (int j = 0; j <= power; j++) {
                // término C(k, j)·x^(k−j)·(−o)^j
                target[power - j] += c * binomial * Math.pow(-origin, j);
                binomial = binomial * (power - j) / (j + 1);
            }
        }
    }
}
