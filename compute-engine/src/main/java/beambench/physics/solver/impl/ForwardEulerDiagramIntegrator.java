package beambench.physics.solver.impl;

import beambench.config.BeamConfig;
import beambench.domain.beam.DiagramData;
import beambench.domain.beam.ReactionSet;
import beambench.domain.load.AppliedMoment;
import beambench.domain.load.LoadDefinition;
import beambench.domain.load.PointLoad;
import beambench.physics.solver.DiagramIntegrator;

import java.util.List;

/**
 * Integrador numérico de los diagramas de cortante y flector.
 * <p>
 * Recorre n + 1 estaciones con paso dx = L/n:
 * <ol>
 * <li>Saltos de V en las estaciones de apoyos y cargas puntuales.</li>
 * <li>Cargas repartidas: V += q(x)·dx dentro de su tramo.</li>
 * <li>M += V·dx (Euler explícito).</li>
 * <li>Saltos de M por el momento de empotramiento y los momentos aplicados.</li>
 * </ol>
 * El resultado es una aproximación rasterizada para gráficas; la versión exacta la da
 * {@link SuperpositionPolynomialBuilder}.
 */
public class ForwardEulerDiagramIntegrator implements DiagramIntegrator {

    /**
     * Tolerancia, en unidades de estación, para asignar un evento a su estación (absorbe el redondeo de i·dx).
     */
    private static final double STATION_EPSILON = 1e-9;

    @Override
    public String getName() {
        return "Diagrams_ForwardEuler";
    }

    @Override
    public DiagramData integrate(BeamConfig config, List<LoadDefinition> loads, ReactionSet reactions, int samples) {
        if (samples < 1) {
            throw new IllegalArgumentException("El número de muestras debe ser al menos 1.");
        }
        final int n = samples;
        final double length = config.length();
        final double dx = length / n;

        // 1. Saltos concentrados indexados por estación
        double[] shearJumps = new double[n + 1];
        double[] momentJumps = new double[n + 1];

        shearJumps[stationOf(reactions.supportA(), dx, n)] += reactions.ra();
        if (reactions.boundaryCondition().hasFixedEnd()) {
            momentJumps[stationOf(reactions.supportA(), dx, n)] -= reactions.ma();
        } else {
            shearJumps[stationOf(reactions.supportB(), dx, n)] += reactions.rb();
        }

        for (LoadDefinition load : loads) {
            if (load instanceof PointLoad point) {
                shearJumps[stationOf(point.x(), dx, n)] += point.magnitude();
            } else if (load instanceof AppliedMoment moment) {
                momentJumps[stationOf(moment.x(), dx, n)] -= moment.magnitude();
            }
        }

        // 2. Barrido
        double[] xs = new double[n + 1];
        double[] shear = new double[n + 1];
        double[] moment = new double[n + 1];

        double v = 0.0;
        double m = 0.0;
        for (int i = 0; i <= n; i++) {
            final double x = i * dx;

            v += shearJumps[i];

            double q = 0.0;
            for (LoadDefinition load : loads) {
                q += load.intensityAt(x);
            }
            v += q * dx;

            m += v * dx;
            m += momentJumps[i];

            xs[i] = x;
            shear[i] = v;
            moment[i] = m;
        }

        return new DiagramData(xs, shear, moment);
    }

    /**
     * Estación k tal que x_k ≤ t &lt; x_k + dx, acotada a [0, n].
     */
    static int stationOf(double position, double dx, int n) {
        int k = (int) Math.floor(position / dx + STATION_EPSILON);
        return Math.max(0, Math.min(k, n));
    }
}
