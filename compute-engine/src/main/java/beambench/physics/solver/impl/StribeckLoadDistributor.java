package beambench.physics.solver.impl;

import beambench.config.BearingConfig;
import beambench.domain.bearing.BearingElement;
import beambench.physics.solver.BearingLoadDistributor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Reparto de carga radial de Stribeck: Q(ψ) = Qmax·cos(ψ)^1.5 dentro de la zona de carga
 * (|ψ| &lt; 90° respecto al vector de carga), con Qmax = 5·Fr / (Z·cos α).
 * <p>
 * Las magnitudes de tensión y deformación son calibraciones para visualización, no
 * valores hertzianos de diseño.
 */
@Slf4j
public class StribeckLoadDistributor implements BearingLoadDistributor {

    /** Factor de Stribeck para juego nulo. */
    public static final double STRIBECK_FACTOR = 5.0;
    /** Escala visual de la tensión de contacto: σ = k·√(Q/d). */
    public static final double HERTZ_STRESS_SCALE = 50.0;
    /** Escala visual de la deformación: δ = k·Q^(2/3). */
    public static final double DEFORMATION_SCALE = 0.001;

    /** La carga actúa vertical hacia abajo. */
    public static final double LOAD_VECTOR_ANGLE = 3.0 * Math.PI / 2.0;

    private static final double TWO_PI = 2.0 * Math.PI;
    private static final double ANGULAR_TOLERANCE = 1e-9;

    @Override
    public String getName() {
        return "Bearing_Stribeck";
    }

    @Override
    public List<BearingElement> distribute(BearingConfig config, double timeSeconds) {
        final int z = config.ballCount();
        final double pitchRadius = config.pitchRadius();
        final double ballDiameter = config.ballDiameter();
        final double cosAlpha = Math.cos(Math.toRadians(config.contactAngle()));

        final double qMax = STRIBECK_FACTOR * config.radialLoad() / (z * cosAlpha);
        final double cageAngle = cageAngle(config, timeSeconds);

        List<BearingElement> elements = new ArrayList<>(z);
        for (int i = 0; i < z; i++) {
            final double theta = wrap(TWO_PI * i / z + cageAngle);
            final double psi = angularDistanceToLoad(theta);

            double load = 0.0;
            if (psi < Math.PI / 2.0 - ANGULAR_TOLERANCE) {
                load = qMax * Math.pow(Math.cos(psi), 1.5);
            }

            double stress = load > 0 ? HERTZ_STRESS_SCALE * Math.sqrt(load / ballDiameter) : 0.0;
            double deformation = load > 0 ? DEFORMATION_SCALE * Math.pow(load, 2.0 / 3.0) : 0.0;

            elements.add(new BearingElement(
                    i,
                    theta,
                    load,
                    stress,
                    deformation,
                    pitchRadius * Math.cos(theta),
                    pitchRadius * Math.sin(theta),
                    ballDiameter / 2.0));
        }

        log.debug("Reparto de Stribeck: Z={}, Fr={}, Qmax={}, jaula={} rad", z, config.radialLoad(), qMax, cageAngle);
        return elements;
    }

    /**
     * Ángulo girado por la jaula en el instante t con el anillo interior girando y el exterior fijo:
     * ω_jaula = ω_eje·(1 − d·cos α / D_primitivo) / 2.
     */
    static double cageAngle(BearingConfig config, double timeSeconds) {
        if (config.rotationSpeed() == 0.0 || timeSeconds == 0.0) {
            return 0.0;
        }
        final double shaftOmega = config.rotationSpeed() * TWO_PI / 60.0;
        final double pitchDiameter = 2.0 * config.pitchRadius();
        final double ratio = config.ballDiameter() * Math.cos(Math.toRadians(config.contactAngle())) / pitchDiameter;
        final double cageOmega = shaftOmega * (1.0 - ratio) / 2.0;
        return wrap(cageOmega * timeSeconds);
    }

    private static double angularDistanceToLoad(double theta) {
        double psi = Math.abs(theta - LOAD_VECTOR_ANGLE);
        return psi > Math.PI ? TWO_PI - psi : psi;
    }

    private static double wrap(double angle) {
        double wrapped = angle % TWO_PI;
        return wrapped < 0 ? wrapped + TWO_PI : wrapped;
    }
}
