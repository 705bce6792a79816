package beambench.physics.solver.impl;

import beambench.domain.bearing.BearingElement;
import beambench.domain.bearing.StressPoint;
import beambench.physics.solver.BallStressFieldGenerator;

import java.util.ArrayList;
import java.util.List;

/**
 * Nube de tensión interior de una bola. La tensión decae exponencialmente desde los dos polos
 * de contacto (pista interior y exterior), situados sobre la dirección radial de la bola:
 * σ = σmax·exp(−2·d/R), con d la distancia al polo más cercano.
 * <p>
 * Anillos concéntricos r = 0..resolución: un punto en el centro y 6r puntos en el anillo r.
 */
public class ContactPoleStressFieldGenerator implements BallStressFieldGenerator {

    private static final int POINTS_PER_RING = 6;
    private static final double DECAY_RATE = 2.0;

    @Override
    public String getName() {
        return "BallStress_ContactPoles";
    }

    @Override
    public List<StressPoint> generate(BearingElement element, int resolution) {
        if (resolution < 0) {
            throw new IllegalArgumentException("La resolución de la malla de bola no puede ser negativa.");
        }
        final double cx = element.x();
        final double cy = element.y();
        final double radius = element.radius();

        final double dirX = Math.cos(element.angle());
        final double dirY = Math.sin(element.angle());
        final double outerPoleX = cx + radius * dirX;
        final double outerPoleY = cy + radius * dirY;
        final double innerPoleX = cx - radius * dirX;
        final double innerPoleY = cy - radius * dirY;

        List<StressPoint> points = new ArrayList<>(1 + 3 * resolution * (resolution + 1));
        for (int r = 0; r <= resolution; r++) {
            final double dist = resolution == 0 ? 0.0 : radius * r / resolution;
            final int count = r == 0 ? 1 : POINTS_PER_RING * r;

            for (int a = 0; a < count; a++) {
                final double phi = 2.0 * Math.PI * a / count;
                final double px = cx + dist * Math.cos(phi);
                final double py = cy + dist * Math.sin(phi);

                final double dOuter = Math.hypot(px - outerPoleX, py - outerPoleY);
                final double dInner = Math.hypot(px - innerPoleX, py - innerPoleY);
                final double minD = Math.min(dOuter, dInner);

                final double stress = radius > 0
                        ? element.maxStress() * Math.exp(-DECAY_RATE * minD / radius)
                        : element.maxStress();
                points.add(new StressPoint(px, py, stress));
            }
        }
        return points;
    }
}
