package beambench.domain.load;

import java.util.List;

/**
 * Momento concentrado (par) aplicado en un punto. No aporta fuerza vertical.
 *
 * @param id        Etiqueta de la carga.
 * @param x         Posición en metros.
 * @param magnitude Momento en N·m, positivo en sentido antihorario.
 */
public record AppliedMoment(String id, double x, double magnitude) implements LoadDefinition {

    @Override
    public double resultantForce() {
        return 0.0;
    }

    @Override
    public double centroid() {
        return x;
    }

    @Override
    public double appliedMoment() {
        return magnitude;
    }

    @Override
    public List<Double> breakpoints() {
        return List.of(x);
    }

    @Override
    public List<LoadDefinition> clampedTo(double length) {
        return List.of(new AppliedMoment(id, LoadDefinition.clamp(x, length), magnitude));
    }
}
