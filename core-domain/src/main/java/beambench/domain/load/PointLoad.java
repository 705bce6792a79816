package beambench.domain.load;

import java.util.List;

/**
 * Fuerza concentrada.
 *
 * @param id        Etiqueta de la carga.
 * @param x         Posición en metros.
 * @param magnitude Fuerza en N (negativa hacia abajo).
 */
public record PointLoad(String id, double x, double magnitude) implements LoadDefinition {

    @Override
    public double resultantForce() {
        return magnitude;
    }

    @Override
    public double centroid() {
        return x;
    }

    @Override
    public List<Double> breakpoints() {
        return List.of(x);
    }

    @Override
    public List<LoadDefinition> clampedTo(double length) {
        return List.of(new PointLoad(id, LoadDefinition.clamp(x, length), magnitude));
    }
}
