package beambench.domain.load;

import java.util.List;

/**
 * Carga uniformemente repartida entre x1 y x2.
 *
 * @param id        Etiqueta de la carga.
 * @param x1        Inicio del tramo cargado (m).
 * @param x2        Fin del tramo cargado (m).
 * @param magnitude Intensidad en N/m (negativa hacia abajo).
 */
public record UniformLoad(String id, double x1, double x2, double magnitude) implements LoadDefinition {

    public double span() {
        return x2 - x1;
    }

    @Override
    public double resultantForce() {
        return magnitude * span();
    }

    @Override
    public double centroid() {
        return (x1 + x2) / 2.0;
    }

    @Override
    public double intensityAt(double x) {
        return (x >= x1 && x <= x2) ? magnitude : 0.0;
    }

    @Override
    public List<Double> breakpoints() {
        return List.of(x1, x2);
    }

    @Override
    public List<LoadDefinition> clampedTo(double length) {
        double a = LoadDefinition.clamp(Math.min(x1, x2), length);
        double b = LoadDefinition.clamp(Math.max(x1, x2), length);
        return List.of(new UniformLoad(id, a, b, magnitude));
    }
}
