package beambench.domain.load;

import java.util.List;

/**
 * Carga triangular: crece linealmente desde 0 hasta {@code peakMagnitude} en el extremo indicado.
 * <p>
 * La resultante vale ½·w·(x2 − x1) y actúa a un tercio del tramo medido desde el extremo del pico.
 *
 * @param id            Etiqueta de la carga.
 * @param x1            Inicio del tramo cargado (m).
 * @param x2            Fin del tramo cargado (m).
 * @param peakMagnitude Intensidad máxima en N/m (negativa hacia abajo).
 * @param peakSide      Extremo donde se alcanza la intensidad máxima.
 */
public record TriangularLoad(String id, double x1, double x2, double peakMagnitude, PeakSide peakSide)
        implements LoadDefinition {

    public TriangularLoad {
        if (peakSide == null) {
            peakSide = PeakSide.RIGHT;
        }
    }

    public double span() {
        return x2 - x1;
    }

    @Override
    public double resultantForce() {
        return 0.5 * peakMagnitude * span();
    }

    @Override
    public double centroid() {
        return peakSide == PeakSide.RIGHT
                ? x1 + (2.0 / 3.0) * span()
                : x1 + (1.0 / 3.0) * span();
    }

    @Override
    public double intensityAt(double x) {
        if (x < x1 || x > x2 || span() <= 0) {
            return 0.0;
        }
        double ratio = (x - x1) / span();
        return (peakSide == PeakSide.RIGHT ? ratio : 1.0 - ratio) * peakMagnitude;
    }

    @Override
    public List<Double> breakpoints() {
        return List.of(x1, x2);
    }

    /**
     * Corta la carga en [0, length] conservando su intensidad original en cada punto.
     * <ul>
     * <li>Si se corta el extremo del pico queda un triángulo menor, con el pico interpolado
     * en el punto de corte.</li>
     * <li>Si se corta el extremo nulo queda un trapecio, que se devuelve como una uniforme con
     * la intensidad menor más una triangular con la diferencia.</li>
     * </ul>
     * Las posiciones invertidas se normalizan antes de cortar.
     */
    @Override
    public List<LoadDefinition> clampedTo(double length) {
        TriangularLoad normalized = new TriangularLoad(id, Math.min(x1, x2), Math.max(x1, x2), peakMagnitude, peakSide);
        double a = LoadDefinition.clamp(normalized.x1(), length);
        double b = LoadDefinition.clamp(normalized.x2(), length);
        if (!(b > a) || !(normalized.span() > 0)) {
            // Sin longitud útil: el resolvedor la descarta
            return List.of(new TriangularLoad(id, a, b, peakMagnitude, peakSide));
        }

        double qa = normalized.intensityAt(a);
        double qb = normalized.intensityAt(b);
        // Intensidad en el extremo nulo del tramo recortado y en el extremo del pico
        double base = peakSide == PeakSide.RIGHT ? qa : qb;
        double peak = peakSide == PeakSide.RIGHT ? qb : qa;

        TriangularLoad triangle = new TriangularLoad(id, a, b, peak - base, peakSide);
        if (base == 0.0) {
            return List.of(triangle);
        }
        return List.of(new UniformLoad(id, a, b, base), triangle);
    }
}
