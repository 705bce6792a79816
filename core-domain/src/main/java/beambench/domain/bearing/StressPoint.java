package beambench.domain.bearing;

/**
 * Punto interior de una bola con su tensión interpolada. Sólo para renderizado.
 */
public record StressPoint(double x, double y, double stress) {
}
