package beambench.domain.load;

/**
 * Extremo en el que una carga triangular alcanza su valor máximo.
 */
public enum PeakSide {
    LEFT,
    RIGHT
}
