package beambench.domain.beam;

/**
 * Nodo de la malla de visualización.
 *
 * @param x          Posición longitudinal sin deformar (m).
 * @param y          Distancia a la fibra neutra sin deformar (m), positiva hacia arriba.
 * @param displacedX Posición x desplazada (exagerada) para el renderizado.
 * @param displacedY Posición y desplazada (exagerada) para el renderizado.
 * @param deflection Flecha v(x) real (m).
 * @param slope      Giro θ(x) real (rad).
 * @param moment     Momento flector M(x) (N·m), positivo a flexión cóncava.
 * @param stress     Tensión normal σ = −M·y/I (Pa), positiva a tracción.
 */
public record FieldSample(
        double x,
        double y,
        double displacedX,
        double displacedY,
        double deflection,
        double slope,
        double moment,
        double stress
) {
}
