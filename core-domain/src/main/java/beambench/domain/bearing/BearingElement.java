package beambench.domain.bearing;

/**
 * Estado de un elemento rodante.
 *
 * @param index       Índice de la bola (0..Z-1).
 * @param angle       Posición angular del centro de la bola (rad, en [0, 2π)).
 * @param load        Carga asignada Q (N, ≥ 0).
 * @param maxStress   Tensión de contacto hertziana aproximada (MPa).
 * @param deformation Deformación de compresión aproximada (mm).
 * @param x           Coordenada x del centro sobre la circunferencia primitiva.
 * @param y           Coordenada y del centro sobre la circunferencia primitiva.
 * @param radius      Radio de la bola.
 */
public record BearingElement(
        int index,
        double angle,
        double load,
        double maxStress,
        double deformation,
        double x,
        double y,
        double radius
) {
    public boolean carriesLoad() {
        return load > 0;
    }
}
