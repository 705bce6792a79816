package beambench.domain.beam;

import java.util.List;

/**
 * Malla de visualización y estadísticas globales del campo de la viga.
 *
 * @param cells         Celdas de la malla (meshDensityX × meshDensityY).
 * @param maxStress     Máxima |σ| en los nodos (Pa).
 * @param maxDeflection Máxima |v| en los nodos (m), sin el factor de exageración.
 * @param closedForm    false si la condición de contorno no tiene solución cerrada en este solver.
 */
public record BeamFieldResult(List<MeshCell> cells, double maxStress, double maxDeflection, boolean closedForm) {

    public BeamFieldResult {
        cells = List.copyOf(cells);
    }
}
