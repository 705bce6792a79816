package beambench.domain.beam;

import java.util.List;

/**
 * Celda cuadrilátera de la malla: nodos en orden (i,j), (i+1,j), (i+1,j+1), (i,j+1).
 *
 * @param i             Índice longitudinal de la celda.
 * @param j             Índice en el canto de la celda.
 * @param nodes         Los cuatro nodos de la celda.
 * @param averageStress Media de las tensiones de los cuatro nodos (sombreado plano).
 */
public record MeshCell(int i, int j, List<FieldSample> nodes, double averageStress) {

    public MeshCell {
        if (nodes == null || nodes.size() != 4) {
            throw new IllegalArgumentException("Una celda cuadrilátera necesita exactamente 4 nodos.");
        }
        nodes = List.copyOf(nodes);
    }

    public static MeshCell of(int i, int j, FieldSample p1, FieldSample p2, FieldSample p3, FieldSample p4) {
        double avg = (p1.stress() + p2.stress() + p3.stress() + p4.stress()) / 4.0;
        return new MeshCell(i, j, List.of(p1, p2, p3, p4), avg);
    }
}
