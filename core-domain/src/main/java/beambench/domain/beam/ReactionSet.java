package beambench.domain.beam;

import beambench.config.BoundaryCondition;

/**
 * Reacciones de apoyo de la viga.
 * <p>
 * Fuerzas positivas hacia arriba; el momento de empotramiento es positivo en sentido antihorario.
 *
 * @param boundaryCondition Condición de contorno resuelta.
 * @param ra                Reacción vertical en el apoyo A (o en el empotramiento).
 * @param rb                Reacción vertical en el apoyo B (0 en voladizo).
 * @param ma                Momento de empotramiento (0 si no hay empotramiento).
 * @param supportA          Posición del apoyo A.
 * @param supportB          Posición del apoyo B.
 * @param degenerate        true si los dos apoyos coinciden y se sustituyó la luz por 1.
 *                          El resultado está definido numéricamente pero no tiene sentido físico.
 */
public record ReactionSet(
        BoundaryCondition boundaryCondition,
        double ra,
        double rb,
        double ma,
        double supportA,
        double supportB,
        boolean degenerate
) {
    public double totalVerticalReaction() {
        return ra + rb;
    }

    /**
     * Momento de las reacciones respecto a un pivote arbitrario (antihorario positivo).
     */
    public double momentAbout(double pivot) {
        return ra * (supportA - pivot) + rb * (supportB - pivot) + ma;
    }
}
