package beambench.domain.beam;

import beambench.domain.math.Polynomial;

/**
 * Tramo [xA, xB) de la viga dentro del cual V(x) y M(x) son un único polinomio.
 *
 * @param xA               Inicio del tramo.
 * @param xB               Fin del tramo.
 * @param shear            V(x), grado ≤ 2.
 * @param moment           M(x), grado ≤ 3.
 * @param shearExpression  V(x) en formato legible.
 * @param momentExpression M(x) en formato legible.
 */
public record PiecewiseSegment(
        double xA,
        double xB,
        Polynomial shear,
        Polynomial moment,
        String shearExpression,
        String momentExpression
) {
    public static PiecewiseSegment of(double xA, double xB, Polynomial shear, Polynomial moment) {
        return new PiecewiseSegment(xA, xB, shear, moment, shear.format("x"), moment.format("x"));
    }

    public boolean contains(double x) {
        return x >= xA && x < xB;
    }

    public double length() {
        return xB - xA;
    }

    public double shearAt(double x) {
        return shear.evaluate(x);
    }

    public double momentAt(double x) {
        return moment.evaluate(x);
    }
}
