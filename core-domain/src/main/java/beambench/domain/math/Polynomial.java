package beambench.domain.math;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Polinomio inmutable en x con coeficientes en potencias ascendentes:
 * {@code c0 + c1·x + c2·x² + ...}.
 */
public final class Polynomial {

    /**
     * Umbral por debajo del cual un coeficiente no se muestra (sólo afecta al formato).
     */
    public static final double DISPLAY_THRESHOLD = 0.001;

    private static final Polynomial ZERO = new Polynomial(new double[]{0.0});

    private final double[] coefficients;

    @JsonCreator
    public Polynomial(@JsonProperty("coefficients") double[] coefficients) {
        Objects.requireNonNull(coefficients, "Los coeficientes no pueden ser nulos.");
        this.coefficients = coefficients.length == 0 ? new double[]{0.0} : coefficients.clone();
    }

    public static Polynomial zero() {
        return ZERO;
    }

    /**
     * Construye el polinomio a partir de coeficientes en potencias ascendentes.
     */
    public static Polynomial of(double... ascendingCoefficients) {
        return new Polynomial(ascendingCoefficients);
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public double coefficient(int power) {
        return power < coefficients.length ? coefficients[power] : 0.0;
    }

    /**
     * Grado efectivo: mayor potencia con coeficiente distinto de cero.
     */
    public int degree() {
        for (int p = coefficients.length - 1; p > 0; p--) {
            if (coefficients[p] != 0.0) {
                return p;
            }
        }
        return 0;
    }

    /**
     * Evalúa el polinomio con el esquema de Horner.
     */
    public double evaluate(double x) {
        double result = 0.0;
        for (int p = coefficients.length - 1; p >= 0; p--) {
            result = result * x + coefficients[p];
        }
        return result;
    }

    public Polynomial derivative() {
        if (coefficients.length <= 1) {
            return ZERO;
        }
        double[] d = new double[coefficients.length - 1];
        for (int p = 1; p < coefficients.length; p++) {
            d[p - 1] = p * coefficients[p];
        }
        return new Polynomial(d);
    }

    public Polynomial plus(Polynomial other) {
        int n = Math.max(coefficients.length, other.coefficients.length);
        double[] sum = new double[n];
        for (int p = 0; p < n; p++) {
            sum[p] = coefficient(p) + other.coefficient(p);
        }
        return new Polynomial(sum);
    }

    /**
     * Raíces reales del polinomio hasta grado 2. Para grados mayores devuelve una lista vacía.
     */
    public List<Double> realRoots() {
        List<Double> roots = new ArrayList<>();
        int degree = degree();
        if (degree == 1) {
            roots.add(-coefficients[0] / coefficients[1]);
        } else if (degree == 2) {
            double a = coefficients[2];
            double b = coefficients[1];
            double c = coefficients[0];
            double discriminant = b * b - 4 * a * c;
            if (discriminant >= 0) {
                double sqrt = Math.sqrt(discriminant);
                roots.add((-b + sqrt) / (2 * a));
                roots.add((-b - sqrt) / (2 * a));
            }
        }
        return roots;
    }

    /**
     * Formato legible en potencias descendentes, con dos decimales.
     * Ejemplo: {@code -0.50x^2 + 12.00x - 3.25}. El polinomio nulo se muestra como {@code 0.00}.
     *
     * @param variable Nombre de la variable independiente.
     */
    public String format(String variable) {
        StringBuilder sb = new StringBuilder();
        for (int p = coefficients.length - 1; p >= 0; p--) {
            double c = coefficients[p];
            if (Math.abs(c) <= DISPLAY_THRESHOLD) {
                continue;
            }
            if (sb.length() == 0) {
                if (c < 0) sb.append('-');
            } else {
                sb.append(c < 0 ? " - " : " + ");
            }
            sb.append(String.format(Locale.ROOT, "%.2f", Math.abs(c)));
            if (p == 1) {
                sb.append(variable);
            } else if (p > 1) {
                sb.append(variable).append('^').append(p);
            }
        }
        return sb.length() == 0 ? "0.00" : sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Polynomial)) return false;
        Polynomial that = (Polynomial) o;
        int n = Math.max(coefficients.length, that.coefficients.length);
        for (int p = 0; p < n; p++) {
            if (Double.compare(coefficient(p), that.coefficient(p)) != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(Arrays.copyOf(coefficients, degree() + 1));
    }

    @Override
    public String toString() {
        return format("x");
    }
}
