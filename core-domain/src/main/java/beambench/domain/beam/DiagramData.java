package beambench.domain.beam;

import java.util.Arrays;

/**
 * Diagramas de cortante y flector muestreados en n + 1 estaciones equiespaciadas.
 * Los tres arrays son paralelos.
 * <p>
 * Inmutable: los arrays se copian al construir y en cada acceso, porque el mismo resultado
 * memorizado se entrega a varios consumidores.
 */
public record DiagramData(double[] xs, double[] shear, double[] moment) {

    public DiagramData {
        if (xs.length != shear.length || xs.length != moment.length) {
            throw new IllegalArgumentException("Los arrays del diagrama deben tener la misma longitud.");
        }
        xs = xs.clone();
        shear = shear.clone();
        moment = moment.clone();
    }

    @Override
    public double[] xs() {
        return xs.clone();
    }

    @Override
    public double[] shear() {
        return shear.clone();
    }

    @Override
    public double[] moment() {
        return moment.clone();
    }

    public int stationCount() {
        return xs.length;
    }

    public double xAt(int i) {
        return xs[i];
    }

    public double shearAt(int i) {
        return shear[i];
    }

    public double momentAt(int i) {
        return moment[i];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiagramData other)) return false;
        return Arrays.equals(xs, other.xs)
                && Arrays.equals(shear, other.shear)
                && Arrays.equals(moment, other.moment);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(xs);
        result = 31 * result + Arrays.hashCode(shear);
        result = 31 * result + Arrays.hashCode(moment);
        return result;
    }

    @Override
    public String toString() {
        return "DiagramData[stations=" + xs.length
                + ", xs=" + Arrays.toString(xs)
                + ", shear=" + Arrays.toString(shear)
                + ", moment=" + Arrays.toString(moment) + "]";
    }
}
