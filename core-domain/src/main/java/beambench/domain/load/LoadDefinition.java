package beambench.domain.load;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Representa una carga aplicada sobre la viga.
 * <p>
 * Convención de signos: el eje y apunta hacia arriba, por lo que una fuerza (o intensidad)
 * negativa es una carga descendente. Los momentos aplicados son positivos en sentido antihorario.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.PROPERTY,
        property = "type"
)
@JsonSubTypes({
        @JsonSubTypes.Type(value = PointLoad.class, name = "POINT"),
        @JsonSubTypes.Type(value = UniformLoad.class, name = "UNIFORM"),
        @JsonSubTypes.Type(value = TriangularLoad.class, name = "TRIANGULAR"),
        @JsonSubTypes.Type(value = AppliedMoment.class, name = "MOMENT")
})
public interface LoadDefinition {

    /**
     * Etiqueta de la carga. Sólo se usa para numerar la carga en pantalla.
     */
    String id();

    /**
     * Fuerza vertical resultante de la carga (con signo).
     */
    double resultantForce();

    /**
     * Posición de la resultante. Para un momento puro se devuelve su punto de aplicación.
     */
    double centroid();

    /**
     * Momento concentrado aplicado (antihorario positivo). Cero salvo para {@link AppliedMoment}.
     */
    default double appliedMoment() {
        return 0.0;
    }

    /**
     * Intensidad distribuida (fuerza por unidad de longitud, con signo) en la posición x.
     * Las cargas concentradas devuelven 0.
     */
    default double intensityAt(double x) {
        return 0.0;
    }

    /**
     * Momento de la carga respecto a un pivote: F·(x̄ − pivote) + momento aplicado.
     */
    default double momentAbout(double pivot) {
        return resultantForce() * (centroid() - pivot) + appliedMoment();
    }

    /**
     * Posiciones donde la carga introduce una discontinuidad en V(x) o M(x).
     */
    List<Double> breakpoints();

    /**
     * Devuelve la parte de la carga que actúa sobre [0, length]. La porción fuera de la viga
     * se corta, no se redistribuye; por eso una carga puede quedar descompuesta en varias.
     */
    List<LoadDefinition> clampedTo(double length);

    static double clamp(double value, double length) {
        return Math.max(0.0, Math.min(value, length));
    }
}
