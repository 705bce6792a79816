package beambench.domain.load;

import java.util.List;

/**
 * Origen de las cargas de un caso: o bien una lista explícita, o bien la carga puntual base
 * implícita. Se resuelve una única vez en la entrada del motor; los solvers sólo ven la lista.
 */
public interface LoadSource {

    List<LoadDefinition> loads();

    /**
     * Lista explícita definida por el usuario.
     */
    record ExplicitLoads(List<LoadDefinition> loads) implements LoadSource {
        public ExplicitLoads {
            loads = List.copyOf(loads);
        }
    }

    /**
     * Carga puntual única sintetizada a partir de la fuerza base y su posición.
     */
    record ImplicitSingleLoad(double magnitude, double position) implements LoadSource {
        public static final String DEFAULT_ID = "P";

        @Override
        public List<LoadDefinition> loads() {
            return List.of(new PointLoad(DEFAULT_ID, position, magnitude));
        }
    }
}
