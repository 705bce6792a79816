package beambench.physics.solver;

import beambench.config.BearingConfig;
import beambench.domain.bearing.BearingElement;

import java.util.List;

public interface BearingLoadDistributor extends SolverComponent {

    /**
     * Reparte la carga radial entre los elementos rodantes con la jaula en el instante indicado.
     *
     * @param config      Configuración del rodamiento.
     * @param timeSeconds Instante (s) usado para girar la jaula según la velocidad del eje.
     * @return Un elemento por bola.
     */
    List<BearingElement> distribute(BearingConfig config, double timeSeconds);

    default List<BearingElement> distribute(BearingConfig config) {
        return distribute(config, 0.0);
    }
}
