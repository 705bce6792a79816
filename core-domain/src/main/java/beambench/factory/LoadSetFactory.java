package beambench.factory;

import beambench.config.BeamConfig;
import beambench.domain.load.LoadDefinition;
import beambench.domain.load.TriangularLoad;
import beambench.domain.load.UniformLoad;

import java.util.ArrayList;
import java.util.List;

/**
 * Resuelve el origen de cargas de una {@link BeamConfig} en la lista definitiva que
 * consumen los solvers.
 * <ol>
 * <li>Lista explícita o carga base implícita (se decide una única vez aquí).</li>
 * <li>Todas las posiciones se acotan a [0, L]; lo que cae fuera de la viga se corta.</li>
 * <li>Las cargas repartidas de longitud nula se descartan: no transmiten fuerza.</li>
 * </ol>
 */
public final class LoadSetFactory {

    /**
     * Prohibido construir esta clase utilidad
     */
    private LoadSetFactory() {
    }

    public static List<LoadDefinition> resolve(BeamConfig config) {
        final double length = config.length();
        List<LoadDefinition> resolved = new ArrayList<>();

        for (LoadDefinition load : config.loadSource().loads()) {
            for (LoadDefinition clamped : load.clampedTo(length)) {
                if (clamped instanceof UniformLoad uniform && uniform.span() <= 0) {
                    continue;
                }
                if (clamped instanceof TriangularLoad triangular && triangular.span() <= 0) {
                    continue;
                }
                resolved.add(clamped);
            }
        }
        return List.copyOf(resolved);
    }
}
