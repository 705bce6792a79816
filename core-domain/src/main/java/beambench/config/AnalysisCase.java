package beambench.config;

import lombok.Builder;
import lombok.With;

/**
 * Un caso de diseño independiente. La aplicación puede mantener varios a la vez;
 * cada uno se recalcula por separado sin compartir estado con los demás.
 *
 * @param id             Identificador único del caso.
 * @param name           Nombre visible.
 * @param mode           Modo activo en la interfaz.
 * @param beam           Configuración de viga.
 * @param bearing        Configuración de rodamiento.
 * @param discretization Parámetros de muestreo.
 */
@Builder
@With
public record AnalysisCase(
        String id,
        String name,
        AnalysisMode mode,
        BeamConfig beam,
        BearingConfig bearing,
        DiscretizationConfig discretization
) {
    public AnalysisCase {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("El caso necesita un identificador.");
        }
        if (mode == null) {
            mode = AnalysisMode.BEAM;
        }
        if (discretization == null) {
            discretization = DiscretizationConfig.defaults();
        }
    }
}
