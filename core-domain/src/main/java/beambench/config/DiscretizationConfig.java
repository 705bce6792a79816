package beambench.config;

import lombok.Builder;
import lombok.With;

/**
 * Parámetros de discretización de los resultados (no afectan a la física, sólo al muestreo).
 *
 * @param meshDensityX       Número de celdas de la malla a lo largo de la viga.
 * @param meshDensityY       Número de celdas en el canto.
 * @param deformationScale   Factor de exageración de la deformada (0 = sin deformar).
 * @param diagramSamples     Número de intervalos n del barrido de diagramas (n + 1 estaciones).
 * @param ballMeshResolution Número de anillos de la nube de puntos de cada bola.
 */
@Builder
@With
public record DiscretizationConfig(
        int meshDensityX,
        int meshDensityY,
        double deformationScale,
        int diagramSamples,
        int ballMeshResolution
) {
    public DiscretizationConfig {
        if (meshDensityX < 1 || meshDensityY < 1) {
            throw new IllegalArgumentException("La densidad de malla debe ser al menos 1 en cada dirección.");
        }
        if (diagramSamples < 1) {
            throw new IllegalArgumentException("El número de muestras del diagrama debe ser al menos 1.");
        }
        if (ballMeshResolution < 0) {
            throw new IllegalArgumentException("La resolución de la malla de bola no puede ser negativa.");
        }
    }

    public static DiscretizationConfig defaults() {
        return DiscretizationConfig.builder()
                .meshDensityX(40)
                .meshDensityY(8)
                .deformationScale(50)
                .diagramSamples(400)
                .ballMeshResolution(8)
                .build();
    }
}
