package beambench.domain.analysis;

import beambench.config.BearingConfig;
import beambench.domain.bearing.BearingElement;
import beambench.domain.bearing.StressPoint;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Resultados de un rodamiento: reparto de carga por bola y nubes de tensión interiores.
 *
 * @param config           Configuración analizada.
 * @param timeSeconds      Instante para el que se posicionó la jaula.
 * @param elements         Un elemento por bola, en orden de índice.
 * @param ballStressFields Nube de puntos de cada bola, paralela a {@code elements}.
 * @param maxBallLoad      Carga máxima asignada a una bola (N).
 * @param maxContactStress Tensión de contacto máxima (MPa).
 * @param loadedBallCount  Número de bolas dentro de la zona de carga.
 * @param computedAt       Marca temporal del cálculo.
 */
@Builder
public record BearingAnalysisResult(
        BearingConfig config,
        double timeSeconds,
        List<BearingElement> elements,
        List<List<StressPoint>> ballStressFields,
        double maxBallLoad,
        double maxContactStress,
        int loadedBallCount,
        Instant computedAt
) {
    public BearingAnalysisResult {
        elements = List.copyOf(elements);
        ballStressFields = ballStressFields.stream().map(List::copyOf).toList();
    }
}
