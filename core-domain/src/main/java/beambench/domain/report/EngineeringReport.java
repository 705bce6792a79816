package beambench.domain.report;

import lombok.Builder;

/**
 * Comprobaciones de resistencia y servicio derivadas de los resultados de una viga.
 * Lo consumen el panel de informes y el asistente conversacional.
 *
 * @param caseName              Nombre del caso.
 * @param maxStress             Máxima |σ| de la malla (Pa).
 * @param maxDeflection         Máxima |v| de la malla (m).
 * @param peakMoment            Flector de mayor valor absoluto según los polinomios por tramos (N·m).
 * @param peakMomentPosition    Posición de dicho flector (m).
 * @param peakMomentStress      |M|·c/I del flector pico (Pa).
 * @param governingStress       Tensión que gobierna el coeficiente de seguridad (Pa).
 * @param safetyFactor          σy / max(1, |maxStress|), el cociente que muestra el panel de informes.
 * @param governingSafetyFactor σy / max(1, governingStress). Nunca supera a {@code safetyFactor}.
 * @param verdict               Veredicto de resistencia, según {@code governingSafetyFactor}.
 * @param allowableDeflection   Flecha admisible L/360 (m).
 * @param deflectionUtilization maxDeflection / allowableDeflection.
 * @param serviceabilityOk      true si maxDeflection ≤ L/360.
 * @param topFiber              Estado de la fibra superior en la sección crítica.
 * @param summary               Resumen textual de las estadísticas.
 */
@Builder
public record EngineeringReport(
        String caseName,
        double maxStress,
        double maxDeflection,
        double peakMoment,
        double peakMomentPosition,
        double peakMomentStress,
        double governingStress,
        double safetyFactor,
        double governingSafetyFactor,
        Verdict verdict,
        double allowableDeflection,
        double deflectionUtilization,
        boolean serviceabilityOk,
        FiberState topFiber,
        String summary
) {
}
