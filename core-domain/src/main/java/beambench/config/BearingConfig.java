package beambench.config;

import lombok.Builder;
import lombok.With;

/**
 * Parámetros de un rodamiento radial de bolas.
 *
 * @param outerRadius   Radio exterior de la pista (mm).
 * @param innerRadius   Radio interior de la pista (mm).
 * @param ballCount     Número de elementos rodantes (Z ≥ 1).
 * @param radialLoad    Carga radial aplicada Fr (N, ≥ 0).
 * @param rotationSpeed Velocidad del eje en rpm (0 = estático).
 * @param contactAngle  Ángulo de contacto α en grados, en [0, 90). 0 para rodamientos radiales puros.
 */
@Builder
@With
public record BearingConfig(
        double outerRadius,
        double innerRadius,
        int ballCount,
        double radialLoad,
        double rotationSpeed,
        double contactAngle
) {
    public BearingConfig {
        if (innerRadius <= 0 || outerRadius <= innerRadius) {
            throw new IllegalArgumentException("Se requiere outerRadius > innerRadius > 0.");
        }
        if (ballCount < 1) {
            throw new IllegalArgumentException("El rodamiento debe tener al menos un elemento rodante.");
        }
        if (radialLoad < 0) {
            throw new IllegalArgumentException("La carga radial no puede ser negativa.");
        }
        if (contactAngle < 0 || contactAngle >= 90) {
            throw new IllegalArgumentException("El ángulo de contacto debe estar en [0, 90) grados.");
        }
    }

    /**
     * Radio primitivo: (exterior + interior) / 2.
     */
    public double pitchRadius() {
        return (outerRadius + innerRadius) / 2.0;
    }

    /**
     * Diámetro de bola simplificado (llenado completo de la pista).
     */
    public double ballDiameter() {
        return outerRadius - innerRadius;
    }

    public double ballRadius() {
        return ballDiameter() / 2.0;
    }

    public static BearingConfig getTestingBearing() {
        return BearingConfig.builder()
                .outerRadius(100)
                .innerRadius(60)
                .ballCount(12)
                .radialLoad(5000)
                .rotationSpeed(0)
                .contactAngle(0)
                .build();
    }
}
