package beambench.config;

import lombok.Builder;
import lombok.With;

/**
 * Descriptor inmutable de la sección transversal de la viga.
 * <p>
 * Sólo se usan las dimensiones relevantes para cada forma; el resto se ignoran.
 *
 * @param shape           Forma de la sección.
 * @param height          Canto total H en metros (diámetro para secciones circulares).
 * @param width           Ancho b de la sección rectangular en metros.
 * @param flangeWidth     Ancho de ala B del perfil doble T en metros.
 * @param flangeThickness Espesor de ala tf del perfil doble T en metros.
 * @param webThickness    Espesor de alma tw del perfil doble T en metros.
 */
@Builder
@With
public record SectionDescriptor(
        SectionType shape,
        double height,
        double width,
        double flangeWidth,
        double flangeThickness,
        double webThickness
) {
    public SectionDescriptor {
        if (shape == null) {
            throw new IllegalArgumentException("La forma de la sección no puede ser nula.");
        }
        if (height <= 0) {
            throw new IllegalArgumentException("El canto de la sección debe ser positivo.");
        }
        if (width < 0 || flangeWidth < 0 || flangeThickness < 0 || webThickness < 0) {
            throw new IllegalArgumentException("Las dimensiones de la sección no pueden ser negativas.");
        }
        // Las dimensiones propias de la forma deben ser estrictamente positivas (I > 0)
        if (shape == SectionType.RECTANGULAR && width <= 0) {
            throw new IllegalArgumentException("El ancho de la sección rectangular debe ser positivo.");
        }
        if (shape == SectionType.I_BEAM && (flangeWidth <= 0 || flangeThickness <= 0 || webThickness <= 0)) {
            throw new IllegalArgumentException("El ancho de ala, el espesor de ala y el espesor de alma del perfil doble T deben ser positivos.");
        }
    }

    /**
     * Distancia desde la fibra neutra hasta la fibra extrema (c = H/2 en las tres formas simétricas).
     */
    public double extremeFiberDistance() {
        return height / 2.0;
    }

    public static SectionDescriptor rectangular(double width, double height) {
        return SectionDescriptor.builder()
                .shape(SectionType.RECTANGULAR)
                .width(width)
                .height(height)
                .build();
    }

    public static SectionDescriptor circular(double diameter) {
        return SectionDescriptor.builder()
                .shape(SectionType.CIRCULAR)
                .height(diameter)
                .build();
    }

    public static SectionDescriptor iBeam(double height, double flangeWidth, double flangeThickness, double webThickness) {
        return SectionDescriptor.builder()
                .shape(SectionType.I_BEAM)
                .height(height)
                .flangeWidth(flangeWidth)
                .flangeThickness(flangeThickness)
                .webThickness(webThickness)
                .build();
    }
}
