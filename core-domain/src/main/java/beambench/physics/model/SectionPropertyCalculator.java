package beambench.physics.model;

import beambench.config.SectionDescriptor;
import beambench.domain.beam.SectionProperties;
import lombok.extern.slf4j.Slf4j;

/**
 * Calcula el momento de inercia y el área de una sección transversal.
 * <ul>
 * <li><b>Rectangular:</b> I = b·h³/12, A = b·h.</li>
 * <li><b>Circular:</b> I = π·d⁴/64, A = π·(d/2)².</li>
 * <li><b>Doble T:</b> caja exterior menos hueco, I = (B·H³ − b·h³)/12 con h = H − 2·tf y b = B − tw.</li>
 * </ul>
 * Si el hueco del doble T resulta nulo o negativo la sección se trata como un rectángulo macizo
 * con las dimensiones exteriores. No se lanza ninguna excepción: la geometría puede ser
 * transitoriamente inválida mientras el usuario arrastra un control.
 */
@Slf4j
public final class SectionPropertyCalculator {

    /**
     * Prohibido construir esta clase utilidad
     */
    private SectionPropertyCalculator() {
    }

    public static SectionProperties calculate(SectionDescriptor section) {
        final double h = section.height();

        switch (section.shape()) {
            case RECTANGULAR: {
                final double b = section.width();
                return new SectionProperties(b * Math.pow(h, 3) / 12.0, b * h, false);
            }
            case CIRCULAR: {
                // h es el diámetro
                double inertia = Math.PI * Math.pow(h, 4) / 64.0;
                double area = Math.PI * Math.pow(h / 2.0, 2);
                return new SectionProperties(inertia, area, false);
            }
            case I_BEAM:
                return calculateIBeam(section);
            default:
                throw new IllegalStateException("Forma de sección no soportada: " + section.shape());
        }
    }

    private static SectionProperties calculateIBeam(SectionDescriptor section) {
        final double outerH = section.height();
        final double outerB = section.flangeWidth();
        final double tf = section.flangeThickness();
        final double tw = section.webThickness();

        final double innerH = outerH - 2.0 * tf;
        final double innerB = outerB - tw;

        if (innerH > 0 && innerB > 0) {
            double inertia = (outerB * Math.pow(outerH, 3) - innerB * Math.pow(innerH, 3)) / 12.0;
            double area = 2.0 * outerB * tf + tw * innerH;
            return new SectionProperties(inertia, area, false);
        }

        // Geometría inválida (alas más gruesas que medio canto o alma más ancha que el ala)
        log.debug("Perfil doble T inválido (h_int={}, b_int={}). Se trata como sección maciza.", innerH, innerB);
        return new SectionProperties(outerB * Math.pow(outerH, 3) / 12.0, outerB * outerH, true);
    }
}
