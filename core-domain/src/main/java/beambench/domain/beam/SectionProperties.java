package beambench.domain.beam;

/**
 * Propiedades geométricas de una sección.
 *
 * @param momentOfInertia Momento de inercia I respecto a la fibra neutra (m⁴).
 * @param area            Área de la sección (m²).
 * @param solidFallback   true si la geometría del perfil era inválida y se trató como sección maciza.
 */
public record SectionProperties(double momentOfInertia, double area, boolean solidFallback) {
}
