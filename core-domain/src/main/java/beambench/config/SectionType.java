package beambench.config;

/**
 * Formas de sección transversal soportadas por el calculador de propiedades.
 */
public enum SectionType {
    /** Sección rectangular maciza (ancho × canto). */
    RECTANGULAR,
    /** Sección circular maciza. El canto se interpreta como diámetro. */
    CIRCULAR,
    /** Perfil doble T: caja exterior menos los dos huecos laterales. */
    I_BEAM
}
