package beambench.physics.model;

import beambench.config.SectionDescriptor;
import beambench.domain.beam.SectionProperties;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class SectionPropertyCalculatorTest {

    private static final double DELTA = 1e-9;

    @Test
    @DisplayName("Rectangular: I = b·h³/12 para b=0.2 m, h=0.5 m")
    void calculate_rectangular_shouldMatchClosedForm() {
        // ARRANGE
        SectionDescriptor section = SectionDescriptor.rectangular(0.2, 0.5);

        // ACT
        SectionProperties props = SectionPropertyCalculator.calculate(section);
        log.info("Rectangular: I={} m^4, A={} m^2", props.momentOfInertia(), props.area());

        // ASSERT
        assertEquals(0.0020833333, props.momentOfInertia(), 1e-9, "Inercia rectangular incorrecta");
        assertEquals(0.1, props.area(), DELTA);
        assertFalse(props.solidFallback());
    }

    @Test
    @DisplayName("Circular: I = π·d⁴/64 y A = π·r²")
    void calculate_circular_shouldUseDiameter() {
        SectionDescriptor section = SectionDescriptor.circular(0.1);

        SectionProperties props = SectionPropertyCalculator.calculate(section);

        assertEquals(Math.PI * Math.pow(0.1, 4) / 64.0, props.momentOfInertia(), 1e-15);
        assertEquals(Math.PI * 0.05 * 0.05, props.area(), 1e-12);
    }

    @Test
    @DisplayName("Doble T: caja exterior menos hueco")
    void calculate_iBeam_shouldSubtractVoid() {
        // ARRANGE
        double h = 0.5, flange = 0.3, tf = 0.02, tw = 0.015;
        SectionDescriptor section = SectionDescriptor.iBeam(h, flange, tf, tw);
        double innerH = h - 2 * tf;
        double innerB = flange - tw;
        double expected = (flange * Math.pow(h, 3) - innerB * Math.pow(innerH, 3)) / 12.0;

        // ACT
        SectionProperties props = SectionPropertyCalculator.calculate(section);

        // ASSERT
        assertEquals(expected, props.momentOfInertia(), 1e-12);
        assertEquals(2 * flange * tf + tw * innerH, props.area(), 1e-12);
        assertFalse(props.solidFallback());
        assertTrue(props.momentOfInertia() < flange * Math.pow(h, 3) / 12.0,
                "El perfil hueco debe tener menos inercia que la caja maciza");
    }

    @Test
    @DisplayName("Doble T degenerado: alas más gruesas que medio canto se tratan como rectángulo macizo")
    void calculate_iBeamWithThickFlanges_shouldFallBackToSolidRectangle() {
        SectionDescriptor section = SectionDescriptor.iBeam(0.5, 0.3, 0.3, 0.015);

        SectionProperties props = SectionPropertyCalculator.calculate(section);

        assertTrue(props.solidFallback());
        assertEquals(0.3 * Math.pow(0.5, 3) / 12.0, props.momentOfInertia(), 1e-12);
        assertEquals(0.15, props.area(), 1e-12);
    }

    @Test
    @DisplayName("Doble T degenerado: alma más ancha que el ala no lanza excepción")
    void calculate_iBeamWithWideWeb_shouldNotThrow() {
        SectionDescriptor section = SectionDescriptor.iBeam(0.4, 0.1, 0.01, 0.2);

        SectionProperties props = assertDoesNotThrow(() -> SectionPropertyCalculator.calculate(section));

        assertTrue(props.solidFallback());
        assertTrue(props.momentOfInertia() > 0);
    }

    @Test
    @DisplayName("Rectangular con ancho nulo es rechazada: la inercia sería 0")
    void rectangular_zeroWidth_shouldBeRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> SectionDescriptor.rectangular(0.0, 0.5));

        assertTrue(ex.getMessage().contains("ancho"));
    }

    @ParameterizedTest(name = "B={0}, tf={1}, tw={2}")
    @CsvSource({
            "0.0, 0.02, 0.015",
            "0.3, 0.0, 0.015",
            "0.3, 0.02, 0.0"
    })
    @DisplayName("Doble T con ala o alma nula es rechazado")
    void iBeam_zeroDimension_shouldBeRejected(double flangeWidth, double flangeThickness, double webThickness) {
        assertThrows(IllegalArgumentException.class,
                () -> SectionDescriptor.iBeam(0.5, flangeWidth, flangeThickness, webThickness));
    }

    @Test
    @DisplayName("Circular ignora ancho y alas nulos y da inercia positiva")
    void circular_withUnusedZeroDimensions_shouldBeAccepted() {
        SectionProperties props = SectionPropertyCalculator.calculate(SectionDescriptor.circular(0.2));

        assertTrue(props.momentOfInertia() > 0);
        assertTrue(Double.isFinite(props.momentOfInertia()));
    }
}
