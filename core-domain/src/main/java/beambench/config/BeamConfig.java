package beambench.config;

import beambench.domain.load.LoadDefinition;
import beambench.domain.load.LoadSource;
import lombok.Builder;
import lombok.With;

import java.util.List;

/**
 * Un objeto de valor inmutable con todos los parámetros de un caso de viga.
 * <p>
 * La capa de interfaz es la propietaria de esta configuración; el motor sólo la lee y
 * recalcula todos los resultados a partir de ella en cada cambio.
 *
 * @param name              Nombre del caso (sólo para informes).
 * @param length            Longitud total L en metros (&gt; 0).
 * @param boundaryCondition Condición de contorno.
 * @param supportA          Posición del apoyo A (sólo OVERHANGING).
 * @param supportB          Posición del apoyo B (sólo OVERHANGING).
 * @param youngsModulus     Módulo de Young E en Pa (&gt; 0).
 * @param yieldStrength     Límite elástico σy en Pa.
 * @param section           Sección transversal.
 * @param baseForce         Fuerza puntual base en N (negativa hacia abajo).
 * @param loadPosition      Posición de la fuerza base en metros (se acota a [0, L]).
 * @param customLoads       Cargas explícitas. Si está vacía se usa la fuerza base.
 */
@Builder
@With
public record BeamConfig(
        String name,
        double length,
        BoundaryCondition boundaryCondition,
        double supportA,
        double supportB,
        double youngsModulus,
        double yieldStrength,
        SectionDescriptor section,
        double baseForce,
        double loadPosition,
        List<LoadDefinition> customLoads
) {
    public BeamConfig {
        if (length <= 0) {
            throw new IllegalArgumentException("La longitud de la viga debe ser positiva.");
        }
        if (boundaryCondition == null) {
            throw new IllegalArgumentException("La condición de contorno no puede ser nula.");
        }
        if (section == null) {
            throw new IllegalArgumentException("La sección no puede ser nula.");
        }
        if (youngsModulus <= 0) {
            throw new IllegalArgumentException("El módulo de Young debe ser positivo.");
        }
        if (yieldStrength < 0) {
            throw new IllegalArgumentException("El límite elástico no puede ser negativo.");
        }
        customLoads = (customLoads == null) ? List.of() : List.copyOf(customLoads);
    }

    /**
     * Posición de la fuerza base acotada a [0, L].
     */
    public double clampedLoadPosition() {
        return Math.max(0.0, Math.min(loadPosition, length));
    }

    /**
     * Posición efectiva del primer apoyo (o del empotramiento).
     */
    public double effectiveSupportA() {
        if (boundaryCondition != BoundaryCondition.OVERHANGING) {
            return 0.0;
        }
        return Math.min(clampToBeam(supportA), clampToBeam(supportB));
    }

    /**
     * Posición efectiva del segundo apoyo. En voladizo coincide con el empotramiento.
     */
    public double effectiveSupportB() {
        switch (boundaryCondition) {
            case CANTILEVER:
                return 0.0;
            case SIMPLY_SUPPORTED:
                return length;
            default:
                return Math.max(clampToBeam(supportA), clampToBeam(supportB));
        }
    }

    /**
     * Resuelve el origen de cargas: lista explícita o carga puntual base implícita.
     */
    public LoadSource loadSource() {
        if (customLoads.isEmpty()) {
            return new LoadSource.ImplicitSingleLoad(baseForce, clampedLoadPosition());
        }
        return new LoadSource.ExplicitLoads(customLoads);
    }

    private double clampToBeam(double position) {
        return Math.max(0.0, Math.min(position, length));
    }

    // Caso por defecto de la aplicación: viga biapoyada de acero de 8 m con 50 kN en el centro.
    public static BeamConfig getTestingBeam() {
        return BeamConfig.builder()
                .name("Design Case 1")
                .length(8.0)
                .boundaryCondition(BoundaryCondition.SIMPLY_SUPPORTED)
                .supportA(1.0)
                .supportB(7.0)
                .youngsModulus(200e9)
                .yieldStrength(250e6)
                .section(SectionDescriptor.builder()
                        .shape(SectionType.RECTANGULAR)
                        .height(0.5)
                        .width(0.2)
                        .flangeWidth(0.3)
                        .flangeThickness(0.02)
                        .webThickness(0.015)
                        .build())
                .baseForce(-50000.0)
                .loadPosition(4.0)
                .customLoads(List.of())
                .build();
    }
}
