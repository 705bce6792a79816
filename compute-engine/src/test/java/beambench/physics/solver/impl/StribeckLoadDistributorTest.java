package beambench.physics.solver.impl;

import beambench.config.BearingConfig;
import beambench.domain.bearing.BearingElement;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class StribeckLoadDistributorTest {

    private StribeckLoadDistributor distributor;
    private BearingConfig config;

    @BeforeEach
    void setUp() {
        distributor = new StribeckLoadDistributor();
        config = BearingConfig.getTestingBearing();
    }

    @Test
    @DisplayName("Escenario C: la bola alineada con la carga recibe Qmax = 5·Fr/Z ≈ 2083.3 N")
    void distribute_scenarioC_shouldPeakUnderLoadVector() {
        // ACT
        List<BearingElement> elements = distributor.distribute(config);

        // ASSERT
        for (BearingElement e : elements) {
            log.info("Bola {}: θ={} rad, Q={} N, σ={}", e.index(), e.angle(), e.load(), e.maxStress());
        }
        assertEquals(12, elements.size());

        BearingElement bottom = elements.get(9);
        assertEquals(3.0 * Math.PI / 2.0, bottom.angle(), 1e-12);
        assertEquals(5000.0 * 5.0 / 12.0, bottom.load(), 1e-6);
        assertEquals(2083.333, bottom.load(), 1e-3);

        double maxLoad = elements.stream().mapToDouble(BearingElement::load).max().orElseThrow();
        assertEquals(bottom.load(), maxLoad);
    }

    @Test
    @DisplayName("Bolas a 90° o más del vector de carga no reciben carga")
    void distribute_outsideLoadZone_shouldCarryNothing() {
        List<BearingElement> elements = distributor.distribute(config);

        // θ = 0 y θ = π están a ψ = π/2; θ = π/2 está enfrente de la carga
        assertEquals(0.0, elements.get(0).load());
        assertEquals(0.0, elements.get(6).load());
        assertEquals(0.0, elements.get(3).load());
        assertEquals(0.0, elements.get(3).maxStress());
        assertEquals(0.0, elements.get(3).deformation());
        assertFalse(elements.get(3).carriesLoad());

        long loaded = elements.stream().filter(BearingElement::carriesLoad).count();
        assertEquals(5, loaded, "Sólo las bolas 7..11 están en la zona de carga");
    }

    @Test
    @DisplayName("Q(ψ) = Qmax·cos(ψ)^1.5 y escalas de tensión y deformación")
    void distribute_shouldFollowStribeckProfile() {
        List<BearingElement> elements = distributor.distribute(config);
        double qMax = 5000.0 * 5.0 / 12.0;

        // Bola 7: θ = 7π/6, ψ = π/3
        BearingElement e = elements.get(7);
        double expected = qMax * Math.pow(0.5, 1.5);
        assertEquals(expected, e.load(), 1e-6);
        assertEquals(StribeckLoadDistributor.HERTZ_STRESS_SCALE * Math.sqrt(expected / 40.0), e.maxStress(), 1e-6);
        assertEquals(StribeckLoadDistributor.DEFORMATION_SCALE * Math.pow(expected, 2.0 / 3.0), e.deformation(), 1e-9);
        assertEquals(elements.get(11).load(), e.load(), 1e-6, "Reparto simétrico respecto al vector de carga");
    }

    @Test
    @DisplayName("Geometría: centros sobre la circunferencia primitiva y radio de bola")
    void distribute_shouldPlaceBallsOnPitchCircle() {
        List<BearingElement> elements = distributor.distribute(config);

        for (BearingElement e : elements) {
            assertEquals(80.0, Math.hypot(e.x(), e.y()), 1e-9);
            assertEquals(20.0, e.radius(), 1e-12);
            assertEquals(2.0 * Math.PI * e.index() / 12.0, e.angle(), 1e-12, "Sin giro la jaula está en reposo");
        }
    }

    @Test
    @DisplayName("Ángulo de contacto: Qmax = 5·Fr / (Z·cos α)")
    void distribute_withContactAngle_shouldIncreasePeakLoad() {
        BearingConfig angular = config.withContactAngle(60.0);

        double peak = distributor.distribute(angular).get(9).load();

        assertEquals(2.0 * 5000.0 * 5.0 / 12.0, peak, 1e-6);
    }

    @Test
    @DisplayName("Jaula en movimiento: gira a ω_eje·(1 − d·cos α / D)/2")
    void cageAngle_shouldAdvanceWithShaftSpeed() {
        // 60 rpm → ω_eje = 2π rad/s; d/D = 40/160 → ω_jaula = 0.75π rad/s
        BearingConfig rotating = config.withRotationSpeed(60.0);

        assertEquals(0.0, StribeckLoadDistributor.cageAngle(rotating, 0.0));
        assertEquals(0.75 * Math.PI, StribeckLoadDistributor.cageAngle(rotating, 1.0), 1e-12);

        List<BearingElement> elements = distributor.distribute(rotating, 1.0);
        assertEquals(0.75 * Math.PI, elements.get(0).angle(), 1e-12);
        for (BearingElement e : elements) {
            assertTrue(e.angle() >= 0 && e.angle() < 2 * Math.PI);
        }
    }

    @Test
    @DisplayName("Carga radial nula: ninguna bola cargada")
    void distribute_zeroLoad_shouldLeaveAllBallsUnloaded() {
        List<BearingElement> elements = distributor.distribute(config.withRadialLoad(0.0));

        assertTrue(elements.stream().noneMatch(BearingElement::carriesLoad));
    }
}
