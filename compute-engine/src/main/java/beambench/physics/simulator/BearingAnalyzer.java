package beambench.physics.simulator;

import beambench.config.BearingConfig;
import beambench.domain.analysis.BearingAnalysisResult;
import beambench.domain.bearing.BearingElement;
import beambench.domain.bearing.StressPoint;
import beambench.physics.solver.BallStressFieldGenerator;
import beambench.physics.solver.BearingLoadDistributor;
import beambench.physics.solver.impl.ContactPoleStressFieldGenerator;
import beambench.physics.solver.impl.StribeckLoadDistributor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Facade del análisis de rodamiento: reparto de carga por bola y nube de tensión de cada bola.
 */
@Slf4j
public class BearingAnalyzer {

    private final BearingLoadDistributor loadDistributor;
    private final BallStressFieldGenerator stressFieldGenerator;

    public BearingAnalyzer() {
        this(new StribeckLoadDistributor(), new ContactPoleStressFieldGenerator());
    }

    public BearingAnalyzer(BearingLoadDistributor loadDistributor, BallStressFieldGenerator stressFieldGenerator) {
        this.loadDistributor = loadDistributor;
        this.stressFieldGenerator = stressFieldGenerator;
    }

    public BearingAnalysisResult analyze(BearingConfig config, int ballMeshResolution) {
        return analyze(config, ballMeshResolution, 0.0);
    }

    public BearingAnalysisResult analyze(BearingConfig config, int ballMeshResolution, double timeSeconds) {
        if (config == null) {
            throw new IllegalArgumentException("La configuración del rodamiento es obligatoria.");
        }

        List<BearingElement> elements = loadDistributor.distribute(config, timeSeconds);

        List<List<StressPoint>> fields = new ArrayList<>(elements.size());
        double maxLoad = 0.0;
        double maxStress = 0.0;
        int loaded = 0;
        for (BearingElement element : elements) {
            fields.add(stressFieldGenerator.generate(element, ballMeshResolution));
            maxLoad = Math.max(maxLoad, element.load());
            maxStress = Math.max(maxStress, element.maxStress());
            if (element.carriesLoad()) {
                loaded++;
            }
        }

        log.info("Rodamiento analizado (t={} s): Z={}, {} bolas cargadas, Qmax={} N",
                timeSeconds, config.ballCount(), loaded, maxLoad);

        return BearingAnalysisResult.builder()
                .config(config)
                .timeSeconds(timeSeconds)
                .elements(elements)
                .ballStressFields(fields)
                .maxBallLoad(maxLoad)
                .maxContactStress(maxStress)
                .loadedBallCount(loaded)
                .computedAt(Instant.now())
                .build();
    }
}
