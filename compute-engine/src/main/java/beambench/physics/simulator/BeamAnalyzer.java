package beambench.physics.simulator;

import beambench.config.BeamConfig;
import beambench.config.DiscretizationConfig;
import beambench.domain.analysis.BeamAnalysisResult;
import beambench.domain.beam.BeamFieldResult;
import beambench.domain.beam.DiagramData;
import beambench.domain.beam.PiecewiseSegment;
import beambench.domain.beam.ReactionSet;
import beambench.domain.beam.SectionProperties;
import beambench.domain.load.LoadDefinition;
import beambench.domain.report.EngineeringReport;
import beambench.factory.LoadSetFactory;
import beambench.factory.ReportFactory;
import beambench.physics.model.SectionPropertyCalculator;
import beambench.physics.solver.BeamFieldSolver;
import beambench.physics.solver.DiagramIntegrator;
import beambench.physics.solver.PiecewisePolynomialBuilder;
import beambench.physics.solver.ReactionSolver;
import beambench.physics.solver.impl.EulerBernoulliFieldSolver;
import beambench.physics.solver.impl.ForwardEulerDiagramIntegrator;
import beambench.physics.solver.impl.StaticEquilibriumReactionSolver;
import beambench.physics.solver.impl.SuperpositionPolynomialBuilder;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;

/**
 * Facade de alto nivel para el análisis de una viga.
 * <p>
 * Orden fijo: cargas → sección → reacciones → campo de tensiones → diagramas → tramos → informe.
 * Cada paso es una función pura de la configuración; el resultado se recalcula entero en cada cambio.
 */
@Slf4j
public class BeamAnalyzer {

    private final ReactionSolver reactionSolver;
    private final BeamFieldSolver fieldSolver;
    private final DiagramIntegrator diagramIntegrator;
    private final PiecewisePolynomialBuilder polynomialBuilder;

    public BeamAnalyzer() {
        this(new StaticEquilibriumReactionSolver(),
                new EulerBernoulliFieldSolver(),
                new ForwardEulerDiagramIntegrator(),
                new SuperpositionPolynomialBuilder());
    }

    public BeamAnalyzer(ReactionSolver reactionSolver,
                        BeamFieldSolver fieldSolver,
                        DiagramIntegrator diagramIntegrator,
                        PiecewisePolynomialBuilder polynomialBuilder) {
        this.reactionSolver = reactionSolver;
        this.fieldSolver = fieldSolver;
        this.diagramIntegrator = diagramIntegrator;
        this.polynomialBuilder = polynomialBuilder;
        log.debug("BeamAnalyzer listo. (Reacciones: {}, Campo: {}, Diagramas: {}, Tramos: {})",
                reactionSolver.getName(), fieldSolver.getName(),
                diagramIntegrator.getName(), polynomialBuilder.getName());
    }

    public BeamAnalysisResult analyze(BeamConfig config, DiscretizationConfig discretization) {
        if (config == null || discretization == null) {
            throw new IllegalArgumentException("La configuración de viga y la discretización son obligatorias.");
        }
        long start = System.nanoTime();

        // 1. Cargas resueltas (lista explícita o carga base), una única vez
        List<LoadDefinition> loads = LoadSetFactory.resolve(config);

        // 2. Propiedades de sección
        SectionProperties section = SectionPropertyCalculator.calculate(config.section());

        // 3. Equilibrio estático
        ReactionSet reactions = reactionSolver.solveReactions(config, loads);

        // 4. Campo de tensiones y deformada
        BeamFieldResult field = fieldSolver.solveField(config, section, discretization);

        // 5. Diagramas muestreados y polinomios por tramos
        DiagramData diagram = diagramIntegrator.integrate(config, loads, reactions, discretization.diagramSamples());
        List<PiecewiseSegment> segments = polynomialBuilder.buildSegments(config, loads, reactions);

        // 6. Informe de ingeniería
        EngineeringReport report = ReportFactory.create(config, section, field, segments);

        log.info("Viga '{}' analizada en {} ms: {} cargas, {} tramos, σmax={} Pa, CS={}, CS gobernante={}",
                config.name(), (System.nanoTime() - start) / 1_000_000,
                loads.size(), segments.size(), field.maxStress(), report.safetyFactor(),
                report.governingSafetyFactor());

        return BeamAnalysisResult.builder()
                .config(config)
                .resolvedLoads(loads)
                .sectionProperties(section)
                .reactions(reactions)
                .field(field)
                .diagram(diagram)
                .segments(segments)
                .report(report)
                .computedAt(Instant.now())
                .build();
    }
}
