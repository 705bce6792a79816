package beambench.domain.analysis;

import beambench.config.BeamConfig;
import beambench.domain.beam.BeamFieldResult;
import beambench.domain.beam.DiagramData;
import beambench.domain.beam.PiecewiseSegment;
import beambench.domain.beam.ReactionSet;
import beambench.domain.beam.SectionProperties;
import beambench.domain.load.LoadDefinition;
import beambench.domain.report.EngineeringReport;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Conjunto completo de resultados de una viga. Inmutable; se recalcula entero en cada cambio.
 */
@Builder
public record BeamAnalysisResult(
        BeamConfig config,
        List<LoadDefinition> resolvedLoads,
        SectionProperties sectionProperties,
        ReactionSet reactions,
        BeamFieldResult field,
        DiagramData diagram,
        List<PiecewiseSegment> segments,
        EngineeringReport report,
        Instant computedAt
) {
    public BeamAnalysisResult {
        resolvedLoads = List.copyOf(resolvedLoads);
        segments = List.copyOf(segments);
    }
}
