package beambench.factory;

import beambench.config.BeamConfig;
import beambench.domain.beam.BeamFieldResult;
import beambench.domain.beam.PiecewiseSegment;
import beambench.domain.beam.SectionProperties;
import beambench.domain.report.EngineeringReport;
import beambench.domain.report.FiberState;
import beambench.domain.report.Verdict;

import java.util.List;
import java.util.Locale;

/**
 * Construye el {@link EngineeringReport} de una viga ya resuelta.
 * <p>
 * El flector pico se obtiene de los polinomios por tramos (extremos de cada tramo y ceros
 * de V en su interior), así que no depende del muestreo del diagrama.
 * <p>
 * Se calculan dos coeficientes de seguridad: {@code safetyFactor} con la tensión máxima de la
 * malla y {@code governingSafetyFactor} con la mayor entre ésta y la del flector pico. El
 * veredicto y el resumen usan el segundo, que sigue siendo válido en vigas con voladizo.
 */
public final class ReportFactory {

    /** Límite de servicio: flecha admisible = L / 360. */
    public static final double SERVICEABILITY_RATIO = 360.0;

    /** Denominador mínimo en los cocientes de tensión (convención de visualización). */
    private static final double MIN_STRESS_DENOMINATOR = 1.0;

    /**
     * Prohibido construir esta clase utilidad
     */
    private ReportFactory() {
    }

    public static EngineeringReport create(BeamConfig config,
                                           SectionProperties section,
                                           BeamFieldResult field,
                                           List<PiecewiseSegment> segments) {
        // 1. Flector pico exacto
        double peakMoment = 0.0;
        double peakPosition = 0.0;
        for (PiecewiseSegment segment : segments) {
            for (double x : candidatePositions(segment)) {
                double m = segment.momentAt(x);
                if (Math.abs(m) > Math.abs(peakMoment)) {
                    peakMoment = m;
                    peakPosition = x;
                }
            }
        }

        final double c = config.section().extremeFiberDistance();
        final double peakMomentStress = Math.abs(peakMoment) * c / section.momentOfInertia();

        // 2. Resistencia
        final double governingStress = Math.max(field.maxStress(), peakMomentStress);
        final double safetyFactor = config.yieldStrength() / Math.max(MIN_STRESS_DENOMINATOR, Math.abs(field.maxStress()));
        final double governingSafetyFactor = config.yieldStrength() / Math.max(MIN_STRESS_DENOMINATOR, governingStress);

        // 3. Servicio
        final double allowable = config.length() / SERVICEABILITY_RATIO;
        final double utilization = field.maxDeflection() / allowable;

        EngineeringReport report = EngineeringReport.builder()
                .caseName(config.name())
                .maxStress(field.maxStress())
                .maxDeflection(field.maxDeflection())
                .peakMoment(peakMoment)
                .peakMomentPosition(peakPosition)
                .peakMomentStress(peakMomentStress)
                .governingStress(governingStress)
                .safetyFactor(safetyFactor)
                .governingSafetyFactor(governingSafetyFactor)
                .verdict(Verdict.fromSafetyFactor(governingSafetyFactor))
                .allowableDeflection(allowable)
                .deflectionUtilization(utilization)
                .serviceabilityOk(field.maxDeflection() <= allowable)
                .topFiber(FiberState.topFiberFor(peakMoment))
                .summary(summarize(config, governingStress, governingSafetyFactor, field.maxDeflection()))
                .build();
        return report;
    }

    private static double[] candidatePositions(PiecewiseSegment segment) {
        List<Double> roots = segment.shear().realRoots();
        double[] xs = new double[2 + roots.size()];
        xs[0] = segment.xA();
        xs[1] = segment.xB();
        int k = 2;
        for (double root : roots) {
            // Sólo los ceros estrictamente interiores; fuera del tramo el polinomio no aplica
            xs[k++] = (root > segment.xA() && root < segment.xB()) ? root : segment.xA();
        }
        return xs;
    }

    /**
     * Resumen en texto plano para el panel de informes y el asistente conversacional.
     */
    static String summarize(BeamConfig config, double stress, double safetyFactor, double maxDeflection) {
        String ratio = maxDeflection > 0
                ? String.format(Locale.ROOT, "L/%.0f", config.length() / maxDeflection)
                : "n/a";

        return String.format(Locale.ROOT,
                "Caso: %s%n"
                        + "Condición de contorno: %s%n"
                        + "Sección: %s (canto %.3f m)%n"
                        + "Longitud: %.2f m%n"
                        + "Material: E = %.1f GPa, σy = %.1f MPa%n"
                        + "Carga base: %.1f N en x = %.2f m (%d cargas explícitas)%n"
                        + "Tensión máxima: %.2f MPa%n"
                        + "Coeficiente de seguridad: %.2f%n"
                        + "Flecha máxima: %.3f mm (%s)",
                config.name(),
                config.boundaryCondition(),
                config.section().shape(),
                config.section().height(),
                config.length(),
                config.youngsModulus() / 1e9,
                config.yieldStrength() / 1e6,
                config.baseForce(),
                config.clampedLoadPosition(),
                config.customLoads().size(),
                stress / 1e6,
                safetyFactor,
                maxDeflection * 1000.0,
                ratio);
    }
}
