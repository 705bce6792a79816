package beambench.service;

import beambench.config.AnalysisCase;
import beambench.config.BeamConfig;
import beambench.config.BearingConfig;
import beambench.config.DiscretizationConfig;
import beambench.domain.analysis.BeamAnalysisResult;
import beambench.domain.analysis.BearingAnalysisResult;
import beambench.physics.simulator.BeamAnalyzer;
import beambench.physics.simulator.BearingAnalyzer;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mantiene varios casos de diseño independientes y memoiza sus resultados.
 * <p>
 * La clave de caché es la configuración exacta (records con igualdad por valor), de modo que
 * un cambio en cualquier parámetro produce un recálculo y dos casos con la misma configuración
 * comparten un resultado inmutable. La caché es una optimización: vaciarla no cambia ningún resultado.
 */
@Slf4j
public class CaseAnalysisService {

    public static final int DEFAULT_MAX_CACHE_ENTRIES = 64;

    private record BeamKey(BeamConfig config, DiscretizationConfig discretization) {}

    private record BearingKey(BearingConfig config, int resolution) {}

    private final BeamAnalyzer beamAnalyzer;
    private final BearingAnalyzer bearingAnalyzer;
    private final int maxCacheEntries;

    private final Map<String, AnalysisCase> cases = new LinkedHashMap<>();
    private final Map<BeamKey, BeamAnalysisResult> beamCache = new ConcurrentHashMap<>();
    private final Map<BearingKey, BearingAnalysisResult> bearingCache = new ConcurrentHashMap<>();

    public CaseAnalysisService() {
        this(new BeamAnalyzer(), new BearingAnalyzer(), DEFAULT_MAX_CACHE_ENTRIES);
    }

    public CaseAnalysisService(BeamAnalyzer beamAnalyzer, BearingAnalyzer bearingAnalyzer, int maxCacheEntries) {
        if (maxCacheEntries < 1) {
            throw new IllegalArgumentException("La caché debe admitir al menos una entrada.");
        }
        this.beamAnalyzer = beamAnalyzer;
        this.bearingAnalyzer = bearingAnalyzer;
        this.maxCacheEntries = maxCacheEntries;
    }

    // --- Gestión de casos ---

    public synchronized void putCase(AnalysisCase analysisCase) {
        cases.put(analysisCase.id(), analysisCase);
        log.debug("Caso '{}' registrado ({} casos).", analysisCase.id(), cases.size());
    }

    public synchronized Optional<AnalysisCase> findCase(String id) {
        return Optional.ofNullable(cases.get(id));
    }

    public synchronized boolean removeCase(String id) {
        return cases.remove(id) != null;
    }

    public synchronized Collection<AnalysisCase> listCases() {
        return List.copyOf(cases.values());
    }

    // --- Análisis ---

    public BeamAnalysisResult analyzeBeam(String caseId) {
        AnalysisCase analysisCase = requireCase(caseId);
        if (analysisCase.beam() == null) {
            throw new IllegalArgumentException("El caso '" + caseId + "' no tiene configuración de viga.");
        }
        return analyzeBeam(analysisCase.beam(), analysisCase.discretization());
    }

    public BearingAnalysisResult analyzeBearing(String caseId) {
        AnalysisCase analysisCase = requireCase(caseId);
        if (analysisCase.bearing() == null) {
            throw new IllegalArgumentException("El caso '" + caseId + "' no tiene configuración de rodamiento.");
        }
        return analyzeBearing(analysisCase.bearing(), analysisCase.discretization().ballMeshResolution());
    }

    public BeamAnalysisResult analyzeBeam(BeamConfig config, DiscretizationConfig discretization) {
        BeamKey key = new BeamKey(config, discretization);
        BeamAnalysisResult cached = beamCache.get(key);
        if (cached != null) {
            log.debug("Resultado de viga servido desde caché para '{}'.", config.name());
            return cached;
        }
        BeamAnalysisResult result = beamAnalyzer.analyze(config, discretization);
        evictIfFull(beamCache);
        BeamAnalysisResult previous = beamCache.putIfAbsent(key, result);
        return previous != null ? previous : result;
    }

    public BearingAnalysisResult analyzeBearing(BearingConfig config, int resolution) {
        BearingKey key = new BearingKey(config, resolution);
        BearingAnalysisResult cached = bearingCache.get(key);
        if (cached != null) {
            return cached;
        }
        BearingAnalysisResult result = bearingAnalyzer.analyze(config, resolution);
        evictIfFull(bearingCache);
        BearingAnalysisResult previous = bearingCache.putIfAbsent(key, result);
        return previous != null ? previous : result;
    }

    public void clearCache() {
        beamCache.clear();
        bearingCache.clear();
        log.info("Caché de resultados vaciada.");
    }

    public int cachedResultCount() {
        return beamCache.size() + bearingCache.size();
    }

    private AnalysisCase requireCase(String caseId) {
        return findCase(caseId)
                .orElseThrow(() -> new IllegalArgumentException("Caso desconocido: " + caseId));
    }

    private <K, V> void evictIfFull(Map<K, V> cache) {
        // Política simple: al llenarse se descarta todo
        if (cache.size() >= maxCacheEntries) {
            log.debug("Caché llena ({} entradas). Se vacía.", cache.size());
            cache.clear();
        }
    }
}
