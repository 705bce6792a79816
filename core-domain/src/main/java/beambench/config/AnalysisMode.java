package beambench.config;

public enum AnalysisMode {
    BEAM,
    BEARING
}
