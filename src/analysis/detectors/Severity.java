package analysis.detectors;

/**
 * How serious a reported problem is, from least to most
 */
public enum Severity {
    INFO, LOW, MEDIUM, HIGH, CRITICAL;
}
