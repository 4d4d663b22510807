package com.purchasingpower.docflow.parser;

/**
 * Persisted outcome of a review gate, read from its result marker.
 */
public record ReviewGateRecord(String gateId, boolean passed, int issues, int warnings, int line) {

    public String toMarker() {
        return format(gateId, passed, issues, warnings);
    }

    public static String format(String gateId, boolean passed, int issues, int warnings) {
        return String.format("<!-- review_gate_result:%s status=%s issues=%d warnings=%d -->",
                gateId, passed ? "passed" : "failed", issues, warnings);
    }
}
