package com.purchasingpower.docflow.marker;

import java.util.Map;

/**
 * One marker event found on a document line.
 *
 * @param kind       marker kind
 * @param line       0-based line index
 * @param id         section/subsection/table/lock id, meta key or gate id; null for placeholders
 * @param attributes kind-specific attributes (lock, value, version, status, issues, warnings)
 * @param reason     why the marker is malformed; null otherwise
 */
public record MarkerToken(MarkerKind kind, int line, String id, Map<String, String> attributes, String reason) {

    public MarkerToken {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static MarkerToken of(MarkerKind kind, int line, String id) {
        return new MarkerToken(kind, line, id, Map.of(), null);
    }

    public static MarkerToken malformed(int line, String reason) {
        return new MarkerToken(MarkerKind.MALFORMED, line, null, Map.of(), reason);
    }

    public String attribute(String name) {
        return attributes.get(name);
    }

    public boolean is(MarkerKind expected) {
        return kind == expected;
    }

    public boolean lockValue() {
        return "true".equals(attributes.get("lock"));
    }

    public int intAttribute(String name) {
        String value = attributes.get(name);
        return value == null ? 0 : Integer.parseInt(value);
    }
}
