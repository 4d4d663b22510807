package com.purchasingpower.docflow.marker;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Marker grammar: exact patterns and constants shared by the tokenizer,
 * the sanitizer and the patch validator.
 */
public final class MarkerSyntax {

    public static final String PLACEHOLDER = "<!-- PLACEHOLDER -->";
    public static final String DIVIDER = "---";
    public static final String REVIEW_GATE_PREFIX = "review_gate:";

    public static final Pattern SECTION = Pattern.compile("<!--\\s*section:(?<id>[a-z0-9_]+)\\s*-->");
    public static final Pattern SUBSECTION = Pattern.compile("<!--\\s*subsection:(?<id>[a-z0-9_]+)\\s*-->");
    public static final Pattern TABLE = Pattern.compile("<!--\\s*table:(?<id>[a-z0-9_]+)\\s*-->");
    public static final Pattern SECTION_LOCK = Pattern.compile(
            "<!--\\s*section_lock:(?<id>[a-z0-9_]+)\\s+lock=(?<lock>true|false)\\s*-->");
    public static final Pattern META = Pattern.compile(
            "<!--\\s*meta:(?<key>[a-z_]+)(?:\\s+value=\"(?<value>[^\"]+)\")?(?:\\s+version=\"(?<version>[^\"]+)\")?\\s*-->");
    public static final Pattern REVIEW_GATE_RESULT = Pattern.compile(
            "<!--\\s*review_gate_result:(?<gate>[a-z0-9_:]+)\\s+status=(?<status>passed|failed)"
                    + "(?:\\s+issues=(?<issues>\\d{1,9}))?(?:\\s+warnings=(?<warnings>\\d{1,9}))?\\s*-->");
    public static final Pattern WORKFLOW_ORDER_START = Pattern.compile("<!--\\s*workflow:order\\b");

    /** Any comment that opens with a marker keyword, valid or not. */
    public static final Pattern MARKER_KEYWORD = Pattern.compile(
            "<!--\\s*(?<keyword>section_lock|subsection|section|table|review_gate_result|meta):");

    static final Pattern LOCK_VALUE = Pattern.compile("lock=(?<value>\\S*?)\\s*(?:-->|$)");

    public static final Set<String> SUPPORTED_METADATA_KEYS = Set.of("doc_type", "doc_format", "version");

    private MarkerSyntax() {
    }

    /**
     * True when the text carries any marker syntax, including bare HTML comments.
     */
    public static boolean containsMarkerSyntax(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        if (MARKER_KEYWORD.matcher(text).find() || WORKFLOW_ORDER_START.matcher(text).find()) {
            return true;
        }
        return text.contains("<!--") && text.contains("-->");
    }

    public static boolean isReviewGate(String targetId) {
        return targetId != null && targetId.startsWith(REVIEW_GATE_PREFIX);
    }
}
