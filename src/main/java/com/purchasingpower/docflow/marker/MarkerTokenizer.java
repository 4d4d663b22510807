package com.purchasingpower.docflow.marker;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Single-pass tokenizer turning document lines into a typed stream of marker events.
 *
 * <p>Lines inside a {@code workflow:order} block produce no tokens. A line that opens
 * with a marker keyword but fails that keyword's strict grammar yields a
 * {@link MarkerKind#MALFORMED} token, so no downstream check re-derives syntax rules.
 */
@Slf4j
public final class MarkerTokenizer {

    private MarkerTokenizer() {
    }

    public static List<MarkerToken> tokenize(List<String> lines) {
        List<MarkerToken> tokens = new ArrayList<>();
        boolean inWorkflowBlock = false;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);

            if (inWorkflowBlock) {
                if (line.contains("-->")) {
                    inWorkflowBlock = false;
                }
                continue;
            }

            Matcher workflow = MarkerSyntax.WORKFLOW_ORDER_START.matcher(line);
            if (workflow.find()) {
                tokens.add(MarkerToken.of(MarkerKind.WORKFLOW_ORDER_START, i, "workflow:order"));
                inWorkflowBlock = !line.substring(workflow.end()).contains("-->");
                continue;
            }

            if (line.contains(MarkerSyntax.PLACEHOLDER)) {
                tokens.add(MarkerToken.of(MarkerKind.PLACEHOLDER, i, null));
            }

            Matcher keyword = MarkerSyntax.MARKER_KEYWORD.matcher(line);
            if (keyword.find()) {
                MarkerToken token = classify(keyword.group("keyword"), line, i);
                if (token != null) {
                    tokens.add(token);
                }
            }
        }

        log.debug("Tokenized {} lines into {} marker events", lines.size(), tokens.size());
        return tokens;
    }

    private static MarkerToken classify(String keyword, String line, int index) {
        return switch (keyword) {
            case "section" -> idMarker(MarkerKind.SECTION, MarkerSyntax.SECTION.matcher(line), index, "section");
            case "subsection" -> idMarker(MarkerKind.SUBSECTION, MarkerSyntax.SUBSECTION.matcher(line), index, "subsection");
            case "table" -> idMarker(MarkerKind.TABLE, MarkerSyntax.TABLE.matcher(line), index, "table");
            case "section_lock" -> lockMarker(line, index);
            case "review_gate_result" -> gateResultMarker(line, index);
            case "meta" -> metaMarker(line, index);
            default -> throw new IllegalStateException("Unhandled marker keyword: " + keyword);
        };
    }

    private static MarkerToken idMarker(MarkerKind kind, Matcher matcher, int index, String keyword) {
        if (matcher.find()) {
            return MarkerToken.of(kind, index, matcher.group("id"));
        }
        return MarkerToken.malformed(index, "Invalid " + keyword + " ID format (expected [a-z0-9_]+)");
    }

    private static MarkerToken lockMarker(String line, int index) {
        Matcher matcher = MarkerSyntax.SECTION_LOCK.matcher(line);
        if (matcher.find()) {
            return new MarkerToken(MarkerKind.SECTION_LOCK, index, matcher.group("id"),
                    Map.of("lock", matcher.group("lock")), null);
        }
        Matcher value = MarkerSyntax.LOCK_VALUE.matcher(line);
        if (!value.find()) {
            return MarkerToken.malformed(index, "Missing lock=true|false attribute");
        }
        String lock = value.group("value");
        if (!"true".equals(lock) && !"false".equals(lock)) {
            return MarkerToken.malformed(index, "Lock value must be 'true' or 'false', got '" + lock + "'");
        }
        return MarkerToken.malformed(index, "Invalid section_lock ID format (expected [a-z0-9_]+)");
    }

    private static MarkerToken gateResultMarker(String line, int index) {
        Matcher matcher = MarkerSyntax.REVIEW_GATE_RESULT.matcher(line);
        if (!matcher.find()) {
            return MarkerToken.malformed(index, "Invalid review_gate_result syntax");
        }
        Map<String, String> attributes = new HashMap<>();
        attributes.put("status", matcher.group("status"));
        attributes.put("issues", matcher.group("issues") == null ? "0" : matcher.group("issues"));
        attributes.put("warnings", matcher.group("warnings") == null ? "0" : matcher.group("warnings"));
        return new MarkerToken(MarkerKind.REVIEW_GATE_RESULT, index, matcher.group("gate"), attributes, null);
    }

    private static MarkerToken metaMarker(String line, int index) {
        Matcher matcher = MarkerSyntax.META.matcher(line);
        if (!matcher.find()) {
            return MarkerToken.malformed(index, "Invalid meta marker syntax");
        }
        String key = matcher.group("key");
        if (!MarkerSyntax.SUPPORTED_METADATA_KEYS.contains(key)) {
            log.debug("Ignoring unsupported metadata key '{}' on line {}", key, index + 1);
            return null;
        }
        Map<String, String> attributes = new HashMap<>();
        if (matcher.group("value") != null) {
            attributes.put("value", matcher.group("value"));
        }
        if (matcher.group("version") != null) {
            attributes.put("version", matcher.group("version"));
        }
        return new MarkerToken(MarkerKind.META, index, key, attributes, null);
    }
}
