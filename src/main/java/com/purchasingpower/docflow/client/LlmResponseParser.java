package com.purchasingpower.docflow.client;

import com.purchasingpower.docflow.marker.MarkerSyntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls structured content out of free-form model output.
 */
public final class LlmResponseParser {

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);
    private static final Pattern INLINE_COMMENT = Pattern.compile("<!--.*?-->");

    private LlmResponseParser() {
    }

    /**
     * Finds the JSON object in a response: a fenced block first, then the whole text,
     * then everything from the first '{' to the last '}'.
     */
    public static Optional<String> extractJsonObject(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        Matcher fenced = FENCED_JSON.matcher(response);
        if (fenced.find()) {
            return Optional.of(fenced.group(1));
        }
        String trimmed = response.strip();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            return Optional.of(trimmed);
        }
        int first = trimmed.indexOf('{');
        int last = trimmed.lastIndexOf('}');
        if (first >= 0 && last > first) {
            return Optional.of(trimmed.substring(first, last + 1));
        }
        return Optional.empty();
    }

    /**
     * Removes every line carrying marker syntax, plus a surrounding code fence if the
     * model wrapped its whole answer in one.
     */
    public static String stripMarkerLines(String text) {
        if (text == null) {
            return "";
        }
        String body = text.strip();
        if (body.startsWith("```") && body.endsWith("```") && body.length() >= 6) {
            int firstNewline = body.indexOf('\n');
            body = firstNewline < 0 ? "" : body.substring(firstNewline + 1, body.length() - 3);
        }
        List<String> kept = new ArrayList<>();
        for (String line : body.split("\\R", -1)) {
            if (!MarkerSyntax.containsMarkerSyntax(line)) {
                kept.add(line);
            }
        }
        return String.join("\n", kept).strip();
    }

    /** Removes inline comments from single-line text such as a question. */
    public static String stripInlineMarkers(String text) {
        return text == null ? "" : INLINE_COMMENT.matcher(text).replaceAll("").strip();
    }
}
