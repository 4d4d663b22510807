package com.purchasingpower.docflow.editing;

import com.purchasingpower.docflow.marker.MarkerSyntax;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans generated text so it can never carry structure into a region body.
 */
@Slf4j
@Component
public class BodySanitizer {

    private static final Pattern HEADING = Pattern.compile("^\\s*#+\\s*(?<text>.*?)\\s*$");
    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-*+]|\\d+[.)])\\s+(?<text>.*)$");

    public String sanitize(String body, SanitizeRules rules) {
        if (body == null || body.isBlank()) {
            return "";
        }

        List<String> kept = new ArrayList<>();
        Set<String> seenBullets = new HashSet<>();
        int dropped = 0;

        for (String line : body.split("\\R", -1)) {
            String stripped = line.strip();

            if (MarkerSyntax.containsMarkerSyntax(line) || stripped.equals(MarkerSyntax.DIVIDER)) {
                dropped++;
                continue;
            }
            Matcher heading = HEADING.matcher(line);
            if (heading.matches() && !isPreservedHeading(heading.group("text"), rules)) {
                dropped++;
                continue;
            }
            if (matchesAny(line, rules.getRemovePatterns())) {
                dropped++;
                continue;
            }
            if (rules.isDedupeBullets()) {
                Matcher bullet = BULLET.matcher(line);
                if (bullet.matches() && !seenBullets.add(normalize(bullet.group("text")))) {
                    dropped++;
                    continue;
                }
            }
            kept.add(line.stripTrailing());
        }

        if (dropped > 0) {
            log.debug("Sanitizer dropped {} line(s)", dropped);
        }
        return collapseBlankRuns(kept);
    }

    private boolean isPreservedHeading(String text, SanitizeRules rules) {
        for (String allowed : rules.getPreservedHeadings()) {
            if (allowed.equalsIgnoreCase(text.strip())) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesAny(String line, List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(line).find()) {
                return true;
            }
        }
        return false;
    }

    static String normalize(String text) {
        return text.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private String collapseBlankRuns(List<String> lines) {
        List<String> out = new ArrayList<>();
        boolean previousBlank = true;
        for (String line : lines) {
            boolean blank = line.isBlank();
            if (blank && previousBlank) {
                continue;
            }
            out.add(blank ? "" : line);
            previousBlank = blank;
        }
        while (!out.isEmpty() && out.get(out.size() - 1).isEmpty()) {
            out.remove(out.size() - 1);
        }
        return String.join("\n", out);
    }
}
