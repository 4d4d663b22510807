package com.purchasingpower.docflow;

import com.purchasingpower.docflow.question.QuestionTableSchema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for marker documents used across tests.
 */
public final class TestDocuments {

    public static final String DATE = "2024-01-15";

    private TestDocuments() {
    }

    public static List<String> lines(String text) {
        return text.lines().toList();
    }

    /**
     * Metadata, version line and workflow block, followed by the given sections.
     */
    public static List<String> document(String docType, List<String> workflowOrder, List<List<String>> sections) {
        List<String> lines = new ArrayList<>();
        lines.add("<!-- meta:doc_type value=\"" + docType + "\" -->");
        lines.add("<!-- meta:version -->");
        lines.add("- **Version:** 0.0");
        lines.add("<!-- workflow:order");
        lines.addAll(workflowOrder);
        lines.add("-->");
        lines.add("");
        lines.add("# Test Document");
        lines.add("");
        sections.forEach(lines::addAll);
        return lines;
    }

    /**
     * A section with a body (or placeholder) and a {@code questions_issues} subsection
     * holding its question table; the lock sits after the table.
     */
    public static List<String> section(String id, String body, boolean locked, String... questionRows) {
        List<String> lines = new ArrayList<>();
        lines.add("<!-- section:" + id + " -->");
        lines.add("## " + title(id));
        lines.add("");
        lines.add(body == null ? "<!-- PLACEHOLDER -->" : body);
        lines.add("");
        lines.add("<!-- subsection:questions_issues -->");
        lines.add("### Questions & Issues");
        lines.add("");
        lines.add("<!-- table:" + id + "_questions -->");
        lines.add(QuestionTableSchema.SECTION.headerRow());
        lines.add(QuestionTableSchema.SECTION.separatorRow());
        lines.addAll(Arrays.asList(questionRows));
        lines.add("");
        lines.add("<!-- section_lock:" + id + " lock=" + locked + " -->");
        lines.add("---");
        lines.add("");
        return lines;
    }

    public static String row(String id, String question, String answer, String status) {
        return "| " + id + " | " + question + " | " + DATE + " | " + answer + " | " + status + " |";
    }

    public static int indexOf(List<String> lines, String line) {
        int index = lines.indexOf(line);
        if (index < 0) {
            throw new AssertionError("Line not found: " + line);
        }
        return index;
    }

    public static long countContaining(List<String> lines, String text) {
        return lines.stream().filter(l -> l.contains(text)).count();
    }

    private static String title(String id) {
        String spaced = id.replace('_', ' ');
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }
}
