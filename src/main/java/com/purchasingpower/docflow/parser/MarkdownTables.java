package com.purchasingpower.docflow.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Pipe-table helpers.
 */
public final class MarkdownTables {

    private static final Pattern SEPARATOR_ROW = Pattern.compile("^\\|(\\s*:?-+:?\\s*\\|)+\\s*$");

    private MarkdownTables() {
    }

    public static boolean isTableLine(String line) {
        return line.stripLeading().startsWith("|");
    }

    public static boolean isSeparatorRow(String line) {
        return SEPARATOR_ROW.matcher(line.strip()).matches();
    }

    /**
     * Splits a row into trimmed cells, ignoring the outer pipes.
     */
    public static List<String> splitRow(String line) {
        String row = line.strip();
        if (row.startsWith("|")) {
            row = row.substring(1);
        }
        if (row.endsWith("|")) {
            row = row.substring(0, row.length() - 1);
        }
        List<String> cells = new ArrayList<>();
        for (String cell : row.split("\\|", -1)) {
            cells.add(cell.strip());
        }
        return cells;
    }

    public static String formatRow(List<String> cells) {
        return "| " + String.join(" | ", cells) + " |";
    }

    public static String separatorRow(int columns) {
        List<String> cells = new ArrayList<>();
        for (int i = 0; i < columns; i++) {
            cells.add("---");
        }
        return "|" + String.join("|", cells) + "|";
    }

    public static int pipeCount(String line) {
        int count = 0;
        for (char c : line.strip().toCharArray()) {
            if (c == '|') {
                count++;
            }
        }
        return count;
    }
}
