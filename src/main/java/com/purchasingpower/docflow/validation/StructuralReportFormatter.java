package com.purchasingpower.docflow.validation;

import com.purchasingpower.docflow.exception.StructuralException;

/**
 * Renders a {@link ValidationReport} for people.
 */
public final class StructuralReportFormatter {

    private StructuralReportFormatter() {
    }

    public static String format(ValidationReport report) {
        StringBuilder out = new StringBuilder();

        if (report.isRepaired()) {
            out.append("⚠️  Document structure repaired:\n");
            for (String repair : report.getRepairs()) {
                out.append("   Repaired: ").append(repair).append('\n');
            }
            out.append("The document has been automatically repaired.");
            if (report.isValid()) {
                return out.toString();
            }
            out.append("\n\n");
        }

        if (report.isValid()) {
            return "✅ Document structure valid";
        }

        out.append("Document Structure Validation Failed:\n");
        for (StructuralException error : report.getErrors()) {
            out.append("  ❌ ").append(error.getMessage()).append('\n');
        }
        out.append("Fix structural errors before processing document.");
        return out.toString();
    }
}
