package com.purchasingpower.docflow.editing;

import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.SectionSpan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.docflow.TestDocuments.lines;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

@DisplayName("Table Routing Tests")
class TableRoutingTest {

    private static final List<String> DOC = lines("""
            <!-- section:requirements -->
            ## Requirements

            <!-- PLACEHOLDER -->

            <!-- subsection:functional_requirements -->
            ### Functional Requirements

            <!-- table:functional_requirements -->
            | ID | Requirement | Priority |
            |---|---|---|
            | <!-- PLACEHOLDER --> | | |

            <!-- subsection:non_functional_requirements -->
            ### Non-Functional Requirements

            <!-- table:non_functional_requirements -->
            | ID | Requirement | Priority |
            |---|---|---|
            | NFR-1 | p99 under 200ms | High |

            <!-- subsection:questions_issues -->
            ### Questions & Issues

            <!-- table:requirements_questions -->
            | Question ID | Question | Date | Answer | Status |
            |---|---|---|---|---|
            """);

    private final SectionSpan span = DocumentParser.findSection(DOC, "requirements").orElseThrow();

    @Test
    @DisplayName("Should send rows to the table under the matching heading and keep the prose")
    void routesByHeading() {
        // Given
        String output = """
                Orders are tracked end to end.

                ### Functional Requirements
                | ID | Requirement | Priority |
                |---|---|---|
                | FR-1 | Track orders | High |

                ### Non-Functional Requirements
                | NFR-1 | p99 under 200ms | High |
                | NFR-2 | 99.9% uptime | Medium |
                """;

        // When
        TableRouting.Routed routed = TableRouting.route(DOC, span, output);

        // Then
        assertEquals(2, routed.rowsAdded());
        assertEquals("Orders are tracked end to end.", routed.preamble());
        List<String> result = routed.lines();
        assertThat(result).doesNotContain("| <!-- PLACEHOLDER --> | | |");
        assertEquals("| FR-1 | Track orders | High |", result.get(result.indexOf("|---|---|---|") + 1));
        assertEquals(1, result.stream().filter("| NFR-1 | p99 under 200ms | High |"::equals).count());
        int nfr2 = result.indexOf("| NFR-2 | 99.9% uptime | Medium |");
        assertEquals(nfr2 - 1, result.indexOf("| NFR-1 | p99 under 200ms | High |"));
    }

    @Test
    @DisplayName("Should return the text unchanged when it names no table subsection")
    void noTableContent() {
        String output = "Plain prose.\n\n### Something Else\n| a | b | c |";

        TableRouting.Routed routed = TableRouting.route(DOC, span, output);

        assertSame(DOC, routed.lines());
        assertEquals(output, routed.preamble());
        assertEquals(0, routed.rowsAdded());
    }

    @Test
    @DisplayName("Should never route rows into the question ledger or rows of the wrong width")
    void ledgerAndWidth() {
        String output = """
                ### Questions & Issues
                | requirements-Q9 | Sneaky? | 2024-01-01 |  | Open |

                ### Functional Requirements
                | FR-1 | Too | many | cells |
                """;

        TableRouting.Routed routed = TableRouting.route(DOC, span, output);

        assertEquals(0, routed.rowsAdded());
        assertEquals(DOC, routed.lines());
        assertEquals("", routed.preamble());
    }

    @Test
    @DisplayName("Should derive subsection ids from heading text")
    void headingId() {
        assertEquals("non_functional_requirements", TableRouting.headingId(" Non-Functional  Requirements "));
        assertEquals("questions_issues", TableRouting.headingId("Questions & Issues"));
    }
}
