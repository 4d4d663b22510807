package com.purchasingpower.docflow.question;

import java.util.List;

/**
 * Result of a ledger mutation.
 *
 * @param lines        the document after the operation (a new list)
 * @param questionIds  ids inserted, matched as duplicates, or resolved
 * @param changedCount number of rows actually written
 */
public record LedgerUpdate(List<String> lines, List<String> questionIds, int changedCount) {

    public boolean changed() {
        return changedCount > 0;
    }
}
