package com.purchasingpower.docflow.question;

import com.purchasingpower.docflow.parser.TableBlock;

import java.util.List;

public record LedgerTable(LedgerScope scope, TableBlock block, List<OpenQuestion> questions) {
}
