package com.purchasingpower.docflow.registry;

public enum ScopeKind {
    CURRENT_SECTION,
    ALL_PRIOR_SECTIONS,
    ENTIRE_DOCUMENT,
    EXPLICIT_SECTIONS
}
