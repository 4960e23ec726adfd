package com.projectcontext.core.engine;

import com.projectcontext.core.model.AuditEvent;
import com.projectcontext.core.model.Decision;

import java.util.List;
import java.util.Objects;

/**
 * What the caller gets back from a resolution.
 *
 * @param resolvedProjectId project the operation applies to, nullable when nothing could be resolved
 * @param confidence merged detection confidence for the resolved project, 0 when it was not detected
 * @param warnings human-readable warnings, to be shown verbatim
 * @param decision final safeguard decision
 * @param auditEvent the audit record written for this resolution
 */
public record Resolution(
    String resolvedProjectId,
    double confidence,
    List<String> warnings,
    Decision decision,
    AuditEvent auditEvent
) {
    /**
     * Compact constructor with validation.
     */
    public Resolution {
        Objects.requireNonNull(decision, "decision must not be null");
        Objects.requireNonNull(auditEvent, "auditEvent must not be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean permitsOperation() {
        return decision.permitsOperation();
    }
}
