package com.projectcontext.core.safeguard;

import com.projectcontext.core.config.EngineConfig.PolicyAction;
import com.projectcontext.core.model.AuditEvent;
import com.projectcontext.core.model.ConfirmationResponse;
import com.projectcontext.core.model.Decision;
import com.projectcontext.core.model.DetectionResult;
import com.projectcontext.core.model.ValidationResult;
import com.projectcontext.core.model.ValidationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Turns a validation result into a final decision and audits it.
 *
 * <p>{@code ok} and {@code structuralIssue} are allowed. {@code mismatch} and
 * {@code lowConfidence} follow the {@link SafeguardPolicy}: blocked outright, or
 * {@link Decision#PENDING_CONFIRMATION} until the confirmation callback answers.
 * Only {@link ConfirmationResponse#YES} within the timeout confirms; a refusal,
 * timeout, callback failure or missing callback blocks.
 *
 * <p>Exactly one event is appended to the {@link AuditLog} before a decision is
 * returned. If the append fails, {@link AuditLogException} propagates and no
 * decision is returned.
 */
public class Safeguard {

    private static final Logger log = LoggerFactory.getLogger(Safeguard.class);

    private static final AtomicInteger WORKER_COUNT = new AtomicInteger();
    private static final ExecutorService CONFIRMATION_WORKERS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "confirmation-worker-" + WORKER_COUNT.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private final AuditLog auditLog;
    private final Clock clock;
    private final Consumer<Decision> stateListener;

    public Safeguard(AuditLog auditLog) {
        this(auditLog, Clock.systemUTC(), decision -> { });
    }

    /**
     * Creates a safeguard.
     *
     * @param auditLog audit log every decision is appended to
     * @param clock clock for event timestamps
     * @param stateListener notified of every state the invocation passes through
     */
    public Safeguard(AuditLog auditLog, Clock clock, Consumer<Decision> stateListener) {
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.stateListener = Objects.requireNonNull(stateListener, "stateListener must not be null");
    }

    public AuditLog getAuditLog() {
        return auditLog;
    }

    /**
     * Decides whether the operation may proceed and audits the decision.
     *
     * @param operation operation label
     * @param actor who asked, nullable
     * @param detection detection the validation was based on
     * @param validation validation result
     * @param policy per-status policy
     * @param callback confirmation callback, nullable
     * @return the audited event carrying the final decision
     * @throws AuditLogException if the event could not be recorded
     */
    public AuditEvent apply(String operation, String actor, DetectionResult detection,
                            ValidationResult validation, SafeguardPolicy policy, ConfirmationCallback callback) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(validation, "validation must not be null");
        Objects.requireNonNull(policy, "policy must not be null");

        Outcome outcome = decide(operation, actor, validation, policy, callback);

        Instant now = clock.instant();
        AuditEvent event = new AuditEvent(AuditLog.newEventId(now, operation), now, operation, actor,
            detection, validation, outcome.decision(), outcome.confirmation(), outcome.note());
        auditLog.append(event);

        stateListener.accept(outcome.decision());
        if (outcome.decision() == Decision.BLOCKED) {
            log.warn("Blocked '{}' on project '{}': {}", operation, validation.resolvedProjectId(), outcome.note());
        } else {
            log.info("{} '{}' on project '{}'", outcome.decision() == Decision.CONFIRMED ? "Confirmed" : "Allowed",
                operation, validation.resolvedProjectId());
        }
        return event;
    }

    private Outcome decide(String operation, String actor, ValidationResult validation,
                           SafeguardPolicy policy, ConfirmationCallback callback) {
        ValidationStatus status = validation.status();
        if (!status.requiresPolicy()) {
            return new Outcome(Decision.ALLOWED, null, status == ValidationStatus.OK ? null : "allowed with " + label(status));
        }
        if (policy.actionFor(status) == PolicyAction.BLOCK) {
            return new Outcome(Decision.BLOCKED, null, "policy blocks " + label(status));
        }

        stateListener.accept(Decision.PENDING_CONFIRMATION);
        if (callback == null) {
            return new Outcome(Decision.BLOCKED, null, "confirmation required for " + label(status) + " but no confirmation is available");
        }

        ConfirmationRequest request = new ConfirmationRequest(operation, actor, validation);
        CompletableFuture<ConfirmationResponse> answer = CompletableFuture.supplyAsync(() -> {
            try {
                return callback.confirm(request);
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, CONFIRMATION_WORKERS);

        ConfirmationResponse response;
        try {
            response = answer.get(policy.confirmationTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            answer.cancel(true);
            return new Outcome(Decision.BLOCKED, ConfirmationResponse.TIMEOUT,
                "confirmation timed out after " + policy.confirmationTimeout().toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                ? e.getCause().getCause()
                : e.getCause();
            log.warn("Confirmation callback failed: {}", String.valueOf(cause));
            return new Outcome(Decision.BLOCKED, null, "confirmation failed: " + cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            answer.cancel(true);
            return new Outcome(Decision.BLOCKED, null, "interrupted while waiting for confirmation");
        }

        if (response == ConfirmationResponse.YES) {
            return new Outcome(Decision.CONFIRMED, response, "confirmed despite " + label(status));
        }
        ConfirmationResponse recorded = response == null ? ConfirmationResponse.NO : response;
        return new Outcome(Decision.BLOCKED, recorded,
            "confirmation " + (recorded == ConfirmationResponse.TIMEOUT ? "timed out" : "declined") + " for " + label(status));
    }

    private static String label(ValidationStatus status) {
        return switch (status) {
            case MISMATCH -> "project mismatch";
            case LOW_CONFIDENCE -> "low detection confidence";
            case STRUCTURAL_ISSUE -> "structural issues";
            case OK -> "no issues";
        };
    }

    private record Outcome(Decision decision, ConfirmationResponse confirmation, String note) {
    }
}
