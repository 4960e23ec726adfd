package com.projectcontext.core.engine;

import com.projectcontext.core.detector.Detector;
import com.projectcontext.core.model.AuditEvent;
import com.projectcontext.core.model.Decision;
import com.projectcontext.core.model.DetectionResult;
import com.projectcontext.core.model.Registry;
import com.projectcontext.core.model.ValidationResult;
import com.projectcontext.core.registry.RegistryStore;
import com.projectcontext.core.safeguard.ConfirmationCallback;
import com.projectcontext.core.safeguard.Safeguard;
import com.projectcontext.core.safeguard.SafeguardPolicy;
import com.projectcontext.core.validator.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves which registered project an operation applies to.
 *
 * <p>Pipeline: registry snapshot, {@link Detector}, {@link Validator},
 * {@link Safeguard}. The registry is only read; the single side effect of a
 * resolution is its audit record, so resolving the same request twice yields the
 * same decision.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Resolution resolution = engine.resolve(
 *     ResolveRequest.of("deploy", Path.of("/ws/api/src")).withStatedProject("api"),
 *     request -> ConfirmationResponse.NO);
 * if (!resolution.permitsOperation()) {
 *     resolution.warnings().forEach(System.err::println);
 * }
 * }</pre>
 */
public class ContextResolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ContextResolutionEngine.class);

    private final RegistryStore store;
    private final Detector detector;
    private final Validator validator;
    private final Safeguard safeguard;
    private final SafeguardPolicy defaultPolicy;

    public ContextResolutionEngine(RegistryStore store, Detector detector, Validator validator,
                                   Safeguard safeguard, SafeguardPolicy defaultPolicy) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.safeguard = Objects.requireNonNull(safeguard, "safeguard must not be null");
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy must not be null");
    }

    public SafeguardPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    public Resolution resolve(ResolveRequest request, ConfirmationCallback callback) {
        return resolve(request, defaultPolicy, callback);
    }

    /**
     * Resolves a request with an explicit policy.
     *
     * @param request operation signals
     * @param policy safeguard policy for this call
     * @param callback confirmation callback, nullable
     * @return resolution with the audited decision
     * @throws com.projectcontext.core.registry.RegistryException if the registry cannot be loaded
     * @throws com.projectcontext.core.safeguard.AuditLogException if the decision cannot be audited
     */
    public Resolution resolve(ResolveRequest request, SafeguardPolicy policy, ConfirmationCallback callback) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        log.debug("Resolving '{}' from {}", request.operation(), request.cwd());

        Registry registry = store.load();
        DetectionResult detection = detector.detect(request.toDetectionContext(), registry);
        ValidationResult validation = validator.validate(detection, request.statedProjectId(), registry);
        AuditEvent event = safeguard.apply(request.operation(), request.actor(), detection, validation,
            policy, callback);

        List<String> warnings = new ArrayList<>(validation.warnings());
        if (event.decision() == Decision.BLOCKED && event.note() != null) {
            warnings.add("Operation blocked: " + event.note());
        }

        String resolvedId = validation.resolvedProjectId();
        double confidence = resolvedId == null ? 0.0 : detection.confidenceFor(resolvedId);
        log.debug("Resolved '{}' to '{}' ({}), decision {}", request.operation(), resolvedId,
            validation.status(), event.decision());
        return new Resolution(resolvedId, confidence, warnings, event.decision(), event);
    }
}
