package io.github.cyfko.relayql.core.security;

import io.github.cyfko.relayql.core.config.ResolverConfig;
import io.github.cyfko.relayql.core.exception.AccessDeniedException;
import io.github.cyfko.relayql.core.metadata.OperationKind;
import io.github.cyfko.relayql.core.metadata.OperationOverride;
import io.github.cyfko.relayql.core.metadata.ResourceDescriptor;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Evaluates the access rules of an operation.
 *
 * <h2>Precedence</h2>
 * <ol>
 *   <li>the access control of the operation override, when declared</li>
 *   <li>otherwise the base access control of the resource</li>
 *   <li>otherwise access is granted</li>
 * </ol>
 * <p>
 * When an override declares a rule, the base rule is never consulted. The same lookup applies to the
 * post-denormalize rule of mutations.
 * </p>
 *
 * <h2>Evaluation points</h2>
 * <ul>
 *   <li>{@link #authorizeCollection}: rules that do not need the subject, before any fetch.</li>
 *   <li>{@link #authorizeItem}: rules that need the subject, on each fetched item or on the submitted
 *       input of a create.</li>
 *   <li>{@link #authorizePostDenormalize}: the post-denormalize rule, on the merged object of a
 *       create or update.</li>
 * </ul>
 * <p>
 * Every denial, including "item not found", is reported with the configured message of the effective
 * control or the generic denial message, so callers cannot tell these situations apart.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class AccessControlEvaluator {

    private static final Logger logger = Logger.getLogger(AccessControlEvaluator.class.getName());

    private final ResolverConfig config;

    public AccessControlEvaluator(ResolverConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @return the override access control if declared, else the base access control, else empty
     */
    public Optional<AccessControl> effectiveControl(ResourceDescriptor resource, OperationKind kind) {
        Optional<AccessControl> declared = resource.operation(kind).flatMap(OperationOverride::accessControl);
        return declared.isPresent() ? declared : resource.accessControl();
    }

    /**
     * @return the override post-denormalize control if declared, else the base one, else empty
     */
    public Optional<AccessControl> effectivePostDenormalizeControl(ResourceDescriptor resource, OperationKind kind) {
        Optional<AccessControl> declared = resource.operation(kind).flatMap(OperationOverride::postDenormalizeAccessControl);
        return declared.isPresent() ? declared : resource.postDenormalizeAccessControl();
    }

    /**
     * Evaluates a control against a principal and an optional subject.
     *
     * @param control   access control
     * @param principal caller
     * @param subject   object the rule applies to, {@code null} at collection level
     * @return the decision, carrying the denial message when denied
     */
    public AccessDecision decide(AccessControl control, Principal principal, Map<String, Object> subject) {
        if (control.rule().test(principal, subject)) {
            return AccessDecision.grant();
        }
        return AccessDecision.deny(control.message() != null ? control.message() : config.getDefaultDenialMessage());
    }

    /**
     * Checks the rules that do not need a subject. Subject rules are deferred to {@link #authorizeItem}.
     *
     * @throws AccessDeniedException if denied
     */
    public void authorizeCollection(ResourceDescriptor resource, OperationKind kind, Principal principal) {
        Optional<AccessControl> control = effectiveControl(resource, kind);
        if (control.isEmpty() || control.get().rule().requiresSubject()) {
            return;
        }
        check(resource, kind, "collection", decide(control.get(), principal, null));
    }

    /**
     * @return whether the effective rule needs to see each item
     */
    public boolean requiresItemCheck(ResourceDescriptor resource, OperationKind kind) {
        return effectiveControl(resource, kind).map(control -> control.rule().requiresSubject()).orElse(false);
    }

    /**
     * Evaluates the subject rule of an operation on one item.
     *
     * @param item fetched item, or submitted input for creates
     * @return the decision, granted when the effective rule does not need a subject
     */
    public AccessDecision authorizeItem(ResourceDescriptor resource, OperationKind kind, Principal principal,
                                        Map<String, Object> item) {
        Optional<AccessControl> control = effectiveControl(resource, kind);
        if (control.isEmpty() || !control.get().rule().requiresSubject()) {
            return AccessDecision.grant();
        }
        AccessDecision decision = decide(control.get(), principal, item);
        logger.fine(() -> String.format("Item access to %s.%s for %s: %s",
                resource.name(), kind.operationName(), principal.name(), decision.granted() ? "granted" : "denied"));
        return decision;
    }

    /**
     * Evaluates the post-denormalize rule on the object about to be persisted.
     *
     * @param merged current state overlaid with the submitted input
     * @throws AccessDeniedException if denied
     */
    public void authorizePostDenormalize(ResourceDescriptor resource, OperationKind kind, Principal principal,
                                         Map<String, Object> merged) {
        Optional<AccessControl> control = effectivePostDenormalizeControl(resource, kind);
        if (control.isPresent()) {
            check(resource, kind, "post-denormalize", decide(control.get(), principal, merged));
        }
    }

    /**
     * Builds the denial reported when an item does not exist, identical to an item-level denial.
     */
    public AccessDeniedException notFound(ResourceDescriptor resource, OperationKind kind) {
        logger.fine(() -> String.format("Item of %s not found for %s", resource.name(), kind.operationName()));
        return new AccessDeniedException(denialMessage(resource, kind));
    }

    /**
     * @return the message of the effective control, or the generic denial message
     */
    public String denialMessage(ResourceDescriptor resource, OperationKind kind) {
        return effectiveControl(resource, kind)
                .map(AccessControl::message)
                .orElse(config.getDefaultDenialMessage());
    }

    public AccessDeniedException denied(AccessDecision decision) {
        return new AccessDeniedException(decision.message());
    }

    private void check(ResourceDescriptor resource, OperationKind kind, String level, AccessDecision decision) {
        if (!decision.granted()) {
            logger.fine(() -> String.format("Access to %s.%s denied at %s level", resource.name(), kind.operationName(), level));
            throw denied(decision);
        }
    }
}
