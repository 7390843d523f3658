package com.resourcelocator.application;

import com.resourcelocator.config.ResourceLocatorProperties;
import com.resourcelocator.domain.model.ConnectionDescriptor;
import com.resourcelocator.domain.model.FailureKind;
import com.resourcelocator.domain.model.ResourceDefinition;
import com.resourcelocator.domain.policy.AccessPolicy;
import com.resourcelocator.domain.policy.BooleanPolicy;
import com.resourcelocator.domain.policy.VectorPolicy;
import com.resourcelocator.domain.repository.StorageUnavailableException;
import com.resourcelocator.infrastructure.audit.AuditService;
import com.resourcelocator.infrastructure.cache.CacheStatistics;
import com.resourcelocator.infrastructure.cache.ResourceDefinitionCache;
import com.resourcelocator.infrastructure.crypto.CryptoService;
import com.resourcelocator.infrastructure.persistence.DeadlineBoundStorage;
import com.resourcelocator.infrastructure.security.BooleanPolicyEvaluator;
import com.resourcelocator.infrastructure.security.EvaluationContext;
import com.resourcelocator.infrastructure.security.EvaluationResult;
import com.resourcelocator.infrastructure.security.SecurityContext;
import com.resourcelocator.infrastructure.security.VectorPolicyEvaluator;
import com.resourcelocator.infrastructure.token.CapabilityToken;
import com.resourcelocator.infrastructure.token.ReplayLedger;
import com.resourcelocator.infrastructure.token.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves logical resource names to connection descriptors for authorized callers,
 * and turns granted resolutions into short-lived capability tokens.
 *
 * <p><strong>Resolution:</strong>
 * <ol>
 *   <li>Look the definition up through the cache; a miss reads the Storage Adapter,
 *       bounded by the request deadline</li>
 *   <li>Build an evaluation context from the security context plus the owner id
 *       parsed from the logical name ({@code category/{ownerId}})</li>
 *   <li>Dispatch to the boolean or the vector evaluator, whichever the definition declares</li>
 *   <li>Substitute {@code {resourceId}}/{@code {ownerId}} into the address template</li>
 *   <li>Append exactly one terminal audit event for the trace</li>
 * </ol>
 *
 * <p>Every outcome is returned as a {@link Resolution}; storage outages are reported as
 * {@link FailureKind#STORAGE_UNAVAILABLE}, never as a denial or "not found". Nothing is
 * retried.
 *
 * <p>Several instances may live in one process; all state (cache, nonce ledger) is
 * held per instance.
 *
 * @author Platform Team
 * @since 1.0.0
 */
@Service
@Slf4j
public class SecureResourceLocator {

    public static final String NOT_FOUND = "not_found";
    public static final String STORAGE_UNAVAILABLE = "storage_unavailable";
    public static final String ADDRESS_TEMPLATE_UNRESOLVED = "address_template_unresolved";

    private static final String RESOURCE_ID_PLACEHOLDER = "{resourceId}";
    private static final String OWNER_ID_PLACEHOLDER = "{ownerId}";

    private final DeadlineBoundStorage storage;
    private final ResourceDefinitionCache cache;
    private final BooleanPolicyEvaluator booleanEvaluator;
    private final VectorPolicyEvaluator vectorEvaluator;
    private final AuditService auditService;
    private final CryptoService cryptoService;
    private final ReplayLedger replayLedger;
    private final ResolverMetrics metrics;
    private final Clock clock;

    private final Pattern ownerPattern;
    private final ZoneId zone;
    private final Duration defaultLifetime;
    private final Duration maxLifetime;

    public SecureResourceLocator(
            DeadlineBoundStorage storage,
            ResourceDefinitionCache cache,
            BooleanPolicyEvaluator booleanEvaluator,
            VectorPolicyEvaluator vectorEvaluator,
            AuditService auditService,
            CryptoService cryptoService,
            ReplayLedger replayLedger,
            ResolverMetrics metrics,
            ResourceLocatorProperties properties,
            Clock clock) {
        this.storage = storage;
        this.cache = cache;
        this.booleanEvaluator = booleanEvaluator;
        this.vectorEvaluator = vectorEvaluator;
        this.auditService = auditService;
        this.cryptoService = cryptoService;
        this.replayLedger = replayLedger;
        this.metrics = metrics;
        this.clock = clock;
        this.ownerPattern = Pattern.compile(properties.getOwnerPattern());
        this.zone = properties.getZone();
        this.defaultLifetime = properties.getToken().getDefaultLifetime();
        this.maxLifetime = properties.getToken().getMaxLifetime();
    }

    /**
     * Resolve a logical name for a caller.
     *
     * @param logicalName Logical resource name
     * @param context Caller identity, claims and ambient attributes
     * @return Granted descriptor or typed failure
     */
    public Resolution resolve(String logicalName, SecurityContext context) {
        Objects.requireNonNull(logicalName, "logicalName");
        Objects.requireNonNull(context, "context");

        String traceId = UUID.randomUUID().toString();
        String callerId = context.getCallerId();
        Instant deadline = context.getDeadline();

        log.debug("Resolving {} for caller={} trace={}", logicalName, callerId, traceId);

        Optional<ResourceDefinition> definition;
        try {
            definition = cache.get(logicalName, name -> storage.getConnection(name, deadline).orElse(null));
        } catch (StorageUnavailableException e) {
            log.error("Storage unavailable while resolving {} trace={}: {}", logicalName, traceId, e.getMessage());
            return fail(traceId, logicalName, callerId, FailureKind.STORAGE_UNAVAILABLE, STORAGE_UNAVAILABLE, deadline);
        }

        if (definition.isEmpty()) {
            return fail(traceId, logicalName, callerId, FailureKind.NOT_FOUND, NOT_FOUND, deadline);
        }

        ResourceDefinition resource = definition.get();
        Optional<String> ownerId = ownerIdOf(logicalName);
        EvaluationContext evaluationContext = evaluationContext(context, ownerId);

        EvaluationResult decision = resource.getRequiredPolicy().accept(new AccessPolicy.Visitor<EvaluationResult>() {
            @Override
            public EvaluationResult visitBoolean(BooleanPolicy policy) {
                return booleanEvaluator.checkPermission(policy.getRequirement(), context.getClaims(), evaluationContext);
            }

            @Override
            public EvaluationResult visitVector(VectorPolicy policy) {
                return vectorEvaluator.evaluate(policy, evaluationContext);
            }
        });

        if (!decision.isMet()) {
            FailureKind kind = decision.isMalformed() ? FailureKind.MALFORMED_POLICY : FailureKind.POLICY_DENIED;
            return fail(traceId, logicalName, callerId, kind, decision.getReason(), deadline);
        }

        Optional<ConnectionDescriptor> descriptor = substitute(resource.getConnection(), ownerId);
        if (descriptor.isEmpty()) {
            log.warn("Address template of {} has placeholders with no value", logicalName);
            return fail(traceId, logicalName, callerId, FailureKind.MALFORMED_POLICY,
                ADDRESS_TEMPLATE_UNRESOLVED, deadline);
        }

        String grantReason = decision.getSatisfiedBy()
            .map(claim -> "Access granted by claim: " + claim)
            .orElse(decision.getReason() != null ? decision.getReason() : "Access granted");

        auditService.logHandshakeSuccess(traceId, logicalName, callerId, grantReason, deadline);
        metrics.recordGranted(resource.getRequiredPolicy() instanceof VectorPolicy ? "vector" : "boolean");

        return Resolution.granted(traceId, logicalName, callerId, descriptor.get(), resource.getCapability(),
            decision.getSatisfiedBy().orElse(null), grantReason);
    }

    /**
     * Sign a descriptor with the default lifetime.
     */
    public CapabilityToken sign(ConnectionDescriptor descriptor) {
        return sign(descriptor, defaultLifetime);
    }

    /**
     * Sign a descriptor. Pure construction, no I/O.
     *
     * @param descriptor Resolved descriptor
     * @param lifetimeSeconds Positive lifetime not above the configured maximum
     */
    public CapabilityToken sign(ConnectionDescriptor descriptor, long lifetimeSeconds) {
        return sign(descriptor, Duration.ofSeconds(lifetimeSeconds));
    }

    private CapabilityToken sign(ConnectionDescriptor descriptor, Duration lifetime) {
        if (lifetime.compareTo(maxLifetime) > 0) {
            throw new IllegalArgumentException("Token lifetime " + lifetime + " exceeds maximum " + maxLifetime);
        }
        return CapabilityToken.issue(descriptor, lifetime, cryptoService, clock);
    }

    /**
     * Validate a token issued for a granted resolution and, when it holds, hand out the
     * capability the resource definition declares.
     *
     * <p>A token is redeemable once: a second redemption of the same token is rejected
     * as a replay. A token wrapping a descriptor other than the resolution's is rejected
     * as an integrity failure. Every rejection is audited under the resolution's trace id.
     *
     * @param resolution Granted resolution the token was signed for
     * @param token Token to redeem
     * @return Capability, or the validation failure
     * @throws IllegalArgumentException if the resolution was not granted
     */
    public Redemption redeem(Resolution resolution, CapabilityToken token) {
        if (!resolution.isGranted()) {
            throw new IllegalArgumentException("Only a granted resolution can be redeemed");
        }

        ValidationResult validation = token.validate();
        ConnectionDescriptor descriptor = token.getDescriptor();

        if (validation.isValid() && !resolution.getDescriptor().map(descriptor::equals).orElse(false)) {
            validation = ValidationResult.integrityFailure();
        }
        if (validation.isValid() && !replayLedger.markRedeemed(token.getNonce())) {
            validation = ValidationResult.replayed();
        }

        if (!validation.isValid()) {
            FailureKind failure = validation.getFailure().orElse(FailureKind.TOKEN_INTEGRITY_FAILURE);
            auditService.logPointerFailure(resolution.getTraceId(), descriptor, resolution.getCallerId(),
                validation.getReason().orElse(failure.name()), null);
            metrics.recordTokenFailure(failure);
            return Redemption.rejected(validation);
        }

        Capability capability = Capability.of(
            resolution.getCapability().orElseThrow(), resolution.getLogicalName(), descriptor);
        metrics.recordRedeemed(capability.getKind());
        log.debug("Token redeemed: trace={} capability={}", resolution.getTraceId(), capability);
        return Redemption.accepted(capability);
    }

    /**
     * Insert or replace a resource definition. The cached copy is evicted before this
     * method returns, whether or not the write succeeded, and again once the adapter
     * write completes, so a write that lands after a timeout cannot leave an older
     * definition cached.
     *
     * @throws StorageUnavailableException if the write failed or timed out
     */
    public void register(ResourceDefinition definition) {
        String logicalName = definition.getLogicalName();
        try {
            storage.registerConnection(definition, () -> cache.invalidate(logicalName));
        } finally {
            cache.invalidate(logicalName);
        }
        log.info("Resource registered: logicalName={}, capability={}",
            definition.getLogicalName(), definition.getCapability());
    }

    public void invalidate(String logicalName) {
        cache.invalidate(logicalName);
    }

    public CacheStatistics cacheStatistics() {
        return cache.statistics();
    }

    private Resolution fail(String traceId, String logicalName, String callerId, FailureKind kind, String reason,
                            Instant deadline) {
        auditService.logHandshakeFailure(traceId, logicalName, callerId, reason, deadline);
        metrics.recordFailure(kind);
        return Resolution.failed(traceId, logicalName, callerId, kind, reason);
    }

    private Optional<String> ownerIdOf(String logicalName) {
        Matcher matcher = ownerPattern.matcher(logicalName);
        if (matcher.matches() && matcher.groupCount() >= 1 && matcher.group(1) != null) {
            return Optional.of(matcher.group(1));
        }
        return Optional.empty();
    }

    private EvaluationContext evaluationContext(SecurityContext context, Optional<String> ownerId) {
        ZonedDateTime localTime = context.getRequestedAt() != null
            ? context.getRequestedAt()
            : ZonedDateTime.now(clock).withZoneSameInstant(zone);

        return EvaluationContext.builder()
            .callerId(context.getCallerId())
            .resourceOwnerId(ownerId.orElse(null))
            .dayOfWeek(localTime.getDayOfWeek())
            .hour(localTime.getHour())
            .onCall(context.isOnCall())
            .attributes(context.getAttributes())
            .build();
    }

    private static Optional<ConnectionDescriptor> substitute(ConnectionDescriptor connection, Optional<String> ownerId) {
        String address = connection.getAddress();
        if (ownerId.isPresent()) {
            address = address.replace(RESOURCE_ID_PLACEHOLDER, ownerId.get())
                .replace(OWNER_ID_PLACEHOLDER, ownerId.get());
        }
        if (address.contains(RESOURCE_ID_PLACEHOLDER) || address.contains(OWNER_ID_PLACEHOLDER)) {
            return Optional.empty();
        }
        return Optional.of(connection.withAddress(address));
    }
}
