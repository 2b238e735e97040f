package tech.rolesync.engine.guard;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.rolesync.engine.config.EngineConfig;
import tech.rolesync.engine.diff.Change;
import tech.rolesync.engine.plan.OperationKind;
import tech.rolesync.engine.plan.OperationPayload;
import tech.rolesync.engine.report.ReportItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Withholds changes that would touch provider-owned entities, and destructive
 * changes when cleanup is not enabled.
 *
 * <p>Protection is checked first, so a protected entity is reported as protected
 * even when cleanup is off. Nothing here can be overridden by {@code force}.
 */
@ApplicationScoped
public class SafetyGuard {

    private static final Logger LOG = Logger.getLogger(SafetyGuard.class);

    private final ProtectionPolicy policy;

    @Inject
    public SafetyGuard(EngineConfig config) {
        this(ProtectionPolicy.from(config.protection()));
    }

    public SafetyGuard(ProtectionPolicy policy) {
        this.policy = policy;
    }

    public GuardResult filter(List<Change> changes, boolean cleanup) {
        List<Change> allowed = new ArrayList<>();
        List<ReportItem> protectedItems = new ArrayList<>();
        List<ReportItem> wouldRemove = new ArrayList<>();

        for (Change change : changes) {
            Optional<ProtectionReason> reason = protectionOf(change);
            if (reason.isPresent()) {
                LOG.debugf("Protected: %s (%s)", change.ref(), reason.get());
                protectedItems.add(ReportItem.of(change.ref(), reason.get().name()));
                continue;
            }
            if (change.kind() == OperationKind.DELETE && change.entityType().isCleanupGated() && !cleanup) {
                wouldRemove.add(ReportItem.of(change.ref(), ProtectionReason.CLEANUP_DISABLED.name()));
                continue;
            }
            allowed.add(change);
        }

        if (!protectedItems.isEmpty() || !wouldRemove.isEmpty()) {
            LOG.infof("Guard withheld %d protected and %d destructive change(s)",
                protectedItems.size(), wouldRemove.size());
        }
        return new GuardResult(allowed, protectedItems, wouldRemove);
    }

    /**
     * Reserved names are protected for any change kind. Provider defaults and
     * entities under a protected owner only matter once they exist remotely.
     * System-looking roles and organization scopes are only kept from deletion.
     */
    Optional<ProtectionReason> protectionOf(Change change) {
        boolean existing = change.kind() != OperationKind.CREATE;
        OperationPayload payload = change.payload();

        if (payload instanceof OperationPayload.Resource r) {
            if (!existing) {
                return policy.isReservedName(r.name()) ? Optional.of(ProtectionReason.RESERVED_NAME) : Optional.empty();
            }
            return policy.checkResource(r.name(), r.indicator(), r.isDefault());
        }
        if (payload instanceof OperationPayload.Scope s) {
            if (policy.isReservedName(s.scopeName())) {
                return Optional.of(ProtectionReason.RESERVED_NAME);
            }
            if (existing && policy.checkResource(s.resourceName(), s.ownerIndicator(), s.ownerDefault()).isPresent()) {
                return Optional.of(ProtectionReason.PROTECTED_OWNER);
            }
            return Optional.empty();
        }
        if (payload instanceof OperationPayload.OrganizationScope s) {
            Optional<ProtectionReason> reason = policy.checkName(s.name(), false);
            if (reason.isPresent() || change.kind() != OperationKind.DELETE) {
                return reason;
            }
            return policy.checkSystemEntity(change.entityType(), s.name(), s.description());
        }
        if (payload instanceof OperationPayload.Role r) {
            Optional<ProtectionReason> reason = policy.checkName(r.name(), existing && r.isDefault());
            if (reason.isPresent() || change.kind() != OperationKind.DELETE) {
                return reason;
            }
            return policy.checkSystemEntity(change.entityType(), r.name(), r.description());
        }
        if (payload instanceof OperationPayload.Binding b) {
            return policy.checkName(b.roleKey(), false);
        }
        if (payload instanceof OperationPayload.Application a) {
            return policy.checkName(a.spec().name(), false);
        }
        if (payload instanceof OperationPayload.AccessControl a) {
            return policy.checkName(a.applicationName(), false);
        }
        return Optional.empty();
    }
}
