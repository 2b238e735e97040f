package tech.rolesync.engine.exec;

import org.jboss.logging.Logger;
import tech.rolesync.engine.model.RoleType;
import tech.rolesync.engine.plan.EntityRef;
import tech.rolesync.engine.plan.EntityType;
import tech.rolesync.engine.plan.Operation;
import tech.rolesync.engine.plan.OperationPayload;
import tech.rolesync.engine.provider.IdentityProviderClient;
import tech.rolesync.engine.provider.ProviderError;
import tech.rolesync.engine.provider.ProviderException;
import tech.rolesync.engine.state.ActualState;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates operations into {@link IdentityProviderClient} calls.
 *
 * <p>Ids are resolved through the run's {@link RemoteIdRegistry}. Deleting
 * something that is already gone counts as done.
 */
public class ProviderOperationHandler implements OperationHandler {

    private static final Logger LOG = Logger.getLogger(ProviderOperationHandler.class);

    private final IdentityProviderClient client;
    private final RemoteIdRegistry ids;

    public ProviderOperationHandler(IdentityProviderClient client, RemoteIdRegistry ids) {
        this.client = client;
        this.ids = ids;
    }

    @Override
    public String apply(Operation op) {
        OperationPayload payload = op.payload();
        if (payload instanceof OperationPayload.Resource r) {
            return resource(op, r);
        }
        if (payload instanceof OperationPayload.Scope s) {
            return scope(op, s);
        }
        if (payload instanceof OperationPayload.OrganizationScope s) {
            return organizationScope(op, s);
        }
        if (payload instanceof OperationPayload.Role r) {
            return role(op, r);
        }
        if (payload instanceof OperationPayload.Binding b) {
            binding(b);
            return null;
        }
        if (payload instanceof OperationPayload.Application a) {
            return application(op, a);
        }
        if (payload instanceof OperationPayload.AccessControl a) {
            String appId = ids.require(EntityRef.of(EntityType.APPLICATION, a.applicationName()));
            client.updateApplicationCustomData(appId, a.customData());
            return null;
        }
        throw unsupported(op);
    }

    private String resource(Operation op, OperationPayload.Resource r) {
        switch (op.kind()) {
            case CREATE -> {
                String id = client.createResource(r.name(), r.indicator(), r.accessTokenTtl()).id();
                ids.register(op.ref(), id);
                return id;
            }
            case UPDATE -> client.updateResource(ids.require(op.ref()), r.name(), r.accessTokenTtl());
            case DELETE -> {
                deleteIgnoringMissing(op, () -> client.deleteResource(ids.require(op.ref())));
                ids.forget(op.ref());
            }
        }
        return null;
    }

    private String scope(Operation op, OperationPayload.Scope s) {
        String resourceId = ids.require(EntityRef.of(EntityType.RESOURCE, s.resourceName()));
        switch (op.kind()) {
            case CREATE -> {
                String id = client.createResourceScope(resourceId, s.scopeName(), s.description()).id();
                ids.register(op.ref(), id);
                return id;
            }
            case DELETE -> {
                deleteIgnoringMissing(op, () -> client.deleteResourceScope(resourceId, ids.require(op.ref())));
                ids.forget(op.ref());
            }
            case UPDATE -> throw unsupported(op);
        }
        return null;
    }

    private String organizationScope(Operation op, OperationPayload.OrganizationScope s) {
        switch (op.kind()) {
            case CREATE -> {
                String id = client.createOrganizationScope(s.name(), s.description()).id();
                ids.register(op.ref(), id);
                return id;
            }
            case UPDATE -> client.updateOrganizationScope(ids.require(op.ref()), s.name(), s.description());
            case DELETE -> {
                deleteIgnoringMissing(op, () -> client.deleteOrganizationScope(ids.require(op.ref())));
                ids.forget(op.ref());
            }
        }
        return null;
    }

    private String role(Operation op, OperationPayload.Role r) {
        switch (op.kind()) {
            case CREATE -> {
                String id = client.createRole(r.roleType(), r.name(), r.description()).id();
                ids.register(EntityRef.of(EntityType.forRole(r.roleType()), ActualState.roleKey(r.name())), id);
                return id;
            }
            case UPDATE -> client.updateRole(r.roleType(), ids.require(op.ref()), r.description());
            case DELETE -> {
                deleteIgnoringMissing(op, () -> client.deleteRole(r.roleType(), ids.require(op.ref())));
                ids.forget(op.ref());
            }
        }
        return null;
    }

    private void binding(OperationPayload.Binding b) {
        RoleType type = b.roleType();
        String roleId = ids.require(EntityRef.of(EntityType.forRole(type), b.roleKey()));
        EntityType scopeType = type == RoleType.ORGANIZATION ? EntityType.ORGANIZATION_SCOPE : EntityType.SCOPE;

        List<String> removed = new ArrayList<>(b.remove().size());
        for (String scope : b.remove()) {
            String scopeId = ids.require(EntityRef.of(scopeType, scope));
            try {
                client.removeRoleScope(type, roleId, scopeId);
                removed.add(scopeId);
            } catch (ProviderException e) {
                if (!(e.getError() instanceof ProviderError.NotFound)) {
                    throw e;
                }
                LOG.debugf("Binding %s of role %s already removed", scope, b.roleKey());
            }
        }

        List<String> scopeIds = new ArrayList<>(b.assign().size());
        for (String scope : b.assign()) {
            scopeIds.add(ids.require(EntityRef.of(scopeType, scope)));
        }
        if (scopeIds.isEmpty()) {
            return;
        }
        try {
            client.assignRoleScopes(type, roleId, scopeIds);
        } catch (ProviderException e) {
            restoreBindings(type, b.roleKey(), roleId, removed, e);
            throw e;
        }
    }

    /**
     * Puts back the bindings removed by a rewrite whose assignment failed, so the
     * role keeps its previous permissions. A retry removes them again.
     */
    private void restoreBindings(RoleType type, String roleKey, String roleId, List<String> removed,
                                 ProviderException cause) {
        if (removed.isEmpty()) {
            return;
        }
        try {
            client.assignRoleScopes(type, roleId, removed);
            LOG.infof("Restored %d binding(s) of role %s after failed assignment", removed.size(), roleKey);
        } catch (ProviderException e) {
            LOG.warnf(e, "Could not restore %d binding(s) of role %s", removed.size(), roleKey);
            cause.addSuppressed(e);
        }
    }

    private String application(Operation op, OperationPayload.Application a) {
        switch (op.kind()) {
            case CREATE -> {
                // A retry after a partial failure must not register the application twice
                String id = ids.find(op.ref()).orElse(null);
                if (id == null) {
                    id = client.createApplication(a.spec()).id();
                    ids.register(op.ref(), id);
                }
                if (a.displayName() != null) {
                    client.setApplicationDisplayName(id, a.displayName());
                }
                if (!a.consentScopes().isEmpty()) {
                    client.setApplicationConsentScopes(id, a.consentScopes());
                }
                return id;
            }
            case UPDATE -> {
                String id = ids.require(op.ref());
                if (a.detailsChanged()) {
                    client.updateApplication(id, a.spec());
                }
                if (a.brandingChanged()) {
                    client.setApplicationDisplayName(id, a.displayName());
                }
                if (a.scopesChanged()) {
                    client.setApplicationConsentScopes(id, a.consentScopes());
                }
            }
            case DELETE -> {
                deleteIgnoringMissing(op, () -> client.deleteApplication(ids.require(op.ref())));
                ids.forget(op.ref());
            }
        }
        return null;
    }

    private void deleteIgnoringMissing(Operation op, Runnable delete) {
        try {
            delete.run();
        } catch (ProviderException e) {
            if (!(e.getError() instanceof ProviderError.NotFound)) {
                throw e;
            }
            LOG.debugf("%s already absent", op.ref());
        }
    }

    private static IllegalStateException unsupported(Operation op) {
        return new IllegalStateException("Unsupported operation " + op.kind() + " on " + op.ref());
    }
}
