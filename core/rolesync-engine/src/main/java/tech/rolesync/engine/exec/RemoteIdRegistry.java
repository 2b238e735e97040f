package tech.rolesync.engine.exec;

import tech.rolesync.engine.model.RoleType;
import tech.rolesync.engine.plan.EntityRef;
import tech.rolesync.engine.plan.EntityType;
import tech.rolesync.engine.provider.ProviderError;
import tech.rolesync.engine.provider.ProviderException;
import tech.rolesync.engine.provider.RemoteScope;
import tech.rolesync.engine.state.ActualState;
import tech.rolesync.engine.state.ApplicationState;
import tech.rolesync.engine.state.ResourceState;
import tech.rolesync.engine.state.RoleState;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider ids by natural key for the current run.
 *
 * <p>Seeded from actual state; creates register the id they receive so later
 * phases can address the new entity. Safe for concurrent use by executor workers.
 */
public class RemoteIdRegistry {

    private final Map<EntityRef, String> ids = new ConcurrentHashMap<>();

    public void seed(ActualState state) {
        for (ResourceState resource : state.resources().values()) {
            ids.putIfAbsent(EntityRef.of(EntityType.RESOURCE, resource.resource().name()), resource.resource().id());
            for (RemoteScope scope : resource.scopes()) {
                ids.putIfAbsent(EntityRef.of(EntityType.SCOPE, scope.name()), scope.id());
            }
        }
        for (RemoteScope scope : state.organizationScopes().values()) {
            ids.putIfAbsent(EntityRef.of(EntityType.ORGANIZATION_SCOPE, scope.name()), scope.id());
        }
        for (RoleType type : RoleType.values()) {
            for (Map.Entry<String, RoleState> entry : state.roles(type).entrySet()) {
                ids.putIfAbsent(EntityRef.of(EntityType.forRole(type), entry.getKey()), entry.getValue().role().id());
            }
        }
        for (ApplicationState app : state.applications().values()) {
            ids.putIfAbsent(EntityRef.of(EntityType.APPLICATION, app.application().name()), app.application().id());
        }
    }

    public void register(EntityRef ref, String id) {
        ids.put(ref, id);
    }

    public void forget(EntityRef ref) {
        ids.remove(ref);
    }

    public Optional<String> find(EntityRef ref) {
        return Optional.ofNullable(ids.get(ref));
    }

    /**
     * @throws ProviderException NotFound if nothing is registered for the ref
     */
    public String require(EntityRef ref) {
        String id = ids.get(ref);
        if (id == null) {
            throw new ProviderException(new ProviderError.NotFound("No remote id known for " + ref));
        }
        return id;
    }

    public int size() {
        return ids.size();
    }
}
