package tech.rolesync.engine.plan;

import tech.rolesync.engine.model.RoleType;
import tech.rolesync.engine.provider.ApplicationSpec;

import java.util.List;
import java.util.Map;

/**
 * What an operation writes. One variant per entity type.
 */
public sealed interface OperationPayload permits
    OperationPayload.Resource,
    OperationPayload.Scope,
    OperationPayload.OrganizationScope,
    OperationPayload.Role,
    OperationPayload.Binding,
    OperationPayload.Application,
    OperationPayload.AccessControl {

    /**
     * @param isDefault as reported by the provider; false for new resources
     */
    record Resource(String name, String indicator, int accessTokenTtl, boolean isDefault)
        implements OperationPayload {}

    /**
     * @param ownerIndicator indicator of the owning resource, used for protection checks
     * @param ownerDefault whether the owning resource is a provider default
     */
    record Scope(String resourceName, String scopeName, String description,
                 String ownerIndicator, boolean ownerDefault) implements OperationPayload {}

    record OrganizationScope(String name, String description) implements OperationPayload {}

    record Role(RoleType roleType, String name, String description, boolean isDefault)
        implements OperationPayload {}

    /**
     * Scope bindings of one role. {@code remove} runs before {@code assign}; an update
     * that reorders removes every managed binding and re-assigns the full list in order.
     *
     * @param roleKey lower-cased role name
     */
    record Binding(RoleType roleType, String roleKey, List<String> assign, List<String> remove)
        implements OperationPayload {

        public Binding {
            assign = List.copyOf(assign);
            remove = List.copyOf(remove);
        }
    }

    /**
     * @param displayName null leaves branding untouched
     */
    record Application(ApplicationSpec spec, String displayName, List<String> consentScopes,
                       boolean detailsChanged, boolean brandingChanged, boolean scopesChanged)
        implements OperationPayload {}

    /**
     * @param customData the complete custom data the application should hold afterwards
     */
    record AccessControl(String applicationName, Map<String, Object> customData)
        implements OperationPayload {}
}
