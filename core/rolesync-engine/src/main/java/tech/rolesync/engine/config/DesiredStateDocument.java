package tech.rolesync.engine.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Raw shape of a desired-state YAML file, before conversion to the model.
 *
 * <p>Roles and resources may sit under {@code hierarchy:} or at the top level;
 * {@code third_party_apps} is accepted in both places as well.
 */
record DesiredStateDocument(
    @JsonProperty("metadata") MetadataDoc metadata,
    @JsonProperty("hierarchy") HierarchyDoc hierarchy,
    @JsonProperty("organization_roles") List<RoleDoc> organizationRoles,
    @JsonProperty("user_roles") List<RoleDoc> userRoles,
    @JsonProperty("resources") List<ResourceDoc> resources,
    @JsonProperty("third_party_apps") List<ApplicationDoc> thirdPartyApps
) {

    record MetadataDoc(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("description") String description
    ) {}

    record HierarchyDoc(
        @JsonProperty("organization_roles") List<RoleDoc> organizationRoles,
        @JsonProperty("user_roles") List<RoleDoc> userRoles,
        @JsonProperty("resources") List<ResourceDoc> resources,
        @JsonProperty("third_party_apps") List<ApplicationDoc> thirdPartyApps
    ) {}

    record RoleDoc(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("permissions") List<PermissionDoc> permissions
    ) {}

    record PermissionDoc(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name
    ) {}

    record ResourceDoc(
        @JsonProperty("name") String name,
        @JsonProperty("actions") List<String> actions,
        @JsonProperty("access_token_ttl") Integer accessTokenTtl
    ) {}

    record ApplicationDoc(
        @JsonProperty("name") String name,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("description") String description,
        @JsonProperty("login_url") String loginUrl,
        @JsonProperty("scopes") List<String> scopes,
        @JsonProperty("redirect_uris") List<String> redirectUris,
        @JsonProperty("post_logout_redirect_uris") List<String> postLogoutRedirectUris,
        @JsonProperty("access_control") AccessControlDoc accessControl
    ) {}

    record AccessControlDoc(
        @JsonProperty("organization_roles") List<String> organizationRoles,
        @JsonProperty("user_roles") List<String> userRoles
    ) {}
}
