package tech.rolesync.engine.guard;

import tech.rolesync.engine.config.EngineConfig;
import tech.rolesync.engine.plan.EntityType;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a remote entity belongs to the provider and must be left alone.
 *
 * <p>Two tiers apply. Reserved names and indicators are never touched, whatever the
 * change. System-looking roles and organization scopes, recognised by name or
 * description fragments, are only kept from deletion: a desired role may well be
 * called {@code admin} or {@code member}.
 *
 * @param systemNameFragments per entity type, name fragments that mark an entity as system-owned
 * @param roleDescriptionFragments description fragments that mark a role as system-owned
 */
public record ProtectionPolicy(
    Set<String> resourceNames,
    Set<String> resourceIndicators,
    List<String> nameFragments,
    Map<EntityType, List<String>> systemNameFragments,
    List<String> roleDescriptionFragments
) {

    private static final String GENERATED_SCOPE_DESCRIPTION_PREFIX = "organization scope:";

    public ProtectionPolicy {
        resourceNames = lowerCase(resourceNames);
        resourceIndicators = Set.copyOf(resourceIndicators);
        nameFragments = lowerCase(nameFragments);
        Map<EntityType, List<String>> fragments = new EnumMap<>(EntityType.class);
        systemNameFragments.forEach((type, values) -> fragments.put(type, lowerCase(values)));
        systemNameFragments = Map.copyOf(fragments);
        roleDescriptionFragments = lowerCase(roleDescriptionFragments);
    }

    public static ProtectionPolicy defaults() {
        return new ProtectionPolicy(
            Set.of("Logto Management API"),
            Set.of("https://default.logto.app/api"),
            List.of("logto", "machine-to-machine", "management api"),
            Map.of(
                EntityType.USER_ROLE, List.of("logto", "admin", "machine-to-machine", "system", "default"),
                EntityType.ORGANIZATION_ROLE, List.of("logto", "admin", "system", "default", "owner", "member"),
                EntityType.ORGANIZATION_SCOPE, List.of("logto", "system", "default", "management", "api")),
            List.of("system", "default", "logto")
        );
    }

    public static ProtectionPolicy from(EngineConfig.ProtectionConfig config) {
        return new ProtectionPolicy(
            Set.copyOf(config.resourceNames()),
            Set.copyOf(config.resourceIndicators()),
            config.nameFragments(),
            Map.of(
                EntityType.USER_ROLE, config.userRoleFragments(),
                EntityType.ORGANIZATION_ROLE, config.organizationRoleFragments(),
                EntityType.ORGANIZATION_SCOPE, config.organizationScopeFragments()),
            config.roleDescriptionFragments()
        );
    }

    /**
     * Whether an existing role or organization scope looks provider-owned and must
     * not be deleted. Other entity types never match.
     */
    public Optional<ProtectionReason> checkSystemEntity(EntityType type, String name, String description) {
        List<String> fragments = systemNameFragments.getOrDefault(type, List.of());
        if (fragments.isEmpty()) {
            return Optional.empty();
        }
        if (containsAny(name, fragments)) {
            return Optional.of(ProtectionReason.SYSTEM_ENTITY);
        }
        boolean systemDescription = type == EntityType.ORGANIZATION_SCOPE
            ? isSystemScopeDescription(description)
            : containsAny(description, roleDescriptionFragments);
        return systemDescription ? Optional.of(ProtectionReason.SYSTEM_ENTITY) : Optional.empty();
    }

    /**
     * Scope descriptions written by this engine start with "Organization scope:" and
     * may mention a system by name, so "system" alone only counts outside that prefix.
     */
    private static boolean isSystemScopeDescription(String description) {
        if (description == null) {
            return false;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        return lower.contains("logto") || lower.contains("management")
            || (lower.contains("system") && !lower.startsWith(GENERATED_SCOPE_DESCRIPTION_PREFIX));
    }

    private static boolean containsAny(String value, List<String> fragments) {
        if (value == null) {
            return false;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        for (String fragment : fragments) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Protection reason for a resource, if any.
     */
    public Optional<ProtectionReason> checkResource(String name, String indicator, boolean isDefault) {
        if (name != null && resourceNames.contains(name.toLowerCase(Locale.ROOT))) {
            return Optional.of(ProtectionReason.RESERVED_NAME);
        }
        if (indicator != null && resourceIndicators.contains(indicator)) {
            return Optional.of(ProtectionReason.RESERVED_NAME);
        }
        if (isDefault) {
            return Optional.of(ProtectionReason.DEFAULT_ENTITY);
        }
        return Optional.empty();
    }

    /**
     * Protection reason for a role or scope, if any.
     */
    public Optional<ProtectionReason> checkName(String name, boolean isDefault) {
        if (isReservedName(name)) {
            return Optional.of(ProtectionReason.RESERVED_NAME);
        }
        if (isDefault) {
            return Optional.of(ProtectionReason.DEFAULT_ENTITY);
        }
        return Optional.empty();
    }

    public boolean isReservedName(String name) {
        if (name == null) {
            return false;
        }
        return resourceNames.contains(name.toLowerCase(Locale.ROOT)) || containsAny(name, nameFragments);
    }

    private static Set<String> lowerCase(Set<String> values) {
        return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
    }

    private static List<String> lowerCase(List<String> values) {
        return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).toList();
    }
}
