package tech.rolesync.engine.guard;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.rolesync.engine.diff.Change;
import tech.rolesync.engine.model.RoleType;
import tech.rolesync.engine.plan.EntityRef;
import tech.rolesync.engine.plan.EntityType;
import tech.rolesync.engine.plan.OperationPayload;
import tech.rolesync.engine.report.ReportItem;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SafetyGuard.
 *
 * Nothing owned by the provider may ever be modified, whatever the run options.
 */
class SafetyGuardTest {

    private final SafetyGuard guard = new SafetyGuard(ProtectionPolicy.defaults());

    // ========================================
    // PROTECTION
    // ========================================

    @Test
    @DisplayName("filter should protect the management API resource even with cleanup enabled")
    void filter_shouldProtectManagementApi_whenCleanupEnabled() {
        // Arrange
        Change delete = Change.delete(EntityRef.of(EntityType.RESOURCE, "Logto Management API"),
            new OperationPayload.Resource("Logto Management API", "https://default.logto.app/api", 3600, true),
            List.of(), "Delete resource Logto Management API");

        // Act
        GuardResult result = guard.filter(List.of(delete), true);

        // Assert
        assertThat(result.allowed()).isEmpty();
        assertThat(result.protectedItems()).singleElement()
            .extracting(ReportItem::reason).isEqualTo("RESERVED_NAME");
    }

    @Test
    @DisplayName("filter should protect a default resource by its flag")
    void filter_shouldProtectDefaultResource() {
        // Arrange
        Change update = Change.update(EntityRef.of(EntityType.RESOURCE, "default-api"),
            new OperationPayload.Resource("default-api", "https://api.example.com/default", 60, true),
            List.of(), "Update resource default-api");

        // Act
        GuardResult result = guard.filter(List.of(update), true);

        // Assert
        assertThat(result.protectedItems()).singleElement()
            .extracting(ReportItem::reason).isEqualTo("DEFAULT_ENTITY");
    }

    @Test
    @DisplayName("filter should protect scopes owned by a protected resource")
    void filter_shouldProtectScopeOfProtectedOwner() {
        // Arrange
        Change delete = Change.delete(EntityRef.of(EntityType.SCOPE, "all"),
            new OperationPayload.Scope("Logto Management API", "all", "Default scope",
                "https://default.logto.app/api", true),
            List.of(), "Delete scope all");

        // Act
        GuardResult result = guard.filter(List.of(delete), true);

        // Assert
        assertThat(result.protectedItems()).singleElement()
            .extracting(ReportItem::reason).isEqualTo("PROTECTED_OWNER");
    }

    @Test
    @DisplayName("filter should protect reserved role names on create as well")
    void filter_shouldProtectReservedRoleName_whenCreating() {
        // Arrange
        Change create = Change.create(EntityRef.of(EntityType.USER_ROLE, "logto:admin"),
            new OperationPayload.Role(RoleType.USER, "logto:admin", "x", false),
            List.of(), "Create user role logto:admin");

        // Act
        GuardResult result = guard.filter(List.of(create), false);

        // Assert
        assertThat(result.allowed()).isEmpty();
        assertThat(result.protectedItems()).hasSize(1);
    }

    @Test
    @DisplayName("filter should protect default roles from updates")
    void filter_shouldProtectDefaultRole_whenUpdating() {
        // Arrange
        Change update = Change.update(EntityRef.of(EntityType.USER_ROLE, "default-user"),
            new OperationPayload.Role(RoleType.USER, "default-user", "Default", true),
            List.of(), "Update user role default-user");

        // Act
        GuardResult result = guard.filter(List.of(update), true);

        // Assert
        assertThat(result.protectedItems()).singleElement()
            .extracting(ReportItem::reason).isEqualTo("DEFAULT_ENTITY");
    }

    @Test
    @DisplayName("filter should report protection before cleanup when both apply")
    void filter_shouldReportProtected_whenCleanupDisabledToo() {
        // Arrange
        Change delete = Change.delete(EntityRef.of(EntityType.ORGANIZATION_ROLE, "machine-to-machine"),
            new OperationPayload.Role(RoleType.ORGANIZATION, "machine-to-machine", "x", false),
            List.of(), "Delete organization role machine-to-machine");

        // Act
        GuardResult result = guard.filter(List.of(delete), false);

        // Assert
        assertThat(result.protectedItems()).hasSize(1);
        assertThat(result.wouldRemove()).isEmpty();
    }

    // ========================================
    // SYSTEM ENTITIES
    // ========================================

    @Test
    @DisplayName("filter should keep system-looking user roles from deletion by name or description")
    void filter_shouldProtectSystemUserRoles_whenDeleting() {
        // Arrange
        Change admin = Change.delete(EntityRef.of(EntityType.USER_ROLE, "admin"),
            new OperationPayload.Role(RoleType.USER, "Admin", "Full access", false),
            List.of(), "Delete user role Admin");
        Change ops = Change.delete(EntityRef.of(EntityType.USER_ROLE, "ops"),
            new OperationPayload.Role(RoleType.USER, "ops", "System role", false),
            List.of(), "Delete user role ops");

        // Act
        GuardResult result = guard.filter(List.of(admin, ops), true);

        // Assert
        assertThat(result.allowed()).isEmpty();
        assertThat(result.protectedItems())
            .extracting(ReportItem::key, ReportItem::reason)
            .containsExactly(tuple("admin", "SYSTEM_ENTITY"), tuple("ops", "SYSTEM_ENTITY"));
    }

    @Test
    @DisplayName("filter should keep owner, member and default-described organization roles from deletion")
    void filter_shouldProtectSystemOrganizationRoles_whenDeleting() {
        // Arrange
        List<Change> deletes = List.of(
            orgRoleDelete("Owner", "Organization owner"),
            orgRoleDelete("Member", "Regular member"),
            orgRoleDelete("editor", "Default editor role"));

        // Act
        GuardResult result = guard.filter(deletes, true);

        // Assert
        assertThat(result.allowed()).isEmpty();
        assertThat(result.protectedItems()).hasSize(3)
            .extracting(ReportItem::reason).containsOnly("SYSTEM_ENTITY");
    }

    @Test
    @DisplayName("filter should keep system-looking organization scopes from deletion")
    void filter_shouldProtectSystemOrganizationScopes_whenDeleting() {
        // Arrange
        Change api = orgScopeDelete("read:api", "Organization scope: read:api");
        Change logto = orgScopeDelete("reports:view", "Managed by Logto");
        Change generated = orgScopeDelete("billing:read", "Organization scope: Billing system access");

        // Act
        GuardResult result = guard.filter(List.of(api, logto, generated), true);

        // Assert
        assertThat(result.protectedItems())
            .extracting(ReportItem::key)
            .containsExactly("read:api", "reports:view");
        assertThat(result.allowed()).containsExactly(generated);
    }

    @Test
    @DisplayName("filter should let desired roles with system-looking names be created and updated")
    void filter_shouldAllowSystemLookingNames_whenNotDeleting() {
        // Arrange
        Change create = Change.create(EntityRef.of(EntityType.USER_ROLE, "admin"),
            new OperationPayload.Role(RoleType.USER, "admin", "Administrator (priority 100)", false),
            List.of(), "Create user role admin");
        Change update = Change.update(EntityRef.of(EntityType.ORGANIZATION_ROLE, "member"),
            new OperationPayload.Role(RoleType.ORGANIZATION, "member", "Default member (priority 1)", false),
            List.of(), "Update organization role member");

        // Act
        GuardResult result = guard.filter(List.of(create, update), false);

        // Assert
        assertThat(result.allowed()).containsExactly(create, update);
        assertThat(result.protectedItems()).isEmpty();
    }

    // ========================================
    // CLEANUP GATING
    // ========================================

    @Test
    @DisplayName("filter should withhold entity deletes when cleanup is disabled")
    void filter_shouldWithholdDelete_whenCleanupDisabled() {
        // Arrange
        Change delete = roleDelete("legacy-role");

        // Act
        GuardResult result = guard.filter(List.of(delete), false);

        // Assert
        assertThat(result.allowed()).isEmpty();
        assertThat(result.wouldRemove()).singleElement().satisfies(item -> {
            assertThat(item.key()).isEqualTo("legacy-role");
            assertThat(item.reason()).isEqualTo("CLEANUP_DISABLED");
        });
    }

    @Test
    @DisplayName("filter should allow entity deletes when cleanup is enabled")
    void filter_shouldAllowDelete_whenCleanupEnabled() {
        // Act
        GuardResult result = guard.filter(List.of(roleDelete("legacy-role")), true);

        // Assert
        assertThat(result.allowed()).hasSize(1);
        assertThat(result.wouldRemove()).isEmpty();
    }

    @Test
    @DisplayName("filter should allow binding removals without cleanup")
    void filter_shouldAllowBindingRemoval_whenCleanupDisabled() {
        // Arrange
        Change removal = Change.delete(EntityRef.of(EntityType.ROLE_PERMISSION, "user/viewer"),
            new OperationPayload.Binding(RoleType.USER, "viewer", List.of(), List.of("systems:manage")),
            List.of(), "Remove [systems:manage] from user role viewer");

        // Act
        GuardResult result = guard.filter(List.of(removal), false);

        // Assert
        assertThat(result.allowed()).containsExactly(removal);
    }

    @Test
    @DisplayName("filter should pass through ordinary creates and updates")
    void filter_shouldAllowOrdinaryChanges() {
        // Arrange
        Change create = Change.create(EntityRef.of(EntityType.SCOPE, "systems:manage"),
            new OperationPayload.Scope("systems", "systems:manage", "Permission to manage systems",
                "https://rolesync.local/api/systems", false),
            List.of(), "Create scope systems:manage");
        Change update = Change.update(EntityRef.of(EntityType.ORGANIZATION_ROLE, "member"),
            new OperationPayload.Role(RoleType.ORGANIZATION, "member", "Member (priority 2)", false),
            List.of(), "Update organization role member");

        // Act
        GuardResult result = guard.filter(List.of(create, update), false);

        // Assert
        assertThat(result.allowed()).containsExactly(create, update);
        assertThat(result.protectedItems()).isEmpty();
        assertThat(result.wouldRemove()).isEmpty();
    }

    private static Change orgRoleDelete(String name, String description) {
        return Change.delete(EntityRef.of(EntityType.ORGANIZATION_ROLE, name.toLowerCase()),
            new OperationPayload.Role(RoleType.ORGANIZATION, name, description, false),
            List.of(), "Delete organization role " + name);
    }

    private static Change orgScopeDelete(String name, String description) {
        return Change.delete(EntityRef.of(EntityType.ORGANIZATION_SCOPE, name),
            new OperationPayload.OrganizationScope(name, description),
            List.of(), "Delete organization scope " + name);
    }

    private static Change roleDelete(String name) {
        return Change.delete(EntityRef.of(EntityType.USER_ROLE, name),
            new OperationPayload.Role(RoleType.USER, name, "Legacy", false),
            List.of(), "Delete user role " + name);
    }
}
