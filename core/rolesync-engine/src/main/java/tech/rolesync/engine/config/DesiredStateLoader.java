package tech.rolesync.engine.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.rolesync.engine.errors.ValidationException;
import tech.rolesync.engine.errors.Violation;
import tech.rolesync.engine.model.AccessControl;
import tech.rolesync.engine.model.ApplicationDefinition;
import tech.rolesync.engine.model.DesiredState;
import tech.rolesync.engine.model.Metadata;
import tech.rolesync.engine.model.PermissionRef;
import tech.rolesync.engine.model.ResourceDefinition;
import tech.rolesync.engine.model.RoleDefinition;
import tech.rolesync.engine.model.RoleType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads a desired-state YAML file into a {@link DesiredState}.
 *
 * <p>Only the document's shape is checked here. Cross-references are checked by
 * {@link DesiredStateValidator}.
 */
@ApplicationScoped
public class DesiredStateLoader {

    private static final Logger LOG = Logger.getLogger(DesiredStateLoader.class);

    private static final Set<String> ORGANIZATION_TYPES = Set.of("org", "organization");
    private static final Set<String> USER_TYPES = Set.of("user");

    private final ObjectMapper mapper;

    public DesiredStateLoader() {
        this.mapper = new YAMLMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @throws ValidationException if the file cannot be read or is malformed
     */
    public DesiredState load(Path file) {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new ValidationException("Cannot read desired state from " + file + ": " + e.getMessage(), e);
        }
        DesiredState state = parse(content);
        LOG.infof("Loaded desired state from %s: %d resources, %d organization roles, %d user roles, %d applications",
            file, state.resources().size(), state.organizationRoles().size(), state.userRoles().size(),
            state.thirdPartyApps().size());
        return state;
    }

    public DesiredState parse(String yaml) {
        DesiredStateDocument doc;
        try {
            doc = mapper.readValue(yaml, DesiredStateDocument.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed desired state: " + e.getOriginalMessage(), e);
        }
        if (doc == null) {
            throw new ValidationException(List.of(new Violation("$", "document is empty")));
        }

        DesiredStateDocument.HierarchyDoc hierarchy = doc.hierarchy();
        List<Violation> violations = new ArrayList<>();

        List<RoleDefinition> organizationRoles = roles(
            pick(hierarchy == null ? null : hierarchy.organizationRoles(), doc.organizationRoles()),
            RoleType.ORGANIZATION, "organization_roles", violations);
        List<RoleDefinition> userRoles = roles(
            pick(hierarchy == null ? null : hierarchy.userRoles(), doc.userRoles()),
            RoleType.USER, "user_roles", violations);
        List<ResourceDefinition> resources = resources(
            pick(hierarchy == null ? null : hierarchy.resources(), doc.resources()));
        List<ApplicationDefinition> apps = applications(
            pick(hierarchy == null ? null : hierarchy.thirdPartyApps(), doc.thirdPartyApps()));

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }

        Metadata metadata = doc.metadata() == null
            ? Metadata.empty()
            : new Metadata(doc.metadata().name(), doc.metadata().version(), doc.metadata().description());
        return new DesiredState(metadata, resources, organizationRoles, userRoles, apps);
    }

    private static <T> List<T> pick(List<T> nested, List<T> flat) {
        List<T> picked = new ArrayList<>();
        if (nested != null) {
            picked.addAll(nested);
        }
        if (flat != null) {
            picked.addAll(flat);
        }
        return picked;
    }

    private List<RoleDefinition> roles(List<DesiredStateDocument.RoleDoc> docs, RoleType type, String section,
                                       List<Violation> violations) {
        List<RoleDefinition> roles = new ArrayList<>();
        for (int i = 0; i < docs.size(); i++) {
            DesiredStateDocument.RoleDoc doc = docs.get(i);
            if (doc == null) {
                violations.add(new Violation(section + "[" + i + "]", "empty role entry"));
                continue;
            }
            if (doc.type() != null && !acceptsType(type, doc.type())) {
                violations.add(new Violation(section + "[" + doc.id() + "].type",
                    "invalid role type " + doc.type()));
            }
            List<PermissionRef> permissions = new ArrayList<>();
            if (doc.permissions() != null) {
                for (DesiredStateDocument.PermissionDoc p : doc.permissions()) {
                    permissions.add(p == null ? PermissionRef.of(null) : new PermissionRef(p.id(), p.name()));
                }
            }
            roles.add(new RoleDefinition(doc.id(), doc.name(),
                doc.priority() == null ? 0 : doc.priority(), permissions));
        }
        return roles;
    }

    /**
     * Role documents carry a {@code type} that is informative only. Organization roles
     * historically declare {@code user} as well, so both sections accept it.
     */
    private static boolean acceptsType(RoleType section, String declared) {
        String lower = declared.trim().toLowerCase(Locale.ROOT);
        return USER_TYPES.contains(lower) || (section == RoleType.ORGANIZATION && ORGANIZATION_TYPES.contains(lower));
    }

    private List<ResourceDefinition> resources(List<DesiredStateDocument.ResourceDoc> docs) {
        List<ResourceDefinition> resources = new ArrayList<>();
        for (DesiredStateDocument.ResourceDoc doc : docs) {
            if (doc != null) {
                resources.add(new ResourceDefinition(doc.name(), strings(doc.actions()), doc.accessTokenTtl()));
            }
        }
        return resources;
    }

    private List<ApplicationDefinition> applications(List<DesiredStateDocument.ApplicationDoc> docs) {
        List<ApplicationDefinition> apps = new ArrayList<>();
        for (DesiredStateDocument.ApplicationDoc doc : docs) {
            if (doc == null) {
                continue;
            }
            AccessControl access = doc.accessControl() == null
                ? AccessControl.none()
                : new AccessControl(strings(doc.accessControl().organizationRoles()),
                    strings(doc.accessControl().userRoles()));
            apps.add(new ApplicationDefinition(doc.name(), doc.displayName(), doc.description(), doc.loginUrl(),
                strings(doc.scopes()), strings(doc.redirectUris()), strings(doc.postLogoutRedirectUris()), access));
        }
        return apps;
    }

    /**
     * Blank list entries become empty strings so the validator can point at them.
     */
    private static List<String> strings(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().map(v -> v == null ? "" : v).toList();
    }
}
