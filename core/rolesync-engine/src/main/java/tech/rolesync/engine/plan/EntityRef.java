package tech.rolesync.engine.plan;

/**
 * Natural-key reference to an entity, used for dependencies and the remote id registry.
 */
public record EntityRef(
    EntityType type,
    String key
) {

    public static EntityRef of(EntityType type, String key) {
        return new EntityRef(type, key);
    }

    @Override
    public String toString() {
        return type.label() + " " + key;
    }
}
