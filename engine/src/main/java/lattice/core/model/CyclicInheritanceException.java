package lattice.core.model;

/**
 * Thrown when adding a parent edge would make an entity its own ancestor.
 *
 * <p>The rejected mutation leaves the store unchanged.
 */
public class CyclicInheritanceException extends AuthorizationException {

    private final EntityType entityType;
    private final EntityKey key;
    private final String parentId;

    public CyclicInheritanceException(EntityType entityType, EntityKey key, String parentId) {
        super(
                ErrorKind.CYCLIC_INHERITANCE,
                "cyclic inheritance: %s '%s' cannot inherit from '%s' in workspace '%s'"
                        .formatted(entityType.label(), key.id(), parentId, key.workspaceId()));
        this.entityType = entityType;
        this.key = key;
        this.parentId = parentId;
    }

    public EntityType entityType() {
        return entityType;
    }

    public EntityKey key() {
        return key;
    }

    /**
     * The parent whose ancestry leads back to the entity.
     */
    public String parentId() {
        return parentId;
    }
}
