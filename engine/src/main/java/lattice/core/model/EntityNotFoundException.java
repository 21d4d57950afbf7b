package lattice.core.model;

/**
 * Thrown when a role or permission does not exist in the given workspace.
 */
public class EntityNotFoundException extends AuthorizationException {

    private final EntityType entityType;
    private final EntityKey key;

    public EntityNotFoundException(EntityType entityType, EntityKey key) {
        super(
                ErrorKind.NOT_FOUND,
                "%s '%s' not found in workspace '%s'".formatted(entityType.label(), key.id(), key.workspaceId()));
        this.entityType = entityType;
        this.key = key;
    }

    public EntityType entityType() {
        return entityType;
    }

    public EntityKey key() {
        return key;
    }
}
