package lattice.core.model;

/**
 * Thrown when creating a role or permission whose workspace and ID are already taken.
 */
public class EntityAlreadyExistsException extends AuthorizationException {

    private final EntityType entityType;
    private final EntityKey key;

    public EntityAlreadyExistsException(EntityType entityType, EntityKey key) {
        super(
                ErrorKind.ALREADY_EXISTS,
                "%s '%s' already exists in workspace '%s'"
                        .formatted(entityType.label(), key.id(), key.workspaceId()));
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
