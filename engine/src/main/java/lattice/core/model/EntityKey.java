package lattice.core.model;

import lattice.core.util.Identifiers;

/**
 * Composite primary key of a role or permission.
 *
 * <p>The same ID may exist independently in two workspaces; only the pair is unique.
 *
 * @param workspaceId the owning workspace
 * @param id          the entity ID within the workspace
 */
public record EntityKey(String workspaceId, String id) {

    public EntityKey {
        Identifiers.requireNonBlank(workspaceId, "workspaceId");
        Identifiers.requireNonBlank(id, "id");
    }

    public static EntityKey of(String workspaceId, String id) {
        return new EntityKey(workspaceId, id);
    }

    public boolean inWorkspace(String candidateWorkspaceId) {
        return workspaceId.equals(candidateWorkspaceId);
    }
}
