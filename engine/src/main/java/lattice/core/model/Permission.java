package lattice.core.model;

import java.util.List;

/**
 * A permission in a workspace.
 *
 * <p>Holding a permission implies holding every permission it inherits from,
 * transitively. For example, with {@code admin -> write -> read}, a role granted
 * {@code admin} also holds {@code write} and {@code read}.
 *
 * @param workspaceId the owning workspace
 * @param id          unique identifier within the workspace (e.g., "post:write")
 * @param name        human-readable name (e.g., "Write posts")
 * @param parentIds   permissions this permission inherits from, in declaration order
 */
public record Permission(String workspaceId, String id, String name, List<String> parentIds) {

    public Permission {
        parentIds = Role.distinct(parentIds);
    }

    /**
     * Create a permission with no parents.
     */
    public static Permission create(String workspaceId, String id, String name) {
        return new Permission(workspaceId, id, name, List.of());
    }

    public EntityKey key() {
        return EntityKey.of(workspaceId, id);
    }

    public boolean hasParent(String parentId) {
        return parentIds.contains(parentId);
    }

    public Permission withName(String newName) {
        return new Permission(workspaceId, id, newName, parentIds);
    }

    public Permission withParentIds(List<String> newParentIds) {
        return new Permission(workspaceId, id, name, newParentIds);
    }

    public Permission withParent(String parentId) {
        return withParentIds(Role.append(parentIds, parentId));
    }

    public Permission withoutParent(String parentId) {
        return withParentIds(Role.remove(parentIds, parentId));
    }

    public static Builder builder(String workspaceId, String id) {
        return new Builder(workspaceId, id);
    }

    public static class Builder {
        private final String workspaceId;
        private final String id;
        private String name;
        private List<String> parentIds = List.of();

        private Builder(String workspaceId, String id) {
            this.workspaceId = workspaceId;
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder parentIds(List<String> parentIds) {
            this.parentIds = parentIds;
            return this;
        }

        public Builder parentIds(String... parentIds) {
            return parentIds(List.of(parentIds));
        }

        public Permission build() {
            return new Permission(workspaceId, id, name, parentIds);
        }
    }
}
