package lattice.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A role in a workspace.
 *
 * <p>A role's effective permissions are its direct permissions plus everything
 * reachable through its parent roles, each expanded through the permission
 * hierarchy. Identifier validation is done by the store, not here, so that
 * records read back from persistent storage are never rejected on construction.
 *
 * @param workspaceId         the owning workspace
 * @param id                  unique identifier within the workspace (e.g., "member")
 * @param name                human-readable name (e.g., "Member")
 * @param parentIds           roles this role inherits from, in declaration order
 * @param directPermissionIds permissions attached directly to this role
 */
public record Role(
        String workspaceId, String id, String name, List<String> parentIds, List<String> directPermissionIds) {

    public Role {
        parentIds = distinct(parentIds);
        directPermissionIds = distinct(directPermissionIds);
    }

    /**
     * Create a role with no parents and no direct permissions.
     */
    public static Role create(String workspaceId, String id, String name) {
        return new Role(workspaceId, id, name, List.of(), List.of());
    }

    public EntityKey key() {
        return EntityKey.of(workspaceId, id);
    }

    public boolean hasParent(String parentId) {
        return parentIds.contains(parentId);
    }

    public boolean hasDirectPermission(String permissionId) {
        return directPermissionIds.contains(permissionId);
    }

    public Role withName(String newName) {
        return new Role(workspaceId, id, newName, parentIds, directPermissionIds);
    }

    public Role withParentIds(List<String> newParentIds) {
        return new Role(workspaceId, id, name, newParentIds, directPermissionIds);
    }

    public Role withDirectPermissionIds(List<String> newDirectPermissionIds) {
        return new Role(workspaceId, id, name, parentIds, newDirectPermissionIds);
    }

    public Role withParent(String parentId) {
        return withParentIds(append(parentIds, parentId));
    }

    public Role withoutParent(String parentId) {
        return withParentIds(remove(parentIds, parentId));
    }

    public Role withDirectPermission(String permissionId) {
        return withDirectPermissionIds(append(directPermissionIds, permissionId));
    }

    public Role withoutDirectPermission(String permissionId) {
        return withDirectPermissionIds(remove(directPermissionIds, permissionId));
    }

    public static Builder builder(String workspaceId, String id) {
        return new Builder(workspaceId, id);
    }

    static List<String> distinct(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        // Stream.toList() tolerates null elements; the store rejects them with a proper error
        return ids.stream().distinct().toList();
    }

    static List<String> append(List<String> ids, String id) {
        final var copy = new ArrayList<>(ids);
        copy.add(id);
        return copy;
    }

    static List<String> remove(List<String> ids, String id) {
        return ids.stream().filter(existing -> !existing.equals(id)).toList();
    }

    public static class Builder {
        private final String workspaceId;
        private final String id;
        private String name;
        private List<String> parentIds = List.of();
        private List<String> directPermissionIds = List.of();

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

        public Builder directPermissionIds(List<String> directPermissionIds) {
            this.directPermissionIds = directPermissionIds;
            return this;
        }

        public Builder directPermissionIds(String... directPermissionIds) {
            return directPermissionIds(List.of(directPermissionIds));
        }

        public Role build() {
            return new Role(workspaceId, id, name, parentIds, directPermissionIds);
        }
    }
}
