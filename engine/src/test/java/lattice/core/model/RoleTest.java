package lattice.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Role")
class RoleTest {

    @Nested
    @DisplayName("construction")
    class ConstructionTests {

        @Test
        @DisplayName("should default null lists to empty")
        void shouldDefaultNullLists() {
            final var role = new Role("ws", "guest", "Guest", null, null);

            assertTrue(role.parentIds().isEmpty());
            assertTrue(role.directPermissionIds().isEmpty());
        }

        @Test
        @DisplayName("should copy lists so later changes to the source are not seen")
        void shouldCopyLists() {
            final var parents = new ArrayList<>(List.of("guest"));
            final var role = Role.builder("ws", "member").name("Member").parentIds(parents).build();

            parents.add("owner");

            assertEquals(List.of("guest"), role.parentIds());
            assertThrows(UnsupportedOperationException.class, () -> role.parentIds().add("x"));
        }

        @Test
        @DisplayName("should drop duplicate IDs keeping first occurrence")
        void shouldDropDuplicates() {
            final var role = Role.builder("ws", "member")
                    .name("Member")
                    .parentIds("b", "a", "b")
                    .directPermissionIds("read", "read")
                    .build();

            assertEquals(List.of("b", "a"), role.parentIds());
            assertEquals(List.of("read"), role.directPermissionIds());
        }
    }

    @Nested
    @DisplayName("copy methods")
    class CopyTests {

        @Test
        @DisplayName("should add and remove parents without touching the original")
        void shouldAddAndRemoveParents() {
            final var role = Role.create("ws", "member", "Member");

            final var withParent = role.withParent("guest");
            final var withoutParent = withParent.withoutParent("guest");

            assertTrue(role.parentIds().isEmpty());
            assertTrue(withParent.hasParent("guest"));
            assertFalse(withoutParent.hasParent("guest"));
        }

        @Test
        @DisplayName("should add and remove direct permissions")
        void shouldAddAndRemoveDirectPermissions() {
            final var role = Role.create("ws", "member", "Member").withDirectPermission("read");

            assertTrue(role.hasDirectPermission("read"));
            assertFalse(role.withoutDirectPermission("read").hasDirectPermission("read"));
            assertEquals("Renamed", role.withName("Renamed").name());
        }
    }

    @Test
    @DisplayName("key() should pair workspace and ID")
    void keyShouldPairWorkspaceAndId() {
        final var role = Role.create("ws", "guest", "Guest");

        assertEquals(EntityKey.of("ws", "guest"), role.key());
        assertTrue(role.key().inWorkspace("ws"));
        assertFalse(role.key().inWorkspace("other"));
    }
}
