package lattice.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import lattice.adapter.out.storage.memory.InMemoryAuthorizationStore;
import lattice.core.cache.ManualTicker;
import lattice.core.model.CyclicInheritanceException;
import lattice.core.model.EntityNotFoundException;
import lattice.core.model.ErrorKind;
import lattice.core.model.InvalidArgumentException;
import lattice.core.model.Permission;
import lattice.core.model.Role;

@DisplayName("AuthorizationService")
class AuthorizationServiceTest {

    private static final String WS = "acme";
    private static final Duration TTL = Duration.ofMinutes(5);

    private InMemoryAuthorizationStore store;
    private ManualTicker ticker;
    private AuthorizationService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryAuthorizationStore();
        ticker = new ManualTicker();
        service = new AuthorizationService(
                store, EffectivePermissionCache.withTtl(new EffectivePermissionResolver(store), TTL, ticker));

        service.createPermission(Permission.create(WS, "read", "Read"));
        service.createPermission(Permission.builder(WS, "write").name("Write").parentIds("read").build());
        service.createPermission(Permission.builder(WS, "admin").name("Admin").parentIds("write").build());
        service.createRole(Role.builder(WS, "guest").name("Guest").directPermissionIds("read").build());
        service.createRole(Role.builder(WS, "member").name("Member").parentIds("guest").directPermissionIds("write").build());
        service.createRole(Role.builder(WS, "owner").name("Owner").parentIds("member").directPermissionIds("admin").build());
    }

    private static List<String> ids(List<Permission> permissions) {
        return permissions.stream().map(Permission::id).toList();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch was not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    @Nested
    @DisplayName("queries")
    class QueryTests {

        @Test
        @DisplayName("hasPermission() should follow both hierarchies")
        void hasPermissionShouldFollowHierarchies() {
            assertTrue(service.hasPermission(WS, "guest", "read"));
            assertFalse(service.hasPermission(WS, "guest", "write"));
            assertTrue(service.hasPermission(WS, "member", "read"));
            assertTrue(service.hasPermission(WS, "owner", "admin"));
            assertFalse(service.hasPermission(WS, "member", "admin"));
        }

        @Test
        @DisplayName("hasPermission() should deny unknown permission IDs")
        void hasPermissionShouldDenyUnknownPermission() {
            assertFalse(service.hasPermission(WS, "owner", "delete"));
        }

        @Test
        @DisplayName("hasAnyPermission() should need a single match")
        void hasAnyPermissionShouldNeedOneMatch() {
            assertTrue(service.hasAnyPermission(WS, "guest", "admin", "read"));
            assertFalse(service.hasAnyPermission(WS, "guest", List.of("write", "admin")));
        }

        @Test
        @DisplayName("hasAllPermissions() should need every match")
        void hasAllPermissionsShouldNeedEveryMatch() {
            assertTrue(service.hasAllPermissions(WS, "owner", "read", "write", "admin"));
            assertFalse(service.hasAllPermissions(WS, "member", List.of("read", "admin")));
        }

        @Test
        @DisplayName("getEffectivePermissions() should return full entities ordered by ID")
        void getEffectivePermissionsShouldReturnEntities() {
            final var effective = service.getEffectivePermissions(WS, "owner");

            assertEquals(List.of("admin", "read", "write"), ids(effective));
            assertEquals("Write", effective.get(2).name());
            assertTrue(service.getEffectivePermissions(WS, "guest").stream().allMatch(p -> p.workspaceId().equals(WS)));
        }

        @Test
        @DisplayName("should reject empty permission lists")
        void shouldRejectEmptyPermissionLists() {
            assertThrows(InvalidArgumentException.class, () -> service.hasAnyPermission(WS, "guest"));
            assertThrows(InvalidArgumentException.class, () -> service.hasAllPermissions(WS, "guest", List.of()));
            assertThrows(
                    InvalidArgumentException.class, () -> service.hasAllPermissions(WS, "guest", (List<String>) null));
        }

        @Test
        @DisplayName("should reject blank identifiers")
        void shouldRejectBlankIdentifiers() {
            final var exception =
                    assertThrows(InvalidArgumentException.class, () -> service.hasPermission(WS, "guest", " "));

            assertEquals(ErrorKind.INVALID_ARGUMENT, exception.kind());
            assertThrows(InvalidArgumentException.class, () -> service.hasPermission("", "guest", "read"));
            assertThrows(InvalidArgumentException.class, () -> service.getEffectivePermissions(WS, null));
            assertThrows(InvalidArgumentException.class, () -> service.hasAnyPermission(WS, "guest", "read", ""));
        }

        @Test
        @DisplayName("should report an unknown role as NOT_FOUND")
        void shouldReportUnknownRole() {
            final var exception =
                    assertThrows(EntityNotFoundException.class, () -> service.hasPermission(WS, "ghost", "read"));

            assertEquals(ErrorKind.NOT_FOUND, exception.kind());
        }
    }

    @Nested
    @DisplayName("cache consistency")
    class CacheConsistencyTests {

        @Test
        @DisplayName("mutations through the service should be visible immediately")
        void serviceMutationsShouldBeVisible() {
            assertFalse(service.hasPermission(WS, "guest", "write"));

            service.addPermissionToRole(WS, "guest", "write");
            assertTrue(service.hasPermission(WS, "guest", "write"));

            service.removePermissionFromRole(WS, "guest", "write");
            assertFalse(service.hasPermission(WS, "guest", "write"));
        }

        @Test
        @DisplayName("changing an ancestor role should reach cached descendants")
        void ancestorChangesShouldReachDescendants() {
            assertFalse(service.hasPermission(WS, "owner", "billing"));

            service.createPermission(Permission.create(WS, "billing", "Billing"));
            service.updateRole(Role.builder(WS, "guest").name("Guest").directPermissionIds("read", "billing").build());

            assertTrue(service.hasPermission(WS, "owner", "billing"));
        }

        @Test
        @DisplayName("changing the permission hierarchy should reach cached roles")
        void permissionHierarchyChangesShouldReachRoles() {
            service.createPermission(Permission.create(WS, "audit", "Audit"));
            assertFalse(service.hasPermission(WS, "member", "audit"));

            service.addPermissionParent(WS, "write", "audit");
            assertTrue(service.hasPermission(WS, "member", "audit"));

            service.removePermissionParent(WS, "write", "audit");
            assertFalse(service.hasPermission(WS, "member", "audit"));
        }

        @Test
        @DisplayName("removing a parent role should revoke inherited permissions")
        void removingParentShouldRevoke() {
            assertTrue(service.hasPermission(WS, "owner", "read"));

            service.removeRoleParent(WS, "member", "guest");

            // write still implies read through the permission hierarchy
            assertTrue(service.hasPermission(WS, "owner", "read"));
            service.removePermissionParent(WS, "write", "read");
            assertFalse(service.hasPermission(WS, "owner", "read"));
        }

        @Test
        @DisplayName("deleting a permission should drop it from every role")
        void deletingPermissionShouldDropIt() {
            assertTrue(service.hasPermission(WS, "owner", "admin"));

            service.deletePermission(WS, "admin");

            assertFalse(service.hasPermission(WS, "owner", "admin"));
            assertEquals(List.of("read", "write"), ids(service.getEffectivePermissions(WS, "owner")));
        }

        @Test
        @DisplayName("deleting a role should make its descendants lose what it granted")
        void deletingRoleShouldAffectDescendants() {
            service.removePermissionParent(WS, "write", "read");
            assertTrue(service.hasPermission(WS, "owner", "read"));

            service.deleteRole(WS, "guest");

            assertFalse(service.hasPermission(WS, "owner", "read"));
            assertThrows(EntityNotFoundException.class, () -> service.hasPermission(WS, "guest", "read"));
        }

        @Test
        @DisplayName("direct store edits should stay invisible until the TTL elapses")
        void directStoreEditsShouldWaitForTtl() {
            assertFalse(service.hasPermission(WS, "guest", "admin"));

            service.store().addPermissionToRole(WS, "guest", "admin");
            assertFalse(service.hasPermission(WS, "guest", "admin"));

            ticker.advance(TTL.plusSeconds(1));
            assertTrue(service.hasPermission(WS, "guest", "admin"));
        }

        @Test
        @DisplayName("explicit invalidation should expose direct store edits")
        void explicitInvalidationShouldExposeEdits() {
            assertFalse(service.hasPermission(WS, "guest", "admin"));
            service.store().addPermissionToRole(WS, "guest", "admin");

            service.invalidate(WS, "guest");
            assertTrue(service.hasPermission(WS, "guest", "admin"));

            service.store().removePermissionFromRole(WS, "guest", "admin");
            service.invalidateWorkspace(WS);
            assertFalse(service.hasPermission(WS, "guest", "admin"));

            service.store().addPermissionToRole(WS, "guest", "admin");
            service.invalidateAll();
            assertTrue(service.hasPermission(WS, "guest", "admin"));
        }

        @Test
        @DisplayName("a revoke should win over a query that was resolving when it ran")
        void revokeShouldWinOverInFlightQuery() throws Exception {
            final var resolved = new CountDownLatch(1);
            final var release = new CountDownLatch(1);
            final var pauseNext = new AtomicBoolean(true);
            final var pausingResolver = new EffectivePermissionResolver(store) {
                @Override
                public Set<String> resolve(String workspaceId, String roleId) {
                    final var result = super.resolve(workspaceId, roleId);
                    if (pauseNext.compareAndSet(true, false)) {
                        resolved.countDown();
                        awaitQuietly(release);
                    }
                    return result;
                }
            };
            final var racing = new AuthorizationService(
                    store, EffectivePermissionCache.withTtl(pausingResolver, TTL, ticker));
            final var executor = Executors.newSingleThreadExecutor();
            try {
                final var query = executor.submit(() -> racing.hasPermission(WS, "guest", "read"));
                assertTrue(resolved.await(5, TimeUnit.SECONDS));

                racing.removePermissionFromRole(WS, "guest", "read");
                release.countDown();

                // the in-flight query answers from what it read before the revoke
                assertTrue(query.get(5, TimeUnit.SECONDS));
                assertFalse(racing.hasPermission(WS, "guest", "read"));
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("a rejected mutation should leave cached answers intact")
        void rejectedMutationShouldNotChangeAnswers() {
            assertTrue(service.hasPermission(WS, "owner", "admin"));

            assertThrows(CyclicInheritanceException.class, () -> service.addRoleParent(WS, "guest", "owner"));

            assertTrue(service.hasPermission(WS, "owner", "admin"));
            assertFalse(service.hasPermission(WS, "guest", "admin"));
        }
    }

    @Nested
    @DisplayName("factories")
    class FactoryTests {

        @Test
        @DisplayName("an uncached service should see direct store edits immediately")
        void uncachedServiceShouldSeeStoreEdits() {
            final var uncached = AuthorizationService.create(store);
            assertFalse(uncached.hasPermission(WS, "guest", "admin"));

            store.addPermissionToRole(WS, "guest", "admin");

            assertTrue(uncached.hasPermission(WS, "guest", "admin"));
            assertSame(store, uncached.store());
        }

        @Test
        @DisplayName("a cached service should answer like an uncached one")
        void cachedServiceShouldAnswerLikeUncached() {
            final var cached = AuthorizationService.create(store, Duration.ofMinutes(1));
            final var uncached = AuthorizationService.create(store);

            for (final var role : List.of("guest", "member", "owner")) {
                assertEquals(
                        ids(uncached.getEffectivePermissions(WS, role)), ids(cached.getEffectivePermissions(WS, role)));
            }
        }

        @Test
        @DisplayName("should reject null entities on update")
        void shouldRejectNullUpdates() {
            assertThrows(InvalidArgumentException.class, () -> service.updateRole(null));
            assertThrows(InvalidArgumentException.class, () -> service.updatePermission(null));
        }
    }
}
