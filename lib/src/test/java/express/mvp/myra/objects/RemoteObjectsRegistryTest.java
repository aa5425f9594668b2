package express.mvp.myra.objects;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.myra.objects.endpoint.DestroyedListener;
import express.mvp.myra.objects.endpoint.Endpoint;
import express.mvp.myra.objects.endpoint.HostedEndpoint;
import express.mvp.myra.objects.endpoint.ProcessChangedListener;
import express.mvp.myra.objects.endpoint.Subscription;
import express.mvp.myra.objects.migration.PendingMigration;
import express.mvp.myra.objects.owner.OwnerKey;
import express.mvp.myra.objects.owner.OwnerState;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link RemoteObjectsRegistry}. */
@DisplayName("RemoteObjectsRegistry")
class RemoteObjectsRegistryTest {

    private static final int CTX_A = 10;
    private static final int CTX_B = 20;

    private RemoteObjectsRegistry registry;
    private HostedEndpoint e1;
    private HostedEndpoint e2;

    @BeforeEach
    void setUp() {
        registry = new RemoteObjectsRegistry();
        e1 = new HostedEndpoint(1, 100);
        e2 = new HostedEndpoint(2, 500);
    }

    /** An endpoint that refuses every subscription. */
    private static Endpoint closedEndpoint() {
        return new Endpoint() {
            @Override
            public int id() {
                return 9;
            }

            @Override
            public int backingProcessId() {
                return 900;
            }

            @Override
            public Subscription onDestroyed(DestroyedListener listener) {
                throw new IllegalStateException("endpoint closed");
            }

            @Override
            public Subscription onProcessChanged(ProcessChangedListener listener) {
                throw new IllegalStateException("endpoint closed");
            }
        };
    }

    @Nested
    @DisplayName("add")
    class AddTests {

        @Test
        @DisplayName("First registration returns handle 1 with count 1")
        void firstRegistration() {
            Object x = new Object();
            int h = registry.add(e1, CTX_A, x);

            assertEquals(1, h);
            assertEquals(1, registry.refCount(h));
            assertSame(x, registry.get(h).orElseThrow());
        }

        @Test
        @DisplayName("Repeated identical add returns the same handle without re-counting")
        void repeatedAddIdempotent() {
            Object x = new Object();
            int first = registry.add(e1, CTX_A, x);
            int second = registry.add(e1, CTX_A, x);

            assertEquals(first, second);
            assertEquals(1, registry.refCount(first));
        }

        @Test
        @DisplayName("Each distinct owner adds one reference")
        void distinctOwnersCount() {
            Object x = new Object();
            int h = registry.add(e1, CTX_A, x);
            registry.add(e2, CTX_B, x);
            registry.add(e2, CTX_B, x);

            assertEquals(2, registry.refCount(h));
        }

        @Test
        @DisplayName("Distinct objects get distinct handles")
        void distinctObjects() {
            int a = registry.add(e1, CTX_A, new Object());
            int b = registry.add(e1, CTX_A, new Object());
            assertNotEquals(a, b);
            assertEquals(Set.of(a, b), registry.ownedHandles(OwnerKey.of(1, 100)));
        }

        @Test
        @DisplayName("First registration subscribes both lifecycle listeners")
        void subscribesListeners() {
            registry.add(e1, CTX_A, new Object());
            registry.add(e1, CTX_A, new Object());

            assertEquals(1, e1.events().destroyedListenerCount());
            assertEquals(1, e1.events().processChangedListenerCount());
        }

        @Test
        @DisplayName("Null arguments are rejected")
        void nullArgumentsRejected() {
            assertThrows(NullPointerException.class, () -> registry.add(null, CTX_A, "x"));
            assertThrows(NullPointerException.class, () -> registry.add(e1, CTX_A, null));
        }

        @Test
        @DisplayName("Handle exhaustion surfaces as RegistryException")
        void exhaustion() {
            RemoteObjectsRegistry small =
                    new RemoteObjectsRegistry(RegistryConfig.builder().maxHandle(1).build());
            small.add(e1, CTX_A, new Object());
            assertThrows(RegistryException.class, () -> small.add(e1, CTX_A, new Object()));
        }

        @Test
        @DisplayName("Failed subscription leaves no unreferenced handle behind")
        void failedSubscriptionDropsHandle() {
            Object x = new Object();

            assertThrows(IllegalStateException.class, () -> registry.add(closedEndpoint(), CTX_A, x));
            assertEquals(0, registry.stats().liveHandles());
            assertTrue(registry.get(1).isEmpty());

            int h = registry.add(e1, CTX_A, x);
            assertTrue(h > 1);
            assertEquals(1, registry.refCount(h));
        }

        @Test
        @DisplayName("Failed subscription keeps an object already referenced by another owner")
        void failedSubscriptionKeepsReferencedHandle() {
            Object x = new Object();
            int h = registry.add(e1, CTX_A, x);

            assertThrows(IllegalStateException.class, () -> registry.add(closedEndpoint(), CTX_A, x));
            assertEquals(1, registry.refCount(h));
            assertSame(x, registry.get(h).orElseThrow());
        }
    }

    @Nested
    @DisplayName("get")
    class GetTests {

        @Test
        @DisplayName("Unknown handle is absent")
        void unknownAbsent() {
            assertTrue(registry.get(99).isEmpty());
        }

        @Test
        @DisplayName("Typed get filters by type")
        void typedGet() {
            int h = registry.add(e1, CTX_A, "service");
            assertEquals("service", registry.get(h, String.class).orElseThrow());
            assertTrue(registry.get(h, Integer.class).isEmpty());
        }

        @Test
        @DisplayName("Released handle is absent and re-registration allocates a greater handle")
        void releasedThenReRegistered() {
            Object x = new Object();
            int h = registry.add(e1, CTX_A, x);
            registry.remove(e1, CTX_A, h);

            assertTrue(registry.get(h).isEmpty());
            int again = registry.add(e1, CTX_A, x);
            assertTrue(again > h);
        }
    }

    @Nested
    @DisplayName("remove")
    class RemoveTests {

        @Test
        @DisplayName("remove drops the count to zero and deletes the entry")
        void removeReleases() {
            int h = registry.add(e1, CTX_A, new Object());
            registry.remove(e1, CTX_A, h);

            assertEquals(0, registry.refCount(h));
            assertTrue(registry.get(h).isEmpty());
            assertTrue(registry.ownedHandles(OwnerKey.of(1, 100)).isEmpty());
        }

        @Test
        @DisplayName("Second remove is a no-op")
        void doubleRemove() {
            int h = registry.add(e1, CTX_A, new Object());
            int other = registry.add(e1, CTX_A, new Object());
            registry.remove(e1, CTX_A, h);

            assertDoesNotThrow(() -> registry.remove(e1, CTX_A, h));
            assertTrue(registry.get(h).isEmpty());
            assertEquals(1, registry.refCount(other));
        }

        @Test
        @DisplayName("Duplicate remove does not release another owner's reference")
        void duplicateRemoveKeepsOtherOwners() {
            Object x = new Object();
            int h = registry.add(e1, CTX_A, x);
            registry.add(e2, CTX_B, x);

            registry.remove(e1, CTX_A, h);
            registry.remove(e1, CTX_A, h);

            assertEquals(1, registry.refCount(h));
            assertSame(x, registry.get(h).orElseThrow());
        }

        @Test
        @DisplayName("Mismatched context id changes nothing")
        void mismatchedContext() {
            int h = registry.add(e1, CTX_A, new Object());
            registry.remove(e1, CTX_B, h);
            assertEquals(1, registry.refCount(h));
        }

        @Test
        @DisplayName("Unknown owner changes nothing")
        void unknownOwner() {
            int h = registry.add(e1, CTX_A, new Object());
            registry.remove(e2, CTX_A, h);
            assertEquals(1, registry.refCount(h));
        }
    }

    @Nested
    @DisplayName("clear")
    class ClearTests {

        @Test
        @DisplayName("clear dereferences every handle once and removes the owner")
        void clearReleasesAll() {
            Object shared = new Object();
            int exclusive = registry.add(e1, CTX_A, new Object());
            int sharedHandle = registry.add(e1, CTX_A, shared);
            registry.add(e2, CTX_B, shared);

            registry.clear(OwnerKey.of(1, 100), CTX_A);

            assertTrue(registry.get(exclusive).isEmpty());
            assertEquals(1, registry.refCount(sharedHandle));
            assertTrue(registry.ownerState(OwnerKey.of(1, 100)).isEmpty());
        }

        @Test
        @DisplayName("clear disposes the owner's listeners")
        void clearDisposesListeners() {
            registry.add(e1, CTX_A, new Object());
            registry.clear(e1, CTX_A);

            assertEquals(0, e1.events().destroyedListenerCount());
            assertEquals(0, e1.events().processChangedListenerCount());
        }

        @Test
        @DisplayName("clear with mismatched context is a no-op")
        void clearMismatched() {
            int h = registry.add(e1, CTX_A, new Object());
            registry.clear(OwnerKey.of(1, 100), CTX_B);

            assertEquals(1, registry.refCount(h));
            assertEquals(OwnerState.ACTIVE, registry.ownerState(OwnerKey.of(1, 100)).orElseThrow());
        }

        @Test
        @DisplayName("clear of unknown owner is a no-op")
        void clearUnknown() {
            assertDoesNotThrow(() -> registry.clear(OwnerKey.of(9, 9), CTX_A));
        }

        @Test
        @DisplayName("clear drops a pending migration of the context")
        void clearDropsMigration() {
            registry.add(e1, CTX_A, new Object());
            e1.swapProcess(200);
            assertTrue(registry.pendingMigration(CTX_A).isPresent());

            registry.clear(OwnerKey.of(1, 100), CTX_A);

            assertTrue(registry.pendingMigration(CTX_A).isEmpty());
            assertTrue(registry.stats().isEmpty());
        }
    }

    @Nested
    @DisplayName("Endpoint destruction")
    class DestroyedTests {

        @Test
        @DisplayName("Destruction of the backing process clears the owner")
        void destroyClears() {
            int h = registry.add(e1, CTX_A, new Object());
            e1.destroy();

            assertTrue(registry.get(h).isEmpty());
            assertTrue(registry.stats().isEmpty());
            assertEquals(0, e1.events().destroyedListenerCount());
        }

        @Test
        @DisplayName("Destruction of an unrelated process is ignored")
        void unrelatedProcessIgnored() {
            int h = registry.add(e1, CTX_A, new Object());
            e1.processDestroyed(999);

            assertEquals(1, registry.refCount(h));
            assertEquals(1, e1.events().destroyedListenerCount());
        }

        @Test
        @DisplayName("Destruction only affects the destroyed endpoint's owners")
        void otherEndpointsUnaffected() {
            Object x = new Object();
            int h = registry.add(e1, CTX_A, x);
            registry.add(e2, CTX_B, x);

            e1.destroy();

            assertEquals(1, registry.refCount(h));
            assertSame(x, registry.get(h).orElseThrow());
        }
    }

    @Nested
    @DisplayName("Process swap")
    class MigrationTests {

        private final OwnerKey oldKey = OwnerKey.of(1, 100);
        private final OwnerKey newKey = OwnerKey.of(1, 200);

        @Test
        @DisplayName("Swap notification records a pending migration")
        void swapRecordsMigration() {
            registry.add(e1, CTX_A, new Object());
            e1.swapProcess(200);

            assertEquals(
                    new PendingMigration(oldKey, newKey),
                    registry.pendingMigration(CTX_A).orElseThrow());
            assertEquals(OwnerState.MIGRATION_PENDING, registry.ownerState(oldKey).orElseThrow());
            assertEquals(0, e1.events().processChangedListenerCount());
        }

        @Test
        @DisplayName("Swap of an unrelated process is ignored")
        void unrelatedSwapIgnored() {
            registry.add(e1, CTX_A, new Object());
            e1.events().fireProcessChanged(999, 200);

            assertTrue(registry.pendingMigration(CTX_A).isEmpty());
            assertEquals(1, e1.events().processChangedListenerCount());
        }

        @Test
        @DisplayName("Registration from the new process keeps the handle and its count")
        void migratedRegistrationKeepsCount() {
            Object x = new Object();
            int h = registry.add(e1, CTX_A, x);
            e1.swapProcess(200);

            int again = registry.add(e1, CTX_A, x);

            assertEquals(h, again);
            assertSame(x, registry.get(h).orElseThrow());
            assertEquals(1, registry.refCount(h));
            assertTrue(registry.ownerState(oldKey).isEmpty());
            assertEquals(OwnerState.ACTIVE, registry.ownerState(newKey).orElseThrow());
            assertEquals(Set.of(h), registry.ownedHandles(newKey));
            assertTrue(registry.pendingMigrationContexts().isEmpty());
        }

        @Test
        @DisplayName("Migrated owner listens on the new process only")
        void migratedOwnerListensOnNewProcess() {
            Object x = new Object();
            int h = registry.add(e1, CTX_A, x);
            e1.swapProcess(200);
            registry.add(e1, CTX_A, x);

            assertEquals(1, e1.events().destroyedListenerCount());
            e1.processDestroyed(100);
            assertEquals(1, registry.refCount(h));

            e1.destroy();
            assertTrue(registry.get(h).isEmpty());
            assertTrue(registry.stats().isEmpty());
        }

        @Test
        @DisplayName("Confirmation through the old process with a new context starts a new owner")
        void confirmationThroughOldProcess() {
            Object x = new Object();
            Object y = new Object();
            int hx = registry.add(e1, CTX_A, x);
            e1.swapProcess(200);

            int hy = registry.add(e1, 100, CTX_B, y);

            assertEquals(CTX_B, registry.ownerContext(newKey).orElseThrow());
            assertEquals(Set.of(hy), registry.ownedHandles(newKey));
            assertEquals(Set.of(hx), registry.ownedHandles(oldKey));
            assertTrue(registry.pendingMigration(CTX_A).isEmpty());
            assertEquals(1, registry.refCount(hy));
        }

        @Test
        @DisplayName("Old process destruction after a migration releases only the old owner")
        void oldProcessDestructionAfterMigration() {
            Object x = new Object();
            Object y = new Object();
            int hx = registry.add(e1, CTX_A, x);
            e1.swapProcess(200);
            int hy = registry.add(e1, 100, CTX_B, y);

            e1.processDestroyed(100);

            assertTrue(registry.get(hx).isEmpty());
            assertEquals(1, registry.refCount(hy));
            assertTrue(registry.ownerState(oldKey).isEmpty());

            e1.destroy();
            assertTrue(registry.stats().isEmpty());
        }

        @Test
        @DisplayName("Destruction before confirmation abandons the migration")
        void destructionBeforeConfirmation() {
            Object x = new Object();
            int h = registry.add(e1, CTX_A, x);
            e1.swapProcess(200);
            e1.processDestroyed(100);

            assertTrue(registry.get(h).isEmpty());
            assertTrue(registry.pendingMigration(CTX_A).isEmpty());

            int again = registry.add(e1, CTX_A, x);
            assertTrue(again > h);
            assertEquals(1, registry.refCount(again));
        }

        @Test
        @DisplayName("Chained swaps leave the first owner in place until its process dies")
        void chainedSwaps() {
            Object x = new Object();
            int h = registry.add(e1, CTX_A, x);
            e1.swapProcess(200);
            e1.swapProcess(300);

            OwnerKey finalKey = OwnerKey.of(1, 300);
            assertEquals(h, registry.add(e1, CTX_A, x));
            assertEquals(2, registry.refCount(h));
            assertEquals(Set.of(h), registry.ownedHandles(oldKey));
            assertEquals(Set.of(h), registry.ownedHandles(finalKey));
            assertTrue(registry.ownerState(newKey).isEmpty());
            assertEquals(
                    new PendingMigration(oldKey, newKey),
                    registry.pendingMigration(CTX_A).orElseThrow());

            e1.processDestroyed(100);
            assertEquals(1, registry.refCount(h));
            assertTrue(registry.pendingMigrationContexts().isEmpty());

            e1.destroy();
            assertTrue(registry.get(h).isEmpty());
            assertTrue(registry.stats().isEmpty());
        }

        @Test
        @DisplayName("Unconfirmed migration stays visible")
        void unconfirmedMigrationRetained() {
            registry.add(e1, CTX_A, new Object());
            e1.swapProcess(200);

            assertEquals(Set.of(CTX_A), registry.pendingMigrationContexts());
            assertEquals(1, registry.stats().pendingMigrations());
        }
    }

    @Nested
    @DisplayName("Reload without swap")
    class ReloadTests {

        private final OwnerKey key = OwnerKey.of(1, 100);

        @Test
        @DisplayName("New context on the same process updates the owner in place")
        void contextUpdatedInPlace() {
            int hx = registry.add(e1, CTX_A, new Object());
            int hy = registry.add(e1, CTX_B, new Object());

            assertEquals(CTX_B, registry.ownerContext(key).orElseThrow());
            assertEquals(Set.of(hx, hy), registry.ownedHandles(key));
            assertEquals(1, registry.stats().owners());
        }

        @Test
        @DisplayName("Reload replaces the lifecycle listeners")
        void reloadReplacesListeners() {
            registry.add(e1, CTX_A, new Object());
            registry.add(e1, CTX_B, new Object());

            assertEquals(1, e1.events().destroyedListenerCount());
            assertEquals(1, e1.events().processChangedListenerCount());
        }

        @Test
        @DisplayName("Calls addressed to the previous context are ignored")
        void previousContextIgnored() {
            int hx = registry.add(e1, CTX_A, new Object());
            registry.add(e1, CTX_B, new Object());

            registry.remove(e1, CTX_A, hx);
            registry.clear(key, CTX_A);

            assertEquals(1, registry.refCount(hx));
        }

        @Test
        @DisplayName("Destruction after reload releases handles from both contexts")
        void destructionAfterReload() {
            registry.add(e1, CTX_A, new Object());
            registry.add(e1, CTX_B, new Object());

            e1.destroy();

            assertTrue(registry.stats().isEmpty());
        }
    }

    @Nested
    @DisplayName("Statistics")
    class StatsTests {

        @Test
        @DisplayName("stats reflect occupancy and cumulative counters")
        void statsReflectOccupancy() {
            int h = registry.add(e1, CTX_A, new Object());
            registry.add(e2, CTX_B, new Object());
            registry.remove(e1, CTX_A, h);

            RegistryStats stats = registry.stats();
            assertEquals(1, stats.liveHandles());
            assertEquals(2, stats.owners());
            assertEquals(0, stats.pendingMigrations());
            assertEquals(2, stats.totalAllocated());
            assertEquals(1, stats.totalReleased());
            assertFalse(stats.isEmpty());
        }

        @Test
        @DisplayName("toString includes the registry name")
        void toStringIncludesName() {
            RemoteObjectsRegistry named =
                    new RemoteObjectsRegistry(RegistryConfig.builder().name("frames").build());
            assertTrue(named.toString().contains("frames"));
        }
    }
}
