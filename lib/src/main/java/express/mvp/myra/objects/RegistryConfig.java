package express.mvp.myra.objects;

import express.mvp.myra.objects.handle.IdentityTagStore;
import express.mvp.myra.objects.handle.WeakIdentityTagStore;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Configuration for a {@link RemoteObjectsRegistry}.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Registry Configuration Parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>name</td><td>"objects"</td><td>Identifier used in log messages</td></tr>
 *   <tr><td>firstHandle</td><td>1</td><td>First handle value allocated</td></tr>
 *   <tr><td>maxHandle</td><td>Integer.MAX_VALUE</td><td>Largest handle value allocated</td></tr>
 *   <tr><td>identityTagStore</td><td>WeakIdentityTagStore</td><td>Object to handle side
 *       table</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RegistryConfig config = RegistryConfig.builder()
 *     .name("browser-objects")
 *     .maxHandle(1_000_000)
 *     .build();
 *
 * RemoteObjectsRegistry registry = new RemoteObjectsRegistry(config);
 * }</pre>
 */
public final class RegistryConfig {

    private static final RegistryConfig DEFAULTS = builder().build();

    private final String name;
    private final int firstHandle;
    private final int maxHandle;
    private final Supplier<? extends IdentityTagStore> identityTagStore;

    private RegistryConfig(Builder builder) {
        this.name = builder.name;
        this.firstHandle = builder.firstHandle;
        this.maxHandle = builder.maxHandle;
        this.identityTagStore = builder.identityTagStore;
    }

    /**
     * Returns the default configuration.
     *
     * @return the defaults
     */
    public static RegistryConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a new builder with default values.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public String name() {
        return name;
    }

    public int firstHandle() {
        return firstHandle;
    }

    public int maxHandle() {
        return maxHandle;
    }

    /**
     * Creates the identity tag store for a new registry.
     *
     * @return a fresh tag store
     */
    public IdentityTagStore newIdentityTagStore() {
        return Objects.requireNonNull(identityTagStore.get(), "identityTagStore supplied null");
    }

    @Override
    public String toString() {
        return "RegistryConfig[name="
                + name
                + ", firstHandle="
                + firstHandle
                + ", maxHandle="
                + maxHandle
                + "]";
    }

    /** Builder for {@link RegistryConfig}. */
    public static final class Builder {
        private String name = "objects";
        private int firstHandle = 1;
        private int maxHandle = Integer.MAX_VALUE;
        private Supplier<? extends IdentityTagStore> identityTagStore = WeakIdentityTagStore::new;

        private Builder() {}

        /**
         * Sets the name used in log messages.
         *
         * @param name the registry name
         * @return this builder
         */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        /**
         * Sets the first handle value.
         *
         * @param firstHandle first handle (at least 1)
         * @return this builder
         */
        public Builder firstHandle(int firstHandle) {
            if (firstHandle < 1) {
                throw new IllegalArgumentException("firstHandle must be >= 1: " + firstHandle);
            }
            this.firstHandle = firstHandle;
            return this;
        }

        /**
         * Sets the largest handle value. Allocation past it fails with {@link RegistryException}.
         *
         * @param maxHandle the largest handle (at least 1)
         * @return this builder
         */
        public Builder maxHandle(int maxHandle) {
            if (maxHandle < 1) {
                throw new IllegalArgumentException("maxHandle must be >= 1: " + maxHandle);
            }
            this.maxHandle = maxHandle;
            return this;
        }

        /**
         * Sets the factory of the identity tag store.
         *
         * @param identityTagStore tag store factory, called once per registry
         * @return this builder
         */
        public Builder identityTagStore(Supplier<? extends IdentityTagStore> identityTagStore) {
            this.identityTagStore = Objects.requireNonNull(identityTagStore, "identityTagStore");
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return the configuration
         * @throws IllegalArgumentException if maxHandle is below firstHandle
         */
        public RegistryConfig build() {
            if (maxHandle < firstHandle) {
                throw new IllegalArgumentException(
                        "maxHandle must be >= firstHandle: " + maxHandle + " < " + firstHandle);
            }
            return new RegistryConfig(this);
        }
    }
}
