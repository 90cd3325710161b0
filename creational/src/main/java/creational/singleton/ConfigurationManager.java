package creational.singleton;

import creational.config.CreationalConfig;
import creational.config.CreationalConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Process-wide configuration manager for a backend service.
 *
 * <p>The manager is created lazily, on the first {@link #getInstance()} call, and loads its
 * settings from the classpath with {@link CreationalConfigLoader#load()} at that moment.
 * Construction goes through a {@link SingletonHolder}, so concurrent first calls build it
 * once. If loading fails the caller receives an
 * {@link creational.exceptions.InitializationException} and the next call tries again.
 *
 * <p>The constructor is guarded: calling it any other way, including through reflection,
 * throws {@link creational.exceptions.IllegalConstructionException}.
 *
 * <h2>Usage:</h2>
 * <pre>
 * CreationalConfig config = ConfigurationManager.getInstance().config();
 * </pre>
 */
public final class ConfigurationManager {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationManager.class);

    private static final ConstructionGuard GUARD = ConstructionGuard.forType(ConfigurationManager.class);

    private static final SingletonHolder<ConfigurationManager> HOLDER =
            SingletonHolder.guarded(GUARD, () -> new ConfigurationManager(CreationalConfigLoader.load()));

    private final CreationalConfig config;
    private final Instant loadedAt;

    private ConfigurationManager(CreationalConfig config) {
        GUARD.checkConstruction();
        this.config = Objects.requireNonNull(config, "config");
        this.loadedAt = Instant.now();
        log.info("Configuration manager ready for service '{}'", config.serviceName());
    }

    /**
     * Returns the single configuration manager, loading configuration on first use.
     *
     * @return the configuration manager
     * @throws creational.exceptions.InitializationException if configuration cannot be loaded
     */
    public static ConfigurationManager getInstance() {
        return HOLDER.get();
    }

    /**
     * Returns true once the manager has been created.
     */
    public static boolean isLoaded() {
        return HOLDER.isInitialized();
    }

    /**
     * Returns the loaded configuration.
     */
    public CreationalConfig config() {
        return config;
    }

    /**
     * Returns when the configuration was loaded.
     */
    public Instant loadedAt() {
        return loadedAt;
    }
}
