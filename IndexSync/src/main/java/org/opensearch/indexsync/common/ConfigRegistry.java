package org.opensearch.indexsync.common;

import java.util.concurrent.atomic.AtomicReference;

import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide default {@link ConnectionOptions}. Construct one at startup and hand it to every component that
 * needs defaults; configuration calls only overwrite the keys they carry.
 */
@Slf4j
public class ConfigRegistry {
    private final AtomicReference<ConnectionOptions> defaults = new AtomicReference<>(ConnectionOptions.EMPTY);

    public ConfigRegistry() {}

    public ConfigRegistry(ConnectionOptions initialDefaults) {
        configure(initialDefaults);
    }

    /**
     * Stores the non-empty keys of {@code options} as defaults, leaving every other stored key untouched.
     */
    public ConnectionOptions configure(ConnectionOptions options) {
        if (options == null) {
            return getDefaults();
        }
        var updated = defaults.updateAndGet(options::mergedOver);
        log.atInfo().setMessage("Search defaults are now {}").addArgument(updated).log();
        return updated;
    }

    public ConnectionOptions getDefaults() {
        return defaults.get();
    }

    /**
     * Per-call values win, then the stored defaults.
     *
     * @throws ConfigurationException if host or port is still missing
     */
    public ConnectionOptions resolve(ConnectionOptions override) {
        var merged = override == null ? getDefaults() : override.mergedOver(getDefaults());
        return merged.validate();
    }

    /**
     * Resolves the options for one collection: per-collection values win, then the stored defaults, then the
     * built-ins derived from the collection name (index {@code [prefix-]name}, type {@code name}).
     * The index keeps the collection name's case, as cross-collection search targets do.
     *
     * @throws ConfigurationException if host or port is still missing
     */
    public ConnectionOptions resolveFor(String collectionName, ConnectionOptions collectionOverride) {
        var merged = collectionOverride == null
            ? getDefaults()
            : collectionOverride.mergedOver(getDefaults());
        return merged.mergedOver(builtInsFor(collectionName, merged.getPrefix())).requireIndexAndType();
    }

    static ConnectionOptions builtInsFor(String collectionName, String prefix) {
        var indexName = ConnectionOptions.isPresent(prefix) ? prefix + "-" + collectionName : collectionName;
        return ConnectionOptions.builder()
            .index(indexName)
            .type(collectionName)
            .build();
    }
}
