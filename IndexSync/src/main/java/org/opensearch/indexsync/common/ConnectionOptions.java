package org.opensearch.indexsync.common;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Properties;
import java.util.function.Function;

import lombok.Builder;
import lombok.Value;

/**
 * Where and under which index/type a collection's documents live. Every key is optional here;
 * {@link #validate()} enforces the ones a request cannot go without.
 */
@Value
@Builder(toBuilder = true)
public class ConnectionOptions {
    public static final ConnectionOptions EMPTY = ConnectionOptions.builder().build();

    public static final String HOST_KEY = "host";
    public static final String PORT_KEY = "port";
    public static final String INDEX_KEY = "index";
    public static final String TYPE_KEY = "type";
    public static final String PREFIX_KEY = "prefix";

    private static final String DEFAULT_SCHEME = "http://";

    String host;
    Integer port;
    String index;
    String type;
    String prefix;

    public boolean hasPrefix() {
        return isPresent(prefix);
    }

    /**
     * Field-by-field merge: a present, non-empty value on this object wins, otherwise the fallback's value is used.
     */
    public ConnectionOptions mergedOver(ConnectionOptions fallback) {
        if (fallback == null) {
            return this;
        }
        return ConnectionOptions.builder()
            .host(pick(host, fallback.host))
            .port(port != null ? port : fallback.port)
            .index(pick(index, fallback.index))
            .type(pick(type, fallback.type))
            .prefix(pick(prefix, fallback.prefix))
            .build();
    }

    /**
     * @throws ConfigurationException if host or port is missing, the port is out of range, or the host carries a
     *     port of its own
     */
    public ConnectionOptions validate() {
        if (!isPresent(host)) {
            throw new ConfigurationException("No search host was configured; call configure() or pass a host");
        }
        if (hostUri(host).getPort() != -1) {
            throw new ConfigurationException("Search host " + host + " includes a port; set it through port instead");
        }
        if (port == null) {
            throw new ConfigurationException("No search port was configured for host " + host);
        }
        if (port <= 0 || port > 65535) {
            throw new ConfigurationException("Invalid search port " + port);
        }
        return this;
    }

    public ConnectionOptions requireIndexAndType() {
        validate();
        if (!isPresent(index) || !isPresent(type)) {
            throw new ConfigurationException("Both index and type are required, got index=" + index + ", type=" + type);
        }
        return this;
    }

    /** e.g. {@code http://localhost:9200}, never with a trailing slash. */
    public String baseUri() {
        validate();
        return withScheme(host) + ":" + port;
    }

    private static String withScheme(String host) {
        var h = host.contains("://") ? host : DEFAULT_SCHEME + host;
        while (h.endsWith("/")) {
            h = h.substring(0, h.length() - 1);
        }
        return h;
    }

    private static URI hostUri(String host) {
        try {
            return new URI(withScheme(host));
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Search host " + host + " is not a valid URI", e);
        }
    }

    public static ConnectionOptions fromProperties(Properties properties) {
        return fromProperties(properties, "");
    }

    /**
     * Reads {@code host}, {@code port}, {@code index}, {@code type} and {@code prefix}, each under the given key
     * prefix (for instance {@code indexsync.}). Absent keys stay unset.
     */
    public static ConnectionOptions fromProperties(Properties properties, String keyPrefix) {
        Function<String, String> read = key -> {
            var value = properties.getProperty(keyPrefix + key);
            return value == null ? null : value.trim();
        };
        var portValue = read.apply(PORT_KEY);
        Integer port = null;
        if (isPresent(portValue)) {
            try {
                port = Integer.valueOf(portValue);
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Property " + keyPrefix + PORT_KEY + " is not a number: " + portValue, e);
            }
        }
        return ConnectionOptions.builder()
            .host(emptyToNull(read.apply(HOST_KEY)))
            .port(port)
            .index(emptyToNull(read.apply(INDEX_KEY)))
            .type(emptyToNull(read.apply(TYPE_KEY)))
            .prefix(emptyToNull(read.apply(PREFIX_KEY)))
            .build();
    }

    static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }

    private static String pick(String preferred, String fallback) {
        return isPresent(preferred) ? preferred : fallback;
    }

    private static String emptyToNull(String value) {
        return isPresent(value) ? value : null;
    }
}
