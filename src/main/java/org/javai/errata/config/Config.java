package org.javai.errata.config;

import java.util.Objects;

/**
 * A fully-populated service configuration.
 *
 * @param debug whether debug mode is on
 * @param port the listening port, an unsigned 16-bit value
 * @param host the host to bind to
 */
public record Config(boolean debug, int port, String host) {

    public static final boolean DEFAULT_DEBUG = false;
    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_HOST = "localhost";

    public static final int MAX_PORT = 0xFFFF;

    public Config {
        Objects.requireNonNull(host, "host must not be null");
        if (port < 0 || port > MAX_PORT) {
            throw new IllegalArgumentException("port must be between 0 and " + MAX_PORT + ": " + port);
        }
    }

    /**
     * Returns {@code debug=false, port=8080, host=localhost}.
     */
    public static Config defaults() {
        return new Config(DEFAULT_DEBUG, DEFAULT_PORT, DEFAULT_HOST);
    }

    public Config withDebug(boolean debug) {
        return new Config(debug, port, host);
    }

    public Config withPort(int port) {
        return new Config(debug, port, host);
    }

    public Config withHost(String host) {
        return new Config(debug, port, host);
    }
}
