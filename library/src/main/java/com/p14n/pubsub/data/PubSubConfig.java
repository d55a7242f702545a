package com.p14n.pubsub.data;

/**
 * Configuration interface for the broker server.
 * Defines the network and lifecycle settings needed to run a broker.
 */
public interface PubSubConfig {
    /**
     * Gets the host clients use to reach the broker.
     *
     * @return The broker host
     */
    String host();

    /**
     * Gets the port the broker listens on. Zero selects an ephemeral port.
     *
     * @return The broker port number
     */
    int port();

    /**
     * Gets the time allowed for in-flight calls to finish when the broker stops.
     * Default is 30 seconds.
     *
     * @return The shutdown timeout in seconds
     */
    default int shutdownTimeoutSeconds() {
        return 30;
    }

    /**
     * Constructs the target string used by gRPC channel builders.
     *
     * @return The target in host:port form
     */
    default String target() {
        return String.format("%s:%d", host(), port());
    }
}
