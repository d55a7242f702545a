package com.p14n.pubsub.data;

public record ConfigData(String host,
        int port,
        int shutdownTimeoutSeconds) implements PubSubConfig {
    public ConfigData(String host, int port) {
        this(host, port, 30);
    }
}
