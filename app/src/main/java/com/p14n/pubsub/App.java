package com.p14n.pubsub;

import java.util.Map;

import com.p14n.pubsub.data.ConfigData;

import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    static final int DEFAULT_PORT = 50051;

    private static String envVal(Map<String, String> env, String name, String defaultValue) {
        var e = env.get(name);
        if (e != null && !e.isBlank()) {
            return e.trim();
        }
        return defaultValue;
    }

    private static int envInt(Map<String, String> env, String name, int defaultValue) {
        var e = envVal(env, name, null);
        if (e == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(e);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be a number but was '" + e + "'", ex);
        }
    }

    static ConfigData configFrom(Map<String, String> env) {
        return new ConfigData(
                envVal(env, "APP_BROKER_HOST", "localhost"),
                envInt(env, "APP_BROKER_PORT", DEFAULT_PORT),
                envInt(env, "APP_SHUTDOWN_TIMEOUT_SECONDS", 30));
    }

    static OpenTelemetry telemetryFrom(Map<String, String> env) {
        var endpoint = envVal(env, "APP_OTEL_ENDPOINT", null);
        if (endpoint == null) {
            return OpenTelemetry.noop();
        }
        return Opentelemetry.create("pubsub", endpoint);
    }

    public static void main(String[] args) throws Exception {
        var env = System.getenv();
        var cfg = configFrom(env);
        var ot = telemetryFrom(env);

        var server = new BrokerServer(cfg, ot);
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.atInfo().log("Shutting down broker since JVM is shutting down");
            try {
                server.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.atError().setCause(e).log("Error shutting down broker");
            }
        }));
        server.blockUntilShutdown();
    }
}
