package com.p14n.pubsub.example;

import com.p14n.pubsub.BrokerServer;
import com.p14n.pubsub.client.PubSubConsumer;
import com.p14n.pubsub.client.PubSubPublisher;
import com.p14n.pubsub.data.ConfigData;

import io.opentelemetry.api.OpenTelemetry;

import java.nio.charset.StandardCharsets;

public class RemoteConsumerExample {

    public static void main(String[] args) throws Exception {

        var cfg = new ConfigData("localhost", 50051);

        try (var server = new BrokerServer(cfg, OpenTelemetry.noop())) {
            server.start();

            try (var consumer = new PubSubConsumer(cfg.host(), cfg.port());
                    var publisher = new PubSubPublisher(cfg.host(), cfg.port())) {

                consumer.subscribe("example_topic");
                Thread.sleep(1000);

                publisher.publish("example_topic", "Hello, World!");
                Thread.sleep(1000);

                consumer.messages().forEach(m -> System.err.println(
                        "Received on " + m.topic() + ": " + new String(m.payload(), StandardCharsets.UTF_8)));
            }
        }
    }
}
