package com.p14n.pubsub;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.p14n.pubsub.broker.MessageBroker;
import com.p14n.pubsub.broker.PubSubBroker;
import com.p14n.pubsub.broker.grpc.PubSubGrpcServer;
import com.p14n.pubsub.data.PubSubConfig;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link PubSubBroker} behind a gRPC server.
 *
 * <p>
 * Each open subscription keeps one handler thread busy until it ends, so the
 * server runs its handlers on a cached pool of named threads rather than a
 * fixed one.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * var server = new BrokerServer(new ConfigData("localhost", 50051), OpenTelemetry.noop());
 * server.start();
 * server.blockUntilShutdown();
 * }</pre>
 */
public class BrokerServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BrokerServer.class);

    private final PubSubConfig cfg;
    private final OpenTelemetry ot;
    private PubSubBroker broker;
    private ExecutorService executor;
    private Server server;

    /**
     * Creates a new BrokerServer instance.
     *
     * @param cfg The configuration for the broker server
     * @param ot  The OpenTelemetry instance for metrics and tracing
     */
    public BrokerServer(PubSubConfig cfg, OpenTelemetry ot) {
        this.cfg = cfg;
        this.ot = ot;
    }

    /**
     * Starts the broker bound to the configured host and port.
     *
     * @throws IOException If the server fails to start
     */
    public void start() throws IOException {
        start(NettyServerBuilder.forAddress(new InetSocketAddress(cfg.host(), cfg.port())));
    }

    /**
     * Starts the broker with a custom server builder configuration.
     *
     * @param sb The server builder to use for configuration
     * @throws IOException If the server fails to start
     */
    public void start(ServerBuilder<?> sb) throws IOException {
        logger.atInfo().log("Starting broker server");

        if (server != null) {
            logger.atError().log("Broker server already started");
            throw new IllegalStateException("Already started");
        }

        broker = new PubSubBroker(ot, "pubsub_broker");
        executor = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder().setNameFormat("pubsub-broker-%d").build());

        try {
            server = sb.addService(new PubSubGrpcServer(broker))
                    .executor(executor)
                    .permitKeepAliveTime(1, TimeUnit.HOURS)
                    .permitKeepAliveWithoutCalls(true)
                    .build()
                    .start();

            logger.atInfo().log("Broker server started, listening on port {}", server.getPort());
        } catch (IOException e) {
            logger.atError()
                    .setCause(e)
                    .log("Failed to start broker server");
            broker.close();
            executor.shutdownNow();
            server = null;
            throw e;
        }
    }

    /**
     * @return the port the server is bound to
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Not started");
        }
        return server.getPort();
    }

    /**
     * @return the addresses the server is listening on
     */
    public List<? extends SocketAddress> getListenSockets() {
        if (server == null) {
            throw new IllegalStateException("Not started");
        }
        return server.getListenSockets();
    }

    /**
     * @return the broker served by this server
     */
    public MessageBroker broker() {
        if (broker == null) {
            throw new IllegalStateException("Not started");
        }
        return broker;
    }

    /**
     * Stops the server. The broker is closed first so that parked subscribe
     * calls end, then in-flight calls get up to the configured timeout to
     * finish.
     *
     * @throws InterruptedException If the shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        if (server == null) {
            return;
        }
        logger.atInfo().log("Stopping broker server");

        broker.close();
        server.shutdown();
        if (!server.awaitTermination(cfg.shutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
            logger.atWarn().log("Broker server did not terminate in time, forcing shutdown");
            server.shutdownNow();
        }
        executor.shutdownNow();
        server = null;

        logger.atInfo().log("Broker server stopped");
    }

    /**
     * Blocks until the server is shutdown.
     *
     * @throws InterruptedException If the blocking is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        Server s = server;
        if (s != null) {
            s.awaitTermination();
        }
    }

    @Override
    public void close() throws Exception {
        stop();
    }
}
