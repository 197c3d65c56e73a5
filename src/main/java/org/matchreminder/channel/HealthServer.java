package org.matchreminder.channel;

import org.glassfish.grizzly.http.server.HttpServer;
import org.glassfish.grizzly.http.server.NetworkListener;
import org.glassfish.jersey.grizzly2.httpserver.GrizzlyHttpServerFactory;
import org.glassfish.jersey.server.ResourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;

/**
 * HTTP endpoint for the hosting platform: a liveness probe on {@code /} and, when a webhook
 * monitor is present, a registration probe on {@code /health/webhook}.
 */
public class HealthServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HealthServer.class);

    private final HttpServer server;

    public HealthServer(int port, ChannelHealthMonitor monitor) {
        ResourceConfig resources = new ResourceConfig().register(LivenessResource.class);
        if (monitor != null) {
            resources.register(new WebhookHealthResource(monitor));
        }
        this.server = GrizzlyHttpServerFactory.createHttpServer(
                URI.create("http://0.0.0.0:" + port + "/"), resources, false);
    }

    public void start() throws IOException {
        server.start();
        log.info("Health server listening on port {}", getPort());
    }

    /**
     * The bound port, which differs from the configured one when that was 0.
     */
    public int getPort() {
        NetworkListener listener = server.getListeners().iterator().next();
        return listener.getPort();
    }

    @Override
    public void close() {
        server.shutdownNow();
    }
}
