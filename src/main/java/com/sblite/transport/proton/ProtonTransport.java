package com.sblite.transport.proton;

import com.sblite.config.ReceiverConfig;
import com.sblite.transport.AmqpTransport;
import com.sblite.transport.TransportException;
import com.sblite.transport.TransportSession;
import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.proton.ProtonClient;
import io.vertx.proton.ProtonClientOptions;
import io.vertx.proton.ProtonConnection;
import io.vertx.proton.ProtonSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * AMQP 1.0 transport over a vertx-proton client connection.
 *
 * All proton objects are touched only on a single Vert.x context; callers
 * block on the outcome with the configured connect timeout.
 */
public class ProtonTransport implements AmqpTransport {

    private static final Logger log = LoggerFactory.getLogger(ProtonTransport.class);

    private final ReceiverConfig config;
    private final Vertx vertx;
    private final boolean ownsVertx;
    private final Context context;
    private final ProtonClient client;

    // Links attached on this connection, ended when the connection drops
    private final Set<ProtonTransportReceiverLink> links = ConcurrentHashMap.newKeySet();

    private volatile ProtonConnection connection;
    private volatile boolean connected;

    public ProtonTransport(ReceiverConfig config) {
        this(Vertx.vertx(), true, config);
    }

    /**
     * Use a caller-managed Vert.x instance; it is not closed with the transport.
     */
    public ProtonTransport(Vertx vertx, ReceiverConfig config) {
        this(vertx, false, config);
    }

    private ProtonTransport(Vertx vertx, boolean ownsVertx, ReceiverConfig config) {
        this.config = config;
        this.vertx = vertx;
        this.ownsVertx = ownsVertx;
        this.context = vertx.getOrCreateContext();
        this.client = ProtonClient.create(vertx);
    }

    @Override
    public synchronized boolean open() {
        if (isOpen()) {
            return true;
        }

        CompletableFuture<ProtonConnection> opened = new CompletableFuture<>();
        context.runOnContext(v -> connect(res -> {
            if (res.failed()) {
                opened.completeExceptionally(res.cause());
                return;
            }
            ProtonConnection conn = res.result();
            if (config.getContainerId() != null) {
                conn.setContainer(config.getContainerId());
            }
            conn.openHandler(openRes -> {
                if (openRes.succeeded()) {
                    opened.complete(conn);
                } else {
                    opened.completeExceptionally(openRes.cause());
                }
            });
            conn.closeHandler(closeRes -> onConnectionLost(conn));
            conn.disconnectHandler(this::onConnectionLost);
            conn.open();
        }));

        try {
            connection = await(opened, "connection to " + config.getHost() + ":" + config.getPort());
            connected = true;
            log.info("Connected to {}:{}", config.getHost(), config.getPort());
            return true;
        } catch (TransportException e) {
            log.warn("Connection to {}:{} failed: {}", config.getHost(), config.getPort(), e.getMessage());
            return false;
        }
    }

    private void connect(Handler<AsyncResult<ProtonConnection>> handler) {
        ProtonClientOptions options = new ProtonClientOptions()
                .setConnectTimeout((int) config.getConnectTimeoutMs());
        if (config.getIdleTimeoutMs() > 0) {
            options.setHeartbeat(config.getIdleTimeoutMs());
        }
        if (config.hasCredentials()) {
            options.addEnabledSaslMechanism("PLAIN");
            client.connect(options, config.getHost(), config.getPort(),
                    config.getUsername(), config.getPassword(), handler);
        } else {
            options.addEnabledSaslMechanism("ANONYMOUS");
            client.connect(options, config.getHost(), config.getPort(), handler);
        }
    }

    private void onConnectionLost(ProtonConnection conn) {
        if (conn != connection || !connected) {
            return;
        }
        connected = false;
        log.warn("Connection to {}:{} lost", config.getHost(), config.getPort());
        for (ProtonTransportReceiverLink link : new ArrayList<>(links)) {
            link.onRemoteClose();
        }
    }

    @Override
    public boolean isOpen() {
        ProtonConnection conn = connection;
        return connected && conn != null && !conn.isDisconnected();
    }

    @Override
    public TransportSession createSession() {
        ProtonConnection conn = connection;
        if (!isOpen()) {
            throw new TransportException("Connection to " + config.getHost() + ":" + config.getPort() + " is not open");
        }

        CompletableFuture<ProtonSession> opened = new CompletableFuture<>();
        context.runOnContext(v -> {
            ProtonSession session = conn.createSession();
            session.openHandler(res -> {
                if (res.succeeded()) {
                    opened.complete(res.result());
                } else {
                    opened.completeExceptionally(res.cause());
                }
            });
            session.open();
        });
        return new ProtonTransportSession(this, await(opened, "session begin"));
    }

    @Override
    public synchronized void close() {
        ProtonConnection conn = connection;
        connected = false;
        connection = null;
        if (conn != null) {
            for (ProtonTransportReceiverLink link : new ArrayList<>(links)) {
                link.close();
            }
            context.runOnContext(v -> conn.close());
            log.info("Closed connection to {}:{}", config.getHost(), config.getPort());
        }
        if (ownsVertx) {
            try {
                await(vertx.close().toCompletionStage().toCompletableFuture(), "transport shutdown");
            } catch (TransportException e) {
                log.warn("Error shutting down transport", e);
            }
        }
    }

    void register(ProtonTransportReceiverLink link) {
        links.add(link);
    }

    void unregister(ProtonTransportReceiverLink link) {
        links.remove(link);
    }

    Context getContext() {
        return context;
    }

    /**
     * Wait for an operation started on the context.
     */
    <T> T await(CompletableFuture<T> future, String what) {
        try {
            return future.get(config.getConnectTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted waiting for " + what, e);
        } catch (ExecutionException e) {
            throw new TransportException(what + " failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new TransportException("Timed out waiting for " + what, e);
        }
    }
}
