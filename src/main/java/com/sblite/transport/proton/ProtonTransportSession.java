package com.sblite.transport.proton;

import com.sblite.transport.TransportReceiverLink;
import com.sblite.transport.TransportSession;
import io.vertx.proton.ProtonLinkOptions;
import io.vertx.proton.ProtonQoS;
import io.vertx.proton.ProtonReceiver;
import io.vertx.proton.ProtonSession;
import org.apache.qpid.proton.amqp.messaging.Source;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Session on a {@link ProtonTransport} connection.
 */
class ProtonTransportSession implements TransportSession {

    private final ProtonTransport transport;
    private final ProtonSession session;

    ProtonTransportSession(ProtonTransport transport, ProtonSession session) {
        this.transport = transport;
        this.session = session;
    }

    @Override
    public TransportReceiverLink createReceiver(String name, String address) {
        return attach(name, address, receiver -> {
        });
    }

    @Override
    public TransportReceiverLink createReceiver(String name, Source source) {
        return attach(name, source.getAddress(), receiver -> receiver.setSource(source));
    }

    private TransportReceiverLink attach(String name, String address, Consumer<ProtonReceiver> customizer) {
        CompletableFuture<ProtonTransportReceiverLink> attached = new CompletableFuture<>();
        transport.getContext().runOnContext(v -> {
            ProtonReceiver receiver = session.createReceiver(address, new ProtonLinkOptions().setLinkName(name));
            customizer.accept(receiver);

            // Credit is only ever granted explicitly; settlement is left to the caller
            receiver.setPrefetch(0);
            receiver.setAutoAccept(false);
            receiver.setQoS(ProtonQoS.AT_LEAST_ONCE);

            ProtonTransportReceiverLink link = new ProtonTransportReceiverLink(transport, receiver);
            receiver.handler(link::onDelivery);
            receiver.closeHandler(res -> link.onRemoteClose());
            receiver.detachHandler(res -> link.onRemoteClose());
            receiver.openHandler(res -> {
                if (res.succeeded()) {
                    attached.complete(link);
                } else {
                    attached.completeExceptionally(res.cause());
                }
            });
            receiver.open();
        });

        ProtonTransportReceiverLink link = transport.await(attached, "attach of link '" + name + "'");
        transport.register(link);
        return link;
    }

    @Override
    public void close() {
        transport.getContext().runOnContext(v -> session.close());
    }
}
