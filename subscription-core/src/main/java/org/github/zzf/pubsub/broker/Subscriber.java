package org.github.zzf.pubsub.broker;

import java.util.concurrent.CompletableFuture;

/**
 * Something that can receive a delivery: a local connection, a forward to another node...
 * <p>Subscribers are compared by identity only, implementations should not override equals.</p>
 */
public interface Subscriber {

    CompletableFuture<Void> send(Ssid ssid, String channel, byte[] payload);

    default Type type() {
        return Type.DIRECT;
    }

    enum Type {
        /**
         * connected to this node
         */
        DIRECT,
        /**
         * another node of the cluster
         */
        REMOTE,
        ;
    }

}
