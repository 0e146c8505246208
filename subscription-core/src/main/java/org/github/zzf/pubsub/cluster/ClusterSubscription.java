package org.github.zzf.pubsub.cluster;

import static com.google.common.base.Preconditions.checkNotNull;

import org.github.zzf.pubsub.broker.Ssid;

/**
 * Interest of a node in a channel, as shared with the other nodes.
 * <p>Carries no Subscriber: the cluster knows who is interested, not whom to deliver to.</p>
 */
public record ClusterSubscription(Ssid ssid, String channel) {

    public ClusterSubscription {
        checkNotNull(ssid, "ssid");
        checkNotNull(channel, "channel");
    }

}
