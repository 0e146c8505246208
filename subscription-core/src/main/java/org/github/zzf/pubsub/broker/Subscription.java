package org.github.zzf.pubsub.broker;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * @author : zhanfeng.zhang@icloud.com
 * @date : 2026-10-17
 */
public record Subscription(Ssid ssid, String channel, Subscriber subscriber) {

    public Subscription {
        checkNotNull(ssid, "ssid");
        checkNotNull(channel, "channel");
        checkNotNull(subscriber, "subscriber");
    }

}
