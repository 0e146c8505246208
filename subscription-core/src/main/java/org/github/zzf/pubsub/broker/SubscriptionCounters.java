package org.github.zzf.pubsub.broker;

import static com.google.common.base.Preconditions.checkNotNull;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.pubsub.cluster.ClusterSubscription;

/**
 * Reference counts of the subscriptions of this node, bucketed by {@link Ssid#combinedHash()}.
 * <pre>
 *     bucket lifecycle: absent -> count=1 -> count=n -> absent
 * </pre>
 * <p>Thread safe: one lock guards the whole map, increment / decrement / all never interleave. Logging happens
 * after the lock is released.</p>
 * <p>Two Ssid sharing a combined hash share a bucket. The bucket keeps the Ssid that created it, so such a merge
 * is reported (log + metric) but not prevented.</p>
 *
 * @author : zhanfeng.zhang@icloud.com
 * @date : 2026-10-17
 */
@Slf4j
public class SubscriptionCounters {

    public static final String METRIC_SIZE = "pubsub.subscription.counters.size";
    public static final String METRIC_COLLISION = "pubsub.subscription.counters.collision";

    private final Lock lock = new ReentrantLock();

    /**
     * combinedHash -> SubCounter
     */
    private final Map<Integer, SubCounter> counters;

    private final Counter incrementCollision;
    private final Counter decrementCollision;

    /**
     * @param name tag of the meters, tells apart the instances sharing a registry
     */
    public SubscriptionCounters(String name, MeterRegistry registry) {
        checkNotNull(name, "name");
        checkNotNull(registry, "registry");
        this.counters = new HashMap<>(Integer.getInteger("SubscriptionCounters.default.size", 64));
        Gauge.builder(METRIC_SIZE, this, SubscriptionCounters::size)
            .tag("name", name)
            .strongReference(true)
            .register(registry);
        this.incrementCollision = registry.counter(METRIC_COLLISION, "name", name, "op", "increment");
        this.decrementCollision = registry.counter(METRIC_COLLISION, "name", name, "op", "decrement");
    }

    /**
     * one more subscription for the ssid
     *
     * @return true if there was no subscription for the ssid before
     */
    public boolean increment(Ssid ssid, String channel) {
        checkNotNull(ssid, "ssid");
        checkNotNull(channel, "channel");
        int key = ssid.combinedHash();
        boolean created = false;
        SubCounter merged = null;
        lock.lock();
        try {
            SubCounter c = counters.get(key);
            if (c == null) {
                c = new SubCounter(ssid, channel);
                counters.put(key, c);
                created = true;
            }
            else if (!c.ssid.equals(ssid)) {
                incrementCollision.increment();
                merged = c;
            }
            c.counter += 1;
        } finally {
            lock.unlock();
        }
        // log out of the lock
        if (created) {
            log.debug("SubscriptionCounters create counter-> ssid: {}, channel: {}", ssid, channel);
        }
        if (merged != null) {
            log.warn("SubscriptionCounters hash collision, counts merged-> hash: {}, bucket: {}({}), ssid: {}({})",
                Integer.toUnsignedString(key), merged.ssid, merged.channel, ssid, channel);
        }
        return created;
    }

    /**
     * one less subscription for the ssid, the counter is removed once it reaches 0.
     * <p>Decrement an absent ssid does nothing.</p>
     *
     * @return true if the counter was removed
     */
    public boolean decrement(Ssid ssid) {
        checkNotNull(ssid, "ssid");
        int key = ssid.combinedHash();
        SubCounter c;
        boolean foreign = false;
        boolean removed = false;
        lock.lock();
        try {
            c = counters.get(key);
            if (c != null) {
                if (!c.ssid.equals(ssid)) {
                    decrementCollision.increment();
                    foreign = true;
                }
                c.counter -= 1;
                if (c.counter <= 0) {
                    // no subscriber left
                    counters.remove(key);
                    removed = true;
                }
            }
        } finally {
            lock.unlock();
        }
        if (c == null) {
            log.debug("SubscriptionCounters decrement absent counter-> ssid: {}", ssid);
            return false;
        }
        if (foreign) {
            log.warn("SubscriptionCounters hash collision, foreign decrement-> hash: {}, bucket: {}({}), ssid: {}",
                Integer.toUnsignedString(key), c.ssid, c.channel, ssid);
        }
        if (removed) {
            log.debug("SubscriptionCounters remove counter-> ssid: {}, channel: {}", c.ssid, c.channel);
        }
        return removed;
    }

    /**
     * a copy of all the active subscriptions, in no particular order
     */
    public List<ClusterSubscription> all() {
        lock.lock();
        try {
            List<ClusterSubscription> clone = new ArrayList<>(counters.size());
            for (SubCounter c : counters.values()) {
                clone.add(new ClusterSubscription(c.ssid, c.channel));
            }
            return clone;
        } finally {
            lock.unlock();
        }
    }

    /**
     * current count of the bucket of the ssid, 0 if absent
     */
    public int count(Ssid ssid) {
        checkNotNull(ssid, "ssid");
        lock.lock();
        try {
            SubCounter c = counters.get(ssid.combinedHash());
            return c == null ? 0 : c.counter;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return counters.size();
        } finally {
            lock.unlock();
        }
    }

    private static class SubCounter {

        final Ssid ssid;
        final String channel;
        int counter;

        SubCounter(Ssid ssid, String channel) {
            this.ssid = ssid;
            this.channel = channel;
        }

    }

}
