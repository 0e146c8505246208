package org.github.zzf.pubsub.broker;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A set of Subscriber, unique by identity.
 * <p>Not thread safe. The owner (a trie node for example) must serialize the access.</p>
 * <p>Membership is a linear scan: a channel usually has few subscribers.</p>
 *
 * @author : zhanfeng.zhang@icloud.com
 * @date : 2026-10-17
 */
public class Subscribers implements Iterable<Subscriber> {

    private final List<Subscriber> subscribers;

    public Subscribers() {
        this(Integer.getInteger("Subscribers.default.size", 4));
    }

    public Subscribers(int initialCapacity) {
        this.subscribers = new ArrayList<>(initialCapacity);
    }

    /**
     * @return true if the subscriber was not in the set
     */
    public boolean addUnique(Subscriber subscriber) {
        checkNotNull(subscriber, "subscriber");
        if (contains(subscriber)) {
            return false;
        }
        return subscribers.add(subscriber);
    }

    public boolean contains(Subscriber subscriber) {
        for (Subscriber s : subscribers) {
            if (s == subscriber) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return subscribers.size();
    }

    public boolean isEmpty() {
        return subscribers.isEmpty();
    }

    /**
     * a copy of the members, unaffected by later changes of the set
     */
    public List<Subscriber> toList() {
        return new ArrayList<>(subscribers);
    }

    @Override
    public Iterator<Subscriber> iterator() {
        return Collections.unmodifiableList(subscribers).iterator();
    }

    @Override
    public String toString() {
        return "Subscribers" + subscribers;
    }

}
