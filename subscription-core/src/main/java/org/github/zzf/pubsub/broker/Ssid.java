package org.github.zzf.pubsub.broker;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;

/**
 * Subscription ID: the contract followed by the hashes of the channel tokens.
 * <p>Elements are unsigned 32-bit values held in {@code int}.</p>
 *
 * @author : zhanfeng.zhang@icloud.com
 * @date : 2026-10-17
 */
public final class Ssid {

    private final int[] elements;

    private Ssid(int[] elements) {
        this.elements = elements;
    }

    public static Ssid of(int contract, Channel channel) {
        int[] query = checkNotNull(channel, "channel").query();
        int[] elements = new int[query.length + 1];
        elements[0] = contract;
        System.arraycopy(query, 0, elements, 1, query.length);
        return new Ssid(elements);
    }

    /**
     * rebuild a Ssid from its raw elements, contract first
     */
    public static Ssid of(int... elements) {
        checkNotNull(elements, "elements");
        checkArgument(elements.length > 0, "Ssid needs at least the contract");
        return new Ssid(elements.clone());
    }

    public int contract() {
        return elements[0];
    }

    /**
     * XOR of all the elements.
     * <p>The result is only a bucket key. Different Ssid may share it, use {@link #equals(Object)} for identity.</p>
     */
    public int combinedHash() {
        int h = elements[0];
        for (int i = 1; i < elements.length; i++) {
            h ^= elements[i];
        }
        return h;
    }

    public int size() {
        return elements.length;
    }

    public int get(int idx) {
        return elements[idx];
    }

    /**
     * the channel part, without the contract
     */
    public int[] query() {
        return Arrays.copyOfRange(elements, 1, elements.length);
    }

    public int[] toArray() {
        return elements.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(elements, ((Ssid) o).elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < elements.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(Integer.toUnsignedString(elements[i]));
        }
        return sb.append(']').toString();
    }

}
