package org.github.zzf.pubsub.broker.channel;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Splitter;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.util.List;
import org.github.zzf.pubsub.broker.Channel;

/**
 * Channel whose tokens are the non-empty "/" separated levels of the name, each hashed with murmur3.
 * <p>No validation and no wildcard handling: "a/+/" hashes "+" like any other token.</p>
 */
public final class HashedChannel implements Channel {

    static final String LEVEL_SEPARATOR = "/";

    private static final Splitter SPLITTER = Splitter.on(LEVEL_SEPARATOR).omitEmptyStrings();
    private static final HashFunction TOKEN_HASH = Hashing.murmur3_32_fixed();

    private final String name;
    private final int[] query;

    private HashedChannel(String name, int[] query) {
        this.name = name;
        this.query = query;
    }

    public static HashedChannel of(String name) {
        checkNotNull(name, "name");
        List<String> tokens = SPLITTER.splitToList(name);
        int[] query = new int[tokens.size()];
        for (int i = 0; i < query.length; i++) {
            query[i] = hash(tokens.get(i));
        }
        return new HashedChannel(name, query);
    }

    static int hash(String token) {
        return TOKEN_HASH.hashString(token, UTF_8).asInt();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int[] query() {
        return query.clone();
    }

    @Override
    public String toString() {
        return name;
    }

}
