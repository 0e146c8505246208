package org.github.zzf.pubsub.broker;

/**
 * A channel already parsed and validated by the channel parser.
 *
 * @author : zhanfeng.zhang@icloud.com
 * @date : 2026-10-17
 */
public interface Channel {

    /**
     * the channel as the client subscribed it, e.g. "a/b/"
     */
    String name();

    /**
     * hashes of the channel tokens, most general token first
     */
    int[] query();

}
