package org.github.zzf.pubsub.broker;

import static org.assertj.core.api.BDDAssertions.then;
import static org.assertj.core.api.BDDAssertions.thenThrownBy;

import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SubscribersTest {

    @Mock
    Subscriber s1;
    @Mock
    Subscriber s2;

    @Test
    void givenRepeatedSubscriber_whenAddUnique_thenSizeIsDistinctCount() {
        Subscribers subscribers = new Subscribers();
        then(subscribers.addUnique(s1)).isTrue();
        then(subscribers.addUnique(s2)).isTrue();
        then(subscribers.addUnique(s1)).isFalse();
        then(subscribers.addUnique(s2)).isFalse();
        then(subscribers.addUnique(s1)).isFalse();
        then(subscribers.size()).isEqualTo(2);
        then(subscribers).containsExactlyInAnyOrder(s1, s2);
    }

    @Test
    void givenEmpty_whenContains_thenFalse() {
        Subscribers subscribers = new Subscribers(0);
        then(subscribers.isEmpty()).isTrue();
        then(subscribers.contains(s1)).isFalse();
        subscribers.addUnique(s1);
        then(subscribers.contains(s1)).isTrue();
        then(subscribers.contains(s2)).isFalse();
    }

    /**
     * equal but not the same subscriber are two members
     */
    @Test
    void givenEqualSubscribers_whenAddUnique_thenComparedByIdentity() {
        Subscriber a = new EqualsAll();
        Subscriber b = new EqualsAll();
        Subscribers subscribers = new Subscribers();
        subscribers.addUnique(a);
        then(subscribers.contains(b)).isFalse();
        then(subscribers.addUnique(b)).isTrue();
        then(subscribers.size()).isEqualTo(2);
        then(a.type()).isEqualTo(Subscriber.Type.DIRECT);
    }

    @Test
    void givenSubscribers_whenToList_thenIndependentCopy() {
        Subscribers subscribers = new Subscribers();
        subscribers.addUnique(s1);
        List<Subscriber> copy = subscribers.toList();
        subscribers.addUnique(s2);
        then(copy).containsExactly(s1);
        copy.clear();
        then(subscribers.size()).isEqualTo(2);
    }

    @Test
    void givenSubscribers_whenIteratorRemove_thenUnsupported() {
        Subscribers subscribers = new Subscribers();
        subscribers.addUnique(s1);
        Iterator<Subscriber> it = subscribers.iterator();
        then(it.next()).isSameAs(s1);
        thenThrownBy(it::remove).isInstanceOf(UnsupportedOperationException.class);
        then(subscribers.contains(s1)).isTrue();
    }

    static class EqualsAll implements Subscriber {

        @Override
        public CompletableFuture<Void> send(Ssid ssid, String channel, byte[] payload) {
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof EqualsAll;
        }

        @Override
        public int hashCode() {
            return 1;
        }

    }

}
