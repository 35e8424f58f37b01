package com.umitunal.corequeue.storage;

import com.umitunal.corequeue.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

/**
 * Behaviour every {@link KeyValueStore} adapter must share.
 * Subclasses supply the adapter under test, built on the given clock.
 */
abstract class KeyValueStoreContract {

    protected MutableClock clock;
    protected KeyValueStore store;

    protected abstract KeyValueStore createStore(MutableClock clock) throws Exception;

    @BeforeEach
    void setUpStore() throws Exception {
        clock = new MutableClock();
        store = createStore(clock);
    }

    @AfterEach
    void tearDownStore() throws Exception {
        if (store != null) {
            store.close();
        }
    }

    @Test
    @DisplayName("Should read back written values and report absent keys as null")
    void testValues() throws Exception {
        // When
        store.set("k", bytes("v1"));

        // Then
        assertThat(store.get("k")).isEqualTo(bytes("v1"));
        assertThat(store.get("missing")).isNull();
        assertThat(store.exists("k")).isTrue();
        assertThat(store.exists("missing")).isFalse();
    }

    @Test
    @DisplayName("Should create a key only once with setIfAbsent")
    void testSetIfAbsent() throws Exception {
        // When
        boolean first = store.setIfAbsent("k", bytes("first"));
        boolean second = store.setIfAbsent("k", bytes("second"));

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(store.get("k")).isEqualTo(bytes("first"));
    }

    @Test
    @DisplayName("Should expire values after their time-to-live")
    void testExpiry() throws Exception {
        // Given
        store.setIfAbsent("ttl", bytes("x"), Duration.ofSeconds(10));
        store.set("plain", bytes("y"));
        store.expire("plain", Duration.ofSeconds(5));

        // When
        clock.advance(Duration.ofSeconds(6));

        // Then
        assertThat(store.get("plain")).isNull();
        assertThat(store.get("ttl")).isEqualTo(bytes("x"));

        clock.advance(Duration.ofSeconds(5));
        assertThat(store.exists("ttl")).isFalse();
        assertThat(store.setIfAbsent("ttl", bytes("again"), Duration.ofSeconds(10))).isTrue();
    }

    @Test
    @DisplayName("Should not set expiry on a missing key")
    void testExpireMissingKey() throws Exception {
        assertThat(store.expire("missing", Duration.ofSeconds(1))).isFalse();
    }

    @Test
    @DisplayName("Should support hash field operations")
    void testHashes() throws Exception {
        // When
        store.hset("h", "a", "1");
        boolean created = store.hsetIfAbsent("h", "b", "2");
        boolean duplicate = store.hsetIfAbsent("h", "a", "9");

        // Then
        assertThat(created).isTrue();
        assertThat(duplicate).isFalse();
        assertThat(store.hget("h", "a")).isEqualTo("1");
        assertThat(store.hexists("h", "b")).isTrue();
        assertThat(store.hlen("h")).isEqualTo(2);
        assertThat(store.hgetAll("h")).containsOnlyKeys("a", "b");

        assertThat(store.hdel("h", "a")).isEqualTo(1);
        assertThat(store.hdel("h", "a")).isZero();
        assertThat(store.hget("h", "a")).isNull();
    }

    @Test
    @DisplayName("Should remove a hash field only while it holds the expected value")
    void testHdelIfEquals() throws Exception {
        // Given
        store.hset("leases", "job", "1000");
        store.hset("leases", "other", "1000");

        // When
        boolean stale = store.hdelIfEquals("leases", "job", "999");
        boolean missing = store.hdelIfEquals("leases", "absent", "1000");
        boolean current = store.hdelIfEquals("leases", "job", "1000");

        // Then
        assertThat(stale).isFalse();
        assertThat(missing).isFalse();
        assertThat(current).isTrue();
        assertThat(store.hgetAll("leases")).containsOnlyKeys("other");

        store.hdelIfEquals("leases", "other", "1000");
        assertThat(store.exists("leases")).isFalse();
    }

    @Test
    @DisplayName("Should drop a hash once its last field is removed")
    void testEmptyHashDisappears() throws Exception {
        // Given
        store.hset("h", "only", "1");

        // When
        store.hdel("h", "only");

        // Then
        assertThat(store.exists("h")).isFalse();
        assertThat(store.hgetAll("h")).isEmpty();
    }

    @Test
    @DisplayName("Should increment counters from zero")
    void testHincrBy() throws Exception {
        assertThat(store.hincrBy("c", "job", 1)).isEqualTo(1);
        assertThat(store.hincrBy("c", "job", 2)).isEqualTo(3);
        assertThat(store.hget("c", "job")).isEqualTo("3");
    }

    @Test
    @DisplayName("Should serve list pushed on the left first-in first-out from the right")
    void testListFifo() throws Exception {
        // Given
        store.lpush("l", "a");
        store.lpush("l", "b");
        long length = store.lpush("l", "c");

        // Then
        assertThat(length).isEqualTo(3);
        assertThat(store.lrange("l")).containsExactly("c", "b", "a");
        assertThat(store.rpop("l")).isEqualTo("a");
        assertThat(store.rpop("l")).isEqualTo("b");
        assertThat(store.llen("l")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should pop an element pushed back on the right next")
    void testRpushThenRpop() throws Exception {
        // Given
        store.lpush("l", "a");
        store.lpush("l", "b");
        String popped = store.rpop("l");

        // When
        store.rpush("l", popped);

        // Then
        assertThat(store.rpop("l")).isEqualTo("a");
        assertThat(store.rpop("l")).isEqualTo("b");
        assertThat(store.rpop("l")).isNull();
        assertThat(store.exists("l")).isFalse();
    }

    @Test
    @DisplayName("Should delete keys of every kind and count the ones that existed")
    void testDelete() throws Exception {
        // Given
        store.set("v", bytes("x"));
        store.hset("h", "f", "1");
        store.lpush("l", "e");

        // When
        long removed = store.delete(List.of("v", "h", "l", "missing"));

        // Then
        assertThat(removed).isEqualTo(3);
        assertThat(store.exists("v")).isFalse();
        assertThat(store.exists("h")).isFalse();
        assertThat(store.llen("l")).isZero();
    }

    @Test
    @DisplayName("Should run batched commands in order")
    void testBatch() throws Exception {
        // When
        store.batch()
                .set("payload", bytes("data"))
                .hset("index", "payload", "1")
                .hincrBy("counters", "payload", 5)
                .lpush("list", "payload")
                .hdel("index", "payload")
                .execute();

        // Then
        assertThat(store.get("payload")).isEqualTo(bytes("data"));
        assertThat(store.hexists("index", "payload")).isFalse();
        assertThat(store.hget("counters", "payload")).isEqualTo("5");
        assertThat(store.lrange("list")).containsExactly("payload");
    }

    protected static byte[] bytes(String text) {
        return text.getBytes(UTF_8);
    }
}
