package com.umitunal.corequeue.queue;

import com.umitunal.corequeue.MutableClock;
import com.umitunal.corequeue.core.MalformedRecordException;
import com.umitunal.corequeue.storage.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class QueueRegistryTest {

    private MutableClock clock;
    private InMemoryKeyValueStore store;
    private QueueRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new InMemoryKeyValueStore(clock);
        registry = new QueueRegistry(store, clock);
    }

    @Test
    @DisplayName("Should register each name once")
    void testRegister() throws Exception {
        // Given
        Instant first = clock.instant();

        // When
        boolean created = registry.register("emails");
        clock.advance(Duration.ofSeconds(5));
        boolean again = registry.register("emails");
        registry.register("reports");

        // Then
        assertThat(created).isTrue();
        assertThat(again).isFalse();
        assertThat(registry.isRegistered("emails")).isTrue();
        assertThat(registry.list())
                .containsEntry("emails", first)
                .containsEntry("reports", first.plusSeconds(5));
    }

    @Test
    @DisplayName("Should unregister a name")
    void testUnregister() throws Exception {
        registry.register("emails");

        assertThat(registry.unregister("emails")).isTrue();
        assertThat(registry.unregister("emails")).isFalse();
        assertThat(registry.isRegistered("emails")).isFalse();
        assertThat(registry.list()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a malformed creation time")
    void testMalformedEntry() throws Exception {
        store.hset(QueueKeys.REGISTRY, "broken", "soon");

        assertThatThrownBy(registry::list)
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("broken");
    }
}
