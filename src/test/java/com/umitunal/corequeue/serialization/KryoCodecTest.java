package com.umitunal.corequeue.serialization;

import com.esotericsoftware.kryo.Kryo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class KryoCodecTest {

    @Test
    @DisplayName("Should round-trip a string payload")
    void testSimpleString() {
        // Given
        KryoCodec<String> codec = new KryoCodec<>(String.class);
        String original = "send-welcome-mail";

        // When
        byte[] encoded = codec.encode(original);
        String decoded = codec.decode(encoded);

        // Then
        assertThat(decoded).isEqualTo(original);
    }

    @Test
    @DisplayName("Should round-trip a payload with collections")
    void testComplexObject() {
        // Given
        KryoCodec<MailJob> codec = new KryoCodec<>(MailJob.class);
        MailJob original = new MailJob(
                "mail-1",
                42,
                List.of("a@example.com", "b@example.com", "c@example.com"),
                Map.of("Subject", "Welcome", "X-Trace", "t-1")
        );

        // When
        byte[] encoded = codec.encode(original);
        MailJob decoded = codec.decode(encoded);

        // Then
        assertThat(decoded.id).isEqualTo(original.id);
        assertThat(decoded.count).isEqualTo(original.count);
        assertThat(decoded.recipients).containsExactlyElementsOf(original.recipients);
        assertThat(decoded.headers).containsAllEntriesOf(original.headers);
    }

    @Test
    @DisplayName("Should round-trip a payload holding another payload")
    void testNestedPayloads() {
        // Given
        KryoCodec<Batch> codec = new KryoCodec<>(Batch.class);
        Batch original = new Batch(
                "nightly-digest",
                new MailJob("mail-2", 10, List.of("ops@example.com", "dev@example.com"), Map.of())
        );

        // When
        byte[] encoded = codec.encode(original);
        Batch decoded = codec.decode(encoded);

        // Then
        assertThat(decoded.name).isEqualTo(original.name);
        assertThat(decoded.first.id).isEqualTo(original.first.id);
        assertThat(decoded.first.count).isEqualTo(original.first.count);
        assertThat(decoded.first.recipients).containsExactly("ops@example.com", "dev@example.com");
    }

    @Test
    @DisplayName("Should keep cyclic references between payloads")
    void testCircularReferences() {
        // Given
        KryoCodec<LinkedTask> codec = new KryoCodec<>(LinkedTask.class);
        LinkedTask retry = new LinkedTask("retry");
        LinkedTask cleanup = new LinkedTask("cleanup");
        retry.next = cleanup;
        cleanup.next = retry;

        // When
        byte[] encoded = codec.encode(retry);
        LinkedTask decoded = codec.decode(encoded);

        // Then
        assertThat(decoded.name).isEqualTo("retry");
        assertThat(decoded.next.name).isEqualTo("cleanup");
        assertThat(decoded.next.next.name).isEqualTo("retry");
    }

    @Test
    @DisplayName("Should encode with a Kryo instance from a custom factory")
    void testCustomFactory() {
        // Given
        KryoCodec<MailJob> codec = new KryoCodec<>(MailJob.class, () -> {
            Kryo kryo = new Kryo();
            kryo.setRegistrationRequired(false);
            kryo.setReferences(false); // MailJob has no cycles
            kryo.register(MailJob.class);
            return kryo;
        });

        MailJob original = new MailJob("mail-3", 99, List.of("x@example.com"), Map.of());

        // When
        byte[] encoded = codec.encode(original);
        MailJob decoded = codec.decode(encoded);

        // Then
        assertThat(decoded.id).isEqualTo(original.id);
        assertThat(decoded.count).isEqualTo(original.count);
    }

    @Test
    @DisplayName("Should encode from many threads at once")
    void testThreadSafety() throws InterruptedException {
        // Given
        KryoCodec<String> codec = new KryoCodec<>(String.class);
        int threadCount = 10;
        int iterations = 100;
        Thread[] threads = new Thread[threadCount];
        AtomicInteger mismatches = new AtomicInteger();

        // When
        for (int i = 0; i < threadCount; i++) {
            final int threadNum = i;
            threads[i] = new Thread(() -> {
                for (int j = 0; j < iterations; j++) {
                    String original = "worker-" + threadNum + "-job-" + j;
                    byte[] encoded = codec.encode(original);
                    if (!original.equals(codec.decode(encoded))) {
                        mismatches.incrementAndGet();
                    }
                }
            });
            threads[i].start();
        }

        // Then
        for (Thread thread : threads) {
            thread.join();
        }
        assertThat(mismatches.get()).isZero();
    }

    @Test
    @DisplayName("Should wrap corrupt input in a codec exception")
    void testCorruptInput() {
        // Given
        KryoCodec<MailJob> codec = new KryoCodec<>(MailJob.class);
        byte[] truncated = Arrays.copyOf(
                codec.encode(new MailJob("id", 1, List.of("a"), Map.of())), 3);

        // When/Then
        assertThatThrownBy(() -> codec.decode(truncated))
                .isInstanceOf(CodecException.class)
                .hasMessageContaining(MailJob.class.getName());
    }

    @Test
    @DisplayName("Should refuse unregistered classes when registration is required")
    void testRegistrationRequired() {
        // Given
        KryoCodec<MailJob> codec = new KryoCodec<>(MailJob.class, () -> {
            Kryo kryo = KryoCodec.defaultKryo();
            kryo.setRegistrationRequired(true);
            return kryo;
        });

        // When/Then
        assertThatThrownBy(() -> codec.encode(new MailJob("id", 1, null, null)))
                .isInstanceOf(CodecException.class);
    }

    @Test
    @DisplayName("Should handle null values")
    void testNullValues() {
        // Given
        KryoCodec<MailJob> codec = new KryoCodec<>(MailJob.class);
        MailJob original = new MailJob(null, 0, null, null);

        // When
        byte[] encoded = codec.encode(original);
        MailJob decoded = codec.decode(encoded);

        // Then
        assertThat(decoded.id).isNull();
        assertThat(decoded.count).isZero();
        assertThat(decoded.recipients).isNull();
        assertThat(decoded.headers).isNull();
    }

    @Test
    @DisplayName("Should handle empty collections")
    void testEmptyCollections() {
        // Given
        KryoCodec<MailJob> codec = new KryoCodec<>(MailJob.class);
        MailJob original = new MailJob("id", 0, List.of(), Map.of());

        // When
        byte[] encoded = codec.encode(original);
        MailJob decoded = codec.decode(encoded);

        // Then
        assertThat(decoded.recipients).isEmpty();
        assertThat(decoded.headers).isEmpty();
    }

    public static class MailJob implements Serializable {
        private String id;
        private int count;
        private List<String> recipients;
        private Map<String, String> headers;

        public MailJob() {}

        public MailJob(String id, int count, List<String> recipients, Map<String, String> headers) {
            this.id = id;
            this.count = count;
            this.recipients = recipients;
            this.headers = headers;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }

        public List<String> getRecipients() { return recipients; }
        public void setRecipients(List<String> recipients) { this.recipients = recipients; }

        public Map<String, String> getHeaders() { return headers; }
        public void setHeaders(Map<String, String> headers) { this.headers = headers; }
    }

    public static class Batch implements Serializable {
        private String name;
        private MailJob first;

        public Batch() {}

        public Batch(String name, MailJob first) {
            this.name = name;
            this.first = first;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public MailJob getFirst() { return first; }
        public void setFirst(MailJob first) { this.first = first; }
    }

    public static class LinkedTask implements Serializable {
        private String name;
        private LinkedTask next;

        public LinkedTask() {}

        public LinkedTask(String name) {
            this.name = name;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public LinkedTask getNext() { return next; }
        public void setNext(LinkedTask next) { this.next = next; }
    }
}
