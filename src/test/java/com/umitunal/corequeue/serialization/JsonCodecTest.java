package com.umitunal.corequeue.serialization;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class JsonCodecTest {

    @Test
    @DisplayName("Should encode a map payload as a JSON object")
    void testMapPayload() {
        // Given
        JsonCodec<Map<String, String>> codec = new JsonCodec<>(new TypeReference<Map<String, String>>() {});

        // When
        byte[] encoded = codec.encode(Map.of("k", "v"));

        // Then
        assertThat(new String(encoded, UTF_8)).isEqualTo("{\"k\":\"v\"}");
        assertThat(codec.decode(encoded)).containsExactly(entry("k", "v"));
    }

    @Test
    @DisplayName("Should decode into the declared bean type")
    void testBeanPayload() {
        // Given
        JsonCodec<Report> codec = new JsonCodec<>(Report.class);

        // When
        Report decoded = codec.decode("{\"name\":\"daily\",\"pages\":[1,2]}".getBytes(UTF_8));

        // Then
        assertThat(decoded.getName()).isEqualTo("daily");
        assertThat(decoded.getPages()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Should wrap malformed JSON in a codec exception")
    void testMalformedJson() {
        JsonCodec<Report> codec = new JsonCodec<>(Report.class);

        assertThatThrownBy(() -> codec.decode("{not json".getBytes(UTF_8)))
                .isInstanceOf(CodecException.class)
                .hasCauseInstanceOf(java.io.IOException.class);
    }

    @Test
    @DisplayName("Should pass strings and bytes through unchanged")
    void testPassThroughCodecs() {
        byte[] raw = {0, 1, 2};

        assertThat(new ByteArrayCodec().decode(new ByteArrayCodec().encode(raw))).containsExactly(0, 1, 2);
        assertThat(new StringCodec().encode("héllo")).isEqualTo("héllo".getBytes(UTF_8));
    }

    public static class Report {
        private String name;
        private List<Integer> pages;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public List<Integer> getPages() { return pages; }
        public void setPages(List<Integer> pages) { this.pages = pages; }
    }
}
