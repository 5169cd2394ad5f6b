package com.governance.engine.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CanonicalJsonTest {

    @Test
    void write_shouldSortKeysRecursivelyAndKeepArrayOrder() throws Exception {
        var node = new ObjectMapper().readTree("{\"b\": 1, \"a\": {\"z\": [3, 1], \"y\": null}}");

        assertThat(CanonicalJson.write(node)).isEqualTo("{\"a\":{\"y\":null,\"z\":[3,1]},\"b\":1}");
    }

    @Test
    void hash_shouldNotDependOnInsertionOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("x", 1);
        first.put("y", List.of("a", "b"));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("y", List.of("a", "b"));
        second.put("x", 1);

        assertThat(CanonicalJson.hash(first)).isEqualTo(CanonicalJson.hash(second)).hasSize(64);
    }

    @Test
    void sha256Hex_knownValue() {
        assertThat(CanonicalJson.sha256Hex(""))
            .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }
}
