package io.coordmesh.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class SensitiveDataMaskerTest {

    @Test
    void masksSensitiveKeysAtAnyDepth() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("Authorization", "Bearer abc");
        nested.put("path", "src/a.txt");
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("db_password", "hunter2");
        input.put("request", nested);
        input.put("items", List.of(Map.of("apiKey", "k-1")));

        Map<String, Object> masked = SensitiveDataMasker.maskedMap(input);

        Assertions.assertEquals(SensitiveDataMasker.MASK, masked.get("db_password"));
        @SuppressWarnings("unchecked")
        Map<String, Object> request = (Map<String, Object>) masked.get("request");
        Assertions.assertEquals(SensitiveDataMasker.MASK, request.get("Authorization"));
        Assertions.assertEquals("src/a.txt", request.get("path"));
        Assertions.assertTrue(masked.get("items").toString().contains(SensitiveDataMasker.MASK));
        Assertions.assertEquals("hunter2", input.get("db_password"));
    }

    @Test
    void masksLongOpaqueValuesButKeepsIdentifiers() {
        Map<String, Object> masked = SensitiveDataMasker.maskedMap(Map.of(
                "note", "ghp0123456789abcdefghijklmnopqrstuvwxyz",
                "task_id", "tsk_7f9a3c1e-2b44-4d6e-9a51-0c8f6b2d1e77",
                "count", 3
        ));

        Assertions.assertEquals(SensitiveDataMasker.MASK, masked.get("note"));
        Assertions.assertEquals("tsk_7f9a3c1e-2b44-4d6e-9a51-0c8f6b2d1e77", masked.get("task_id"));
        Assertions.assertEquals(3, masked.get("count"));
    }

    @Test
    void emptyAndNullInputsYieldEmptyMap() {
        Assertions.assertTrue(SensitiveDataMasker.maskedMap(null).isEmpty());
        Assertions.assertTrue(SensitiveDataMasker.maskedMap(Map.of()).isEmpty());
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey("resource_key"));
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("X-Api_Key"));
    }
}
