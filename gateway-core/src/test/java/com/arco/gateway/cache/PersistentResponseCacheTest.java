package com.arco.gateway.cache;

import com.arco.gateway.ManualClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("PersistentResponseCache Tests")
class PersistentResponseCacheTest {

    private static final Duration TTL = Duration.ofHours(24);
    private static final String TARGET = "https://api.example.com/v1/search";

    private final ObjectMapper mapper = new ObjectMapper();
    private final ManualClock clock = new ManualClock(Instant.parse("2026-01-01T00:00:00Z"));

    @TempDir
    Path tempDir;

    private PersistentResponseCache cache;

    @AfterEach
    void tearDown() {
        if (cache != null) {
            cache.close();
        }
    }

    private CacheStore store(String backend) {
        return switch (backend) {
            case "sqlite" -> new SqliteCacheStore(tempDir.resolve("cache.db"));
            default -> new FileCacheStore(tempDir.resolve("cache"));
        };
    }

    private JsonNode json(String text) throws IOException {
        return mapper.readTree(text);
    }

    @ParameterizedTest(name = "{0} store")
    @ValueSource(strings = {"file", "sqlite"})
    @DisplayName("Should return what was stored")
    void roundTrip(String backend) throws IOException {
        cache = new PersistentResponseCache(store(backend), TTL, clock);
        JsonNode payload = json("{\"results\":[{\"name\":\"Acme\",\"score\":0.9}],\"total\":1}");

        cache.set(TARGET, Map.of("q", "dentists", "page", 1), payload);

        assertThat(cache.get(TARGET, Map.of("q", "dentists", "page", 1))).contains(payload);
        assertThat(cache.getStats().hits()).isEqualTo(1);
        assertThat(cache.getStats().writes()).isEqualTo(1);
    }

    @ParameterizedTest(name = "{0} store")
    @ValueSource(strings = {"file", "sqlite"})
    @DisplayName("Should expire entries strictly after the TTL and evict them")
    void expiry(String backend) throws IOException {
        CacheStore store = store(backend);
        cache = new PersistentResponseCache(store, TTL, clock);
        cache.set(TARGET, Map.of("q", "x"), json("{\"v\":1}"));

        clock.advance(TTL);
        assertThat(cache.get(TARGET, Map.of("q", "x"))).isPresent();

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get(TARGET, Map.of("q", "x"))).isEmpty();
        assertThat(cache.getStats().expired()).isEqualTo(1);
        assertThat(store.size()).isZero();
    }

    @ParameterizedTest(name = "{0} store")
    @ValueSource(strings = {"file", "sqlite"})
    @DisplayName("Should survive a restart")
    void durableAcrossInstances(String backend) throws IOException {
        cache = new PersistentResponseCache(store(backend), TTL, clock);
        cache.set(TARGET, Map.of("q", "x"), json("{\"v\":42}"));
        cache.close();

        cache = new PersistentResponseCache(store(backend), TTL, clock);

        assertThat(cache.get(TARGET, Map.of("q", "x")))
            .hasValueSatisfying(node -> assertThat(node.get("v").asInt()).isEqualTo(42));
    }

    @ParameterizedTest(name = "{0} store")
    @ValueSource(strings = {"file", "sqlite"})
    @DisplayName("purgeExpired removes only stale entries")
    void purgeExpired(String backend) throws IOException {
        CacheStore store = store(backend);
        cache = new PersistentResponseCache(store, TTL, clock);
        cache.set(TARGET, Map.of("q", "old"), json("1"));
        clock.advance(Duration.ofHours(12));
        cache.set(TARGET, Map.of("q", "new"), json("2"));
        clock.advance(Duration.ofHours(13));

        assertThat(cache.purgeExpired()).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
        assertThat(cache.get(TARGET, Map.of("q", "new"))).isPresent();
    }

    @Test
    @DisplayName("Parameter insertion order does not change the key")
    void orderIndependentKey() throws IOException {
        cache = new PersistentResponseCache(store("file"), TTL, clock);
        Map<String, Object> forward = new LinkedHashMap<>();
        forward.put("a", 1);
        forward.put("b", "two");
        Map<String, Object> reverse = new LinkedHashMap<>();
        reverse.put("b", "two");
        reverse.put("a", 1);

        cache.set(TARGET, forward, json("{\"ok\":true}"));

        assertThat(cache.get(TARGET, reverse)).isPresent();
    }

    @Test
    @DisplayName("Should reject a non-positive TTL")
    void rejectsInvalidTtl() {
        CacheStore store = mock(CacheStore.class);
        assertThatThrownBy(() -> new PersistentResponseCache(store, Duration.ZERO, clock))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Store failures")
    class StoreFailureTests {

        @Test
        @DisplayName("Write failure is logged and swallowed")
        void writeFailureAbsorbed() throws IOException {
            CacheStore store = mock(CacheStore.class);
            doThrow(new CacheWriteException("disk full", new IOException("No space left on device")))
                .when(store).write(any());
            cache = new PersistentResponseCache(store, TTL, clock);

            assertThatCode(() -> cache.set(TARGET, Map.of(), json("{}"))).doesNotThrowAnyException();
            assertThat(cache.getStats().writeFailures()).isEqualTo(1);
            assertThat(cache.getStats().writes()).isZero();
        }

        @Test
        @DisplayName("Read failure counts as a miss")
        void readFailureIsMiss() throws IOException {
            CacheStore store = mock(CacheStore.class);
            when(store.read(anyString())).thenThrow(new IOException("database is locked"));
            cache = new PersistentResponseCache(store, TTL, clock);

            assertThat(cache.get(TARGET, Map.of())).isEmpty();
            assertThat(cache.getStats().misses()).isEqualTo(1);
        }

        @Test
        @DisplayName("Corrupt cache file counts as a miss")
        void corruptFileIsMiss() throws IOException {
            Path dir = tempDir.resolve("cache");
            cache = new PersistentResponseCache(new FileCacheStore(dir), TTL, clock);
            String fingerprint = Fingerprint.of(TARGET, Map.of("q", "x"));
            Files.writeString(dir.resolve(fingerprint + ".json"), "{not json");

            assertThat(cache.get(fingerprint)).isEmpty();
        }
    }
}
