package org.symproof.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.symproof.core.Counterexample;
import org.symproof.engine.ProofCertificate;
import org.symproof.engine.Status;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ProofCacheTest {

    private static final String KEY = CacheKeys.newKey().part("source", "def f(x): return -x").build();

    private static ProofCertificate certificate() {
        return ProofCertificate.builder("f", Status.COUNTEREXAMPLE)
                .sourceHash("0123abcd")
                .postconditions(List.of("result > 0"))
                .counterexample(Counterexample.of(Map.of("x", 0, Counterexample.RETURN_KEY, 0)))
                .message("Counterexample: {'x': 0}")
                .solverVersion("z3-4.12.2.0")
                .build();
    }

    @Nested
    @DisplayName("内存缓存")
    class MemoryTests {

        @Test
        @DisplayName("写入、命中与清空")
        void testGetPutClear() {
            ProofCache cache = new ProofCache();
            ProofCertificate cert = certificate();

            assertTrue(cache.get(KEY).isEmpty());
            cache.put(KEY, cert);
            assertAll(
                    () -> assertSame(cert, cache.get(KEY).orElseThrow()),
                    () -> assertTrue(cache.contains(KEY)),
                    () -> assertEquals(1, cache.size())
            );
            cache.clear();
            assertAll(
                    () -> assertFalse(cache.contains(KEY)),
                    () -> assertEquals(0, cache.size())
            );
        }

        @Test
        @DisplayName("拒绝 null")
        void testNulls() {
            ProofCache cache = new ProofCache();
            assertAll(
                    () -> assertThrows(NullPointerException.class, () -> cache.put(null, certificate())),
                    () -> assertThrows(NullPointerException.class, () -> cache.put(KEY, null))
            );
        }
    }

    @Nested
    @DisplayName("持久缓存")
    class DiskTests {

        @TempDir
        Path directory;

        @Test
        @DisplayName("写入后能读回相等的证书")
        void testRoundTrip() {
            DiskProofStore store = new DiskProofStore(directory.resolve("proofs"));
            store.store(KEY, certificate());

            assertAll(
                    () -> assertTrue(Files.isRegularFile(store.pathFor(KEY))),
                    () -> assertEquals(certificate(), store.load(KEY).orElseThrow()),
                    () -> assertTrue(store.pathFor(KEY).getFileName().toString().endsWith(".json"))
            );
        }

        @Test
        @DisplayName("重复写入覆盖旧记录且不留临时文件")
        void testOverwrite() throws Exception {
            DiskProofStore store = new DiskProofStore(directory);
            store.store(KEY, certificate());
            ProofCertificate verified = ProofCertificate.builder("f", Status.VERIFIED).build();
            store.store(KEY, verified);

            try (Stream<Path> files = Files.list(directory)) {
                assertEquals(1, files.count());
            }
            assertEquals(verified, store.load(KEY).orElseThrow());
        }

        @Test
        @DisplayName("缺失或损坏的记录按未命中处理")
        void testMissingAndCorrupt() throws Exception {
            DiskProofStore store = new DiskProofStore(directory);
            Files.writeString(store.pathFor(KEY), "{\"function_name\": ");

            assertAll(
                    () -> assertTrue(store.load("0000").isEmpty()),
                    () -> assertTrue(store.load(KEY).isEmpty())
            );
        }
    }
}
