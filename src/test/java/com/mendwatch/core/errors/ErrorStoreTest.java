package com.mendwatch.core.errors;

import com.mendwatch.core.model.DetectedError;
import com.mendwatch.core.model.ErrorSeverity;
import com.mendwatch.core.model.ErrorStatus;
import com.mendwatch.core.model.Fix;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ErrorStoreTest {

    private ErrorStore store;

    @BeforeEach
    void setUp() {
        store = new ErrorStore();
    }

    private static DetectedError error(String file, int line, String type) {
        return DetectedError.of(type, "boom", file, line, ErrorSeverity.MEDIUM);
    }

    private static Fix fix(String errorId) {
        return new Fix(errorId, true, "fixed", "trailing_whitespace", List.of(), null, Instant.now());
    }

    // -- add tests ------------------------------------------------------------

    @Nested
    @DisplayName("add")
    class AddTests {

        @Test
        @DisplayName("stores a new error")
        void storesNewError() {
            var e = error("a.py", 3, "SyntaxError");

            assertTrue(store.add(e));
            assertEquals(e, store.get(e.id()).orElseThrow());
        }

        @Test
        @DisplayName("rejects a second unresolved error with the same key")
        void rejectsDuplicateKey() {
            assertTrue(store.add(error("a.py", 3, "SyntaxError")));

            assertFalse(store.add(error("a.py", 3, "SyntaxError")));
            assertEquals(1, store.list().size());
        }

        @Test
        @DisplayName("accepts same key with different type, line or file")
        void acceptsDifferentKeys() {
            assertTrue(store.add(error("a.py", 3, "SyntaxError")));
            assertTrue(store.add(error("a.py", 3, "Style")));
            assertTrue(store.add(error("a.py", 4, "SyntaxError")));
            assertTrue(store.add(error("b.py", 3, "SyntaxError")));
        }

        @Test
        @DisplayName("rejects a known id")
        void rejectsKnownId() {
            var e = error("a.py", 3, "SyntaxError");
            store.add(e);
            store.markResolved(e.id(), fix(e.id()));

            assertFalse(store.add(e));
        }

        @Test
        @DisplayName("a fixed error no longer blocks its key")
        void fixedErrorReleasesKey() {
            var first = error("a.py", 3, "SyntaxError");
            store.add(first);
            store.markResolved(first.id(), fix(first.id()));

            assertTrue(store.add(error("a.py", 3, "SyntaxError")));
        }

        @Test
        @DisplayName("a failed error still blocks its key")
        void failedErrorKeepsKey() {
            var first = error("a.py", 3, "SyntaxError");
            store.add(first);
            store.markFailed(first.id());

            assertFalse(store.add(error("a.py", 3, "SyntaxError")));
        }

        @Test
        @DisplayName("rejects null")
        void rejectsNull() {
            assertFalse(store.add(null));
        }

        @Test
        @DisplayName("concurrent adds of the same key record exactly one error")
        void concurrentAdds() throws Exception {
            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            var start = new CountDownLatch(1);
            var accepted = new AtomicInteger();
            var futures = new ArrayList<java.util.concurrent.Future<?>>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    if (store.add(error("a.py", 1, "SyntaxError"))) {
                        accepted.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (var f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
            pool.shutdown();

            assertEquals(1, accepted.get());
            assertEquals(1, store.listUnresolved().size());
        }
    }

    // -- Resolution tests -----------------------------------------------------

    @Nested
    @DisplayName("resolution")
    class ResolutionTests {

        @Test
        @DisplayName("markResolved attaches the fix and is idempotent")
        void markResolvedIdempotent() {
            var e = error("a.py", 1, "Style");
            store.add(e);
            var first = fix(e.id());

            assertTrue(store.markResolved(e.id(), first));
            assertTrue(store.markResolved(e.id(), fix(e.id())));

            var stored = store.get(e.id()).orElseThrow();
            assertEquals(ErrorStatus.FIXED, stored.status());
            assertEquals(first, stored.fix());
            assertNotNull(stored.fixedAt());
            assertTrue(store.listUnresolved().isEmpty());
        }

        @Test
        @DisplayName("markResolved on an unknown id returns false")
        void markResolvedUnknown() {
            assertFalse(store.markResolved("nope", null));
        }

        @Test
        @DisplayName("incrementFixAttempts counts up and returns -1 for unknown ids")
        void incrementFixAttempts() {
            var e = error("a.py", 1, "Style");
            store.add(e);

            assertEquals(1, store.incrementFixAttempts(e.id()));
            assertEquals(2, store.incrementFixAttempts(e.id()));
            assertEquals(2, store.get(e.id()).orElseThrow().fixAttempts());
            assertEquals(-1, store.incrementFixAttempts("nope"));
        }

        @Test
        @DisplayName("FAILED goes back to PENDING only through retry")
        void retry() {
            var e = error("a.py", 1, "Style");
            store.add(e);

            assertFalse(store.retry(e.id()));
            assertTrue(store.markInProgress(e.id()));
            assertTrue(store.markFailed(e.id()));
            assertTrue(store.retry(e.id()));
            assertEquals(ErrorStatus.PENDING, store.get(e.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("a fixed error cannot be failed")
        void fixedCannotFail() {
            var e = error("a.py", 1, "Style");
            store.add(e);
            store.markResolved(e.id(), fix(e.id()));

            assertFalse(store.markFailed(e.id()));
            assertEquals(ErrorStatus.FIXED, store.get(e.id()).orElseThrow().status());
        }
    }

    // -- Stats tests ----------------------------------------------------------

    @Test
    @DisplayName("stats aggregates totals by type and file")
    void stats() {
        var a = error("a.py", 1, "Style");
        store.add(a);
        store.add(error("a.py", 2, "SyntaxError"));
        store.add(error("b.py", 1, "Style"));
        store.markResolved(a.id(), fix(a.id()));

        var stats = store.stats();

        assertEquals(3, stats.total());
        assertEquals(1, stats.resolved());
        assertEquals(2, stats.unresolved());
        assertEquals(2, stats.byType().get("Style"));
        assertEquals(1, stats.byType().get("SyntaxError"));
        assertEquals(2, stats.byFile().get("a.py"));
        assertEquals(1, stats.byFile().get("b.py"));
    }
}
