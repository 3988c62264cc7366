package com.modelrouter.common.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RequestTraceTest {

    @Nested
    @DisplayName("resolve()")
    class ResolveTests {

        @Test
        @DisplayName("request id wins over the header")
        void requestIdFirst() {
            assertEquals("req-1", RequestTrace.resolve("req-1", "hdr-1"));
        }

        @Test
        @DisplayName("blank request id falls back to the header")
        void headerSecond() {
            assertEquals("hdr-1", RequestTrace.resolve("  ", "hdr-1"));
        }

        @Test
        @DisplayName("neither present → fresh UUID")
        void generated() {
            String id = RequestTrace.resolve(null, "");
            assertDoesNotThrow(() -> UUID.fromString(id));
            assertNotEquals(id, RequestTrace.ensure(null));
        }

        @Test
        @DisplayName("error paths report unknown instead of inventing an id")
        void orUnknown() {
            assertEquals("unknown", RequestTrace.orUnknown(null));
            assertEquals("hdr-1", RequestTrace.orUnknown("hdr-1"));
        }
    }

    @Nested
    @DisplayName("bind() / current()")
    class ContextTests {

        @Test
        @DisplayName("bound id is visible to upstream operators")
        void bound() {
            Mono<String> pipeline = Mono.deferContextual(ctx -> Mono.just(RequestTrace.current(ctx)));

            assertEquals("trace-7", RequestTrace.bind(pipeline, "trace-7").block());
        }

        @Test
        @DisplayName("unbound pipeline reads unknown")
        void unbound() {
            assertEquals("unknown",
                Mono.deferContextual(ctx -> Mono.just(RequestTrace.current(ctx))).block());
        }

        @Test
        @DisplayName("logWith runs the action even without a trace id")
        void logWithRuns() {
            boolean[] ran = {false};
            RequestTrace.logWith(null, () -> ran[0] = true);
            assertTrue(ran[0]);
        }
    }
}
