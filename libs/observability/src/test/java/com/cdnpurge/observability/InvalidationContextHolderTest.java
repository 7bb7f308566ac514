package com.cdnpurge.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("InvalidationContextHolder")
class InvalidationContextHolderTest {

    @AfterEach
    void cleanup() {
        InvalidationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear")
    class Lifecycle {

        @Test
        @DisplayName("empty when nothing is set")
        void emptyByDefault() {
            assertThat(InvalidationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("populates MDC with every non-null field")
        void populatesMdc() {
            var ctx = InvalidationContext.forRequest("req-1", "tenant-1", "CloudFront")
                    .forBatch(2, "ref-2");
            InvalidationContextHolder.set(ctx);

            assertThat(InvalidationContextHolder.get()).contains(ctx);
            assertThat(MDC.get(InvalidationContext.MDC_REQUEST_ID)).isEqualTo("req-1");
            assertThat(MDC.get(InvalidationContext.MDC_TENANT_ID)).isEqualTo("tenant-1");
            assertThat(MDC.get(InvalidationContext.MDC_PROVIDER)).isEqualTo("CloudFront");
            assertThat(MDC.get(InvalidationContext.MDC_BATCH_INDEX)).isEqualTo("2");
            assertThat(MDC.get(InvalidationContext.MDC_CALLER_REFERENCE)).isEqualTo("ref-2");
        }

        @Test
        @DisplayName("clear removes MDC keys")
        void clearRemovesMdc() {
            InvalidationContextHolder.set(InvalidationContext.forRequest("req-1", "t", "None"));
            InvalidationContextHolder.clear();

            assertThat(InvalidationContextHolder.get()).isEmpty();
            assertThat(MDC.get(InvalidationContext.MDC_REQUEST_ID)).isNull();
            assertThat(MDC.get(InvalidationContext.MDC_PROVIDER)).isNull();
        }

        @Test
        @DisplayName("rejects null context and blank request id")
        void rejectsInvalid() {
            assertThatThrownBy(() -> InvalidationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> InvalidationContext.forRequest(" ", "t", "p"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("requestId");
        }
    }

    @Nested
    @DisplayName("callWithContext")
    class Scoped {

        @Test
        @DisplayName("restores previous context afterwards")
        void restoresPrevious() {
            var outer = InvalidationContext.forRequest("outer", "t", "None");
            var inner = InvalidationContext.forRequest("inner", "t", "None");
            InvalidationContextHolder.set(outer);

            String seen = InvalidationContextHolder.callWithContext(
                    inner, () -> MDC.get(InvalidationContext.MDC_REQUEST_ID));

            assertThat(seen).isEqualTo("inner");
            assertThat(InvalidationContextHolder.get()).contains(outer);
        }

        @Test
        @DisplayName("clears when there was no previous context, even on exception")
        void clearsOnException() {
            var ctx = InvalidationContext.forRequest("req", "t", "None");

            assertThatThrownBy(() -> InvalidationContextHolder.runWithContext(ctx, () -> {
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(InvalidationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("carries context onto a pool thread")
        void poolHandOff() throws Exception {
            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                var ctx = InvalidationContext.forRequest("req-pool", "t", "None");
                String seen = CompletableFuture.supplyAsync(
                        () -> InvalidationContextHolder.callWithContext(
                                ctx, () -> MDC.get(InvalidationContext.MDC_REQUEST_ID)),
                        pool).get();
                String after = CompletableFuture.supplyAsync(
                        () -> MDC.get(InvalidationContext.MDC_REQUEST_ID), pool).get();

                assertThat(seen).isEqualTo("req-pool");
                assertThat(after).isNull();
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
