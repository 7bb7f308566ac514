package com.cdnpurge.invalidationservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.cdnpurge.invalidation.ValidationError;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("maps rejected paths to 400 listing every error")
    void rejectedPaths() {
        var error = new ValidationError(List.of("Path must start with '/': a.html", "Path must not be blank"));

        ProblemDetail result = handler.handleRejected(new InvalidationRejectedException(error));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getTitle()).isEqualTo("Invalid Paths");
        assertThat(result.getProperties()).containsEntry("errors", error.messages());
    }

    @Test
    @DisplayName("maps an unknown request to 404")
    void notFound() {
        ProblemDetail result = handler.handleNotFound(new InvalidationNotFoundException("r-1"));

        assertThat(result.getStatus()).isEqualTo(404);
        assertThat(result.getDetail()).contains("r-1");
    }

    @Test
    @DisplayName("maps an invalid state to 409")
    void conflict() {
        assertThat(handler.handleConflict(new IllegalStateException("still running")).getStatus()).isEqualTo(409);
    }

    @Test
    @DisplayName("hides internals behind a generic 500")
    void generic() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("secret detail"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).doesNotContain("secret detail");
    }

    @Test
    @DisplayName("includes timestamp and correlation id")
    void enrichment() {
        MDC.put(CorrelationIdFilter.MDC_CORRELATION_ID, "corr-9");

        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("bad"));

        assertThat(result.getProperties()).containsKey("timestamp").containsEntry("correlationId", "corr-9");
    }
}
