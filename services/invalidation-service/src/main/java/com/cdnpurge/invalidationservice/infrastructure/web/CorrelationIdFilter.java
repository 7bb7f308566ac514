package com.cdnpurge.invalidationservice.infrastructure.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates {@code X-Correlation-ID} for every HTTP request.
 *
 * <p>The id is echoed on the response and placed in the SLF4J MDC under {@code correlationId}
 * for the duration of the request. The publish pipeline usually passes its publish id here so
 * that purge logs can be joined with publish logs. A caller id longer than
 * {@value #MAX_LENGTH} characters or containing anything but printable ASCII is replaced.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String MDC_CORRELATION_ID = "correlationId";
    static final int MAX_LENGTH = 128;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String supplied = request.getHeader(CORRELATION_ID_HEADER);
        String correlationId = acceptable(supplied) ? supplied.strip() : UUID.randomUUID().toString();

        MDC.put(MDC_CORRELATION_ID, correlationId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            MDC.remove(MDC_CORRELATION_ID);
        }
    }

    private static boolean acceptable(String id) {
        if (id == null || id.isBlank() || id.length() > MAX_LENGTH) {
            return false;
        }
        return id.chars().allMatch(c -> c >= 0x20 && c < 0x7F);
    }
}
