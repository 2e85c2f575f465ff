package com.byootify.booking_ledger.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Extracts or generates the correlation ID for each HTTP request, exposes it in MDC
 * and echoes it back in the response header.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        try {
            String correlationId = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
            if (correlationId == null || correlationId.isBlank()) {
                correlationId = CorrelationContext.generateCorrelationId();
            }

            CorrelationContext.setCorrelationId(correlationId);
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);

            filterChain.doFilter(request, response);

        } finally {
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            CorrelationContext.clearDomainKeys();
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }
}
