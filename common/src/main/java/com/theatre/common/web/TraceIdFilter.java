package com.theatre.common.web;

import com.theatre.common.util.TokenGenerator;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Puts a per-request trace id into the logging MDC and echoes it back in the response.
 * An incoming {@code X-Trace-Id} header is reused so callers can correlate their own logs.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Trace-Id";
    public static final String MDC_KEY = "traceId";

    private static final int MAX_TRACE_ID_LENGTH = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(HEADER));

        try {
            response.setHeader(HEADER, traceId);
            request.setAttribute(HEADER, traceId);
            MDC.put(MDC_KEY, traceId);

            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    static String resolveTraceId(String incoming) {
        if (StringUtils.hasText(incoming) && incoming.length() <= MAX_TRACE_ID_LENGTH) {
            return incoming.trim();
        }
        return TokenGenerator.generateTraceId();
    }

    public static String currentTraceId() {
        return MDC.get(MDC_KEY);
    }
}
