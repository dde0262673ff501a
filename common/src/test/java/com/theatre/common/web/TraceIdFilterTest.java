package com.theatre.common.web;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @Test
    void reusesIncomingTraceId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/performances");
        request.addHeader(TraceIdFilter.HEADER, "trace-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInChain = new AtomicReference<>();

        FilterChain chain = (req, res) -> seenInChain.set(MDC.get(TraceIdFilter.MDC_KEY));

        filter.doFilter(request, response, chain);

        assertEquals("trace-123", response.getHeader(TraceIdFilter.HEADER));
        assertEquals("trace-123", seenInChain.get());
        assertNull(MDC.get(TraceIdFilter.MDC_KEY));
    }

    @Test
    void generatesTraceIdWhenHeaderMissing() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/reservations");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        String traceId = response.getHeader(TraceIdFilter.HEADER);
        assertNotNull(traceId);
        assertEquals(32, traceId.length());
    }

    @Test
    void clearsMdcWhenChainThrows() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/plays");
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertThrows(IllegalStateException.class, () -> filter.doFilter(request, response, (req, res) -> {
            throw new IllegalStateException("boom");
        }));
        assertNull(MDC.get(TraceIdFilter.MDC_KEY));
    }

    @Test
    void resolveTraceId_RejectsOverlongHeader() {
        String overlong = "x".repeat(100);

        String resolved = TraceIdFilter.resolveTraceId(overlong);

        assertNotEquals(overlong, resolved);
        assertEquals(32, resolved.length());
    }
}
