package com.di.tripstar.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcRequestFilter Tests")
class MdcRequestFilterTest {

    private final MdcRequestFilter filter = new MdcRequestFilter();

    @Test
    @DisplayName("Should reuse a well-formed incoming request id and clear the MDC afterwards")
    void testReusesIncomingId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/pipeline/runs");
        request.addHeader(MdcRequestFilter.REQUEST_ID_HEADER, "composer-task-17");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenId = new AtomicReference<>();
        AtomicReference<String> seenPath = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> {
            seenId.set(MDC.get("requestId"));
            seenPath.set(MDC.get("requestPath"));
        });

        assertEquals("composer-task-17", seenId.get());
        assertEquals("/api/pipeline/runs", seenPath.get());
        assertEquals("composer-task-17", response.getHeader(MdcRequestFilter.REQUEST_ID_HEADER));
        assertNull(MDC.get("requestId"));
        assertNull(MDC.get("requestPath"));
    }

    @Test
    @DisplayName("Should generate a request id when the incoming one is missing or unsafe")
    void testGeneratesId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/reports/average-fare-by-hour");
        request.addHeader(MdcRequestFilter.REQUEST_ID_HEADER, "bad id\nwith newline");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        assertTrue(response.getHeader(MdcRequestFilter.REQUEST_ID_HEADER).matches("req-[0-9a-f]{8}"));
    }
}
