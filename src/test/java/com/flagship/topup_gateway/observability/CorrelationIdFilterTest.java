package com.flagship.topup_gateway.observability;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    @DisplayName("propagates the incoming correlation id to MDC and the response")
    void propagatesHeader() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/topups");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "abc123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seen.set(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
            }
        });

        assertEquals("abc123", seen.get());
        assertEquals("abc123", response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
    }

    @Test
    @DisplayName("generates an id when the header is absent")
    void generatesId() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/api/topups/1"), response, new MockFilterChain());

        String generated = response.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertNotNull(generated);
        assertEquals(8, generated.length());
    }
}
