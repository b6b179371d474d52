package com.cdcportal.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import jakarta.servlet.FilterChain;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void echoesIncomingRequestIdAndClearsMdc() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/students");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInChain = new AtomicReference<>();

        FilterChain chain = (req, res) -> seenInChain.set(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));

        filter.doFilter(request, response, chain);

        assertThat(seenInChain.get()).isEqualTo("abc-123");
        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("abc-123");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
    }

    @Test
    void stripsUnsafeCharactersAndTruncates() {
        assertThat(RequestIdFilter.resolveRequestId("id\r\nX-Evil: 1")).isEqualTo("idX-Evil:1");
        assertThat(RequestIdFilter.resolveRequestId("a".repeat(100))).hasSize(RequestIdFilter.MAX_REQUEST_ID_LENGTH);
    }

    @Test
    void mintsIdWhenHeaderIsMissingOrUnusable() {
        assertThat(RequestIdFilter.resolveRequestId(null)).hasSize(36);
        assertThat(RequestIdFilter.resolveRequestId("<<>>")).hasSize(36);
    }
}
