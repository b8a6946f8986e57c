package com.deliium.drawingboard.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.deliium.drawingboard.auth.HttpSessionIdentityResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequireAuthFilterTest {

    private final RequireAuthFilter filter =
        new RequireAuthFilter(new HttpSessionIdentityResolver(), new ObjectMapper());

    @Test
    void protectedPaths() {
        assertThat(RequireAuthFilter.isProtected("/api/strokes")).isTrue();
        assertThat(RequireAuthFilter.isProtected("/api/strokes/clear")).isTrue();
        assertThat(RequireAuthFilter.isProtected("/api/strokes/delete")).isTrue();
        assertThat(RequireAuthFilter.isProtected("/api/recognize")).isTrue();
        assertThat(RequireAuthFilter.isProtected("/ws")).isTrue();

        assertThat(RequireAuthFilter.isProtected("/api/login")).isFalse();
        assertThat(RequireAuthFilter.isProtected("/api/me")).isFalse();
        assertThat(RequireAuthFilter.isProtected("/api/strokesx")).isFalse();
        assertThat(RequireAuthFilter.isProtected("/healthz")).isFalse();
    }

    @Test
    void anonymousProtectedCallGetsJson401() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/strokes");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).isEqualTo("{\"error\":\"unauthorized\"}");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void loggedInCallPassesThrough() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/recognize");
        request.getSession(true).setAttribute(HttpSessionIdentityResolver.USER_ID_ATTRIBUTE, 5L);
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    void publicPathIsNotFiltered() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/login");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    void preflightIsNotFiltered() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("OPTIONS", "/api/strokes");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isSameAs(request);
    }
}
