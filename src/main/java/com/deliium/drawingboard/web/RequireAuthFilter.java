package com.deliium.drawingboard.web;

import java.io.IOException;
import java.util.Map;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import com.deliium.drawingboard.auth.IdentityResolver;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Rejects anonymous calls to the stroke API, recognition and the push channel with a JSON 401. */
@Component
public class RequireAuthFilter extends OncePerRequestFilter {

    private final IdentityResolver identity;
    private final ObjectMapper objectMapper;

    public RequireAuthFilter(IdentityResolver identity, ObjectMapper objectMapper) {
        this.identity = identity;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        return !isProtected(request.getRequestURI());
    }

    static boolean isProtected(String path) {
        return path.equals("/api/strokes")
            || path.startsWith("/api/strokes/")
            || path.equals("/api/recognize")
            || path.equals("/ws");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        if (identity.resolve(request).isEmpty()) {
            response.setStatus(HttpStatus.UNAUTHORIZED.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getWriter(), Map.of("error", "unauthorized"));
            return;
        }
        chain.doFilter(request, response);
    }
}
