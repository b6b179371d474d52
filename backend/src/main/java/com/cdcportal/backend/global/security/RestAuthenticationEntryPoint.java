package com.cdcportal.backend.global.security;

import java.io.IOException;

import com.cdcportal.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * 401 for requests without a usable identity. A presented token that failed
 * verification is reported as {@code INVALID_TOKEN} so clients know to sign in
 * again; a missing token as {@code UNAUTHORIZED}.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        boolean rejected = request.getAttribute(JwtAuthenticationFilter.REJECTED_TOKEN_ATTRIBUTE) != null;
        ProblemResponse body = rejected
                ? ProblemResponse.of(HttpStatus.UNAUTHORIZED, "INVALID_TOKEN",
                        "Access token is invalid or expired", request.getRequestURI())
                : ProblemResponse.of(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED",
                        "Authentication required", request.getRequestURI());

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, rejected ? "Bearer error=\"invalid_token\"" : "Bearer");
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
