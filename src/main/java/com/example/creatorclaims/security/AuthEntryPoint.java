package com.example.creatorclaims.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Answers unauthenticated calls with a 401 ProblemDetail. Provider and worker endpoints are told
 * a shared secret is missing; everything else is told to send a user access token.
 */
@Component
public class AuthEntryPoint implements AuthenticationEntryPoint {

    private static final Logger log = LoggerFactory.getLogger(AuthEntryPoint.class);

    static final String CREDENTIAL_PROPERTY = "credential";
    private static final String SERVICE_SECRET_DETAIL = "This endpoint requires the shared service secret as a bearer token.";
    private static final String ACCESS_TOKEN_DETAIL = "A valid access token is required to access this resource.";

    private final ObjectMapper objectMapper;

    public AuthEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        boolean serviceCall = ServiceSecretFilter.isServicePath(request);
        log.warn("Rejected {} call to {}: {}", serviceCall ? "service" : "user",
                request.getRequestURI(), authException.getMessage());

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.UNAUTHORIZED,
                serviceCall ? SERVICE_SECRET_DETAIL : ACCESS_TOKEN_DETAIL);
        problemDetail.setTitle("Unauthorized");
        problemDetail.setInstance(URI.create(request.getRequestURI()));
        problemDetail.setProperty(CREDENTIAL_PROPERTY, serviceCall ? "service-secret" : "access-token");
        problemDetail.setProperty("timestamp", Instant.now());

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE,
                serviceCall ? "Bearer realm=\"creatorclaims-services\"" : "Bearer realm=\"creatorclaims\"");
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), problemDetail);
    }
}
