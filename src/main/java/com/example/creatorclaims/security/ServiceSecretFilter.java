package com.example.creatorclaims.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Authenticates machine callers by shared secret. The provider's webhook gets ROLE_PROVIDER,
 * the scheduled worker gets ROLE_WORKER. A path whose secret is not configured is left open.
 */
@Component
public class ServiceSecretFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(ServiceSecretFilter.class);

    public static final String PROVIDER_PATH_PREFIX = "/api/provider/";
    public static final String WORKER_PATH_PREFIX = "/api/workers/";

    private final String webhookSecret;
    private final String workerSecret;

    public ServiceSecretFilter(@Value("${provider.webhook-secret:}") String webhookSecret,
                               @Value("${worker.secret:}") String workerSecret) {
        this.webhookSecret = webhookSecret;
        this.workerSecret = workerSecret;
        if (!StringUtils.hasText(webhookSecret)) {
            log.warn("provider.webhook-secret is not set; the provider webhook accepts unauthenticated calls.");
        }
        if (!StringUtils.hasText(workerSecret)) {
            log.warn("worker.secret is not set; the reconcile endpoint accepts unauthenticated calls.");
        }
    }

    static boolean isServicePath(HttpServletRequest request) {
        String path = pathWithinApplication(request);
        return path.startsWith(PROVIDER_PATH_PREFIX) || path.startsWith(WORKER_PATH_PREFIX);
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (uri == null) {
            return "";
        }
        return StringUtils.hasLength(contextPath) && uri.startsWith(contextPath) ? uri.substring(contextPath.length()) : uri;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return !isServicePath(request);
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        boolean providerCall = pathWithinApplication(request).startsWith(PROVIDER_PATH_PREFIX);
        String expected = providerCall ? webhookSecret : workerSecret;
        String role = providerCall ? "ROLE_PROVIDER" : "ROLE_WORKER";

        if (!StringUtils.hasText(expected) || secretMatches(request, expected)) {
            var authentication = new UsernamePasswordAuthenticationToken(
                    providerCall ? "provider" : "worker",
                    null,
                    List.of(new SimpleGrantedAuthority(role)));
            SecurityContextHolder.getContext().setAuthentication(authentication);
            log.debug("Service call authenticated as {} for {}", role, request.getRequestURI());
        } else {
            SecurityContextHolder.clearContext();
            log.warn("Rejected service call to {}: shared secret missing or wrong.", request.getRequestURI());
        }

        filterChain.doFilter(request, response);
    }

    private static boolean secretMatches(HttpServletRequest request, String expected) {
        return AccessTokenService.extractToken(request)
                .map(provided -> MessageDigest.isEqual(
                        provided.getBytes(StandardCharsets.UTF_8),
                        expected.getBytes(StandardCharsets.UTF_8)))
                .orElse(false);
    }
}
