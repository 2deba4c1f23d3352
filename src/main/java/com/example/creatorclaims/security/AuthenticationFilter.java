package com.example.creatorclaims.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;

@Component
public class AuthenticationFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(AuthenticationFilter.class);
    private final AccessTokenService accessTokenService;

    public AuthenticationFilter(AccessTokenService accessTokenService) {
        this.accessTokenService = accessTokenService;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        // Service endpoints carry shared secrets, not user tokens
        return ServiceSecretFilter.isServicePath(request);
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        Long userId = accessTokenService.validateTokenAndGetUserId(request);

        if (userId != null) {
            Authentication authentication = new UsernamePasswordAuthenticationToken(
                    String.valueOf(userId),
                    null,
                    Collections.emptyList());
            SecurityContextHolder.getContext().setAuthentication(authentication);
            log.debug("Authentication successful for user {}. Security context updated.", userId);
        } else {
            SecurityContextHolder.clearContext();
            log.debug("Access token missing or invalid. Security context cleared.");
        }

        filterChain.doFilter(request, response);
    }
}
