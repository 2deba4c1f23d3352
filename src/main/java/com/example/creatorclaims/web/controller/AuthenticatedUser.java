package com.example.creatorclaims.web.controller;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.web.server.ResponseStatusException;

/**
 * Reads the platform user id the authentication filter put into the security context.
 */
final class AuthenticatedUser {

    private AuthenticatedUser() {
    }

    static Long id(Authentication authentication) {
        if (authentication == null) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Authentication required.");
        }
        try {
            return Long.valueOf(authentication.getName());
        } catch (NumberFormatException e) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Principal is not a user.", e);
        }
    }
}
