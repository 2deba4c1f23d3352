package com.example.creatorclaims.service;

import com.example.creatorclaims.repository.SocialAccountRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Issues upper-case alphanumeric codes that no other account holds.
 */
@Component
public class VerificationCodeGenerator {

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int MAX_ATTEMPTS = 10;

    private final SecureRandom random = new SecureRandom();
    private final SocialAccountRepository socialAccountRepository;
    private final int codeLength;

    public VerificationCodeGenerator(SocialAccountRepository socialAccountRepository,
                                     @Value("${verification.code-length:6}") int codeLength) {
        if (codeLength < 4) {
            throw new IllegalArgumentException("verification.code-length must be at least 4");
        }
        this.socialAccountRepository = socialAccountRepository;
        this.codeLength = codeLength;
    }

    public String generateUniqueCode() {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String candidate = randomCode();
            if (!socialAccountRepository.existsByVerificationCode(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not generate a unique verification code after " + MAX_ATTEMPTS + " attempts");
    }

    String randomCode() {
        StringBuilder sb = new StringBuilder(codeLength);
        for (int i = 0; i < codeLength; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
