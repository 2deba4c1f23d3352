package com.example.creatorclaims.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;

import javax.crypto.SecretKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

@DisplayName("AccessTokenService Tests")
class AccessTokenServiceTest {

    private final String base64Secret = Base64.getEncoder().encodeToString("TestSecretKeyMustBeAtLeast32BytesLongForHS256".getBytes());
    private final String issuer = "TestIssuer";
    private SecretKey key;
    private AccessTokenService accessTokenService;

    @BeforeEach
    void setUp() {
        key = Keys.hmacShaKeyFor(Base64.getDecoder().decode(base64Secret));
        accessTokenService = new AccessTokenService(base64Secret, issuer);
        accessTokenService.initializeKey();
    }

    private String token(String subject, String tokenIssuer, SecretKey signingKey, Instant expiresAt) {
        return Jwts.builder()
                .subject(subject)
                .issuer(tokenIssuer)
                .issuedAt(Date.from(Instant.now().minusSeconds(5)))
                .expiration(Date.from(expiresAt))
                .signWith(signingKey)
                .compact();
    }

    private MockHttpServletRequest requestWith(String authorization) {
        MockHttpServletRequest request = new MockHttpServletRequest();
        if (authorization != null) {
            request.addHeader(HttpHeaders.AUTHORIZATION, authorization);
        }
        return request;
    }

    @Nested
    @DisplayName("Initialization")
    class InitializationTests {

        @Test
        @DisplayName("✅ Should initialize with a 32+ byte key")
        void initialization_Success() {
            assertThatCode(() -> new AccessTokenService(base64Secret, issuer).initializeKey()).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("❌ Should reject a missing secret")
        void initialization_MissingSecret() {
            AccessTokenService service = new AccessTokenService(null, issuer);
            assertThatIllegalArgumentException()
                    .isThrownBy(service::initializeKey)
                    .withMessageContaining("must be provided");
        }

        @Test
        @DisplayName("❌ Should reject a key shorter than 256 bits")
        void initialization_ShortKey() {
            String shortSecret = Base64.getEncoder().encodeToString("too-short".getBytes());
            AccessTokenService service = new AccessTokenService(shortSecret, issuer);
            assertThatIllegalArgumentException()
                    .isThrownBy(service::initializeKey)
                    .withMessageContaining("at least 256 bits");
        }

        @Test
        @DisplayName("❌ Should reject invalid Base64")
        void initialization_InvalidBase64() {
            AccessTokenService service = new AccessTokenService("%%%not-base64%%%", issuer);
            assertThatIllegalArgumentException()
                    .isThrownBy(service::initializeKey)
                    .withMessageContaining("Invalid Base64");
        }

        @Test
        @DisplayName("❌ Should reject a blank issuer")
        void initialization_BlankIssuer() {
            assertThatIllegalArgumentException()
                    .isThrownBy(() -> new AccessTokenService(base64Secret, " "));
        }
    }

    @Nested
    @DisplayName("Token validation")
    class ValidationTests {

        @Test
        @DisplayName("✅ Should return the user id of a valid token")
        void validToken_ReturnsUserId() {
            String jwt = token("42", issuer, key, Instant.now().plus(Duration.ofHours(1)));

            assertThat(accessTokenService.validateTokenAndGetUserId(requestWith("Bearer " + jwt))).isEqualTo(42L);
        }

        @Test
        @DisplayName("❌ Should return null without an Authorization header")
        void missingHeader_ReturnsNull() {
            assertThat(accessTokenService.validateTokenAndGetUserId(requestWith(null))).isNull();
        }

        @Test
        @DisplayName("❌ Should return null for a non-Bearer scheme")
        void basicScheme_ReturnsNull() {
            assertThat(accessTokenService.validateTokenAndGetUserId(requestWith("Basic dXNlcjpwYXNz"))).isNull();
        }

        @Test
        @DisplayName("❌ Should return null for an expired token")
        void expiredToken_ReturnsNull() {
            String jwt = token("42", issuer, key, Instant.now().minus(Duration.ofMinutes(5)));

            assertThat(accessTokenService.validateTokenAndGetUserId(requestWith("Bearer " + jwt))).isNull();
        }

        @Test
        @DisplayName("❌ Should return null for a token from another issuer")
        void wrongIssuer_ReturnsNull() {
            String jwt = token("42", "SomeoneElse", key, Instant.now().plus(Duration.ofHours(1)));

            assertThat(accessTokenService.validateTokenAndGetUserId(requestWith("Bearer " + jwt))).isNull();
        }

        @Test
        @DisplayName("❌ Should return null for a token signed with another key")
        void wrongKey_ReturnsNull() {
            SecretKey otherKey = Keys.hmacShaKeyFor("AnotherSecretKeyThatIsAlsoLongEnoughForHS256".getBytes());
            String jwt = token("42", issuer, otherKey, Instant.now().plus(Duration.ofHours(1)));

            assertThat(accessTokenService.validateTokenAndGetUserId(requestWith("Bearer " + jwt))).isNull();
        }

        @Test
        @DisplayName("❌ Should return null when the subject is not a user id")
        void nonNumericSubject_ReturnsNull() {
            String jwt = token("alice", issuer, key, Instant.now().plus(Duration.ofHours(1)));

            assertThat(accessTokenService.validateTokenAndGetUserId(requestWith("Bearer " + jwt))).isNull();
        }

        @Test
        @DisplayName("❌ Should return null for a malformed token")
        void malformedToken_ReturnsNull() {
            assertThat(accessTokenService.validateTokenAndGetUserId(requestWith("Bearer not.a.jwt"))).isNull();
        }
    }
}
