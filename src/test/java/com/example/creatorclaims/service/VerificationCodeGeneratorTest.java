package com.example.creatorclaims.service;

import com.example.creatorclaims.repository.SocialAccountRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class VerificationCodeGeneratorTest {

    @Mock
    private SocialAccountRepository accountRepository;

    @Test
    @DisplayName("✅ Codes are six upper-case alphanumerics")
    void codeShape() {
        given(accountRepository.existsByVerificationCode(anyString())).willReturn(false);
        VerificationCodeGenerator generator = new VerificationCodeGenerator(accountRepository, 6);

        assertThat(generator.generateUniqueCode()).matches("[A-Z0-9]{6}");
    }

    @Test
    @DisplayName("✅ Taken codes are skipped")
    void retriesOnCollision() {
        given(accountRepository.existsByVerificationCode(anyString())).willReturn(true, true, false);
        VerificationCodeGenerator generator = new VerificationCodeGenerator(accountRepository, 6);

        assertThat(generator.generateUniqueCode()).hasSize(6);
        then(accountRepository).should(times(3)).existsByVerificationCode(anyString());
    }

    @Test
    @DisplayName("❌ Gives up after repeated collisions")
    void givesUp() {
        given(accountRepository.existsByVerificationCode(anyString())).willReturn(true);
        VerificationCodeGenerator generator = new VerificationCodeGenerator(accountRepository, 6);

        assertThatThrownBy(generator::generateUniqueCode).isInstanceOf(IllegalStateException.class);
    }
}
