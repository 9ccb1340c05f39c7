package com.anotaai.api.users.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * BCrypt behind a boolean contract: a failed check and a broken hash look the same to callers.
 */
@Slf4j
@Component
public class PasswordHasher {

    private final PasswordEncoder encoder;

    public PasswordHasher(PasswordEncoder encoder) {
        this.encoder = encoder;
    }

    public String hash(String raw) {
        return encoder.encode(raw);
    }

    public boolean matches(String candidate, String storedHash) {
        if (candidate == null || storedHash == null || storedHash.isBlank()) return false;
        try {
            return encoder.matches(candidate, storedHash);
        } catch (RuntimeException e) {
            log.warn("password_verify_failed err={}", e.getClass().getSimpleName());
            return false;
        }
    }
}
