package com.questionbank.infrastructure.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JwtProviderTest {

    private static final String SECRET = "test-signing-key-for-question-bank-admin-0123456789";

    @Test
    @DisplayName("issued token validates and carries the user id")
    void round_trip() {
        JwtProvider provider = new JwtProvider(SECRET, 60_000);

        String token = provider.generateToken("admin-1");

        assertThat(provider.validateToken(token)).isTrue();
        assertThat(provider.getUserIdFromToken(token)).isEqualTo("admin-1");
    }

    @Test
    @DisplayName("tampered, foreign and garbage tokens are rejected")
    void rejected() {
        JwtProvider provider = new JwtProvider(SECRET, 60_000);
        JwtProvider other = new JwtProvider(SECRET + "-other", 60_000);
        String token = provider.generateToken("admin-1");

        assertThat(provider.validateToken(token + "x")).isFalse();
        assertThat(provider.validateToken(other.generateToken("admin-1"))).isFalse();
        assertThat(provider.validateToken("not-a-token")).isFalse();
        assertThat(provider.validateToken("")).isFalse();
    }

    @Test
    @DisplayName("expired token is rejected")
    void expired() {
        JwtProvider provider = new JwtProvider(SECRET, -1_000);

        assertThat(provider.validateToken(provider.generateToken("admin-1"))).isFalse();
    }
}
