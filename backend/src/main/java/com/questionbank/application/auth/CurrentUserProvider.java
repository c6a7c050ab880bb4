package com.questionbank.application.auth;

import com.questionbank.application.auth.exception.UnauthorizedException;

import java.util.Optional;

/**
 * Resolves the administrator behind the current request.
 */
public interface CurrentUserProvider {

    Optional<String> currentUserId();

    default String requireUserId() {
        return currentUserId().orElseThrow(UnauthorizedException::new);
    }
}
