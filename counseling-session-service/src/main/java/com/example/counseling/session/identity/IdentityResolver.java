package com.example.counseling.session.identity;

import com.example.counseling.shared.exception.AuthenticationRequiredException;
import org.springframework.http.HttpHeaders;

import java.net.URI;
import java.util.Optional;

/**
 * Extracts the caller identity from a handshake or HTTP request.
 */
public interface IdentityResolver {

    Optional<AuthenticatedUser> resolve(HttpHeaders headers, URI uri);

    default AuthenticatedUser require(HttpHeaders headers, URI uri) {
        return resolve(headers, uri)
                .orElseThrow(() -> new AuthenticationRequiredException("Authentication required"));
    }
}
