package com.example.counseling.session.identity;

/**
 * Caller identity as established by the upstream authentication layer.
 */
public record AuthenticatedUser(String userId, String username) {
}
