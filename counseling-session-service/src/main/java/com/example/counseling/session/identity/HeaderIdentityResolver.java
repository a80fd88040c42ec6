package com.example.counseling.session.identity;

import com.example.counseling.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Reads the identity headers set by the authenticating proxy, falling back to query
 * parameters (browsers cannot set headers on a WebSocket handshake) when allowed.
 */
@Component
@RequiredArgsConstructor
public class HeaderIdentityResolver implements IdentityResolver {

    private final AppProperties appProperties;

    @Override
    public Optional<AuthenticatedUser> resolve(HttpHeaders headers, URI uri) {
        AppProperties.Identity identity = appProperties.getIdentity();
        String userId = trimToNull(headers.getFirst(identity.getUserHeader()));
        String username = trimToNull(headers.getFirst(identity.getUsernameHeader()));

        if (userId == null && identity.isAllowQueryParameters() && uri != null) {
            MultiValueMap<String, String> query = UriComponentsBuilder.fromUri(uri).build().getQueryParams();
            userId = decode(query.getFirst(identity.getUserQueryParameter()));
            if (username == null) {
                username = decode(query.getFirst(identity.getUsernameQueryParameter()));
            }
        }
        if (userId == null) {
            return Optional.empty();
        }
        return Optional.of(new AuthenticatedUser(userId, username != null ? username : userId));
    }

    private static String decode(String value) {
        return value == null ? null : trimToNull(UriUtils.decode(value, StandardCharsets.UTF_8));
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
