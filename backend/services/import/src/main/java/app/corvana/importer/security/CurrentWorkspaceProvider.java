package app.corvana.importer.security;

import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;
import java.util.UUID;

/**
 * Reads the tenant of a request from the caller's token. Membership was checked when the token was issued.
 */
@Component
public class CurrentWorkspaceProvider {

    public Optional<UUID> getWorkspaceId(Jwt jwt) {
        return uuidClaim(jwt, "workspace_id");
    }

    public Optional<UUID> getUserId(Jwt jwt) {
        return uuidClaim(jwt, "user_id");
    }

    public UUID requireWorkspaceId(Jwt jwt) {
        return getWorkspaceId(jwt)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.FORBIDDEN, "workspace_id claim missing"));
    }

    public UUID requireUserId(Jwt jwt) {
        return getUserId(jwt)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.FORBIDDEN, "user_id claim missing"));
    }

    private Optional<UUID> uuidClaim(Jwt jwt, String name) {
        if (jwt == null) {
            return Optional.empty();
        }
        String claim = jwt.getClaimAsString(name);
        if (claim == null || claim.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(claim));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, name + " claim is not a valid id", ex);
        }
    }
}
