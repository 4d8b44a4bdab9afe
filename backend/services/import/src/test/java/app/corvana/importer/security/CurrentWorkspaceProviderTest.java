package app.corvana.importer.security;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CurrentWorkspaceProviderTest {

    private final CurrentWorkspaceProvider provider = new CurrentWorkspaceProvider();

    @Test
    void readsWorkspaceAndUserClaims() {
        UUID workspaceId = UUID.randomUUID();
        UUID userId = UUID.randomUUID();

        Jwt jwt = jwt(Map.of("workspace_id", workspaceId.toString(), "user_id", userId.toString()));

        assertEquals(workspaceId, provider.requireWorkspaceId(jwt));
        assertEquals(userId, provider.requireUserId(jwt));
    }

    @Test
    void missingWorkspaceIsForbidden() {
        Jwt jwt = jwt(Map.of("user_id", UUID.randomUUID().toString()));

        assertTrue(provider.getWorkspaceId(jwt).isEmpty());
        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> provider.requireWorkspaceId(jwt));
        assertEquals(HttpStatus.FORBIDDEN, ex.getStatusCode());
    }

    @Test
    void malformedClaimIsForbidden() {
        Jwt jwt = jwt(Map.of("workspace_id", "not-a-uuid"));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> provider.getWorkspaceId(jwt));
        assertEquals(HttpStatus.FORBIDDEN, ex.getStatusCode());
    }

    private Jwt jwt(Map<String, Object> claims) {
        Jwt.Builder builder = Jwt.withTokenValue("token")
                .header("alg", "none")
                .subject("user")
                .issuedAt(Instant.now())
                .expiresAt(Instant.now().plusSeconds(300));
        claims.forEach(builder::claim);
        return builder.build();
    }
}
