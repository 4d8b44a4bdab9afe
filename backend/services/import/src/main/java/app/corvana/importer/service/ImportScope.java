package app.corvana.importer.service;

import java.util.UUID;

/**
 * Who an import runs for: the caller's token is forwarded to the core service, the workspace scopes every read
 * and write. {@code accountId} is only set for transaction imports.
 */
public record ImportScope(
        String accessToken,
        UUID workspaceId,
        UUID accountId
) {
}
