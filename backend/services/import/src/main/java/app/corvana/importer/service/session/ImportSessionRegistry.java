package app.corvana.importer.service.session;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory sessions, each visible only inside the workspace that created it.
 */
@Component
public class ImportSessionRegistry {

    private final Map<UUID, ImportSession> sessions = new ConcurrentHashMap<>();

    public ImportSession create(UUID workspaceId, UUID userId, String accessToken) {
        ImportSession session = new ImportSession(UUID.randomUUID(), workspaceId, userId, accessToken, Instant.now());
        sessions.put(session.id(), session);
        return session;
    }

    public ImportSession require(UUID sessionId, UUID workspaceId, String accessToken) {
        ImportSession session = sessions.get(sessionId);
        // another workspace's session is reported exactly like a missing one
        if (session == null || !session.workspaceId().equals(workspaceId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Import session not found");
        }
        session.touch(accessToken, Instant.now());
        return session;
    }

    public void remove(UUID sessionId, UUID workspaceId) {
        ImportSession session = require(sessionId, workspaceId, null);
        sessions.remove(session.id(), session);
    }

    /**
     * Drops sessions idle since before {@code cutoff}. Sessions with a commit in flight are kept.
     */
    public List<UUID> expireIdleBefore(Instant cutoff) {
        List<UUID> expired = new ArrayList<>();
        for (ImportSession session : sessions.values()) {
            if (session.committing() || !session.lastTouched().isBefore(cutoff)) {
                continue;
            }
            if (sessions.remove(session.id(), session)) {
                expired.add(session.id());
            }
        }
        return expired;
    }

    public int size() {
        return sessions.size();
    }
}
