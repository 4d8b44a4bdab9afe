package app.corvana.importer.service.session;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Mutable holder of one wizard run. State changes are serialized per session; the commit flag makes sure at most
 * one commit runs at a time.
 */
public class ImportSession {

    private final UUID id;
    private final UUID workspaceId;
    private final UUID userId;
    private final AtomicBoolean committing = new AtomicBoolean(false);
    private volatile String accessToken;
    private volatile ImportSessionState state;
    private volatile Instant lastTouched;

    public ImportSession(UUID id, UUID workspaceId, UUID userId, String accessToken, Instant now) {
        this.id = id;
        this.workspaceId = workspaceId;
        this.userId = userId;
        this.accessToken = accessToken;
        this.state = ImportSessionState.initial();
        this.lastTouched = now;
    }

    public UUID id() {
        return id;
    }

    public UUID workspaceId() {
        return workspaceId;
    }

    public UUID userId() {
        return userId;
    }

    public String accessToken() {
        return accessToken;
    }

    public ImportSessionState state() {
        return state;
    }

    public Instant lastTouched() {
        return lastTouched;
    }

    public boolean committing() {
        return committing.get();
    }

    public synchronized ImportSessionState update(UnaryOperator<ImportSessionState> transition) {
        ImportSessionState next = transition.apply(state);
        state = next;
        return next;
    }

    /**
     * Marks a commit as running. Returns false when one already is.
     */
    public boolean tryBeginCommit() {
        return committing.compareAndSet(false, true);
    }

    public void endCommit() {
        committing.set(false);
    }

    void touch(String latestToken, Instant now) {
        if (latestToken != null && !latestToken.isBlank()) {
            accessToken = latestToken;
        }
        lastTouched = now;
    }
}
