package app.corvana.importer.service.session;

import app.corvana.importer.service.ImportScope;
import app.corvana.importer.service.entity.CandidateEntity;
import app.corvana.importer.service.entity.EntityImportHandler;
import app.corvana.importer.service.entity.EntityImportHandlerRegistry;
import app.corvana.importer.service.entity.EntityType;
import app.corvana.importer.service.mapping.CanonicalField;
import app.corvana.importer.service.mapping.DetectedMapping;
import app.corvana.importer.service.mapping.FieldMapping;
import app.corvana.importer.service.mapping.MappingValidation;
import app.corvana.importer.service.match.AnnotatedCandidate;
import app.corvana.importer.service.match.CandidateAnnotationService;
import app.corvana.importer.service.parser.CsvTableParser;
import app.corvana.importer.service.parser.ParsedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * Runs the side effects around each wizard step (parsing, reads from the core service, the commit) and applies
 * the matching {@link ImportStateMachine} transition to the session.
 */
@Service
public class ImportSessionService {

    private static final Logger log = LoggerFactory.getLogger(ImportSessionService.class);

    private final ImportSessionRegistry registry;
    private final ImportStateMachine stateMachine;
    private final CsvTableParser parser;
    private final EntityImportHandlerRegistry handlers;
    private final CandidateAnnotationService annotationService;
    private final ImportCommitService commitService;
    private final TaskExecutor importTaskExecutor;

    public ImportSessionService(ImportSessionRegistry registry,
                                ImportStateMachine stateMachine,
                                CsvTableParser parser,
                                EntityImportHandlerRegistry handlers,
                                CandidateAnnotationService annotationService,
                                ImportCommitService commitService,
                                @Qualifier("importTaskExecutor") TaskExecutor importTaskExecutor) {
        this.registry = registry;
        this.stateMachine = stateMachine;
        this.parser = parser;
        this.handlers = handlers;
        this.annotationService = annotationService;
        this.commitService = commitService;
        this.importTaskExecutor = importTaskExecutor;
    }

    public ImportSession create(UUID workspaceId, UUID userId, String accessToken) {
        ImportSession session = registry.create(workspaceId, userId, accessToken);
        log.info("Import session created: sessionId={}, workspaceId={}, userId={}", session.id(), workspaceId, userId);
        return session;
    }

    public ImportSession get(UUID sessionId, UUID workspaceId, String accessToken) {
        return registry.require(sessionId, workspaceId, accessToken);
    }

    public ImportSession selectEntityType(UUID sessionId, UUID workspaceId, String accessToken,
                                          EntityType type, UUID accountId) {
        ImportSession session = registry.require(sessionId, workspaceId, accessToken);
        session.update(state -> stateMachine.selectEntityType(state, type, accountId));
        return session;
    }

    public ImportSession upload(UUID sessionId, UUID workspaceId, String accessToken,
                                String fileName, byte[] content, Character delimiter) {
        ImportSession session = registry.require(sessionId, workspaceId, accessToken);
        ImportSessionState current = session.state();
        if (current.step() != ImportStep.upload && current.step() != ImportStep.map_columns) {
            throw new IllegalImportTransitionException("Cannot upload a file while the session is at step " + current.step());
        }
        ParsedTable table = parser.parse(content, delimiter);
        DetectedMapping detected = handlers.require(current.entityType()).detect(table.headers());
        session.update(state -> stateMachine.upload(state, fileName, table, detected));
        log.info("Import file parsed: sessionId={}, type={}, rows={}, columns={}",
                session.id(), current.entityType(), table.rowCount(), table.headers().size());
        return session;
    }

    public ImportSession editMapping(UUID sessionId, UUID workspaceId, String accessToken, FieldMapping mapping) {
        ImportSession session = registry.require(sessionId, workspaceId, accessToken);
        session.update(state -> stateMachine.editMapping(state, mapping));
        return session;
    }

    public List<CanonicalField> fields(EntityType type) {
        return type == null ? List.of() : handlers.require(type).fields();
    }

    public List<CanonicalField> contactSlotFields(EntityType type) {
        return type == null ? List.of() : handlers.require(type).contactSlotFields();
    }

    public MappingValidation validateMapping(ImportSessionState state) {
        if (state.entityType() == null || state.table() == null || state.mapping() == null) {
            return new MappingValidation(List.of("Upload a file before mapping columns"));
        }
        return handlers.require(state.entityType()).validateMapping(state.mapping(), state.table().headers().size());
    }

    public ImportSession preview(UUID sessionId, UUID workspaceId, String accessToken) {
        ImportSession session = registry.require(sessionId, workspaceId, accessToken);
        ImportSessionState current = session.state();
        if (current.step() != ImportStep.map_columns) {
            throw new IllegalImportTransitionException("Cannot preview while the session is at step " + current.step());
        }
        MappingValidation validation = validateMapping(current);
        if (!validation.valid()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, String.join("; ", validation.errors()));
        }

        EntityImportHandler<?> handler = handlers.require(current.entityType());
        List<? extends CandidateEntity> candidates = handler.transform(current.table(), current.mapping());
        ImportScope scope = new ImportScope(session.accessToken(), workspaceId, current.accountId());
        List<AnnotatedCandidate> annotated;
        try {
            annotated = annotationService.annotate(scope, current.entityType(), candidates);
        } catch (RestClientException ex) {
            log.warn("Preview lookup failed: sessionId={}, type={}, error={}",
                    session.id(), current.entityType(), ex.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, "Could not read existing records", ex);
        }
        session.update(state -> {
            // the candidates were built from the snapshot; a concurrent edit or upload makes them stale
            if (state.table() != current.table() || state.mapping() != current.mapping()) {
                throw new IllegalImportTransitionException("The mapping changed while the preview was built, preview again");
            }
            return stateMachine.preview(state, validation, annotated);
        });
        return session;
    }

    public ImportSession back(UUID sessionId, UUID workspaceId, String accessToken) {
        ImportSession session = registry.require(sessionId, workspaceId, accessToken);
        session.update(stateMachine::back);
        return session;
    }

    public ImportSession updateOptions(UUID sessionId, UUID workspaceId, String accessToken, ImportOptions options) {
        ImportSession session = registry.require(sessionId, workspaceId, accessToken);
        session.update(state -> stateMachine.updateOptions(state, options));
        return session;
    }

    /**
     * Moves the session to {@code importing} and hands the commit to the import executor. The caller polls the
     * session for the result.
     */
    public ImportSession commit(UUID sessionId, UUID workspaceId, String accessToken) {
        ImportSession session = registry.require(sessionId, workspaceId, accessToken);
        if (!session.tryBeginCommit()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "An import is already running for this session");
        }
        ImportSessionState importing = beginImport(session);

        ImportScope scope = new ImportScope(session.accessToken(), workspaceId, importing.accountId());
        try {
            importTaskExecutor.execute(() -> runCommit(session, scope, importing));
        } catch (TaskRejectedException ex) {
            log.warn("Import commit rejected, executor is saturated: sessionId={}", session.id());
            finish(session, commitService.failure(importing, "the service is busy, try again later"));
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Import queue is full", ex);
        }
        return session;
    }

    private ImportSessionState beginImport(ImportSession session) {
        try {
            return session.update(stateMachine::beginImport);
        } catch (RuntimeException ex) {
            session.endCommit();
            throw ex;
        }
    }

    public void close(UUID sessionId, UUID workspaceId) {
        registry.remove(sessionId, workspaceId);
        log.info("Import session closed: sessionId={}, workspaceId={}", sessionId, workspaceId);
    }

    void runCommit(ImportSession session, ImportScope scope, ImportSessionState importing) {
        ImportResult result;
        try {
            result = commitService.commit(scope, importing);
        } catch (RuntimeException ex) {
            log.error("Import commit failed: sessionId={}, workspaceId={}, type={}",
                    session.id(), scope.workspaceId(), importing.entityType(), ex);
            result = commitService.failure(importing, ImportCommitService.summarizeError(ex));
        }
        finish(session, result);
    }

    private void finish(ImportSession session, ImportResult result) {
        try {
            session.update(state -> stateMachine.completeImport(state, result));
        } finally {
            session.endCommit();
        }
    }
}
