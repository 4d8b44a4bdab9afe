package app.corvana.importer.controller;

import app.corvana.importer.controller.dto.ImportSessionResponse;
import app.corvana.importer.controller.dto.SelectEntityTypeRequest;
import app.corvana.importer.controller.dto.UpdateMappingRequest;
import app.corvana.importer.controller.dto.UpdateOptionsRequest;
import app.corvana.importer.security.CurrentWorkspaceProvider;
import app.corvana.importer.service.session.ImportSession;
import app.corvana.importer.service.session.ImportSessionService;
import app.corvana.importer.service.session.ImportStep;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@RestController
@RequestMapping("/import-sessions")
public class ImportSessionController {

    private final ImportSessionService sessionService;
    private final CurrentWorkspaceProvider workspaceProvider;

    public ImportSessionController(ImportSessionService sessionService,
                                   CurrentWorkspaceProvider workspaceProvider) {
        this.sessionService = sessionService;
        this.workspaceProvider = workspaceProvider;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ImportSessionResponse create(@AuthenticationPrincipal Jwt jwt,
                                        @RequestHeader("Authorization") String authorization) {
        ImportSession session = sessionService.create(
                workspaceProvider.requireWorkspaceId(jwt),
                workspaceProvider.requireUserId(jwt),
                extractToken(authorization)
        );
        return view(session);
    }

    @GetMapping("/{sessionId}")
    public ImportSessionResponse get(@AuthenticationPrincipal Jwt jwt,
                                     @RequestHeader("Authorization") String authorization,
                                     @PathVariable UUID sessionId) {
        return view(sessionService.get(sessionId, workspaceProvider.requireWorkspaceId(jwt), extractToken(authorization)));
    }

    @PostMapping("/{sessionId}/entity-type")
    public ImportSessionResponse selectEntityType(@AuthenticationPrincipal Jwt jwt,
                                                  @RequestHeader("Authorization") String authorization,
                                                  @PathVariable UUID sessionId,
                                                  @Valid @RequestBody SelectEntityTypeRequest request) {
        return view(sessionService.selectEntityType(sessionId, workspaceProvider.requireWorkspaceId(jwt),
                extractToken(authorization), request.entityType(), request.accountId()));
    }

    @PostMapping(value = "/{sessionId}/file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ImportSessionResponse upload(@AuthenticationPrincipal Jwt jwt,
                                        @RequestHeader("Authorization") String authorization,
                                        @PathVariable UUID sessionId,
                                        @RequestParam(required = false) String delimiter,
                                        @RequestPart("file") MultipartFile file) {
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Failed to read uploaded file", ex);
        }
        return view(sessionService.upload(sessionId, workspaceProvider.requireWorkspaceId(jwt),
                extractToken(authorization), file.getOriginalFilename(), content, parseDelimiter(delimiter)));
    }

    @PutMapping("/{sessionId}/mapping")
    public ImportSessionResponse editMapping(@AuthenticationPrincipal Jwt jwt,
                                             @RequestHeader("Authorization") String authorization,
                                             @PathVariable UUID sessionId,
                                             @Valid @RequestBody UpdateMappingRequest request) {
        return view(sessionService.editMapping(sessionId, workspaceProvider.requireWorkspaceId(jwt),
                extractToken(authorization), request.toMapping()));
    }

    @PostMapping("/{sessionId}/preview")
    public ImportSessionResponse preview(@AuthenticationPrincipal Jwt jwt,
                                         @RequestHeader("Authorization") String authorization,
                                         @PathVariable UUID sessionId) {
        return view(sessionService.preview(sessionId, workspaceProvider.requireWorkspaceId(jwt), extractToken(authorization)));
    }

    @PostMapping("/{sessionId}/back")
    public ImportSessionResponse back(@AuthenticationPrincipal Jwt jwt,
                                      @RequestHeader("Authorization") String authorization,
                                      @PathVariable UUID sessionId) {
        return view(sessionService.back(sessionId, workspaceProvider.requireWorkspaceId(jwt), extractToken(authorization)));
    }

    @PatchMapping("/{sessionId}/options")
    public ImportSessionResponse updateOptions(@AuthenticationPrincipal Jwt jwt,
                                               @RequestHeader("Authorization") String authorization,
                                               @PathVariable UUID sessionId,
                                               @RequestBody UpdateOptionsRequest request) {
        return view(sessionService.updateOptions(sessionId, workspaceProvider.requireWorkspaceId(jwt),
                extractToken(authorization), request.toOptions()));
    }

    @PostMapping("/{sessionId}/commit")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ImportSessionResponse commit(@AuthenticationPrincipal Jwt jwt,
                                        @RequestHeader("Authorization") String authorization,
                                        @PathVariable UUID sessionId) {
        return view(sessionService.commit(sessionId, workspaceProvider.requireWorkspaceId(jwt), extractToken(authorization)));
    }

    @DeleteMapping("/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void close(@AuthenticationPrincipal Jwt jwt,
                      @PathVariable UUID sessionId) {
        sessionService.close(sessionId, workspaceProvider.requireWorkspaceId(jwt));
    }

    private ImportSessionResponse view(ImportSession session) {
        var state = session.state();
        List<String> mappingErrors = state.step() == ImportStep.map_columns
                ? sessionService.validateMapping(state).errors()
                : List.of();
        return ImportSessionResponse.from(
                session,
                sessionService.fields(state.entityType()),
                sessionService.contactSlotFields(state.entityType()),
                mappingErrors
        );
    }

    private Character parseDelimiter(String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) {
            return null;
        }
        if ("tab".equalsIgnoreCase(delimiter) || "\\t".equals(delimiter)) {
            return '\t';
        }
        if (delimiter.length() != 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Delimiter must be a single character");
        }
        return delimiter.charAt(0);
    }

    private String extractToken(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Missing access token");
        }
        String value = authorization.trim();
        if (value.toLowerCase(Locale.ROOT).startsWith("bearer ")) {
            return value.substring(7).trim();
        }
        return value;
    }
}
