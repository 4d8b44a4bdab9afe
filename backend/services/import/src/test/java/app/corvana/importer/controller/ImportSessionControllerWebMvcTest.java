package app.corvana.importer.controller;

import app.corvana.importer.config.SecurityConfig;
import app.corvana.importer.security.CurrentWorkspaceProvider;
import app.corvana.importer.service.entity.EntityType;
import app.corvana.importer.service.mapping.ContactSlotMapping;
import app.corvana.importer.service.mapping.FieldMapping;
import app.corvana.importer.service.parser.MalformedImportException;
import app.corvana.importer.service.session.IllegalImportTransitionException;
import app.corvana.importer.service.session.ImportSession;
import app.corvana.importer.service.session.ImportSessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ImportSessionController.class)
@Import(SecurityConfig.class)
@ActiveProfiles("test")
class ImportSessionControllerWebMvcTest {

    private static final UUID WORKSPACE_ID = UUID.randomUUID();
    private static final UUID USER_ID = UUID.randomUUID();

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    ImportSessionService sessionService;

    @MockitoBean
    CurrentWorkspaceProvider workspaceProvider;

    @BeforeEach
    void setUp() {
        when(workspaceProvider.requireWorkspaceId(any(Jwt.class))).thenReturn(WORKSPACE_ID);
        when(workspaceProvider.requireUserId(any(Jwt.class))).thenReturn(USER_ID);
    }

    @Test
    void create_startsSessionForWorkspace() throws Exception {
        ImportSession session = session();
        when(sessionService.create(WORKSPACE_ID, USER_ID, "token-1")).thenReturn(session);

        mockMvc.perform(post("/import-sessions")
                        .with(jwt())
                        .header("Authorization", "Bearer token-1"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId").value(session.id().toString()))
                .andExpect(jsonPath("$.step").value("select_entity_type"))
                .andExpect(jsonPath("$.committing").value(false));
    }

    @Test
    void get_unknownSessionIsNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(sessionService.get(id, WORKSPACE_ID, "token-1"))
                .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "Import session not found"));

        mockMvc.perform(get("/import-sessions/{id}", id)
                        .with(jwt())
                        .header("Authorization", "Bearer token-1"))
                .andExpect(status().isNotFound());
    }

    @Test
    void selectEntityType_passesTypeAndAccount() throws Exception {
        ImportSession session = session();
        UUID accountId = UUID.randomUUID();
        when(sessionService.selectEntityType(session.id(), WORKSPACE_ID, "token-1", EntityType.transaction, accountId))
                .thenReturn(session);

        mockMvc.perform(post("/import-sessions/{id}/entity-type", session.id())
                        .with(jwt())
                        .header("Authorization", "Bearer token-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entityType\":\"transaction\",\"accountId\":\"" + accountId + "\"}"))
                .andExpect(status().isOk());

        verify(sessionService).selectEntityType(session.id(), WORKSPACE_ID, "token-1", EntityType.transaction, accountId);
    }

    @Test
    void selectEntityType_requiresType() throws Exception {
        mockMvc.perform(post("/import-sessions/{id}/entity-type", UUID.randomUUID())
                        .with(jwt())
                        .header("Authorization", "Bearer token-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void upload_acceptsTabDelimiter() throws Exception {
        ImportSession session = session();
        byte[] content = "Company\tWebsite\nAcme\tacme.com\n".getBytes(StandardCharsets.UTF_8);
        when(sessionService.upload(eq(session.id()), eq(WORKSPACE_ID), eq("token-1"), eq("leads.tsv"), any(), eq('\t')))
                .thenReturn(session);

        mockMvc.perform(multipart("/import-sessions/{id}/file", session.id())
                        .file(new MockMultipartFile("file", "leads.tsv", "text/tab-separated-values", content))
                        .param("delimiter", "tab")
                        .with(jwt())
                        .header("Authorization", "Bearer token-1"))
                .andExpect(status().isOk());

        verify(sessionService).upload(eq(session.id()), eq(WORKSPACE_ID), eq("token-1"), eq("leads.tsv"), eq(content), eq('\t'));
    }

    @Test
    void upload_malformedFileIsBadRequest() throws Exception {
        UUID id = UUID.randomUUID();
        when(sessionService.upload(eq(id), eq(WORKSPACE_ID), eq("token-1"), any(), any(), any()))
                .thenThrow(new MalformedImportException("File is empty"));

        mockMvc.perform(multipart("/import-sessions/{id}/file", id)
                        .file(new MockMultipartFile("file", "empty.csv", "text/csv", new byte[0]))
                        .with(jwt())
                        .header("Authorization", "Bearer token-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("File is empty"));
    }

    @Test
    void editMapping_nullColumnsAreUnmapped() throws Exception {
        ImportSession session = session();
        when(sessionService.editMapping(eq(session.id()), eq(WORKSPACE_ID), eq("token-1"), any(FieldMapping.class)))
                .thenReturn(session);

        mockMvc.perform(put("/import-sessions/{id}/mapping", session.id())
                        .with(jwt())
                        .header("Authorization", "Bearer token-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"columns\":{\"date\":0,\"notes\":null},\"contactSlots\":[{\"email\":null},null]}"))
                .andExpect(status().isOk());

        ArgumentCaptor<FieldMapping> captor = ArgumentCaptor.forClass(FieldMapping.class);
        verify(sessionService).editMapping(eq(session.id()), eq(WORKSPACE_ID), eq("token-1"), captor.capture());
        FieldMapping mapping = captor.getValue();
        assertEquals(Map.of("date", 0), mapping.columns());
        assertEquals(2, mapping.contactSlots().size());
        assertTrue(mapping.contactSlots().stream().allMatch(ContactSlotMapping::isEmpty));
    }

    @Test
    void commit_isAccepted() throws Exception {
        ImportSession session = session();
        when(sessionService.commit(session.id(), WORKSPACE_ID, "token-1")).thenReturn(session);

        mockMvc.perform(post("/import-sessions/{id}/commit", session.id())
                        .with(jwt())
                        .header("Authorization", "Bearer token-1"))
                .andExpect(status().isAccepted());
    }

    @Test
    void commit_fromWrongStepIsConflict() throws Exception {
        UUID id = UUID.randomUUID();
        when(sessionService.commit(id, WORKSPACE_ID, "token-1"))
                .thenThrow(new IllegalImportTransitionException("Cannot start the import while the session is at step upload"));

        mockMvc.perform(post("/import-sessions/{id}/commit", id)
                        .with(jwt())
                        .header("Authorization", "Bearer token-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.detail").value("Cannot start the import while the session is at step upload"));
    }

    @Test
    void delete_closesSession() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(delete("/import-sessions/{id}", id)
                        .with(jwt()))
                .andExpect(status().isNoContent());

        verify(sessionService).close(id, WORKSPACE_ID);
    }

    @Test
    void requestsWithoutTokenAreUnauthorized() throws Exception {
        mockMvc.perform(post("/import-sessions"))
                .andExpect(status().isUnauthorized());
    }

    private ImportSession session() {
        return new ImportSession(UUID.randomUUID(), WORKSPACE_ID, USER_ID, "token-1", Instant.now());
    }
}
