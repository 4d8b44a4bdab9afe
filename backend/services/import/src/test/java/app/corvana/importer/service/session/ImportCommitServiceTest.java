package app.corvana.importer.service.session;

import app.corvana.importer.client.core.CoreApiClient;
import app.corvana.importer.client.core.CoreBatchResponse;
import app.corvana.importer.client.core.CoreContactRequest;
import app.corvana.importer.client.core.CoreLeadRequest;
import app.corvana.importer.client.core.CoreTransactionRequest;
import app.corvana.importer.service.ImportScope;
import app.corvana.importer.service.entity.ContactCandidate;
import app.corvana.importer.service.entity.EntityType;
import app.corvana.importer.service.entity.LeadCandidate;
import app.corvana.importer.service.entity.LeadContactCandidate;
import app.corvana.importer.service.entity.LeadStatus;
import app.corvana.importer.service.entity.TransactionCandidate;
import app.corvana.importer.service.match.AnnotatedCandidate;
import app.corvana.importer.service.match.DuplicateAnnotation;
import app.corvana.importer.service.match.DuplicateReason;
import app.corvana.importer.service.match.MatchAnnotation;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ImportCommitServiceTest {

    private static final UUID WORKSPACE_ID = UUID.randomUUID();
    private static final UUID ACCOUNT_ID = UUID.randomUUID();
    private static final ImportScope SCOPE = new ImportScope("token", WORKSPACE_ID, ACCOUNT_ID);

    private final CoreApiClient coreApiClient = mock(CoreApiClient.class);
    private final ImportCommitService service = new ImportCommitService(coreApiClient);

    @Test
    @SuppressWarnings("unchecked")
    void accountsForEveryValidRowOnPartialSuccess() {
        ImportSessionState state = state(EntityType.transaction, ImportOptions.defaults(),
                AnnotatedCandidate.of(tx(0, "Coffee")),
                AnnotatedCandidate.of(tx(1, "Lunch")),
                AnnotatedCandidate.of(tx(2, "Tea")),
                AnnotatedCandidate.of(tx(3, "Coffee"))
                        .withDuplicate(DuplicateAnnotation.ofExisting(UUID.randomUUID(), DuplicateReason.same_transaction)),
                AnnotatedCandidate.of(new TransactionCandidate(4, null, null, "Broken", null, false,
                        List.of("Date is required")))
        );
        when(coreApiClient.createTransactionsBatch(eq("token"), eq(WORKSPACE_ID), anyList())).thenReturn(
                new CoreBatchResponse(
                        List.of(new CoreBatchResponse.Inserted(0, UUID.randomUUID(), 0)),
                        List.of(new CoreBatchResponse.Failure(1, "amount out of range"))
                ));

        ImportResult result = service.commit(SCOPE, state);

        assertTrue(result.success());
        assertEquals(1, result.imported());
        assertEquals(2, result.failed());
        assertEquals(1, result.skippedDuplicates());
        assertEquals(0, result.skippedUnmatched());
        assertEquals(4, result.imported() + result.failed() + result.skippedDuplicates() + result.skippedUnmatched());
        assertEquals(List.of(
                "Row 2 (Lunch): amount out of range",
                "Row 3 (Tea): no result returned for this row"
        ), result.errors());

        ArgumentCaptor<List<CoreTransactionRequest>> captor = ArgumentCaptor.forClass((Class) List.class);
        verify(coreApiClient).createTransactionsBatch(eq("token"), eq(WORKSPACE_ID), captor.capture());
        assertEquals(List.of(0, 1, 2), captor.getValue().stream().map(CoreTransactionRequest::ref).toList());
        assertEquals(ACCOUNT_ID, captor.getValue().get(0).accountId());
    }

    @Test
    void transportFailureFailsEveryAcceptedRow() {
        ImportSessionState state = state(EntityType.transaction, ImportOptions.defaults(),
                AnnotatedCandidate.of(tx(0, "Coffee")),
                AnnotatedCandidate.of(tx(1, "Lunch"))
        );
        when(coreApiClient.createTransactionsBatch(any(), any(), anyList()))
                .thenThrow(new ResourceAccessException("I/O error", new IOException("Connection refused")));

        ImportResult result = service.commit(SCOPE, state);

        assertFalse(result.success());
        assertEquals(0, result.imported());
        assertEquals(2, result.failed());
        assertEquals(List.of("Import failed for all 2 rows: Connection refused"), result.errors());
    }

    @Test
    void duplicatesAreSentWhenIncluded() {
        ImportSessionState state = state(EntityType.transaction, new ImportOptions(true, false),
                AnnotatedCandidate.of(tx(0, "Coffee")).withDuplicate(DuplicateAnnotation.ofRow(0))
        );
        when(coreApiClient.createTransactionsBatch(any(), any(), anyList())).thenReturn(
                new CoreBatchResponse(List.of(new CoreBatchResponse.Inserted(0, UUID.randomUUID(), 0)), List.of()));

        ImportResult result = service.commit(SCOPE, state);

        assertEquals(1, result.imported());
        assertEquals(0, result.skippedDuplicates());
    }

    @Test
    @SuppressWarnings("unchecked")
    void contactsOfDuplicateLeadsGoToTheExistingLead() {
        UUID existingLead = UUID.randomUUID();
        LeadCandidate fresh = lead(0, "Initech", List.of(new LeadContactCandidate("Peter", null, null, null, null)));
        LeadCandidate known = lead(1, "Acme", List.of(
                new LeadContactCandidate("Ann", "Lee", "ann@acme.com", null, null),
                new LeadContactCandidate("Bob", null, null, null, null)));
        ImportSessionState state = state(EntityType.lead, ImportOptions.defaults(),
                AnnotatedCandidate.of(fresh),
                AnnotatedCandidate.of(known)
                        .withDuplicate(DuplicateAnnotation.ofExisting(existingLead, DuplicateReason.exact_name))
        );
        when(coreApiClient.createLeadsBatch(any(), any(), anyList())).thenReturn(
                new CoreBatchResponse(List.of(new CoreBatchResponse.Inserted(0, UUID.randomUUID(), 1)), List.of()));
        when(coreApiClient.createContactsBatch(any(), any(), anyList())).thenReturn(
                new CoreBatchResponse(List.of(
                        new CoreBatchResponse.Inserted(1, UUID.randomUUID(), 0),
                        new CoreBatchResponse.Inserted(1, UUID.randomUUID(), 0)), List.of()));

        ImportResult result = service.commit(SCOPE, state);

        assertEquals(1, result.imported());
        assertEquals(1, result.subEntitiesCreated());
        assertEquals(1, result.skippedDuplicates());
        assertEquals(2, result.contactsForExistingLeads());

        ArgumentCaptor<List<CoreLeadRequest>> leads = ArgumentCaptor.forClass((Class) List.class);
        verify(coreApiClient).createLeadsBatch(eq("token"), eq(WORKSPACE_ID), leads.capture());
        assertEquals("new", leads.getValue().get(0).status());
        assertEquals("Peter", leads.getValue().get(0).contacts().get(0).firstName());

        ArgumentCaptor<List<CoreContactRequest>> contacts = ArgumentCaptor.forClass((Class) List.class);
        verify(coreApiClient).createContactsBatch(eq("token"), eq(WORKSPACE_ID), contacts.capture());
        assertEquals(2, contacts.getValue().size());
        assertTrue(contacts.getValue().stream().allMatch(c -> existingLead.equals(c.leadId())));
    }

    @Test
    @SuppressWarnings("unchecked")
    void unmatchedRowsAreSkippedAndNamed() {
        UUID acme = UUID.randomUUID();
        ImportSessionState state = state(EntityType.contact, new ImportOptions(true, true),
                AnnotatedCandidate.of(contact(0, "Acme", "Ann"))
                        .withMatch(new MatchAnnotation(acme, "Acme", 100, List.of())),
                AnnotatedCandidate.of(contact(1, "Nowhere", "Bob"))
                        .withMatch(new MatchAnnotation(null, "Acme", 40, List.of())),
                AnnotatedCandidate.of(contact(2, "Nowhere", "Cy"))
                        .withMatch(new MatchAnnotation(null, "Acme", 40, List.of()))
        );
        when(coreApiClient.createContactsBatch(any(), any(), anyList())).thenReturn(
                new CoreBatchResponse(List.of(new CoreBatchResponse.Inserted(0, UUID.randomUUID(), 0)), List.of()));

        ImportResult result = service.commit(SCOPE, state);

        assertEquals(1, result.imported());
        assertEquals(2, result.skippedUnmatched());
        assertEquals(List.of("Nowhere"), result.unmatchedNames());

        ArgumentCaptor<List<CoreContactRequest>> captor = ArgumentCaptor.forClass((Class) List.class);
        verify(coreApiClient).createContactsBatch(eq("token"), eq(WORKSPACE_ID), captor.capture());
        assertEquals(1, captor.getValue().size());
        assertEquals(acme, captor.getValue().get(0).leadId());
    }

    @Test
    void nothingAcceptedMeansNoCall() {
        ImportSessionState state = state(EntityType.transaction, ImportOptions.defaults(),
                AnnotatedCandidate.of(tx(0, "Coffee")).withDuplicate(DuplicateAnnotation.ofRow(0)));

        ImportResult result = service.commit(SCOPE, state);

        assertTrue(result.success());
        assertEquals(1, result.skippedDuplicates());
        verify(coreApiClient, never()).createTransactionsBatch(any(), any(), anyList());
    }

    @Test
    void failureResultCountsAcceptedRowsAsFailed() {
        ImportSessionState state = state(EntityType.transaction, ImportOptions.defaults(),
                AnnotatedCandidate.of(tx(0, "Coffee")),
                AnnotatedCandidate.of(tx(1, "Lunch")).withDuplicate(DuplicateAnnotation.ofRow(0)));

        ImportResult result = service.failure(state, "boom");

        assertFalse(result.success());
        assertEquals(1, result.failed());
        assertEquals(1, result.skippedDuplicates());
        assertEquals(List.of("Import failed: boom"), result.errors());
    }

    @Test
    void summarizesTheRootCause() {
        assertEquals("Connection refused", ImportCommitService.summarizeError(
                new ResourceAccessException("I/O error", new IOException("Connection refused"))));
        assertEquals("IllegalStateException", ImportCommitService.summarizeError(new IllegalStateException()));
    }

    private ImportSessionState state(EntityType type, ImportOptions options, AnnotatedCandidate... candidates) {
        List<AnnotatedCandidate> list = List.of(candidates);
        return new ImportSessionState(ImportStep.importing, type, type == EntityType.transaction ? ACCOUNT_ID : null,
                "file.csv", null, null, null, list, options, null);
    }

    private TransactionCandidate tx(int row, String description) {
        return new TransactionCandidate(row, LocalDate.of(2024, 1, 5).plusDays(row), new BigDecimal("-4.50"),
                description, null, true, List.of());
    }

    private LeadCandidate lead(int row, String name, List<LeadContactCandidate> contacts) {
        return new LeadCandidate(row, name, null, null, LeadStatus.NEW, null, null, null, null, null, null, null,
                contacts, true, List.of());
    }

    private ContactCandidate contact(int row, String leadName, String firstName) {
        return new ContactCandidate(row, leadName, firstName, null, null, null, null, null, true, List.of());
    }
}
