package app.corvana.importer.service.session;

import app.corvana.importer.client.core.CoreApiClient;
import app.corvana.importer.client.core.CoreBatchResponse;
import app.corvana.importer.client.core.CoreContactRequest;
import app.corvana.importer.client.core.CoreLeadContactRequest;
import app.corvana.importer.client.core.CoreLeadRequest;
import app.corvana.importer.client.core.CoreOpportunityRequest;
import app.corvana.importer.client.core.CoreTaskRequest;
import app.corvana.importer.client.core.CoreTransactionRequest;
import app.corvana.importer.service.ImportScope;
import app.corvana.importer.service.entity.CandidateEntity;
import app.corvana.importer.service.entity.ContactCandidate;
import app.corvana.importer.service.entity.EntityType;
import app.corvana.importer.service.entity.LeadCandidate;
import app.corvana.importer.service.entity.LeadContactCandidate;
import app.corvana.importer.service.entity.LeadReference;
import app.corvana.importer.service.entity.OpportunityCandidate;
import app.corvana.importer.service.entity.TaskCandidate;
import app.corvana.importer.service.entity.TransactionCandidate;
import app.corvana.importer.service.match.AnnotatedCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Sends the accepted rows of a previewed session to the core service in one batch and accounts for every valid
 * row. Nothing is retried.
 */
@Service
public class ImportCommitService {

    private static final Logger log = LoggerFactory.getLogger(ImportCommitService.class);

    private final CoreApiClient coreApiClient;

    public ImportCommitService(CoreApiClient coreApiClient) {
        this.coreApiClient = coreApiClient;
    }

    public ImportResult commit(ImportScope scope, ImportSessionState state) {
        EntityType type = state.entityType();
        List<CandidateEntity> accepted = new ArrayList<>();
        List<LeadLink> duplicateLeads = new ArrayList<>();
        Set<String> unmatchedNames = new LinkedHashSet<>();
        int skippedDuplicates = 0;
        int skippedUnmatched = 0;

        for (AnnotatedCandidate item : state.candidates()) {
            switch (CandidateSelection.classify(item, type, state.options())) {
                case invalid -> {
                    // rejected on preview, not part of the accounting
                }
                case unmatched -> {
                    skippedUnmatched++;
                    unmatchedNames.add(((LeadReference) item.candidate()).leadName());
                }
                case duplicate -> {
                    skippedDuplicates++;
                    if (type == EntityType.lead && item.duplicate().matchedExistingId() != null) {
                        duplicateLeads.add(new LeadLink((LeadCandidate) item.candidate(), item.duplicate().matchedExistingId()));
                    }
                }
                case accepted -> accepted.add(item.candidate());
            }
        }

        Map<CandidateEntity, UUID> leadIds = new HashMap<>();
        if (type.leadReferencing()) {
            for (AnnotatedCandidate item : state.candidates()) {
                if (item.isMatched()) {
                    leadIds.put(item.candidate(), item.match().matchedRecordId());
                }
            }
        }

        List<String> errors = new ArrayList<>();
        BatchOutcome outcome = accepted.isEmpty()
                ? new BatchOutcome(0, 0, 0, false)
                : sendBatch(scope, type, accepted, leadIds, errors);
        int contactsForExistingLeads = attachContacts(scope, duplicateLeads, errors);

        ImportResult result = new ImportResult(
                !outcome.wholeBatchFailed(),
                outcome.imported(),
                outcome.failed(),
                skippedDuplicates,
                skippedUnmatched,
                outcome.subEntitiesCreated(),
                contactsForExistingLeads,
                errors,
                new ArrayList<>(unmatchedNames)
        );
        log.info(
                "Import committed: workspaceId={}, type={}, imported={}, failed={}, skippedDuplicates={}, skippedUnmatched={}, contactsForExistingLeads={}",
                scope.workspaceId(),
                type,
                result.imported(),
                result.failed(),
                result.skippedDuplicates(),
                result.skippedUnmatched(),
                result.contactsForExistingLeads()
        );
        return result;
    }

    private BatchOutcome sendBatch(ImportScope scope,
                                   EntityType type,
                                   List<CandidateEntity> accepted,
                                   Map<CandidateEntity, UUID> leadIds,
                                   List<String> errors) {
        CoreBatchResponse response;
        try {
            response = switch (type) {
                case transaction -> coreApiClient.createTransactionsBatch(scope.accessToken(), scope.workspaceId(),
                        accepted.stream().map(c -> toRequest((TransactionCandidate) c, scope.accountId())).toList());
                case lead -> coreApiClient.createLeadsBatch(scope.accessToken(), scope.workspaceId(),
                        accepted.stream().map(c -> toRequest((LeadCandidate) c)).toList());
                case contact -> coreApiClient.createContactsBatch(scope.accessToken(), scope.workspaceId(),
                        accepted.stream().map(c -> toRequest((ContactCandidate) c, leadIds.get(c))).toList());
                case opportunity -> coreApiClient.createOpportunitiesBatch(scope.accessToken(), scope.workspaceId(),
                        accepted.stream().map(c -> toRequest((OpportunityCandidate) c, leadIds.get(c))).toList());
                case task -> coreApiClient.createTasksBatch(scope.accessToken(), scope.workspaceId(),
                        accepted.stream().map(c -> toRequest((TaskCandidate) c, leadIds.get(c))).toList());
            };
        } catch (RestClientException ex) {
            String error = summarizeError(ex);
            log.warn("Import batch failed: workspaceId={}, type={}, rows={}, error={}",
                    scope.workspaceId(), type, accepted.size(), error);
            errors.add("Import failed for all " + accepted.size() + " rows: " + error);
            return new BatchOutcome(0, accepted.size(), 0, true);
        }

        Map<Integer, CoreBatchResponse.Inserted> inserted = new HashMap<>();
        for (CoreBatchResponse.Inserted item : response.inserted()) {
            inserted.putIfAbsent(item.ref(), item);
        }
        Map<Integer, String> failures = new HashMap<>();
        for (CoreBatchResponse.Failure failure : response.failures()) {
            failures.putIfAbsent(failure.ref(), failure.message());
        }

        int imported = 0;
        int failed = 0;
        int subEntities = 0;
        for (CandidateEntity candidate : accepted) {
            CoreBatchResponse.Inserted ok = inserted.get(candidate.rowIndex());
            if (ok != null) {
                imported++;
                subEntities += ok.subEntitiesCreated();
                continue;
            }
            failed++;
            String reason = failures.get(candidate.rowIndex());
            errors.add(rowError(candidate, reason == null || reason.isBlank() ? "no result returned for this row" : reason));
        }
        return new BatchOutcome(imported, failed, subEntities, false);
    }

    private int attachContacts(ImportScope scope, List<LeadLink> duplicateLeads, List<String> errors) {
        List<CoreContactRequest> requests = new ArrayList<>();
        Map<Integer, LeadCandidate> byRow = new HashMap<>();
        for (LeadLink link : duplicateLeads) {
            for (LeadContactCandidate contact : link.lead().contacts()) {
                requests.add(new CoreContactRequest(link.lead().rowIndex(), link.existingLeadId(), contact.firstName(),
                        contact.lastName(), contact.email(), contact.phone(), contact.title(), null));
                byRow.put(link.lead().rowIndex(), link.lead());
            }
        }
        if (requests.isEmpty()) {
            return 0;
        }
        try {
            CoreBatchResponse response = coreApiClient.createContactsBatch(scope.accessToken(), scope.workspaceId(), requests);
            for (CoreBatchResponse.Failure failure : response.failures()) {
                LeadCandidate lead = byRow.get(failure.ref());
                String reason = "contact not attached to existing lead: " + failure.message();
                errors.add(lead == null ? reason : rowError(lead, reason));
            }
            return response.inserted().size();
        } catch (RestClientException ex) {
            String error = summarizeError(ex);
            log.warn("Attaching contacts to existing leads failed: workspaceId={}, contacts={}, error={}",
                    scope.workspaceId(), requests.size(), error);
            errors.add("Contacts for existing leads could not be attached: " + error);
            return 0;
        }
    }

    /**
     * Result for a commit that could not run at all: every accepted row counts as failed.
     */
    public ImportResult failure(ImportSessionState state, String error) {
        int failed = 0;
        int skippedDuplicates = 0;
        int skippedUnmatched = 0;
        Set<String> unmatchedNames = new LinkedHashSet<>();
        for (AnnotatedCandidate item : state.candidates()) {
            switch (CandidateSelection.classify(item, state.entityType(), state.options())) {
                case accepted -> failed++;
                case duplicate -> skippedDuplicates++;
                case unmatched -> {
                    skippedUnmatched++;
                    unmatchedNames.add(((LeadReference) item.candidate()).leadName());
                }
                case invalid -> {
                    // not counted
                }
            }
        }
        return new ImportResult(false, 0, failed, skippedDuplicates, skippedUnmatched, 0, 0,
                List.of("Import failed: " + error), new ArrayList<>(unmatchedNames));
    }

    static String rowError(CandidateEntity candidate, String reason) {
        String key = candidate.displayKey();
        return "Row " + (candidate.rowIndex() + 1) + (key == null ? "" : " (" + key + ")") + ": " + reason;
    }

    private CoreTransactionRequest toRequest(TransactionCandidate c, UUID accountId) {
        return new CoreTransactionRequest(c.rowIndex(), accountId, c.date(), c.amount(), c.description(), c.notes());
    }

    private CoreLeadRequest toRequest(LeadCandidate c) {
        List<CoreLeadContactRequest> contacts = c.contacts().stream()
                .map(contact -> new CoreLeadContactRequest(contact.firstName(), contact.lastName(), contact.email(),
                        contact.phone(), contact.title()))
                .toList();
        return new CoreLeadRequest(c.rowIndex(), c.name(), c.website(), c.industry(), c.status().value(), c.notes(),
                c.address(), c.city(), c.state(), c.country(), c.postalCode(), c.source(), contacts);
    }

    private CoreContactRequest toRequest(ContactCandidate c, UUID leadId) {
        return new CoreContactRequest(c.rowIndex(), leadId, c.firstName(), c.lastName(), c.email(), c.phone(),
                c.title(), c.notes());
    }

    private CoreOpportunityRequest toRequest(OpportunityCandidate c, UUID leadId) {
        return new CoreOpportunityRequest(c.rowIndex(), leadId, c.name(), c.value(), c.valueType().value(),
                c.probability(), c.expectedCloseDate(), c.status().value(), c.notes());
    }

    private CoreTaskRequest toRequest(TaskCandidate c, UUID leadId) {
        return new CoreTaskRequest(c.rowIndex(), leadId, c.title(), c.description(), c.dueDate());
    }

    static String summarizeError(Throwable throwable) {
        if (throwable == null) {
            return "Unknown error";
        }
        Throwable root = throwable;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }
        String fallback = throwable.getMessage();
        if (fallback != null && !fallback.isBlank()) {
            return fallback;
        }
        return throwable.getClass().getSimpleName();
    }

    private record LeadLink(LeadCandidate lead, UUID existingLeadId) {
    }

    private record BatchOutcome(int imported, int failed, int subEntitiesCreated, boolean wholeBatchFailed) {
    }
}
