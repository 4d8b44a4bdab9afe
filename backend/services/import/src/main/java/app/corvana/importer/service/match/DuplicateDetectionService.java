package app.corvana.importer.service.match;

import app.corvana.importer.client.core.CoreApiClient;
import app.corvana.importer.client.core.CoreLeadResponse;
import app.corvana.importer.client.core.CoreTransactionResponse;
import app.corvana.importer.service.ImportScope;
import app.corvana.importer.service.entity.LeadCandidate;
import app.corvana.importer.service.entity.TransactionCandidate;
import app.corvana.importer.service.support.ImportValues;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Flags candidates that already exist in the workspace or repeat an earlier row of the same file.
 * One read from the core service per call; results are aligned to the input by index.
 */
@Service
public class DuplicateDetectionService {

    private final CoreApiClient coreApiClient;
    private final ExistingLeadLoader leadLoader;

    public DuplicateDetectionService(CoreApiClient coreApiClient, ExistingLeadLoader leadLoader) {
        this.coreApiClient = coreApiClient;
        this.leadLoader = leadLoader;
    }

    public List<AnnotatedCandidate> annotateTransactions(ImportScope scope, List<TransactionCandidate> candidates) {
        LocalDate from = null;
        LocalDate to = null;
        for (TransactionCandidate candidate : candidates) {
            if (!checkable(candidate)) {
                continue;
            }
            if (from == null || candidate.date().isBefore(from)) {
                from = candidate.date();
            }
            if (to == null || candidate.date().isAfter(to)) {
                to = candidate.date();
            }
        }

        Map<TransactionKey, UUID> existing = new HashMap<>();
        if (from != null) {
            List<CoreTransactionResponse> stored =
                    coreApiClient.getTransactions(scope.accessToken(), scope.workspaceId(), scope.accountId(), from, to);
            for (CoreTransactionResponse tx : stored) {
                if (tx == null || tx.date() == null || tx.amount() == null) {
                    continue;
                }
                UUID account = tx.accountId() == null ? scope.accountId() : tx.accountId();
                existing.putIfAbsent(TransactionKey.of(tx.date(), tx.amount(), account), tx.id());
            }
        }

        Map<TransactionKey, Integer> seenRows = new HashMap<>();
        List<AnnotatedCandidate> annotated = new ArrayList<>(candidates.size());
        for (TransactionCandidate candidate : candidates) {
            AnnotatedCandidate item = AnnotatedCandidate.of(candidate);
            if (checkable(candidate)) {
                TransactionKey key = TransactionKey.of(candidate.date(), candidate.amount(), scope.accountId());
                if (existing.containsKey(key)) {
                    item = item.withDuplicate(DuplicateAnnotation.ofExisting(existing.get(key), DuplicateReason.same_transaction));
                } else if (seenRows.containsKey(key)) {
                    item = item.withDuplicate(DuplicateAnnotation.ofRow(seenRows.get(key)));
                }
                seenRows.putIfAbsent(key, candidate.rowIndex());
            }
            annotated.add(item);
        }
        return annotated;
    }

    public List<AnnotatedCandidate> annotateLeads(ImportScope scope, List<LeadCandidate> candidates) {
        Map<String, UUID> byName = new HashMap<>();
        Map<String, UUID> byDomain = new HashMap<>();
        if (candidates.stream().anyMatch(LeadCandidate::valid)) {
            for (CoreLeadResponse lead : leadLoader.loadAll(scope)) {
                String name = ImportValues.normalizeName(lead.name());
                if (!name.isEmpty()) {
                    byName.putIfAbsent(name, lead.id());
                }
                String domain = ImportValues.websiteDomain(lead.website());
                if (domain != null) {
                    byDomain.putIfAbsent(domain, lead.id());
                }
            }
        }

        Map<String, Integer> seenNames = new HashMap<>();
        Map<String, Integer> seenDomains = new HashMap<>();
        List<AnnotatedCandidate> annotated = new ArrayList<>(candidates.size());
        for (LeadCandidate candidate : candidates) {
            AnnotatedCandidate item = AnnotatedCandidate.of(candidate);
            if (candidate.valid()) {
                String name = ImportValues.normalizeName(candidate.name());
                String domain = ImportValues.websiteDomain(candidate.website());
                DuplicateAnnotation duplicate = existingLead(byName.get(name), domain == null ? null : byDomain.get(domain));
                if (duplicate == null) {
                    Integer earlier = seenNames.get(name);
                    if (earlier == null && domain != null) {
                        earlier = seenDomains.get(domain);
                    }
                    if (earlier != null) {
                        duplicate = DuplicateAnnotation.ofRow(earlier);
                    }
                }
                if (duplicate != null) {
                    item = item.withDuplicate(duplicate);
                }
                seenNames.putIfAbsent(name, candidate.rowIndex());
                if (domain != null) {
                    seenDomains.putIfAbsent(domain, candidate.rowIndex());
                }
            }
            annotated.add(item);
        }
        return annotated;
    }

    private DuplicateAnnotation existingLead(UUID byName, UUID byDomain) {
        if (byName != null && byName.equals(byDomain)) {
            return DuplicateAnnotation.ofExisting(byName, DuplicateReason.exact_name_and_domain);
        }
        if (byName != null) {
            return DuplicateAnnotation.ofExisting(byName, DuplicateReason.exact_name);
        }
        if (byDomain != null) {
            return DuplicateAnnotation.ofExisting(byDomain, DuplicateReason.same_domain);
        }
        return null;
    }

    private boolean checkable(TransactionCandidate candidate) {
        return candidate.valid() && candidate.date() != null && candidate.amount() != null;
    }

    private record TransactionKey(LocalDate date, BigDecimal amount, UUID accountId) {
        static TransactionKey of(LocalDate date, BigDecimal amount, UUID accountId) {
            // 12.5 and 12.50 are the same amount
            return new TransactionKey(date, amount.stripTrailingZeros(), accountId);
        }
    }
}
