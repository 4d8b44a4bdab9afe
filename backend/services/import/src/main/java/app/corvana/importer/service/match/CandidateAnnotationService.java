package app.corvana.importer.service.match;

import app.corvana.importer.service.ImportScope;
import app.corvana.importer.service.entity.CandidateEntity;
import app.corvana.importer.service.entity.EntityType;
import app.corvana.importer.service.entity.LeadCandidate;
import app.corvana.importer.service.entity.LeadReference;
import app.corvana.importer.service.entity.TransactionCandidate;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class CandidateAnnotationService {

    private final DuplicateDetectionService duplicateDetectionService;
    private final LeadNameMatcher leadNameMatcher;

    public CandidateAnnotationService(DuplicateDetectionService duplicateDetectionService,
                                      LeadNameMatcher leadNameMatcher) {
        this.duplicateDetectionService = duplicateDetectionService;
        this.leadNameMatcher = leadNameMatcher;
    }

    public List<AnnotatedCandidate> annotate(ImportScope scope, EntityType type, List<? extends CandidateEntity> candidates) {
        return switch (type) {
            case transaction -> duplicateDetectionService.annotateTransactions(scope, cast(candidates, TransactionCandidate.class));
            case lead -> duplicateDetectionService.annotateLeads(scope, cast(candidates, LeadCandidate.class));
            case contact, opportunity, task -> leadNameMatcher.annotate(scope, cast(candidates, LeadReference.class));
        };
    }

    private <T> List<T> cast(List<? extends CandidateEntity> candidates, Class<T> type) {
        return candidates.stream().map(type::cast).toList();
    }
}
