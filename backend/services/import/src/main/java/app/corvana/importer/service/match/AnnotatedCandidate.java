package app.corvana.importer.service.match;

import app.corvana.importer.service.entity.CandidateEntity;
import com.fasterxml.jackson.annotation.JsonIgnore;

public record AnnotatedCandidate(
        CandidateEntity candidate,
        DuplicateAnnotation duplicate,
        MatchAnnotation match
) {
    public static AnnotatedCandidate of(CandidateEntity candidate) {
        return new AnnotatedCandidate(candidate, null, null);
    }

    public AnnotatedCandidate withDuplicate(DuplicateAnnotation annotation) {
        return new AnnotatedCandidate(candidate, annotation, match);
    }

    public AnnotatedCandidate withMatch(MatchAnnotation annotation) {
        return new AnnotatedCandidate(candidate, duplicate, annotation);
    }

    @JsonIgnore
    public boolean isDuplicate() {
        return duplicate != null && duplicate.duplicate();
    }

    @JsonIgnore
    public boolean isMatched() {
        return match != null && match.matched();
    }
}
