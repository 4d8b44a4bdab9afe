package app.corvana.importer.service.match;

import app.corvana.importer.client.core.CoreLeadResponse;
import app.corvana.importer.config.ImportProps;
import app.corvana.importer.service.ImportScope;
import app.corvana.importer.service.entity.LeadReference;
import app.corvana.importer.service.support.ImportValues;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the free-text lead name on contact, opportunity and task rows to an existing lead by edit distance.
 * Each distinct name is scored once and the result is shared by every row carrying it.
 */
@Service
public class LeadNameMatcher {

    private static final int ALTERNATIVE_FLOOR = 50;
    private static final int MAX_ALTERNATIVES = 3;

    private final ExistingLeadLoader leadLoader;
    private final ImportProps props;

    public LeadNameMatcher(ExistingLeadLoader leadLoader, ImportProps props) {
        this.leadLoader = leadLoader;
        this.props = props;
    }

    public List<AnnotatedCandidate> annotate(ImportScope scope, List<? extends LeadReference> candidates) {
        Map<String, MatchAnnotation> byName = new LinkedHashMap<>();
        for (LeadReference candidate : candidates) {
            if (candidate.valid()) {
                byName.put(ImportValues.normalizeName(candidate.leadName()), null);
            }
        }
        if (!byName.isEmpty()) {
            List<CoreLeadResponse> leads = leadLoader.loadAll(scope);
            List<String> leadNames = leads.stream()
                    .map(lead -> ImportValues.normalizeName(lead.name()))
                    .toList();
            byName.replaceAll((name, ignored) -> match(name, leads, leadNames));
        }

        List<AnnotatedCandidate> annotated = new ArrayList<>(candidates.size());
        for (LeadReference candidate : candidates) {
            AnnotatedCandidate item = AnnotatedCandidate.of(candidate);
            if (candidate.valid()) {
                item = item.withMatch(byName.get(ImportValues.normalizeName(candidate.leadName())));
            }
            annotated.add(item);
        }
        return annotated;
    }

    MatchAnnotation match(String name, List<CoreLeadResponse> leads, List<String> leadNames) {
        if (leads.isEmpty()) {
            return MatchAnnotation.none();
        }
        List<Scored> scored = new ArrayList<>(leads.size());
        int best = 0;
        for (int i = 0; i < leads.size(); i++) {
            Scored item = new Scored(i, similarity(name, leadNames.get(i)));
            scored.add(item);
            // strictly greater: on a tie the earlier lead in fetch order wins
            if (item.score() > scored.get(best).score()) {
                best = i;
            }
        }
        Scored winner = scored.get(best);
        boolean accepted = winner.score() >= props.matchThreshold();

        List<MatchAlternative> alternatives = scored.stream()
                .filter(item -> !accepted || item.index() != winner.index())
                .filter(item -> item.score() >= ALTERNATIVE_FLOOR)
                .sorted(Comparator.comparingInt(Scored::score).reversed())
                .limit(MAX_ALTERNATIVES)
                .map(item -> {
                    CoreLeadResponse lead = leads.get(item.index());
                    return new MatchAlternative(lead.id(), lead.name(), item.score());
                })
                .toList();

        CoreLeadResponse lead = leads.get(winner.index());
        return new MatchAnnotation(accepted ? lead.id() : null, lead.name(), winner.score(), alternatives);
    }

    /**
     * 0-100, where 100 means identical after normalization.
     */
    static int similarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) {
            return 100;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        double ratio = 1.0 - (double) levenshtein(a, b) / longest;
        return (int) Math.round(ratio * 100);
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private record Scored(int index, int score) {
    }
}
