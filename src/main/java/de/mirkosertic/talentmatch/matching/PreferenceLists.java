package de.mirkosertic.talentmatch.matching;

import de.mirkosertic.talentmatch.model.PreferenceList;
import de.mirkosertic.talentmatch.model.ScoreBreakdown;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of the preference list builder: both sides' rankings, the pairwise
 * scores they were derived from and the pairs that had to use a neutral score.
 */
public record PreferenceLists(
        Map<String, PreferenceList> proposerPrefs,
        Map<String, PreferenceList> reviewerPrefs,
        Map<String, Map<String, ScoreBreakdown>> scores,
        List<PairFallback> fallbacks
) {

    public PreferenceLists {
        proposerPrefs = Collections.unmodifiableMap(new TreeMap<>(proposerPrefs));
        reviewerPrefs = Collections.unmodifiableMap(new TreeMap<>(reviewerPrefs));
        scores = Collections.unmodifiableMap(new TreeMap<>(scores));
        fallbacks = List.copyOf(fallbacks);
    }

    /**
     * Preference lists without scores, e.g. for hand-written fixtures.
     */
    public static PreferenceLists of(final Map<String, PreferenceList> proposerPrefs,
                                     final Map<String, PreferenceList> reviewerPrefs) {
        return new PreferenceLists(proposerPrefs, reviewerPrefs, Map.of(), List.of());
    }

    public @Nullable ScoreBreakdown breakdown(final String proposerId, final String reviewerId) {
        final Map<String, ScoreBreakdown> row = scores.get(proposerId);
        return row == null ? null : row.get(reviewerId);
    }

    public boolean hasFallbacks() {
        return !fallbacks.isEmpty();
    }

    /**
     * True if any pairwise score lacks its semantic contribution.
     */
    public boolean isSemanticDegraded() {
        for (final Map<String, ScoreBreakdown> row : scores.values()) {
            for (final ScoreBreakdown breakdown : row.values()) {
                if (breakdown.semanticUnavailable() || breakdown.semanticSource().isDegraded()) {
                    return true;
                }
            }
        }
        return false;
    }
}
