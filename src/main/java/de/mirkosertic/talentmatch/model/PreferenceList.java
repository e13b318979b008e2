package de.mirkosertic.talentmatch.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One entity's ranking of the opposite side, best first.
 */
public record PreferenceList(String ownerId, List<String> rankedIds) {

    public PreferenceList {
        rankedIds = List.copyOf(rankedIds);
        final Set<String> seen = new HashSet<>();
        for (final String id : rankedIds) {
            if (!seen.add(id)) {
                throw new InvalidSpecificationException("Preference list of " + ownerId + " lists " + id + " twice");
            }
        }
    }

    /**
     * Position of the given id, lower is better, or -1 if absent.
     */
    public int rankOf(final String id) {
        return rankedIds.indexOf(id);
    }

    public int size() {
        return rankedIds.size();
    }

    public String get(final int rank) {
        return rankedIds.get(rank);
    }
}
