package de.mirkosertic.talentmatch.orchestration;

import de.mirkosertic.talentmatch.model.Reviewer;

import java.util.List;

/**
 * Retrieval of talent profiles, implemented by the caller's storage layer.
 * Returned lists are expected to be deduplicated; the orchestrator truncates them
 * to the candidate cap if they are not.
 */
@FunctionalInterface
public interface CandidateSource {

    List<Reviewer> findCandidates(CandidateCriteria criteria);
}
