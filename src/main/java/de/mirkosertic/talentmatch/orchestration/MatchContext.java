package de.mirkosertic.talentmatch.orchestration;

import de.mirkosertic.talentmatch.model.AlgorithmConfig;
import de.mirkosertic.talentmatch.model.Proposer;
import de.mirkosertic.talentmatch.model.Reviewer;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Inputs of one strategy run: validated proposers, the truncated reviewer pool,
 * the configuration, the per-proposer result limit and the run deadline.
 */
public record MatchContext(
        List<Proposer> proposers,
        List<Reviewer> reviewers,
        AlgorithmConfig config,
        int limit,
        @Nullable Instant deadline
) {

    public MatchContext {
        proposers = List.copyOf(proposers);
        reviewers = List.copyOf(reviewers);
    }
}
