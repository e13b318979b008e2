package de.mirkosertic.talentmatch.orchestration;

import de.mirkosertic.talentmatch.dto.MatchRequest;
import de.mirkosertic.talentmatch.model.AlgorithmConfig;
import de.mirkosertic.talentmatch.model.InvalidSpecificationException;
import de.mirkosertic.talentmatch.model.Proposer;
import de.mirkosertic.talentmatch.model.Reviewer;

import java.util.HashSet;
import java.util.Set;

/**
 * Rejects malformed requests before any scoring starts.
 */
public class MatchRequestValidator {

    private static final double MAX_RATING = 5.0;

    /**
     * @throws InvalidSpecificationException describing the first problem found
     */
    public void validate(final MatchRequest request, final AlgorithmConfig config) {
        if (request == null) {
            throw new InvalidSpecificationException("No request given");
        }
        config.validate();
        if (request.proposers().isEmpty() && request.preferences() == null) {
            throw new InvalidSpecificationException("Either proposers or preferences must be given");
        }
        if (request.limit() != null && request.limit() <= 0) {
            throw new InvalidSpecificationException("Limit must be positive: " + request.limit());
        }
        if (request.deadlineMs() != null && request.deadlineMs() <= 0) {
            throw new InvalidSpecificationException("Deadline must be positive: " + request.deadlineMs());
        }

        final Set<String> proposerIds = new HashSet<>();
        for (final Proposer proposer : request.proposers()) {
            if (proposer == null || proposer.id() == null || proposer.id().isBlank()) {
                throw new InvalidSpecificationException("Every proposer needs an id");
            }
            if (!proposerIds.add(proposer.id())) {
                throw new InvalidSpecificationException("Duplicate proposer id: " + proposer.id());
            }
        }

        final Set<String> reviewerIds = new HashSet<>();
        for (final Reviewer reviewer : request.candidates()) {
            if (reviewer == null || reviewer.id() == null || reviewer.id().isBlank()) {
                throw new InvalidSpecificationException("Every candidate needs an id");
            }
            if (!reviewerIds.add(reviewer.id())) {
                throw new InvalidSpecificationException("Duplicate candidate id: " + reviewer.id());
            }
            if (reviewer.experienceYears() != null && reviewer.experienceYears() < 0) {
                throw new InvalidSpecificationException("Negative experience for candidate " + reviewer.id());
            }
            if (reviewer.rating() != null && (reviewer.rating() < 0 || reviewer.rating() > MAX_RATING)) {
                throw new InvalidSpecificationException("Rating of candidate " + reviewer.id() + " outside [0, 5]: " + reviewer.rating());
            }
        }
    }
}
