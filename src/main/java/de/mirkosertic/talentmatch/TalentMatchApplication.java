package de.mirkosertic.talentmatch;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import de.mirkosertic.talentmatch.config.ApplicationConfig;
import de.mirkosertic.talentmatch.config.LoggingConfigurator;
import de.mirkosertic.talentmatch.dto.MatchRequest;
import de.mirkosertic.talentmatch.dto.MatchResponse;
import de.mirkosertic.talentmatch.matching.DeferredAcceptanceSolver;
import de.mirkosertic.talentmatch.matching.PreferenceListBuilder;
import de.mirkosertic.talentmatch.matching.StabilityVerifier;
import de.mirkosertic.talentmatch.orchestration.MatchOrchestrator;
import de.mirkosertic.talentmatch.orchestration.RankedMatchingStrategy;
import de.mirkosertic.talentmatch.orchestration.StableMatchingStrategy;
import de.mirkosertic.talentmatch.scoring.HybridScoringEngine;
import de.mirkosertic.talentmatch.scoring.MatchExplainer;
import de.mirkosertic.talentmatch.scoring.RuleBasedScorer;
import de.mirkosertic.talentmatch.semantic.LexicalSimilarityProvider;
import de.mirkosertic.talentmatch.semantic.SemanticSimilarityProvider;
import de.mirkosertic.talentmatch.semantic.SemanticSimilarityService;
import de.mirkosertic.talentmatch.semantic.SimilarityExecutorService;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command-line entry point of the talent matcher.
 * Reads a JSON match request from a file or stdin and writes the JSON response to stdout.
 * With {@code --info} it prints the engine description instead.
 */
public class TalentMatchApplication {

    private static final Logger logger = LoggerFactory.getLogger(TalentMatchApplication.class);

    static final String INFO_ARGUMENT = "--info";

    private final SimilarityExecutorService similarityExecutor;
    private final SemanticSimilarityService similarityService;
    private final MatchOrchestrator orchestrator;
    private final ObjectMapper objectMapper = createObjectMapper();

    public TalentMatchApplication(final ApplicationConfig config, final @Nullable SemanticSimilarityProvider provider) {
        // Initialize services in dependency order
        this.similarityExecutor = new SimilarityExecutorService(config);

        this.similarityService = new SemanticSimilarityService(
                provider,
                new LexicalSimilarityProvider(),
                similarityExecutor,
                config
        );

        final HybridScoringEngine scoringEngine = new HybridScoringEngine(new RuleBasedScorer(), similarityService);
        final MatchExplainer explainer = new MatchExplainer();

        final StableMatchingStrategy stableStrategy = new StableMatchingStrategy(
                new PreferenceListBuilder(scoringEngine),
                new DeferredAcceptanceSolver(),
                new StabilityVerifier(),
                explainer
        );

        this.orchestrator = new MatchOrchestrator(
                List.of(stableStrategy,
                        new RankedMatchingStrategy(scoringEngine, explainer, false),
                        new RankedMatchingStrategy(scoringEngine, explainer, true)),
                similarityService,
                config.getAlgorithmConfig(),
                config.getDeadlineMs()
        );
    }

    /**
     * Reads one request, runs it and writes the response.
     *
     * @return the response that was written
     */
    public MatchResponse process(final InputStream input, final OutputStream output) throws IOException {
        MatchResponse response;
        try {
            final MatchRequest request = objectMapper.readValue(input, MatchRequest.class);
            response = orchestrator.findMatches(request);
        } catch (final JacksonException e) {
            logger.warn("Malformed match request: {}", e.getOriginalMessage());
            response = MatchResponse.invalid("Malformed request: " + e.getOriginalMessage());
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(output, response);
        output.flush();
        return response;
    }

    /**
     * Writes the engine description.
     */
    public void describe(final OutputStream output) throws IOException {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(output, orchestrator.describe());
        output.flush();
    }

    public MatchOrchestrator getOrchestrator() {
        return orchestrator;
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down talent matcher...");

        try {
            similarityService.close();
        } catch (final Exception e) {
            logger.error("Error closing similarity service", e);
        }

        try {
            similarityExecutor.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down similarity executor", e);
        }

        logger.info("Talent matcher shutdown complete");
    }

    static ObjectMapper createObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
                .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
                .build();
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, stdout is reserved for the JSON result
            final boolean deployedMode = "deployed".equals(System.getProperty("talentmatch.profile"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();
            final TalentMatchApplication app = new TalentMatchApplication(config, null);
            boolean success = true;
            try {
                if (args.length > 0 && INFO_ARGUMENT.equals(args[0])) {
                    app.describe(System.out);
                } else if (args.length > 0) {
                    final Path requestFile = Paths.get(args[0]);
                    try (final InputStream input = Files.newInputStream(requestFile)) {
                        success = app.process(input, System.out).success();
                    }
                } else {
                    success = app.process(System.in, System.out).success();
                }
            } finally {
                app.shutdown();
            }
            if (!success) {
                System.exit(2);
            }
        } catch (final Exception e) {
            // In deployed mode, we can't log to console, so write to stderr
            System.err.println("Talent matcher failed: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
