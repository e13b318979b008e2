package de.mirkosertic.talentmatch.config;

import de.mirkosertic.talentmatch.model.AlgorithmConfig;
import de.mirkosertic.talentmatch.model.InvalidSpecificationException;
import de.mirkosertic.talentmatch.model.ScoreFactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the talent matcher.
 * Loads configuration from YAML files, system properties and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.talentmatch/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_USE_STABLE = "USE_GALE_SHAPLEY";
    private static final String ENV_MAX_CANDIDATES = "MAX_CANDIDATES";
    private static final String ENV_MIN_SCORE = "MIN_SCORE";
    private static final String ENV_RULE_WEIGHT = "RULE_BASED_WEIGHT";
    private static final String ENV_SEMANTIC_WEIGHT = "SEMANTIC_WEIGHT";
    private static final String ENV_MAX_ITERATIONS = "MAX_ITERATIONS";
    private static final String PROP_PREFIX = "talentmatch.";
    private static final String PROP_PROFILES_ACTIVE = "talentmatch.profile";
    private static final String CONFIG_DIR = ".talentmatch";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private static final Map<String, ScoreFactor> CAP_KEYS = Map.of(
            "location", ScoreFactor.LOCATION,
            "budget", ScoreFactor.BUDGET,
            "skills", ScoreFactor.SKILLS,
            "experience", ScoreFactor.EXPERIENCE,
            "availability", ScoreFactor.AVAILABILITY,
            "style", ScoreFactor.STYLE_OVERLAP,
            "rating", ScoreFactor.RATING,
            "style-semantic", ScoreFactor.STYLE_SIMILARITY,
            "text-semantic", ScoreFactor.SEMANTIC_MATCH
    );

    // Matching settings
    private final AlgorithmConfig.Builder matching = AlgorithmConfig.builder();

    // Runtime settings
    private int threadPoolSize = 4;
    private long similarityTimeoutMs = 2000;
    private long deadlineMs = 10000;
    private long similarityCacheSize = 10000;
    private boolean heuristicFallback = true;

    // Profile settings
    private boolean deployedMode = false;

    ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applySystemPropertyOverrides();
        config.applyEnvironmentOverrides();
        config.determineProfile();

        logger.info("Configuration loaded: candidateCap={}, minScore={}, stableEnabled={}, threads={}, deployedMode={}",
                config.matching.build().candidateCap(), config.matching.build().minScore(),
                config.matching.build().stableEnabled(), config.threadPoolSize, config.deployedMode);

        return config;
    }

    /**
     * Load the classpath defaults followed by the given YAML document, without
     * consulting the user file, system properties or the environment.
     */
    public static ApplicationConfig fromYaml(final String yamlDocument) {
        final ApplicationConfig config = new ApplicationConfig();
        config.loadFromClasspath();
        final Map<String, Object> document = new Yaml().load(yamlDocument);
        if (document != null) {
            config.applyYamlConfig(document);
        }
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("talentmatch");
        if (root == null) {
            return;
        }

        final Map<String, Object> matchingConfig = (Map<String, Object>) root.get("matching");
        if (matchingConfig != null) {
            applyMatchingConfig(matchingConfig);
        }

        final Map<String, Object> runtimeConfig = (Map<String, Object>) root.get("runtime");
        if (runtimeConfig != null) {
            applyRuntimeConfig(runtimeConfig);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyMatchingConfig(final Map<String, Object> matchingConfig) {
        if (matchingConfig.containsKey("rule-weight")) {
            matching.ruleWeight(number(matchingConfig.get("rule-weight")).doubleValue());
        }
        if (matchingConfig.containsKey("semantic-weight")) {
            matching.semanticWeight(number(matchingConfig.get("semantic-weight")).doubleValue());
        }
        if (matchingConfig.containsKey("rule-max")) {
            matching.ruleMax(number(matchingConfig.get("rule-max")).doubleValue());
        }
        if (matchingConfig.containsKey("semantic-max")) {
            matching.semanticMax(number(matchingConfig.get("semantic-max")).doubleValue());
        }
        if (matchingConfig.containsKey("candidate-cap")) {
            matching.candidateCap(number(matchingConfig.get("candidate-cap")).intValue());
        }
        if (matchingConfig.containsKey("min-score")) {
            matching.minScore(number(matchingConfig.get("min-score")).intValue());
        }
        if (matchingConfig.containsKey("max-iterations")) {
            matching.maxIterations(number(matchingConfig.get("max-iterations")).intValue());
        }
        if (matchingConfig.containsKey("stable-enabled")) {
            matching.stableEnabled(bool(matchingConfig.get("stable-enabled")));
        }
        if (matchingConfig.containsKey("scale-rule-only")) {
            matching.scaleRuleOnly(bool(matchingConfig.get("scale-rule-only")));
        }
        final Object caps = matchingConfig.get("caps");
        if (caps instanceof Map) {
            for (final Map.Entry<String, Object> entry : ((Map<String, Object>) caps).entrySet()) {
                final ScoreFactor factor = CAP_KEYS.get(entry.getKey());
                if (factor == null) {
                    throw new InvalidSpecificationException("Unknown score factor in caps: " + entry.getKey());
                }
                matching.factorCap(factor, number(entry.getValue()).doubleValue());
            }
        }
        final Object regions = matchingConfig.get("regions");
        if (regions instanceof Map) {
            matching.regions(stringListMap((Map<String, Object>) regions));
        }
        final Object aliases = matchingConfig.get("category-aliases");
        if (aliases instanceof Map) {
            final Map<String, String> result = new LinkedHashMap<>();
            ((Map<String, Object>) aliases).forEach((key, value) -> result.put(key, String.valueOf(value)));
            matching.categoryAliases(result);
        }
        final Object categorySkills = matchingConfig.get("category-skills");
        if (categorySkills instanceof Map) {
            matching.categorySkills(stringListMap((Map<String, Object>) categorySkills));
        }
    }

    private void applyRuntimeConfig(final Map<String, Object> runtimeConfig) {
        if (runtimeConfig.containsKey("thread-pool-size")) {
            this.threadPoolSize = number(runtimeConfig.get("thread-pool-size")).intValue();
        }
        if (runtimeConfig.containsKey("similarity-timeout-ms")) {
            this.similarityTimeoutMs = number(runtimeConfig.get("similarity-timeout-ms")).longValue();
        }
        if (runtimeConfig.containsKey("deadline-ms")) {
            this.deadlineMs = number(runtimeConfig.get("deadline-ms")).longValue();
        }
        if (runtimeConfig.containsKey("similarity-cache-size")) {
            this.similarityCacheSize = number(runtimeConfig.get("similarity-cache-size")).longValue();
        }
        if (runtimeConfig.containsKey("heuristic-fallback")) {
            this.heuristicFallback = bool(runtimeConfig.get("heuristic-fallback"));
        }
    }

    private void applySystemPropertyOverrides() {
        final String minScore = System.getProperty(PROP_PREFIX + "min-score");
        if (minScore != null && !minScore.isBlank()) {
            matching.minScore(Integer.parseInt(minScore.trim()));
        }
        final String candidateCap = System.getProperty(PROP_PREFIX + "candidate-cap");
        if (candidateCap != null && !candidateCap.isBlank()) {
            matching.candidateCap(Integer.parseInt(candidateCap.trim()));
        }
        final String threads = System.getProperty(PROP_PREFIX + "thread-pool-size");
        if (threads != null && !threads.isBlank()) {
            this.threadPoolSize = Integer.parseInt(threads.trim());
        }
    }

    private void applyEnvironmentOverrides() {
        final String useStable = System.getenv(ENV_USE_STABLE);
        if (useStable != null && !useStable.isBlank()) {
            matching.stableEnabled(Boolean.parseBoolean(useStable.trim()));
            logger.info("Stable matching enabled from environment: {}", useStable.trim());
        }
        final String maxCandidates = System.getenv(ENV_MAX_CANDIDATES);
        if (maxCandidates != null && !maxCandidates.isBlank()) {
            matching.candidateCap(Integer.parseInt(maxCandidates.trim()));
        }
        final String minScore = System.getenv(ENV_MIN_SCORE);
        if (minScore != null && !minScore.isBlank()) {
            matching.minScore(Integer.parseInt(minScore.trim()));
        }
        final String ruleWeight = System.getenv(ENV_RULE_WEIGHT);
        if (ruleWeight != null && !ruleWeight.isBlank()) {
            matching.ruleWeight(Double.parseDouble(ruleWeight.trim()));
        }
        final String semanticWeight = System.getenv(ENV_SEMANTIC_WEIGHT);
        if (semanticWeight != null && !semanticWeight.isBlank()) {
            matching.semanticWeight(Double.parseDouble(semanticWeight.trim()));
        }
        final String maxIterations = System.getenv(ENV_MAX_ITERATIONS);
        if (maxIterations != null && !maxIterations.isBlank()) {
            matching.maxIterations(Integer.parseInt(maxIterations.trim()));
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILES_ACTIVE, System.getProperty("profile", "default"));
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    private Number number(final Object value) {
        if (value instanceof Number) {
            return (Number) value;
        }
        final String resolved = resolveVariables(String.valueOf(value)).trim();
        try {
            return Double.valueOf(resolved);
        } catch (final NumberFormatException e) {
            throw new InvalidSpecificationException("Not a number in configuration: " + value);
        }
    }

    private boolean bool(final Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(resolveVariables(String.valueOf(value)).trim());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, List<String>> stringListMap(final Map<String, Object> source) {
        final Map<String, List<String>> result = new LinkedHashMap<>();
        for (final Map.Entry<String, Object> entry : source.entrySet()) {
            final List<String> values = new ArrayList<>();
            if (entry.getValue() instanceof List) {
                for (final Object item : (List<Object>) entry.getValue()) {
                    values.add(String.valueOf(item));
                }
            }
            result.put(entry.getKey(), List.copyOf(values));
        }
        return result;
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    /**
     * Builds a validated {@link AlgorithmConfig} from the matching settings.
     *
     * @throws InvalidSpecificationException if the settings violate the configuration invariants
     */
    public AlgorithmConfig getAlgorithmConfig() {
        final AlgorithmConfig config = matching.build();
        config.validate();
        return config;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public long getSimilarityTimeoutMs() {
        return similarityTimeoutMs;
    }

    public long getDeadlineMs() {
        return deadlineMs;
    }

    public long getSimilarityCacheSize() {
        return similarityCacheSize;
    }

    public boolean isHeuristicFallback() {
        return heuristicFallback;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
