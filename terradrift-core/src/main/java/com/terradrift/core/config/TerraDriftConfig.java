package com.terradrift.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.terradrift.core.compare.ComparisonOptions;
import com.terradrift.core.compare.MatchingStrategy;
import com.terradrift.core.error.ConfigurationException;
import com.terradrift.core.source.RetryPolicy;
import com.terradrift.core.source.terraform.TerraformLookup;

import java.time.Duration;
import java.util.List;

/**
 * Root configuration for TerraDrift.
 *
 * <p>Loaded from {@code terradrift.yaml}. Every section and field is optional; missing values
 * fall back to the defaults below. Command-line options override these values.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * aws:
 *   region: us-east-1
 *
 * check:
 *   attributes: [instance_type, ami, tags]
 *   matching: bipartite
 *   resourceType: aws_instance
 *   stateIdentifierField: id
 *   definitionMatchAttribute: tags.Name
 *
 * run:
 *   concurrency: 5
 *   output: text
 *
 * retry:
 *   maxElapsedMillis: 30000
 *   baseDelayMillis: 500
 *   multiplier: 1.5
 *
 * cache:
 *   ttlSeconds: 300
 * }</pre>
 *
 * @param aws AWS client settings
 * @param check comparison settings
 * @param run worker and output settings
 * @param retry retry settings for AWS calls
 * @param cache live-result cache settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TerraDriftConfig(
    @JsonProperty("aws") AwsConfig aws,
    @JsonProperty("check") CheckConfig check,
    @JsonProperty("run") RunConfig run,
    @JsonProperty("retry") RetryConfig retry,
    @JsonProperty("cache") CacheConfig cache
) {
    public static final int DEFAULT_CONCURRENCY = 5;
    public static final String DEFAULT_OUTPUT = "text";
    public static final long DEFAULT_CACHE_TTL_SECONDS = 300;

    /**
     * Compact constructor replacing missing sections with empty ones.
     */
    public TerraDriftConfig {
        aws = aws != null ? aws : new AwsConfig(null);
        check = check != null ? check : new CheckConfig(null, null, null, null, null);
        run = run != null ? run : new RunConfig(null, null);
        retry = retry != null ? retry : new RetryConfig(null, null, null);
        cache = cache != null ? cache : new CacheConfig(null);
    }

    /**
     * Creates a configuration with every value at its default.
     *
     * @return default configuration
     */
    public static TerraDriftConfig defaults() {
        return new TerraDriftConfig(null, null, null, null, null);
    }

    /**
     * AWS client settings.
     *
     * @param region AWS region; null uses the SDK's default region provider chain
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AwsConfig(
        @JsonProperty("region") String region
    ) {}

    /**
     * Comparison settings.
     *
     * @param attributes attribute checklist; null or empty uses the default EC2 checklist
     * @param matching list matching strategy name ({@code greedy} or {@code bipartite})
     * @param resourceType Terraform resource type to match
     * @param stateIdentifierField state attribute holding the resource identifier
     * @param definitionMatchAttribute dotted attribute of a resource block matched against the identifier
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CheckConfig(
        @JsonProperty("attributes") List<String> attributes,
        @JsonProperty("matching") String matching,
        @JsonProperty("resourceType") String resourceType,
        @JsonProperty("stateIdentifierField") String stateIdentifierField,
        @JsonProperty("definitionMatchAttribute") String definitionMatchAttribute
    ) {
        /**
         * Builds comparison options from these settings.
         *
         * @return comparison options
         * @throws IllegalArgumentException if the matching strategy name is unknown
         */
        public ComparisonOptions toComparisonOptions() {
            List<String> checklist = attributes == null || attributes.isEmpty()
                ? ComparisonOptions.DEFAULT_ATTRIBUTES
                : attributes;
            MatchingStrategy strategy = matching == null || matching.isBlank()
                ? MatchingStrategy.BIPARTITE
                : MatchingStrategy.fromString(matching);
            return ComparisonOptions.of(checklist).withMatching(strategy);
        }

        public TerraformLookup toLookup() {
            return TerraformLookup.of(resourceType, stateIdentifierField, definitionMatchAttribute);
        }
    }

    /**
     * Worker and output settings.
     *
     * @param concurrency maximum concurrent resource checks
     * @param output output format id
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RunConfig(
        @JsonProperty("concurrency") Integer concurrency,
        @JsonProperty("output") String output
    ) {
        public int concurrencyOrDefault() {
            return concurrency != null ? concurrency : DEFAULT_CONCURRENCY;
        }

        public String outputOrDefault() {
            return output != null && !output.isBlank() ? output : DEFAULT_OUTPUT;
        }
    }

    /**
     * Retry settings for AWS calls. Missing values take {@link RetryPolicy#defaults()}.
     *
     * @param maxElapsedMillis total retry budget in milliseconds; 0 disables retries
     * @param baseDelayMillis first backoff delay in milliseconds
     * @param multiplier backoff growth factor
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RetryConfig(
        @JsonProperty("maxElapsedMillis") Long maxElapsedMillis,
        @JsonProperty("baseDelayMillis") Long baseDelayMillis,
        @JsonProperty("multiplier") Double multiplier
    ) {
        /**
         * Builds the retry policy, filling missing values from the defaults.
         *
         * @return retry policy
         * @throws ConfigurationException if a value is out of range
         */
        public RetryPolicy toRetryPolicy() {
            RetryPolicy defaults = RetryPolicy.defaults();
            try {
                return new RetryPolicy(
                    maxElapsedMillis != null ? Duration.ofMillis(maxElapsedMillis) : defaults.maxElapsedTime(),
                    baseDelayMillis != null ? Duration.ofMillis(baseDelayMillis) : defaults.baseDelay(),
                    multiplier != null ? multiplier : defaults.multiplier()
                );
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid retry settings: " + e.getMessage(), e);
            }
        }
    }

    /**
     * Live-result cache settings.
     *
     * @param ttlSeconds time-to-live of cached live resources in seconds
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CacheConfig(
        @JsonProperty("ttlSeconds") Long ttlSeconds
    ) {
        /**
         * Returns the cache time-to-live; zero disables caching.
         *
         * @return time-to-live
         * @throws ConfigurationException if the value is negative
         */
        public Duration ttl() {
            long seconds = ttlSeconds != null ? ttlSeconds : DEFAULT_CACHE_TTL_SECONDS;
            if (seconds < 0) {
                throw new ConfigurationException("Invalid cache settings: ttlSeconds must not be negative, got " + seconds);
            }
            return Duration.ofSeconds(seconds);
        }
    }
}
