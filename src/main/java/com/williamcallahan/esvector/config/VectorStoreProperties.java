package com.williamcallahan.esvector.config;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.PropertyNamingStrategy;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Elasticsearch connection and search settings bound from {@code app.elasticsearch.*}.
 */
@ConfigurationProperties(prefix = "app.elasticsearch")
public class VectorStoreProperties {

    private static final String URL_DEF = "http://localhost:9200";
    private static final Duration CONNECT_TIMEOUT_DEF = Duration.ofSeconds(10);
    private static final Duration READ_TIMEOUT_DEF = Duration.ofSeconds(30);
    private static final String REFRESH_DEF = "wait_for";
    private static final Set<String> REFRESH_VALUES = Set.of("true", "false", "wait_for");
    private static final int MIN_POSITIVE = 1;
    private static final String URL_KEY = "app.elasticsearch.url";
    private static final String CONNECT_TIMEOUT_KEY = "app.elasticsearch.connect-timeout";
    private static final String READ_TIMEOUT_KEY = "app.elasticsearch.read-timeout";
    private static final String REFRESH_KEY = "app.elasticsearch.refresh";
    private static final String NAMING_KEY = "app.elasticsearch.naming-strategy";
    private static final String FACTOR_KEY = "app.elasticsearch.search.num-candidates-factor";
    private static final String WINDOW_KEY = "app.elasticsearch.search.rank-window-size";
    private static final String RANK_CONSTANT_KEY = "app.elasticsearch.search.rank-constant";
    private static final String BLANK_FMT = "%s must not be blank.";
    private static final String NULL_FMT = "%s must not be null.";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String REFRESH_FMT = "%s must be one of true, false, wait_for (got %s).";

    /** Storage naming policies for typed and dynamic records. */
    public enum NamingStrategy {
        LOWER_CAMEL_CASE(PropertyNamingStrategies.LOWER_CAMEL_CASE),
        SNAKE_CASE(PropertyNamingStrategies.SNAKE_CASE);

        private final PropertyNamingStrategy jacksonStrategy;

        NamingStrategy(PropertyNamingStrategy jacksonStrategy) {
            this.jacksonStrategy = jacksonStrategy;
        }

        public PropertyNamingStrategy jacksonStrategy() {
            return jacksonStrategy;
        }
    }

    private String url = URL_DEF;
    private String apiKey = "";
    private Duration connectTimeout = CONNECT_TIMEOUT_DEF;
    private Duration readTimeout = READ_TIMEOUT_DEF;
    private String refresh = REFRESH_DEF;
    private NamingStrategy namingStrategy = NamingStrategy.LOWER_CAMEL_CASE;
    private Search search = new Search();

    /**
     * Validates connection and search settings.
     */
    public void validateConfiguration() {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_FMT, URL_KEY));
        }
        requirePositiveDuration(CONNECT_TIMEOUT_KEY, connectTimeout);
        requirePositiveDuration(READ_TIMEOUT_KEY, readTimeout);
        if (refresh == null || !REFRESH_VALUES.contains(refresh)) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, REFRESH_FMT, REFRESH_KEY, refresh));
        }
        if (namingStrategy == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_FMT, NAMING_KEY));
        }
        requirePositiveCount(FACTOR_KEY, search.getNumCandidatesFactor());
        requirePositiveCount(WINDOW_KEY, search.getRankWindowSize());
        requirePositiveCount(RANK_CONSTANT_KEY, search.getRankConstant());
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(final String url) {
        this.url = url;
    }

    /**
     * Returns the encoded API key sent as {@code Authorization: ApiKey ...}.
     *
     * @return API key, blank when authentication is disabled
     */
    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(final String apiKey) {
        this.apiKey = apiKey;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(final Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(final Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    /**
     * Returns the {@code refresh} parameter used on writes.
     *
     * @return {@code true}, {@code false}, or {@code wait_for}
     */
    public String getRefresh() {
        return refresh;
    }

    public void setRefresh(final String refresh) {
        this.refresh = refresh;
    }

    public NamingStrategy getNamingStrategy() {
        return namingStrategy;
    }

    public void setNamingStrategy(final NamingStrategy namingStrategy) {
        this.namingStrategy = namingStrategy;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(final Search search) {
        this.search = search;
    }

    private void requirePositiveCount(final String propertyKey, final int count) {
        if (count < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }

    private void requirePositiveDuration(String propertyKey, Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }

    /**
     * Nearest-neighbour and rank-fusion tuning.
     */
    public static class Search {
        private int numCandidatesFactor = 2;
        private int rankWindowSize = 10;
        private int rankConstant = 60;

        public int getNumCandidatesFactor() { return numCandidatesFactor; }
        public void setNumCandidatesFactor(int numCandidatesFactor) { this.numCandidatesFactor = numCandidatesFactor; }

        public int getRankWindowSize() { return rankWindowSize; }
        public void setRankWindowSize(int rankWindowSize) { this.rankWindowSize = rankWindowSize; }

        public int getRankConstant() { return rankConstant; }
        public void setRankConstant(int rankConstant) { this.rankConstant = rankConstant; }
    }
}
