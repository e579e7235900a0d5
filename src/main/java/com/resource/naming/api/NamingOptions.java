package com.resource.naming.api;

import com.resource.naming.builder.NameBuilder;

/**
 * Tunables for claim and release processing.
 */
public class NamingOptions {

    public static final int DEFAULT_MAX_CLAIM_ATTEMPTS = 5;
    public static final String DEFAULT_ORG_PREFIX = NameBuilder.DEFAULT_ORG_PREFIX;
    public static final String DEFAULT_RELEASE_REASON = "not specified";
    public static final int DEFAULT_INDEX_WIDTH = 2;

    private final int maxClaimAttempts;
    private final String orgPrefix;
    private final String defaultReleaseReason;
    private final int indexWidth;

    private NamingOptions(Builder builder) {
        this.maxClaimAttempts = builder.maxClaimAttempts;
        this.orgPrefix = builder.orgPrefix;
        this.defaultReleaseReason = builder.defaultReleaseReason;
        this.indexWidth = builder.indexWidth;
    }

    /**
     * Upper bound on candidate names tried when the rule uses {@code index} and the caller gave none.
     */
    public int getMaxClaimAttempts() {
        return maxClaimAttempts;
    }

    public String getOrgPrefix() {
        return orgPrefix;
    }

    public String getDefaultReleaseReason() {
        return defaultReleaseReason;
    }

    /**
     * Zero-padded width of generated index values, e.g. 2 gives {@code 01}.
     */
    public int getIndexWidth() {
        return indexWidth;
    }

    public static NamingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxClaimAttempts = DEFAULT_MAX_CLAIM_ATTEMPTS;
        private String orgPrefix = DEFAULT_ORG_PREFIX;
        private String defaultReleaseReason = DEFAULT_RELEASE_REASON;
        private int indexWidth = DEFAULT_INDEX_WIDTH;

        public Builder maxClaimAttempts(int maxClaimAttempts) {
            if (maxClaimAttempts < 1 || maxClaimAttempts > 99) {
                throw new IllegalArgumentException("maxClaimAttempts must be between 1 and 99");
            }
            this.maxClaimAttempts = maxClaimAttempts;
            return this;
        }

        public Builder orgPrefix(String orgPrefix) {
            this.orgPrefix = orgPrefix;
            return this;
        }

        public Builder defaultReleaseReason(String defaultReleaseReason) {
            if (defaultReleaseReason == null || defaultReleaseReason.isBlank()) {
                throw new IllegalArgumentException("defaultReleaseReason must not be blank");
            }
            this.defaultReleaseReason = defaultReleaseReason;
            return this;
        }

        public Builder indexWidth(int indexWidth) {
            if (indexWidth < 1 || indexWidth > 6) {
                throw new IllegalArgumentException("indexWidth must be between 1 and 6");
            }
            this.indexWidth = indexWidth;
            return this;
        }

        public NamingOptions build() {
            if (String.valueOf(maxClaimAttempts).length() > indexWidth) {
                throw new IllegalArgumentException("indexWidth is too small for maxClaimAttempts");
            }
            return new NamingOptions(this);
        }
    }

    @Override
    public String toString() {
        return "NamingOptions{" +
                "maxClaimAttempts=" + maxClaimAttempts +
                ", orgPrefix='" + orgPrefix + '\'' +
                ", defaultReleaseReason='" + defaultReleaseReason + '\'' +
                ", indexWidth=" + indexWidth +
                '}';
    }
}
