package com.expansion.leads.config;

import java.time.Duration;
import java.util.List;

/**
 * Website discovery, verification and contact extraction settings.
 */
public class EnrichmentConfig {

    private final int searchCallBudget;
    private final Duration searchSleep;
    private final String searchLocale;
    private final int maxCandidates;
    private final int plausibleThreshold;
    private final int verifiedThreshold;
    private final int confirmationBonus;
    private final int strongNameSimilarity;
    private final int moderateNameSimilarity;
    private final int maxContactLinks;
    private final int maxEmails;
    private final int maxPhones;
    private final int pageTextLimit;
    private final Duration cacheTtl;
    private final boolean includePersonalEmails;
    private final List<String> denyDomains;
    private final List<String> roleEmailPrefixes;

    private EnrichmentConfig(Builder builder) {
        this.searchCallBudget = builder.searchCallBudget;
        this.searchSleep = builder.searchSleep;
        this.searchLocale = builder.searchLocale;
        this.maxCandidates = builder.maxCandidates;
        this.plausibleThreshold = builder.plausibleThreshold;
        this.verifiedThreshold = builder.verifiedThreshold;
        this.confirmationBonus = builder.confirmationBonus;
        this.strongNameSimilarity = builder.strongNameSimilarity;
        this.moderateNameSimilarity = builder.moderateNameSimilarity;
        this.maxContactLinks = builder.maxContactLinks;
        this.maxEmails = builder.maxEmails;
        this.maxPhones = builder.maxPhones;
        this.pageTextLimit = builder.pageTextLimit;
        this.cacheTtl = builder.cacheTtl;
        this.includePersonalEmails = builder.includePersonalEmails;
        this.denyDomains = List.copyOf(builder.denyDomains);
        this.roleEmailPrefixes = List.copyOf(builder.roleEmailPrefixes);
    }

    public static EnrichmentConfig defaults() {
        return builder().build();
    }

    public int getSearchCallBudget() {
        return searchCallBudget;
    }

    public Duration getSearchSleep() {
        return searchSleep;
    }

    public String getSearchLocale() {
        return searchLocale;
    }

    public int getMaxCandidates() {
        return maxCandidates;
    }

    public int getPlausibleThreshold() {
        return plausibleThreshold;
    }

    public int getVerifiedThreshold() {
        return verifiedThreshold;
    }

    public int getConfirmationBonus() {
        return confirmationBonus;
    }

    public int getStrongNameSimilarity() {
        return strongNameSimilarity;
    }

    public int getModerateNameSimilarity() {
        return moderateNameSimilarity;
    }

    public int getMaxContactLinks() {
        return maxContactLinks;
    }

    public int getMaxEmails() {
        return maxEmails;
    }

    public int getMaxPhones() {
        return maxPhones;
    }

    public int getPageTextLimit() {
        return pageTextLimit;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public boolean isIncludePersonalEmails() {
        return includePersonalEmails;
    }

    public List<String> getDenyDomains() {
        return denyDomains;
    }

    public List<String> getRoleEmailPrefixes() {
        return roleEmailPrefixes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int searchCallBudget = 80;
        private Duration searchSleep = Duration.ofMillis(1200);
        private String searchLocale = "United Kingdom";
        private int maxCandidates = 5;
        private int plausibleThreshold = 4;
        private int verifiedThreshold = 7;
        private int confirmationBonus = 1;
        private int strongNameSimilarity = 75;
        private int moderateNameSimilarity = 60;
        private int maxContactLinks = 6;
        private int maxEmails = 5;
        private int maxPhones = 5;
        private int pageTextLimit = 20_000;
        private Duration cacheTtl = Duration.ofDays(60);
        private boolean includePersonalEmails = false;
        private List<String> denyDomains = List.of(
                "find-and-update.company-information.service.gov.uk", "companieshouse.gov.uk", "gov.uk",
                "opencorporates.com", "duedil.com", "endole.co.uk", "northdata.com", "companycheck.co.uk",
                "corporationwiki.com", "bizapedia.com", "dnb.com", "dnb.co.uk", "yell.com",
                "linkedin.com", "facebook.com", "instagram.com", "twitter.com", "x.com", "youtube.com",
                "tiktok.com", "crunchbase.com", "bloomberg.com", "zoominfo.com", "signalhire.com",
                "rocketreach.co");
        private List<String> roleEmailPrefixes = List.of(
                "immigration", "globalmobility", "mobility", "hr", "people", "talent", "recruitment",
                "careers", "jobs", "legal", "admin", "office", "info", "contact", "enquiries",
                "hello", "sales");

        public Builder searchCallBudget(int v) {
            this.searchCallBudget = v;
            return this;
        }

        public Builder searchSleep(Duration v) {
            this.searchSleep = v;
            return this;
        }

        public Builder searchLocale(String v) {
            this.searchLocale = v;
            return this;
        }

        public Builder maxCandidates(int v) {
            this.maxCandidates = v;
            return this;
        }

        public Builder plausibleThreshold(int v) {
            this.plausibleThreshold = v;
            return this;
        }

        public Builder verifiedThreshold(int v) {
            this.verifiedThreshold = v;
            return this;
        }

        public Builder confirmationBonus(int v) {
            this.confirmationBonus = v;
            return this;
        }

        public Builder strongNameSimilarity(int v) {
            this.strongNameSimilarity = v;
            return this;
        }

        public Builder moderateNameSimilarity(int v) {
            this.moderateNameSimilarity = v;
            return this;
        }

        public Builder maxContactLinks(int v) {
            this.maxContactLinks = v;
            return this;
        }

        public Builder maxEmails(int v) {
            this.maxEmails = v;
            return this;
        }

        public Builder maxPhones(int v) {
            this.maxPhones = v;
            return this;
        }

        public Builder pageTextLimit(int v) {
            this.pageTextLimit = v;
            return this;
        }

        public Builder cacheTtl(Duration v) {
            this.cacheTtl = v;
            return this;
        }

        public Builder includePersonalEmails(boolean v) {
            this.includePersonalEmails = v;
            return this;
        }

        public Builder denyDomains(List<String> v) {
            this.denyDomains = v;
            return this;
        }

        public Builder roleEmailPrefixes(List<String> v) {
            this.roleEmailPrefixes = v;
            return this;
        }

        public EnrichmentConfig build() {
            if (searchCallBudget < 0) {
                throw new IllegalArgumentException("searchCallBudget must be >= 0");
            }
            if (searchSleep == null || searchSleep.isNegative()) {
                throw new IllegalArgumentException("searchSleep must be >= 0");
            }
            if (plausibleThreshold < 0 || verifiedThreshold > 10 || plausibleThreshold >= verifiedThreshold) {
                throw new IllegalArgumentException(
                        "Verification thresholds must satisfy 0 <= plausible < verified <= 10");
            }
            if (maxCandidates < 1 || maxContactLinks < 0 || maxEmails < 0 || maxPhones < 0) {
                throw new IllegalArgumentException("Enrichment limits must be positive");
            }
            if (cacheTtl == null || cacheTtl.isNegative()) {
                throw new IllegalArgumentException("cacheTtl must be >= 0");
            }
            return new EnrichmentConfig(this);
        }
    }
}
