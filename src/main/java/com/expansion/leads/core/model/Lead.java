package com.expansion.leads.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One entity with its current score, enrichment and provenance. Keyed by the entity identifier.
 */
public class Lead {
    private final Entity entity;
    private final Set<SourceType> provenance;
    private final String route;
    private final String subRoute;
    private final int resolutionScore;
    private final SignalSet signals;
    private final int preEnrichmentScore;
    private final ScoreResult score;
    private final EnrichmentResult enrichment;
    private final String visaHint;
    private final boolean backfilled;

    private Lead(Builder builder) {
        this.entity = builder.entity;
        this.provenance = Collections.unmodifiableSet(EnumSet.copyOf(builder.provenance));
        this.route = builder.route != null ? builder.route : "";
        this.subRoute = builder.subRoute != null ? builder.subRoute : "";
        this.resolutionScore = builder.resolutionScore;
        this.signals = builder.signals != null ? builder.signals : SignalSet.empty();
        this.score = builder.score;
        this.preEnrichmentScore = builder.preEnrichmentScore != null
                ? builder.preEnrichmentScore : builder.score.score();
        this.enrichment = builder.enrichment != null ? builder.enrichment : EnrichmentResult.notRun();
        this.visaHint = builder.visaHint != null ? builder.visaHint : "";
        this.backfilled = builder.backfilled;
    }

    public String getKey() {
        return entity.getId();
    }

    public Entity getEntity() {
        return entity;
    }

    public Set<SourceType> getProvenance() {
        return provenance;
    }

    /**
     * Contributing sources in declaration order, joined with '+'.
     */
    public String getProvenanceText() {
        return provenance.stream()
                .map(Enum::name)
                .collect(Collectors.joining("+"));
    }

    public boolean isSponsorSourced() {
        return provenance.contains(SourceType.SPONSOR_REGISTER);
    }

    public String getRoute() {
        return route;
    }

    public String getSubRoute() {
        return subRoute;
    }

    public int getResolutionScore() {
        return resolutionScore;
    }

    public SignalSet getSignals() {
        return signals;
    }

    public int getPreEnrichmentScore() {
        return preEnrichmentScore;
    }

    public ScoreResult getScore() {
        return score;
    }

    public EnrichmentResult getEnrichment() {
        return enrichment;
    }

    public String getVisaHint() {
        return visaHint;
    }

    public boolean isBackfilled() {
        return backfilled;
    }

    /**
     * Copy marked as backfilled, with the marker as the first rationale entry.
     */
    public Lead asBackfill(String marker) {
        List<String> rationale = new ArrayList<>();
        rationale.add(marker);
        for (String entry : score.rationale()) {
            if (rationale.size() >= ScoreResult.MAX_RATIONALE) {
                break;
            }
            if (!entry.equals(marker)) {
                rationale.add(entry);
            }
        }
        return builder(this)
                .score(new ScoreResult(score.score(), score.bucket(), rationale))
                .backfilled(true)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Lead lead = (Lead) o;
        return Objects.equals(getKey(), lead.getKey());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKey());
    }

    @Override
    public String toString() {
        return "Lead{" +
                "key='" + getKey() + '\'' +
                ", name='" + entity.getDisplayName() + '\'' +
                ", score=" + score.score() +
                ", bucket=" + score.bucket() +
                ", provenance=" + getProvenanceText() +
                ", enrichment=" + enrichment.status() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Lead lead) {
        return new Builder()
                .entity(lead.entity)
                .provenance(lead.provenance)
                .route(lead.route)
                .subRoute(lead.subRoute)
                .resolutionScore(lead.resolutionScore)
                .signals(lead.signals)
                .preEnrichmentScore(lead.preEnrichmentScore)
                .score(lead.score)
                .enrichment(lead.enrichment)
                .visaHint(lead.visaHint)
                .backfilled(lead.backfilled);
    }

    public static class Builder {
        private Entity entity;
        private final Set<SourceType> provenance = EnumSet.noneOf(SourceType.class);
        private String route;
        private String subRoute;
        private int resolutionScore;
        private SignalSet signals;
        private Integer preEnrichmentScore;
        private ScoreResult score;
        private EnrichmentResult enrichment;
        private String visaHint;
        private boolean backfilled;

        public Builder entity(Entity entity) {
            this.entity = entity;
            return this;
        }

        public Builder provenance(Set<SourceType> sources) {
            this.provenance.clear();
            this.provenance.addAll(sources);
            return this;
        }

        public Builder addSource(SourceType source) {
            this.provenance.add(source);
            return this;
        }

        public Builder route(String route) {
            this.route = route;
            return this;
        }

        public Builder subRoute(String subRoute) {
            this.subRoute = subRoute;
            return this;
        }

        public Builder resolutionScore(int resolutionScore) {
            this.resolutionScore = resolutionScore;
            return this;
        }

        public Builder signals(SignalSet signals) {
            this.signals = signals;
            return this;
        }

        public Builder preEnrichmentScore(int preEnrichmentScore) {
            this.preEnrichmentScore = preEnrichmentScore;
            return this;
        }

        public Builder score(ScoreResult score) {
            this.score = score;
            return this;
        }

        public Builder enrichment(EnrichmentResult enrichment) {
            this.enrichment = enrichment;
            return this;
        }

        public Builder visaHint(String visaHint) {
            this.visaHint = visaHint;
            return this;
        }

        public Builder backfilled(boolean backfilled) {
            this.backfilled = backfilled;
            return this;
        }

        public Lead build() {
            Objects.requireNonNull(entity, "entity is required");
            Objects.requireNonNull(score, "score is required");
            return new Lead(this);
        }
    }
}
