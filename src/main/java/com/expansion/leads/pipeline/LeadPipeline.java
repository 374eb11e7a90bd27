package com.expansion.leads.pipeline;

import com.expansion.leads.config.LeadsConfig;
import com.expansion.leads.config.SourceConfig;
import com.expansion.leads.core.UpstreamException;
import com.expansion.leads.core.model.Bucket;
import com.expansion.leads.core.model.BeneficialOwner;
import com.expansion.leads.core.model.CompanyProfile;
import com.expansion.leads.core.model.EnrichStatus;
import com.expansion.leads.core.model.EnrichmentResult;
import com.expansion.leads.core.model.Entity;
import com.expansion.leads.core.model.Incorporation;
import com.expansion.leads.core.model.Lead;
import com.expansion.leads.core.model.Officer;
import com.expansion.leads.core.model.RegisteredAddress;
import com.expansion.leads.core.model.RunSummary;
import com.expansion.leads.core.model.ScoreResult;
import com.expansion.leads.core.model.SeenKey;
import com.expansion.leads.core.model.SignalNames;
import com.expansion.leads.core.model.SignalSet;
import com.expansion.leads.core.model.SourceRecord;
import com.expansion.leads.core.model.SourceType;
import com.expansion.leads.enrichment.EnrichmentBudget;
import com.expansion.leads.enrichment.EnrichmentPipeline;
import com.expansion.leads.enrichment.EnrichmentTarget;
import com.expansion.leads.export.LeadSink;
import com.expansion.leads.logging.LogContext;
import com.expansion.leads.metrics.MetricsService;
import com.expansion.leads.metrics.NoOpMetricsService;
import com.expansion.leads.resolution.IdentityResolver;
import com.expansion.leads.resolution.RegistryClient;
import com.expansion.leads.resolution.ResolutionResult;
import com.expansion.leads.rules.TextNormalizer;
import com.expansion.leads.scoring.ScoringEngine;
import com.expansion.leads.scoring.VisaHints;
import com.expansion.leads.signals.EntityFacts;
import com.expansion.leads.signals.SignalExtractor;
import com.expansion.leads.sources.SponsorRegisterSource;
import com.expansion.leads.store.RunCommit;
import com.expansion.leads.store.SponsorMapping;
import com.expansion.leads.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One weekly run, end to end.
 *
 * <ol>
 *   <li>Sponsor register: the first run baselines every row as seen and emits nothing; later runs
 *       resolve only rows not seen before.</li>
 *   <li>Registry incorporations: recent, unseen, overseas-linked companies.</li>
 *   <li>Signals and scoring, merge per entity, drop suppressed entities, rank and cap.</li>
 *   <li>Budget-gated enrichment of priority leads, then re-scoring.</li>
 *   <li>Backfill, atomic commit, hand-off to the sink.</li>
 * </ol>
 *
 * <p>An upstream failure on one item skips that item; it is not marked seen and is retried next run.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * LeadPipeline pipeline = LeadPipeline.builder()
 *     .config(config)
 *     .registry(registryClient)
 *     .sponsorSource(sponsorSource)
 *     .stateStore(store)
 *     .enrichment(enrichmentPipeline, budget)
 *     .sink(exporter)
 *     .build();
 * RunResult result = pipeline.run(Instant.now());
 * </pre>
 */
public class LeadPipeline {
    private static final Logger log = LoggerFactory.getLogger(LeadPipeline.class);

    private final LeadsConfig config;
    private final SponsorRegisterSource sponsorSource;
    private final RegistryClient registry;
    private final IdentityResolver resolver;
    private final SignalExtractor signalExtractor;
    private final ScoringEngine scoringEngine;
    private final EnrichmentPipeline enrichment;
    private final EnrichmentBudget budget;
    private final LeadAssembler assembler;
    private final StateStore store;
    private final TextNormalizer normalizer;
    private final MetricsService metrics;
    private final LeadSink sink;

    private LeadPipeline(Builder builder) {
        this.config = builder.config;
        this.sponsorSource = builder.sponsorSource;
        this.registry = builder.registry;
        this.store = builder.stateStore;
        this.normalizer = builder.normalizer != null ? builder.normalizer : new TextNormalizer();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpMetricsService();
        this.resolver = builder.resolver != null ? builder.resolver
                : new IdentityResolver(registry, config.getResolver(), normalizer);
        this.signalExtractor = new SignalExtractor(config.getScoring(), normalizer);
        this.scoringEngine = new ScoringEngine(config.getScoring());
        this.enrichment = builder.enrichment;
        this.budget = builder.budget;
        this.assembler = new LeadAssembler(config.getOutput());
        this.sink = builder.sink != null ? builder.sink : LeadSink.NOOP;
    }

    public RunResult run(Instant now) {
        String runId = RunSummary.runIdFor(now);
        try (LogContext ignored = LogContext.forRun(runId)) {
            log.info("run.started runId={}", runId);
            RunState state = new RunState(now);

            collectSponsorLeads(state);
            collectRegistryLeads(state);

            List<Lead> merged = assembler.dropSuppressed(assembler.merge(state.candidates), store);
            List<Lead> persisted = enrichTop(merged, state);
            List<Lead> output = assembler.assemble(persisted, store, now);
            int backfilled = (int) output.stream().filter(Lead::isBackfilled).count();

            RunSummary summary = new RunSummary(runId, now, Instant.now(), state.baselineRun,
                    state.sponsorRowsTotal, state.sponsorRowsNew, state.registryCandidates,
                    budget != null ? budget.used() : 0, state.verifiedSites, output.size(), backfilled,
                    state.itemsSkipped);

            state.meta.put(StateStore.META_LAST_RUN_ID, runId);
            store.commit(new RunCommit(summary, state.meta, state.seenKeys, persisted, state.mappings, now));

            metrics.incrementLeadsEmitted(output.size());
            metrics.incrementBackfilled(backfilled);
            output.forEach(lead -> metrics.recordLeadScore(lead.getScore().score(), lead.getScore().bucket()));
            sink.accept(output, summary);

            log.info("run.completed runId={} baseline={} newRows={} candidates={} leads={} backfilled={} skipped={}",
                    runId, summary.baselineRun(), summary.sponsorRowsNew(), summary.registryCandidates(),
                    output.size(), backfilled, summary.itemsSkipped());
            return new RunResult(summary, output);
        }
    }

    private void collectSponsorLeads(RunState state) {
        if (sponsorSource == null) {
            return;
        }
        List<SourceRecord> rows;
        try (LogContext ignored = LogContext.forStage("sponsor")) {
            try {
                rows = sponsorSource.fetch();
            } catch (UpstreamException e) {
                // No baseline either: a failed download must not be mistaken for an empty register.
                log.warn("sponsor.fetch.failed status={} message={}", e.getStatus(), e.getMessage());
                skip(state, "sponsor");
                return;
            }
            state.sponsorRowsTotal = rows.size();

            if (store.getMeta(StateStore.META_SPONSOR_BASELINED).isEmpty()) {
                rows.forEach(row -> state.seenKeys.add(row.seenKey()));
                state.meta.put(StateStore.META_SPONSOR_BASELINED, state.now.toString());
                state.baselineRun = true;
                log.info("sponsor.baseline rows={}", rows.size());
                return;
            }

            for (SourceRecord row : rows) {
                if (store.isSeen(row.seenKey())) {
                    continue;
                }
                state.sponsorRowsNew++;
                try (LogContext ctx = LogContext.forLead(row.sourceKey(), SourceType.SPONSOR_REGISTER.name())) {
                    state.candidates.add(sponsorLead(row, state));
                    state.seenKeys.add(row.seenKey());
                } catch (UpstreamException e) {
                    log.warn("sponsor.row.skipped name='{}' status={} message={}", row.name(), e.getStatus(),
                            e.getMessage());
                    skip(state, "sponsor");
                }
            }
            log.info("sponsor.scanned rows={} new={} resolverCache=[{}]", rows.size(), state.sponsorRowsNew,
                    resolver.cacheStats());
        }
    }

    private Lead sponsorLead(SourceRecord row, RunState state) {
        String registryNumber = "";
        int resolutionScore = 0;

        Optional<SponsorMapping> mapping = store.findSponsorMapping(row.sourceKey());
        if (mapping.isPresent()) {
            registryNumber = mapping.get().registryNumber();
            resolutionScore = mapping.get().matchScore();
        } else {
            ResolutionResult resolution = resolver.resolve(row.name(), row.locality());
            if (resolution.isMatch()) {
                registryNumber = resolution.identifier();
                resolutionScore = resolution.score();
                state.mappings.add(new SponsorMapping(row.sourceKey(), registryNumber, resolutionScore, state.now));
            }
        }

        Entity entity;
        EntityFacts facts;
        Optional<CompanyProfile> profile = registryNumber.isEmpty()
                ? Optional.empty() : registry.profile(registryNumber);
        if (profile.isPresent()) {
            List<Officer> officers = registry.officers(registryNumber);
            List<BeneficialOwner> owners = registry.owners(registryNumber);
            facts = EntityFacts.of(profile.get(), officers, owners);
            entity = entityFromProfile(profile.get(), row.name(), state.now);
        } else {
            facts = EntityFacts.nameOnly(row.name(), row.locality());
            entity = Entity.builder()
                    .registryNumber(registryNumber)
                    .displayName(row.name())
                    .normalizedName(normalizer.entityNormalize(row.name()))
                    .address(RegisteredAddress.ofLocality(row.locality()))
                    .lastSeenAt(state.now)
                    .build();
        }

        SignalSet signals = signalExtractor.extract(facts, state.asOf);
        ScoreResult score = scoringEngine.score(row.route(), signals);
        log.debug("sponsor.scored number={} resolution={} score={}", registryNumber, resolutionScore, score.score());
        return Lead.builder()
                .entity(entity)
                .addSource(SourceType.SPONSOR_REGISTER)
                .route(row.route())
                .subRoute(row.subRoute())
                .resolutionScore(resolutionScore)
                .signals(signals)
                .score(score)
                .visaHint(VisaHints.hint(true, row.route(), score.score(), config.getScoring()))
                .build();
    }

    private void collectRegistryLeads(RunState state) {
        SourceConfig sources = config.getSources();
        if (sources.maxCompaniesToCheck() == 0) {
            return;
        }
        try (LogContext ignored = LogContext.forStage("registry")) {
            List<Incorporation> incorporations;
            try {
                incorporations = registry.incorporatedBetween(
                        state.asOf.minusDays(sources.incorporationLookbackDays()), state.asOf,
                        sources.maxCompaniesToCheck());
            } catch (UpstreamException e) {
                log.warn("registry.list.failed status={} message={}", e.getStatus(), e.getMessage());
                skip(state, "registry");
                return;
            }

            for (Incorporation incorporation : incorporations) {
                SeenKey seenKey = SeenKey.forIncorporation(incorporation.registryNumber());
                if (store.isSeen(seenKey)) {
                    continue;
                }
                try (LogContext ctx = LogContext.forLead(incorporation.registryNumber(),
                        SourceType.COMPANIES_HOUSE.name())) {
                    registryLead(incorporation, state).ifPresent(lead -> {
                        state.candidates.add(lead);
                        state.registryCandidates++;
                    });
                    state.seenKeys.add(seenKey);
                } catch (UpstreamException e) {
                    log.warn("registry.company.skipped number={} status={} message={}",
                            incorporation.registryNumber(), e.getStatus(), e.getMessage());
                    skip(state, "registry");
                }
            }
            log.info("registry.scanned incorporations={} candidates={}", incorporations.size(),
                    state.registryCandidates);
        }
    }

    private Optional<Lead> registryLead(Incorporation incorporation, RunState state) {
        String number = incorporation.registryNumber();
        Optional<CompanyProfile> profile = registry.profile(number);
        if (profile.isEmpty()) {
            log.debug("registry.profile.missing number={}", number);
            return Optional.empty();
        }
        EntityFacts facts = EntityFacts.of(profile.get(), registry.officers(number), registry.owners(number));
        SignalSet signals = signalExtractor.extract(facts, state.asOf);
        if (!isOverseasLinked(signals)) {
            return Optional.empty();
        }
        ScoreResult score = scoringEngine.score("", signals);
        return Optional.of(Lead.builder()
                .entity(entityFromProfile(profile.get(), incorporation.name(), state.now))
                .addSource(SourceType.COMPANIES_HOUSE)
                .resolutionScore(100)
                .signals(signals)
                .score(score)
                .visaHint(VisaHints.hint(false, "", score.score(), config.getScoring()))
                .build());
    }

    /**
     * Foreign owner, foreign-resident officer, foreign nationality backed by a foreign officer
     * address, or an overseas registered office.
     */
    static boolean isOverseasLinked(SignalSet signals) {
        return signals.isFired(SignalNames.FOREIGN_BENEFICIAL_OWNER)
                || signals.isFired(SignalNames.FOREIGN_OFFICER_RESIDENCE)
                || (signals.isFired(SignalNames.FOREIGN_OFFICER_NATIONALITY)
                    && signals.isFired(SignalNames.FOREIGN_OFFICER_ADDRESS))
                || signals.isFired(SignalNames.FOREIGN_REGISTERED_OFFICE);
    }

    /**
     * Enriches the leads that will make the output, in rank order, and re-scores them.
     * Leads below the cap are returned unchanged.
     */
    private List<Lead> enrichTop(List<Lead> ranked, RunState state) {
        int cap = config.getOutput().maxLeads();
        List<Lead> result = new ArrayList<>(ranked.size());
        try (LogContext ignored = LogContext.forStage("enrichment")) {
            for (int i = 0; i < ranked.size(); i++) {
                Lead lead = ranked.get(i);
                result.add(i < cap ? enrichOne(lead, state) : lead);
            }
        }
        return result;
    }

    private Lead enrichOne(Lead lead, RunState state) {
        if (enrichment == null) {
            return lead;
        }
        EnrichmentResult result;
        try (LogContext ctx = LogContext.forLead(lead.getKey(), lead.getProvenanceText())) {
            if (!isEnrichmentPriority(lead)) {
                result = EnrichmentResult.skipped(EnrichStatus.SKIPPED_LOW_PRIORITY, state.now);
                metrics.recordEnrichmentStatus(result.status());
            } else {
                Entity entity = lead.getEntity();
                result = enrichment.enrich(new EnrichmentTarget(lead.getKey(), entity.getDisplayName(),
                        entity.getRegistryNumber(), entity.getAddress().postcode(),
                        entity.getAddress().locality()), state.now);
            }
            log.debug("enrichment.done status='{}' level={}", result.status().label(), result.level());
        }
        if (result.isVerified() && result.status() != EnrichStatus.CACHED) {
            state.verifiedSites++;
        }

        ScoreResult pre = lead.getScore();
        ScoreResult rescored = scoringEngine.rescore(pre, result);
        return Lead.builder(lead)
                .enrichment(result)
                .preEnrichmentScore(pre.score())
                .score(rescored)
                .visaHint(VisaHints.hint(lead.isSponsorSourced(), lead.getRoute(), rescored.score(),
                        config.getScoring()))
                .build();
    }

    private static boolean isEnrichmentPriority(Lead lead) {
        Bucket bucket = lead.getScore().bucket();
        return bucket == Bucket.HOT || bucket == Bucket.MEDIUM || lead.isSponsorSourced();
    }

    private Entity entityFromProfile(CompanyProfile profile, String fallbackName, Instant now) {
        String name = profile.name().isEmpty() ? fallbackName : profile.name();
        return Entity.builder()
                .registryNumber(profile.registryNumber())
                .displayName(name)
                .normalizedName(normalizer.entityNormalize(name))
                .registrationDate(profile.registrationDate())
                .status(profile.status())
                .classificationCodes(profile.classificationCodes())
                .address(profile.address())
                .lastSeenAt(now)
                .build();
    }

    private void skip(RunState state, String stage) {
        state.itemsSkipped++;
        metrics.incrementItemSkipped(stage);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable per-run accumulators. Lives for one {@link #run} call only.
     */
    private static final class RunState {
        final Instant now;
        final LocalDate asOf;
        final List<Lead> candidates = new ArrayList<>();
        final List<SeenKey> seenKeys = new ArrayList<>();
        final List<SponsorMapping> mappings = new ArrayList<>();
        final Map<String, String> meta = new LinkedHashMap<>();
        boolean baselineRun;
        int sponsorRowsTotal;
        int sponsorRowsNew;
        int registryCandidates;
        int verifiedSites;
        int itemsSkipped;

        RunState(Instant now) {
            this.now = now;
            this.asOf = LocalDate.ofInstant(now, ZoneOffset.UTC);
        }
    }

    public static class Builder {
        private LeadsConfig config;
        private SponsorRegisterSource sponsorSource;
        private RegistryClient registry;
        private IdentityResolver resolver;
        private StateStore stateStore;
        private EnrichmentPipeline enrichment;
        private EnrichmentBudget budget;
        private TextNormalizer normalizer;
        private MetricsService metrics;
        private LeadSink sink;

        public Builder config(LeadsConfig config) {
            this.config = config;
            return this;
        }

        public Builder sponsorSource(SponsorRegisterSource sponsorSource) {
            this.sponsorSource = sponsorSource;
            return this;
        }

        public Builder registry(RegistryClient registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Overrides the resolver built from the registry client and resolver config.
         */
        public Builder resolver(IdentityResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder stateStore(StateStore stateStore) {
            this.stateStore = stateStore;
            return this;
        }

        /**
         * Enables enrichment. The budget must be the one the pipeline's discovery stage consumes.
         */
        public Builder enrichment(EnrichmentPipeline enrichment, EnrichmentBudget budget) {
            this.enrichment = enrichment;
            this.budget = budget;
            return this;
        }

        public Builder normalizer(TextNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder sink(LeadSink sink) {
            this.sink = sink;
            return this;
        }

        public LeadPipeline build() {
            Objects.requireNonNull(config, "config is required");
            Objects.requireNonNull(registry, "registry is required");
            Objects.requireNonNull(stateStore, "stateStore is required");
            if (enrichment != null && budget == null) {
                throw new IllegalStateException("An enrichment budget is required when enrichment is enabled");
            }
            return new LeadPipeline(this);
        }
    }
}
