package com.expansion.leads.store;

import com.expansion.leads.core.LeadsException;
import com.expansion.leads.core.model.Bucket;
import com.expansion.leads.core.model.EnrichStatus;
import com.expansion.leads.core.model.EnrichmentResult;
import com.expansion.leads.core.model.EnrichmentState;
import com.expansion.leads.core.model.Entity;
import com.expansion.leads.core.model.Lead;
import com.expansion.leads.core.model.RegisteredAddress;
import com.expansion.leads.core.model.RunSummary;
import com.expansion.leads.core.model.ScoreResult;
import com.expansion.leads.core.model.SeenKey;
import com.expansion.leads.core.model.Signal;
import com.expansion.leads.core.model.SignalSet;
import com.expansion.leads.core.model.SourceType;
import com.expansion.leads.core.model.VerificationLevel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * SQLite-backed StateStore on Spring JDBC. The schema is created idempotently on open.
 * {@link #commit} runs in one transaction, so a crashed run leaves no seen key without its lead.
 */
public class JdbcStateStore implements StateStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcStateStore.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Signal>> SIGNAL_LIST = new TypeReference<>() {};
    private static final String DO_NOT_CONTACT = "DO_NOT_CONTACT";

    private static final List<String> SCHEMA = List.of(
            """
                CREATE TABLE IF NOT EXISTS meta (
                    k TEXT PRIMARY KEY,
                    v TEXT NOT NULL
                )
                """,
            """
                CREATE TABLE IF NOT EXISTS seen (
                    seen_key TEXT PRIMARY KEY,
                    source TEXT NOT NULL,
                    first_seen_ms INTEGER NOT NULL
                )
                """,
            """
                CREATE TABLE IF NOT EXISTS leads (
                    entity_key TEXT PRIMARY KEY,
                    registry_number TEXT NOT NULL,
                    display_name TEXT NOT NULL,
                    normalized_name TEXT NOT NULL,
                    status TEXT NOT NULL,
                    registration_date TEXT,
                    classification_codes TEXT NOT NULL,
                    street TEXT NOT NULL,
                    postcode TEXT NOT NULL,
                    locality TEXT NOT NULL,
                    country TEXT NOT NULL,
                    provenance TEXT NOT NULL,
                    route TEXT NOT NULL,
                    sub_route TEXT NOT NULL,
                    resolution_score INTEGER NOT NULL,
                    signals TEXT NOT NULL,
                    pre_enrichment_score INTEGER NOT NULL,
                    score INTEGER NOT NULL,
                    bucket TEXT NOT NULL,
                    rationale TEXT NOT NULL,
                    website TEXT NOT NULL,
                    website_level TEXT NOT NULL,
                    website_score INTEGER NOT NULL,
                    evidence TEXT NOT NULL,
                    emails TEXT NOT NULL,
                    phones TEXT NOT NULL,
                    hiring_intent INTEGER NOT NULL,
                    enrich_status TEXT NOT NULL,
                    enrich_state TEXT NOT NULL,
                    visa_hint TEXT NOT NULL,
                    first_seen_ms INTEGER NOT NULL,
                    last_seen_ms INTEGER NOT NULL
                )
                """,
            "CREATE INDEX IF NOT EXISTS idx_leads_recent ON leads (last_seen_ms, score)",
            """
                CREATE TABLE IF NOT EXISTS enrichment_cache (
                    entity_key TEXT PRIMARY KEY,
                    website TEXT NOT NULL,
                    website_level TEXT NOT NULL,
                    website_score INTEGER NOT NULL,
                    evidence TEXT NOT NULL,
                    emails TEXT NOT NULL,
                    phones TEXT NOT NULL,
                    hiring_intent INTEGER NOT NULL,
                    enrich_status TEXT NOT NULL,
                    enrich_state TEXT NOT NULL,
                    updated_ms INTEGER NOT NULL
                )
                """,
            """
                CREATE TABLE IF NOT EXISTS sponsor_company_map (
                    row_key TEXT PRIMARY KEY,
                    company_number TEXT NOT NULL,
                    match_score INTEGER NOT NULL,
                    matched_ms INTEGER NOT NULL
                )
                """,
            """
                CREATE TABLE IF NOT EXISTS lead_actions (
                    entity_key TEXT PRIMARY KEY,
                    status TEXT NOT NULL,
                    note TEXT NOT NULL,
                    updated_ms INTEGER NOT NULL
                )
                """,
            """
                CREATE TABLE IF NOT EXISTS runs (
                    run_id TEXT PRIMARY KEY,
                    started_ms INTEGER NOT NULL,
                    finished_ms INTEGER,
                    baseline_run INTEGER NOT NULL,
                    sponsor_rows_total INTEGER NOT NULL,
                    sponsor_rows_new INTEGER NOT NULL,
                    registry_candidates INTEGER NOT NULL,
                    search_calls INTEGER NOT NULL,
                    verified_sites INTEGER NOT NULL,
                    leads_emitted INTEGER NOT NULL,
                    backfilled INTEGER NOT NULL,
                    items_skipped INTEGER NOT NULL
                )
                """
    );

    private final SingleConnectionDataSource dataSource;
    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final ObjectMapper objectMapper;

    /**
     * Opens (creating if needed) the SQLite database at {@code path}.
     */
    public static JdbcStateStore open(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create state directory for " + path, e);
        }
        SingleConnectionDataSource dataSource =
                new SingleConnectionDataSource("jdbc:sqlite:" + path.toAbsolutePath(), true);
        dataSource.setDriverClassName("org.sqlite.JDBC");
        return new JdbcStateStore(dataSource);
    }

    JdbcStateStore(SingleConnectionDataSource dataSource) {
        this.dataSource = dataSource;
        this.jdbc = new NamedParameterJdbcTemplate(dataSource);
        this.transactions = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        createSchema();
    }

    private void createSchema() {
        for (String ddl : SCHEMA) {
            jdbc.getJdbcTemplate().execute(ddl);
        }
        log.debug("State store schema ready");
    }

    @Override
    public Optional<String> getMeta(String key) {
        List<String> values = jdbc.queryForList("SELECT v FROM meta WHERE k = :k",
                new MapSqlParameterSource("k", key), String.class);
        return values.stream().findFirst();
    }

    @Override
    public boolean isSeen(SeenKey key) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM seen WHERE seen_key = :key",
                new MapSqlParameterSource("key", key.key()), Integer.class);
        return count != null && count > 0;
    }

    @Override
    public Optional<SponsorMapping> findSponsorMapping(String rowKey) {
        List<SponsorMapping> rows = jdbc.query(
                "SELECT row_key, company_number, match_score, matched_ms FROM sponsor_company_map WHERE row_key = :rowKey",
                new MapSqlParameterSource("rowKey", rowKey),
                (rs, i) -> new SponsorMapping(rs.getString("row_key"), rs.getString("company_number"),
                        rs.getInt("match_score"), Instant.ofEpochMilli(rs.getLong("matched_ms"))));
        return rows.stream().findFirst();
    }

    @Override
    public Optional<EnrichmentResult> findEnrichment(String entityKey) {
        List<EnrichmentResult> rows = jdbc.query(
                "SELECT * FROM enrichment_cache WHERE entity_key = :key",
                new MapSqlParameterSource("key", entityKey),
                (rs, i) -> readEnrichment(rs, Instant.ofEpochMilli(rs.getLong("updated_ms"))));
        return rows.stream().findFirst();
    }

    @Override
    public void saveEnrichment(String entityKey, EnrichmentResult result) {
        MapSqlParameterSource params = enrichmentParams(result)
                .addValue("key", entityKey)
                .addValue("updated", toMillis(result.updatedAt(), Instant.now()));
        jdbc.update("""
                INSERT INTO enrichment_cache (entity_key, website, website_level, website_score, evidence,
                    emails, phones, hiring_intent, enrich_status, enrich_state, updated_ms)
                VALUES (:key, :website, :level, :websiteScore, :evidence, :emails, :phones, :hiring,
                    :enrichStatus, :enrichState, :updated)
                ON CONFLICT(entity_key) DO UPDATE SET
                    website = excluded.website, website_level = excluded.website_level,
                    website_score = excluded.website_score, evidence = excluded.evidence,
                    emails = excluded.emails, phones = excluded.phones,
                    hiring_intent = excluded.hiring_intent, enrich_status = excluded.enrich_status,
                    enrich_state = excluded.enrich_state, updated_ms = excluded.updated_ms
                """, params);
    }

    @Override
    public Optional<Lead> findLead(String entityKey) {
        List<Lead> rows = jdbc.query("SELECT * FROM leads WHERE entity_key = :key",
                new MapSqlParameterSource("key", entityKey), leadMapper());
        return rows.stream().findFirst();
    }

    @Override
    public List<Lead> findRecentLeads(Instant since, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("since", since.toEpochMilli())
                .addValue("limit", limit)
                .addValue("dnc", DO_NOT_CONTACT);
        return jdbc.query("""
                SELECT l.* FROM leads l
                WHERE l.last_seen_ms >= :since
                  AND NOT EXISTS (SELECT 1 FROM lead_actions a
                                  WHERE a.entity_key = l.entity_key AND a.status = :dnc)
                ORDER BY l.score DESC, l.last_seen_ms DESC
                LIMIT :limit
                """, params, leadMapper());
    }

    @Override
    public boolean isSuppressed(String entityKey) {
        Integer count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM lead_actions WHERE entity_key = :key AND status = :dnc",
                new MapSqlParameterSource().addValue("key", entityKey).addValue("dnc", DO_NOT_CONTACT),
                Integer.class);
        return count != null && count > 0;
    }

    @Override
    public void suppress(String entityKey, String note, Instant at) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("key", entityKey)
                .addValue("status", DO_NOT_CONTACT)
                .addValue("note", note != null ? note : "")
                .addValue("updated", at.toEpochMilli());
        jdbc.update("""
                INSERT INTO lead_actions (entity_key, status, note, updated_ms)
                VALUES (:key, :status, :note, :updated)
                ON CONFLICT(entity_key) DO UPDATE SET
                    status = excluded.status, note = excluded.note, updated_ms = excluded.updated_ms
                """, params);
        log.info("lead.suppressed key={}", entityKey);
    }

    @Override
    public void commit(RunCommit commit) {
        transactions.executeWithoutResult(status -> {
            long now = commit.committedAt().toEpochMilli();
            for (Map.Entry<String, String> entry : commit.meta().entrySet()) {
                jdbc.update("""
                        INSERT INTO meta (k, v) VALUES (:k, :v)
                        ON CONFLICT(k) DO UPDATE SET v = excluded.v
                        """, new MapSqlParameterSource().addValue("k", entry.getKey()).addValue("v", entry.getValue()));
            }

            if (!commit.seenKeys().isEmpty()) {
                SqlParameterSource[] batch = commit.seenKeys().stream()
                        .map(k -> new MapSqlParameterSource()
                                .addValue("key", k.key())
                                .addValue("source", k.source().name())
                                .addValue("now", now))
                        .toArray(SqlParameterSource[]::new);
                jdbc.batchUpdate("""
                        INSERT INTO seen (seen_key, source, first_seen_ms) VALUES (:key, :source, :now)
                        ON CONFLICT(seen_key) DO NOTHING
                        """, batch);
            }

            for (SponsorMapping mapping : commit.sponsorMappings()) {
                jdbc.update("""
                        INSERT INTO sponsor_company_map (row_key, company_number, match_score, matched_ms)
                        VALUES (:rowKey, :number, :score, :matched)
                        ON CONFLICT(row_key) DO UPDATE SET company_number = excluded.company_number,
                            match_score = excluded.match_score, matched_ms = excluded.matched_ms
                        """, new MapSqlParameterSource()
                        .addValue("rowKey", mapping.rowKey())
                        .addValue("number", mapping.registryNumber())
                        .addValue("score", mapping.matchScore())
                        .addValue("matched", toMillis(mapping.matchedAt(), commit.committedAt())));
            }

            for (Lead lead : commit.leads()) {
                upsertLead(lead, now);
            }

            insertRun(commit.summary());
        });
        log.info("run.committed runId={} leads={} seen={}",
                commit.summary().runId(), commit.leads().size(), commit.seenKeys().size());
    }

    private void upsertLead(Lead lead, long now) {
        Entity entity = lead.getEntity();
        Long carriedFirstSeen = null;
        if (entity.hasRegistryNumber() && !entity.getNameKey().equals(lead.getKey())) {
            MapSqlParameterSource nameKey = new MapSqlParameterSource("key", entity.getNameKey());
            List<Long> stale = jdbc.queryForList(
                    "SELECT first_seen_ms FROM leads WHERE entity_key = :key", nameKey, Long.class);
            if (!stale.isEmpty()) {
                carriedFirstSeen = stale.get(0);
                jdbc.update("DELETE FROM leads WHERE entity_key = :key", nameKey);
                log.debug("lead.rekeyed from={} to={}", entity.getNameKey(), lead.getKey());
            }
        }

        RegisteredAddress address = entity.getAddress();
        ScoreResult score = lead.getScore();
        MapSqlParameterSource params = enrichmentParams(lead.getEnrichment())
                .addValue("key", lead.getKey())
                .addValue("registryNumber", entity.getRegistryNumber())
                .addValue("displayName", entity.getDisplayName())
                .addValue("normalizedName", entity.getNormalizedName())
                .addValue("status", entity.getStatus())
                .addValue("registrationDate", entity.getRegistrationDate() != null
                        ? entity.getRegistrationDate().toString() : null)
                .addValue("codes", toJson(entity.getClassificationCodes()))
                .addValue("street", address.street())
                .addValue("postcode", address.postcode())
                .addValue("locality", address.locality())
                .addValue("country", address.country())
                .addValue("provenance", lead.getProvenanceText())
                .addValue("route", lead.getRoute())
                .addValue("subRoute", lead.getSubRoute())
                .addValue("resolutionScore", lead.getResolutionScore())
                .addValue("signals", toJson(lead.getSignals().signals()))
                .addValue("preScore", lead.getPreEnrichmentScore())
                .addValue("score", score.score())
                .addValue("bucket", score.bucket().name())
                .addValue("rationale", toJson(score.rationale()))
                .addValue("visaHint", lead.getVisaHint())
                .addValue("firstSeen", carriedFirstSeen != null ? carriedFirstSeen : now)
                .addValue("now", now);

        jdbc.update("""
                INSERT INTO leads (entity_key, registry_number, display_name, normalized_name, status,
                    registration_date, classification_codes, street, postcode, locality, country,
                    provenance, route, sub_route, resolution_score, signals, pre_enrichment_score, score,
                    bucket, rationale, website, website_level, website_score, evidence, emails, phones,
                    hiring_intent, enrich_status, enrich_state, visa_hint, first_seen_ms, last_seen_ms)
                VALUES (:key, :registryNumber, :displayName, :normalizedName, :status,
                    :registrationDate, :codes, :street, :postcode, :locality, :country,
                    :provenance, :route, :subRoute, :resolutionScore, :signals, :preScore, :score,
                    :bucket, :rationale, :website, :level, :websiteScore, :evidence, :emails, :phones,
                    :hiring, :enrichStatus, :enrichState, :visaHint, :firstSeen, :now)
                ON CONFLICT(entity_key) DO UPDATE SET
                    registry_number = excluded.registry_number, display_name = excluded.display_name,
                    normalized_name = excluded.normalized_name, status = excluded.status,
                    registration_date = excluded.registration_date,
                    classification_codes = excluded.classification_codes, street = excluded.street,
                    postcode = excluded.postcode, locality = excluded.locality, country = excluded.country,
                    provenance = excluded.provenance, route = excluded.route, sub_route = excluded.sub_route,
                    resolution_score = excluded.resolution_score, signals = excluded.signals,
                    pre_enrichment_score = excluded.pre_enrichment_score, score = excluded.score,
                    bucket = excluded.bucket, rationale = excluded.rationale, website = excluded.website,
                    website_level = excluded.website_level, website_score = excluded.website_score,
                    evidence = excluded.evidence, emails = excluded.emails, phones = excluded.phones,
                    hiring_intent = excluded.hiring_intent, enrich_status = excluded.enrich_status,
                    enrich_state = excluded.enrich_state, visa_hint = excluded.visa_hint,
                    first_seen_ms = MIN(leads.first_seen_ms, excluded.first_seen_ms),
                    last_seen_ms = excluded.last_seen_ms
                """, params);
    }

    private void insertRun(RunSummary summary) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("runId", summary.runId())
                .addValue("started", summary.startedAt().toEpochMilli())
                .addValue("finished", summary.finishedAt() != null ? summary.finishedAt().toEpochMilli() : null)
                .addValue("baseline", summary.baselineRun() ? 1 : 0)
                .addValue("rowsTotal", summary.sponsorRowsTotal())
                .addValue("rowsNew", summary.sponsorRowsNew())
                .addValue("candidates", summary.registryCandidates())
                .addValue("searchCalls", summary.searchCalls())
                .addValue("verified", summary.verifiedSites())
                .addValue("emitted", summary.leadsEmitted())
                .addValue("backfilled", summary.backfilled())
                .addValue("skipped", summary.itemsSkipped());
        jdbc.update("""
                INSERT OR REPLACE INTO runs (run_id, started_ms, finished_ms, baseline_run, sponsor_rows_total,
                    sponsor_rows_new, registry_candidates, search_calls, verified_sites, leads_emitted,
                    backfilled, items_skipped)
                VALUES (:runId, :started, :finished, :baseline, :rowsTotal, :rowsNew, :candidates,
                    :searchCalls, :verified, :emitted, :backfilled, :skipped)
                """, params);
    }

    @Override
    public Optional<RunSummary> findRun(String runId) {
        List<RunSummary> rows = jdbc.query("SELECT * FROM runs WHERE run_id = :runId",
                new MapSqlParameterSource("runId", runId),
                (rs, i) -> {
                    long finished = rs.getLong("finished_ms");
                    Instant finishedAt = rs.wasNull() ? null : Instant.ofEpochMilli(finished);
                    return new RunSummary(
                            rs.getString("run_id"),
                            Instant.ofEpochMilli(rs.getLong("started_ms")),
                            finishedAt,
                            rs.getInt("baseline_run") == 1,
                            rs.getInt("sponsor_rows_total"),
                            rs.getInt("sponsor_rows_new"),
                            rs.getInt("registry_candidates"),
                            rs.getInt("search_calls"),
                            rs.getInt("verified_sites"),
                            rs.getInt("leads_emitted"),
                            rs.getInt("backfilled"),
                            rs.getInt("items_skipped"));
                });
        return rows.stream().findFirst();
    }

    @Override
    public void close() {
        dataSource.destroy();
    }

    private MapSqlParameterSource enrichmentParams(EnrichmentResult result) {
        return new MapSqlParameterSource()
                .addValue("website", result.website())
                .addValue("level", result.level().name())
                .addValue("websiteScore", result.score())
                .addValue("evidence", toJson(result.evidence()))
                .addValue("emails", toJson(result.emails()))
                .addValue("phones", toJson(result.phones()))
                .addValue("hiring", result.hiringIntent() ? 1 : 0)
                .addValue("enrichStatus", result.status().name())
                .addValue("enrichState", result.state().name());
    }

    private EnrichmentResult readEnrichment(ResultSet rs, Instant updatedAt) throws SQLException {
        return new EnrichmentResult(
                rs.getString("website"),
                VerificationLevel.valueOf(rs.getString("website_level")),
                rs.getInt("website_score"),
                fromJson(rs.getString("evidence"), STRING_LIST),
                fromJson(rs.getString("emails"), STRING_LIST),
                fromJson(rs.getString("phones"), STRING_LIST),
                rs.getInt("hiring_intent") == 1,
                EnrichStatus.fromLabel(rs.getString("enrich_status")),
                EnrichmentState.valueOf(rs.getString("enrich_state")),
                updatedAt);
    }

    private RowMapper<Lead> leadMapper() {
        return (rs, rowNum) -> {
            String registrationDate = rs.getString("registration_date");
            Entity entity = Entity.builder()
                    .registryNumber(rs.getString("registry_number"))
                    .displayName(rs.getString("display_name"))
                    .normalizedName(rs.getString("normalized_name"))
                    .status(rs.getString("status"))
                    .registrationDate(registrationDate != null ? LocalDate.parse(registrationDate) : null)
                    .classificationCodes(fromJson(rs.getString("classification_codes"), STRING_LIST))
                    .address(new RegisteredAddress(rs.getString("street"), rs.getString("postcode"),
                            rs.getString("locality"), rs.getString("country")))
                    .lastSeenAt(Instant.ofEpochMilli(rs.getLong("last_seen_ms")))
                    .build();
            ScoreResult score = new ScoreResult(rs.getInt("score"), Bucket.valueOf(rs.getString("bucket")),
                    fromJson(rs.getString("rationale"), STRING_LIST));
            return Lead.builder()
                    .entity(entity)
                    .provenance(parseProvenance(rs.getString("provenance")))
                    .route(rs.getString("route"))
                    .subRoute(rs.getString("sub_route"))
                    .resolutionScore(rs.getInt("resolution_score"))
                    .signals(new SignalSet(fromJson(rs.getString("signals"), SIGNAL_LIST)))
                    .preEnrichmentScore(rs.getInt("pre_enrichment_score"))
                    .score(score)
                    .enrichment(readEnrichment(rs, null))
                    .visaHint(rs.getString("visa_hint"))
                    .build();
        };
    }

    private static Set<SourceType> parseProvenance(String text) {
        Set<SourceType> sources = EnumSet.noneOf(SourceType.class);
        if (text == null || text.isBlank()) {
            return sources;
        }
        for (String part : text.split("\\+")) {
            sources.add(SourceType.valueOf(part.trim()));
        }
        return sources;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new LeadsException("Cannot serialize state column", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json == null || json.isBlank() ? "[]" : json, type);
        } catch (JsonProcessingException e) {
            throw new LeadsException("Cannot read state column", e);
        }
    }

    private static long toMillis(Instant instant, Instant fallback) {
        return (instant != null ? instant : fallback).toEpochMilli();
    }

    List<String> seenKeys() {
        return new ArrayList<>(jdbc.queryForList("SELECT seen_key FROM seen ORDER BY seen_key",
                new MapSqlParameterSource(), String.class));
    }
}
