package com.expansion.leads.export;

import com.expansion.leads.core.ConfigurationException;
import com.expansion.leads.core.model.Bucket;
import com.expansion.leads.core.model.EnrichStatus;
import com.expansion.leads.core.model.EnrichmentResult;
import com.expansion.leads.core.model.EnrichmentState;
import com.expansion.leads.core.model.Entity;
import com.expansion.leads.core.model.Lead;
import com.expansion.leads.core.model.RegisteredAddress;
import com.expansion.leads.core.model.RunSummary;
import com.expansion.leads.core.model.ScoreResult;
import com.expansion.leads.core.model.SourceType;
import com.expansion.leads.core.model.VerificationLevel;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvLeadExporterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T06:00:00Z");

    private static Lead enrichedLead() {
        Entity entity = Entity.builder()
                .registryNumber("12345678")
                .displayName("Acme Robotics, Ltd")
                .normalizedName("acme robotics")
                .registrationDate(LocalDate.of(2026, 2, 10))
                .address(new RegisteredAddress("1 High Street", "EC1A 1BB", "London", "England"))
                .build();
        EnrichmentResult enrichment = new EnrichmentResult("https://www.acmerobotics.co.uk",
                VerificationLevel.VERIFIED, 9, List.of("company number on page", "postcode on page"),
                List.of("careers@acmerobotics.co.uk"), List.of("+44 20 7946 0000"), true,
                EnrichStatus.VERIFIED_SCRAPED, EnrichmentState.CONTACTS_EXTRACTED, NOW);
        return Lead.builder()
                .entity(entity)
                .addSource(SourceType.SPONSOR_REGISTER)
                .addSource(SourceType.COMPANIES_HOUSE)
                .route("Skilled Worker")
                .subRoute("Worker")
                .score(new ScoreResult(54, Bucket.MEDIUM, List.of("Sponsor route: Skilled Worker (+12)",
                        "Verified website (+10)")))
                .enrichment(enrichment)
                .visaHint("Skilled Worker sponsor / compliance")
                .build();
    }

    private static Lead bareLead() {
        Entity entity = Entity.builder()
                .displayName("Beta Bakeries Ltd")
                .normalizedName("beta bakeries")
                .address(RegisteredAddress.ofLocality("York"))
                .build();
        return Lead.builder()
                .entity(entity)
                .addSource(SourceType.SPONSOR_REGISTER)
                .score(new ScoreResult(12, Bucket.WATCH, List.of("Sponsor route: Skilled Worker (+12)")))
                .build()
                .asBackfill("Backfilled from recent leads");
    }

    private static List<CSVRecord> read(String csv) throws IOException {
        try (CSVParser parser = CSVParser.parse(new StringReader(csv),
                CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build())) {
            return parser.getRecords();
        }
    }

    @Test
    @DisplayName("Writes the header and one row per lead")
    void writesRows() throws IOException {
        StringWriter out = new StringWriter();
        new CsvLeadExporter(Path.of("unused")).write(List.of(enrichedLead(), bareLead()), out);

        String csv = out.toString();
        assertTrue(csv.startsWith(String.join(",", CsvLeadExporter.HEADER)));
        assertEquals(22, CsvLeadExporter.HEADER.length);

        List<CSVRecord> records = read(csv);
        assertEquals(2, records.size());

        CSVRecord acme = records.get(0);
        assertEquals("12345678", acme.get("lead_key"));
        assertEquals("Acme Robotics, Ltd", acme.get("company_name"));
        assertEquals("SPONSOR_REGISTER+COMPANIES_HOUSE", acme.get("provenance"));
        assertEquals("54", acme.get("score"));
        assertEquals("MEDIUM", acme.get("bucket"));
        assertEquals("Sponsor route: Skilled Worker (+12); Verified website (+10)", acme.get("rationale"));
        assertEquals("1 High Street, London, EC1A 1BB, England", acme.get("registered_address"));
        assertEquals("2026-02-10", acme.get("registration_date"));
        assertEquals("VERIFIED", acme.get("website_level"));
        assertEquals("careers@acmerobotics.co.uk", acme.get("emails"));
        assertEquals("yes", acme.get("hiring_intent"));
        assertEquals("Verified & scraped", acme.get("enrich_status"));
        assertEquals("no", acme.get("backfilled"));

        CSVRecord beta = records.get(1);
        assertTrue(beta.get("lead_key").startsWith("NAME::"));
        assertEquals("", beta.get("company_number"));
        assertEquals("", beta.get("website"));
        assertEquals("Not enriched", beta.get("enrich_status"));
        assertEquals("yes", beta.get("backfilled"));
        assertTrue(beta.get("rationale").startsWith("Backfilled from recent leads"));
    }

    @Test
    @DisplayName("Accepting a run writes a file named after the run id")
    void writesRunFile(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("out");
        RunSummary summary = new RunSummary(RunSummary.runIdFor(NOW), NOW, NOW, false, 3, 1, 0, 1, 1, 1, 0, 0);

        new CsvLeadExporter(out).accept(List.of(enrichedLead()), summary);

        Path file = out.resolve("leads_20260301T060000Z.csv");
        assertTrue(Files.exists(file));
        assertEquals(1, read(Files.readString(file, StandardCharsets.UTF_8)).size());
    }

    @Test
    @DisplayName("An empty run still writes the header")
    void emptyRun() throws IOException {
        StringWriter out = new StringWriter();
        new CsvLeadExporter(Path.of("unused")).write(List.of(), out);

        assertEquals(String.join(",", CsvLeadExporter.HEADER), out.toString().trim());
    }

    @Test
    @DisplayName("A missing output directory is a configuration error")
    void missingDirectory() {
        assertThrows(ConfigurationException.class, () -> new CsvLeadExporter(null));
    }
}
