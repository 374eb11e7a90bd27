package com.expansion.leads.export;

import com.expansion.leads.core.ConfigurationException;
import com.expansion.leads.core.LeadsException;
import com.expansion.leads.core.model.Entity;
import com.expansion.leads.core.model.EnrichmentResult;
import com.expansion.leads.core.model.Lead;
import com.expansion.leads.core.model.RunSummary;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes one CSV per run into the output directory, named {@code leads_<runId>.csv}.
 *
 * <p>Output format:</p>
 * <pre>
 * lead_key,company_name,company_number,provenance,route,sub_route,score,bucket,rationale,...
 * 12345678,Acme Robotics Ltd,12345678,COMPANIES_HOUSE,,,20,WATCH,Foreign beneficial owner (+20),...
 * </pre>
 */
public class CsvLeadExporter implements LeadSink {
    private static final Logger log = LoggerFactory.getLogger(CsvLeadExporter.class);

    static final String[] HEADER = {
            "lead_key", "company_name", "company_number", "provenance", "route", "sub_route",
            "score", "bucket", "rationale", "visa_hint", "registered_address", "postcode",
            "registration_date", "website", "website_level", "website_score", "evidence",
            "emails", "phones", "hiring_intent", "enrich_status", "backfilled"
    };

    private final Path outputDirectory;

    /**
     * @throws ConfigurationException when no output directory is configured
     */
    public CsvLeadExporter(Path outputDirectory) {
        if (outputDirectory == null) {
            throw new ConfigurationException("No output directory configured for the lead export");
        }
        this.outputDirectory = outputDirectory;
    }

    @Override
    public void accept(List<Lead> leads, RunSummary summary) {
        Path file = outputDirectory.resolve("leads_" + summary.runId() + ".csv");
        try {
            Files.createDirectories(outputDirectory);
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                write(leads, writer);
            }
        } catch (IOException e) {
            throw new LeadsException("Cannot write lead export " + file, e);
        }
        log.info("export.completed file={} leads={}", file, leads.size());
    }

    public void write(List<Lead> leads, Writer writer) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(HEADER).build();
        CSVPrinter printer = new CSVPrinter(writer, format);
        for (Lead lead : leads) {
            Entity entity = lead.getEntity();
            EnrichmentResult enrichment = lead.getEnrichment();
            printer.printRecord(
                    lead.getKey(),
                    entity.getDisplayName(),
                    entity.getRegistryNumber(),
                    lead.getProvenanceText(),
                    lead.getRoute(),
                    lead.getSubRoute(),
                    lead.getScore().score(),
                    lead.getScore().bucket().name(),
                    lead.getScore().rationaleText(),
                    lead.getVisaHint(),
                    entity.getAddress().flattened(),
                    entity.getAddress().postcode(),
                    entity.getRegistrationDate() != null ? entity.getRegistrationDate().toString() : "",
                    enrichment.website(),
                    enrichment.level().name(),
                    enrichment.score(),
                    String.join("; ", enrichment.evidence()),
                    String.join("; ", enrichment.emails()),
                    String.join("; ", enrichment.phones()),
                    enrichment.hiringIntent() ? "yes" : "no",
                    enrichment.status().label(),
                    lead.isBackfilled() ? "yes" : "no");
        }
        printer.flush();
    }
}
