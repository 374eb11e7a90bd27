package com.expansion.leads.sources;

import com.expansion.leads.config.SourceConfig;
import com.expansion.leads.core.model.SourceRecord;
import com.expansion.leads.rules.TextNormalizer;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses the register of licensed sponsors CSV.
 *
 * <p>Expected columns (names are trimmed, either spelling accepted):</p>
 * <pre>
 * Organisation Name | Organization Name, Town/City | Town, County, Type &amp; Rating, Route, Sub Route
 * </pre>
 *
 * <p>Rows outside the route allow-list and rows whose cleaned name looks like noise are dropped.
 * Duplicate row keys keep the first occurrence.</p>
 */
public class SponsorRegisterParser {
    private static final Logger log = LoggerFactory.getLogger(SponsorRegisterParser.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final List<String> NAME_HEADERS = List.of("Organisation Name", "Organization Name");
    static final List<String> TOWN_HEADERS = List.of("Town/City", "Town");
    static final List<String> COUNTY_HEADERS = List.of("County");
    static final List<String> ROUTE_HEADERS = List.of("Route");
    static final List<String> SUB_ROUTE_HEADERS = List.of("Sub Route");

    private final SourceConfig config;
    private final TextNormalizer normalizer;

    public SponsorRegisterParser(SourceConfig config, TextNormalizer normalizer) {
        this.config = config;
        this.normalizer = normalizer;
    }

    public List<SourceRecord> parse(Reader reader) {
        Map<String, SourceRecord> rows = new LinkedHashMap<>();
        int total = 0;
        int offRoute = 0;
        int noise = 0;

        try (CSVParser parser = CSVParser.parse(reader, CSVFormat.DEFAULT.builder().setIgnoreEmptyLines(true).build())) {
            Map<String, Integer> columns = null;
            for (CSVRecord record : parser) {
                if (columns == null) {
                    columns = headerIndex(record);
                    continue;
                }
                total++;
                String rawName = field(record, columns, NAME_HEADERS);
                String town = collapse(field(record, columns, TOWN_HEADERS));
                String county = collapse(field(record, columns, COUNTY_HEADERS));
                String route = collapse(field(record, columns, ROUTE_HEADERS));
                String subRoute = collapse(field(record, columns, SUB_ROUTE_HEADERS));

                if (!config.routeAllowList().contains(route)) {
                    offRoute++;
                    continue;
                }
                String name = normalizer.cleanDisplayName(rawName);
                if (isNoise(name)) {
                    noise++;
                    continue;
                }
                String key = rowKey(rawName, town, route, subRoute);
                rows.putIfAbsent(key, SourceRecord.sponsorRow(key, name, town, county, route, subRoute));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read sponsor register", e);
        }

        log.info("sponsor.parsed total={} kept={} offRoute={} noise={}", total, rows.size(), offRoute, noise);
        return new ArrayList<>(rows.values());
    }

    /**
     * Stable key of a register row; unchanged rows keep their key between downloads.
     */
    public static String rowKey(String name, String town, String route, String subRoute) {
        return "SPONSOR::" + upper(name) + "::" + upper(town) + "::" + upper(route) + "::" + upper(subRoute);
    }

    boolean isNoise(String cleanedName) {
        return cleanedName.length() < config.minCleanNameLength()
                || normalizer.nonAlnumRatio(cleanedName) > config.maxNonAlnumRatio();
    }

    private static Map<String, Integer> headerIndex(CSVRecord header) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i).replace("\uFEFF", "").trim();
            index.putIfAbsent(name.toLowerCase(Locale.ROOT), i);
        }
        return index;
    }

    private static String field(CSVRecord record, Map<String, Integer> columns, List<String> aliases) {
        for (String alias : aliases) {
            Integer i = columns.get(alias.toLowerCase(Locale.ROOT));
            if (i != null && i < record.size()) {
                String value = record.get(i);
                if (value != null && !value.isBlank()) {
                    return value;
                }
            }
        }
        return "";
    }

    private static String collapse(String text) {
        return text == null ? "" : WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    private static String upper(String text) {
        return collapse(text).toUpperCase(Locale.ROOT);
    }
}
