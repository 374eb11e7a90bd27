package com.expansion.leads.http;

import com.expansion.leads.config.HttpConfig;
import com.expansion.leads.core.ConfigurationException;
import com.expansion.leads.core.UpstreamException;
import com.expansion.leads.core.model.BeneficialOwner;
import com.expansion.leads.core.model.CompanyProfile;
import com.expansion.leads.core.model.Incorporation;
import com.expansion.leads.core.model.Officer;
import com.expansion.leads.core.model.RegisteredAddress;
import com.expansion.leads.core.model.RegistrySearchHit;
import com.expansion.leads.resolution.RegistryClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Companies House public data API client. Authenticates with HTTP Basic, the API key as user name.
 */
public class CompaniesHouseClient implements RegistryClient {
    private static final Logger log = LoggerFactory.getLogger(CompaniesHouseClient.class);

    private static final int PAGE_SIZE = 100;

    private final HttpExecutor executor;
    private final HttpConfig config;
    private final String authorization;
    private final ObjectMapper objectMapper;

    public CompaniesHouseClient(HttpExecutor executor, HttpConfig config, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("A Companies House API key is required");
        }
        this.executor = executor;
        this.config = config;
        this.authorization = "Basic " + Base64.getEncoder()
                .encodeToString((apiKey.trim() + ":").getBytes(StandardCharsets.UTF_8));
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<RegistrySearchHit> search(String query, int maxResults) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("items_per_page", String.valueOf(maxResults));
        Optional<JsonNode> body = get("/search/companies", params);
        List<RegistrySearchHit> hits = new ArrayList<>();
        body.ifPresent(json -> {
            for (JsonNode item : json.path("items")) {
                hits.add(new RegistrySearchHit(
                        item.path("title").asText(""),
                        item.path("company_number").asText(""),
                        item.path("company_status").asText(""),
                        item.path("address_snippet").asText("")));
            }
        });
        return hits;
    }

    @Override
    public Optional<CompanyProfile> profile(String registryNumber) {
        return get("/company/" + registryNumber, Map.of()).map(json -> {
            JsonNode office = json.path("registered_office_address");
            String street = joinNonEmpty(office.path("address_line_1").asText(""),
                    office.path("address_line_2").asText(""));
            String locality = office.path("locality").asText("");
            if (locality.isEmpty()) {
                locality = office.path("post_town").asText("");
            }
            List<String> codes = new ArrayList<>();
            json.path("sic_codes").forEach(code -> codes.add(code.asText()));
            return new CompanyProfile(
                    json.path("company_number").asText(registryNumber),
                    json.path("company_name").asText(""),
                    json.path("company_status").asText(""),
                    parseDate(json.path("date_of_creation").asText("")),
                    codes,
                    new RegisteredAddress(street, office.path("postal_code").asText(""), locality,
                            office.path("country").asText("")));
        });
    }

    @Override
    public List<Officer> officers(String registryNumber) {
        Optional<JsonNode> body = get("/company/" + registryNumber + "/officers",
                Map.of("items_per_page", String.valueOf(PAGE_SIZE)));
        List<Officer> officers = new ArrayList<>();
        body.ifPresent(json -> {
            for (JsonNode item : json.path("items")) {
                officers.add(new Officer(
                        item.path("name").asText(""),
                        item.path("officer_role").asText(""),
                        item.path("address").path("country").asText(""),
                        item.path("country_of_residence").asText(""),
                        item.path("nationality").asText(""),
                        item.hasNonNull("resigned_on")));
            }
        });
        return officers;
    }

    @Override
    public List<BeneficialOwner> owners(String registryNumber) {
        Optional<JsonNode> body = get("/company/" + registryNumber + "/persons-with-significant-control",
                Map.of("items_per_page", String.valueOf(PAGE_SIZE)));
        List<BeneficialOwner> owners = new ArrayList<>();
        body.ifPresent(json -> {
            for (JsonNode item : json.path("items")) {
                String country = item.path("address").path("country").asText("");
                if (country.isEmpty()) {
                    country = item.path("identification").path("country_registered").asText("");
                }
                owners.add(new BeneficialOwner(
                        item.path("kind").asText(""),
                        item.path("name").asText(""),
                        country,
                        item.hasNonNull("ceased_on") || item.path("ceased").asBoolean(false)));
            }
        });
        return owners;
    }

    @Override
    public List<Incorporation> incorporatedBetween(LocalDate from, LocalDate to, int maxResults) {
        List<Incorporation> out = new ArrayList<>();
        int startIndex = 0;
        while (out.size() < maxResults) {
            int size = Math.min(PAGE_SIZE, maxResults - out.size());
            Map<String, String> params = new LinkedHashMap<>();
            params.put("incorporated_from", from.toString());
            params.put("incorporated_to", to.toString());
            params.put("size", String.valueOf(size));
            params.put("start_index", String.valueOf(startIndex));
            Optional<JsonNode> body = get("/advanced-search/companies", params);
            if (body.isEmpty()) {
                break;
            }
            int count = 0;
            for (JsonNode item : body.get().path("items")) {
                count++;
                String number = item.path("company_number").asText("");
                if (!number.isEmpty()) {
                    out.add(new Incorporation(number, item.path("company_name").asText(""),
                            parseDate(item.path("date_of_creation").asText(""))));
                }
            }
            if (count < size) {
                break;
            }
            startIndex += size;
        }
        log.debug("registry.incorporations from={} to={} count={}", from, to, out.size());
        return out.size() > maxResults ? out.subList(0, maxResults) : out;
    }

    private Optional<JsonNode> get(String path, Map<String, String> params) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.registryBaseUrl() + path + query(params)))
                .timeout(config.apiTimeout())
                .header("Authorization", authorization)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResult result = executor.execute(request);
        if (result.isNotFound() || result.body().isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(result.body()));
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Unreadable registry response for " + path, e);
        }
    }

    static String query(Map<String, String> params) {
        if (params.isEmpty()) {
            return "";
        }
        return params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&", "?", ""));
    }

    private static LocalDate parseDate(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            log.debug("registry.date.unparseable value={}", text);
            return null;
        }
    }

    private static String joinNonEmpty(String... parts) {
        List<String> kept = new ArrayList<>();
        for (String part : parts) {
            if (part != null && !part.isBlank()) {
                kept.add(part.trim());
            }
        }
        return String.join(", ", kept);
    }
}
