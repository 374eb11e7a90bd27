package com.expansion.leads.http;

import com.expansion.leads.config.HttpConfig;
import com.expansion.leads.core.ConfigurationException;
import com.expansion.leads.core.UpstreamException;
import com.expansion.leads.core.model.BeneficialOwner;
import com.expansion.leads.core.model.CompanyProfile;
import com.expansion.leads.core.model.Incorporation;
import com.expansion.leads.core.model.Officer;
import com.expansion.leads.core.model.RegistrySearchHit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CompaniesHouseClientTest {

    @Mock
    private HttpExecutor executor;

    private CompaniesHouseClient client;

    @BeforeEach
    void setUp() {
        client = new CompaniesHouseClient(executor, HttpConfig.defaults(), "ch-key");
    }

    private static HttpResult json(String body) {
        return new HttpResult(200, body, "application/json", "");
    }

    private HttpRequest capturedRequest() {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(executor).execute(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("A blank API key is a configuration error")
    void blankKeyRejected() {
        assertThrows(ConfigurationException.class, () -> new CompaniesHouseClient(executor, HttpConfig.defaults(), " "));
        assertThrows(ConfigurationException.class, () -> new CompaniesHouseClient(executor, HttpConfig.defaults(), null));
    }

    @Test
    @DisplayName("Requests carry basic auth with the key as user name")
    void basicAuth() {
        when(executor.execute(any(HttpRequest.class))).thenReturn(json("{\"items\":[]}"));

        client.search("acme", 5);

        HttpRequest request = capturedRequest();
        String expected = "Basic " + Base64.getEncoder().encodeToString("ch-key:".getBytes(StandardCharsets.UTF_8));
        assertEquals(Optional.of(expected), request.headers().firstValue("Authorization"));
    }

    @Nested
    @DisplayName("Search")
    class Search {

        @Test
        @DisplayName("Maps search items to hits and encodes the query")
        void mapsHits() {
            when(executor.execute(any(HttpRequest.class))).thenReturn(json("""
                    {"items":[
                      {"title":"ACME ROBOTICS LIMITED","company_number":"12345678",
                       "company_status":"active","address_snippet":"1 High Street, London, EC1A 1BB"},
                      {"title":"ACME HOLDINGS LTD","company_number":"87654321","company_status":"dissolved"}
                    ]}"""));

            List<RegistrySearchHit> hits = client.search("Acme & Sons", 5);

            assertEquals(2, hits.size());
            assertEquals(new RegistrySearchHit("ACME ROBOTICS LIMITED", "12345678", "active",
                    "1 High Street, London, EC1A 1BB"), hits.get(0));
            assertEquals("", hits.get(1).addressSnippet());
            String uri = capturedRequest().uri().toString();
            assertTrue(uri.startsWith("https://api.company-information.service.gov.uk/search/companies?"));
            assertTrue(uri.contains("q=Acme+%26+Sons"));
            assertTrue(uri.contains("items_per_page=5"));
        }

        @Test
        @DisplayName("Not found yields no hits")
        void notFound() {
            when(executor.execute(any(HttpRequest.class))).thenReturn(new HttpResult(404, "", "", ""));

            assertTrue(client.search("nobody", 5).isEmpty());
        }

        @Test
        @DisplayName("Malformed JSON is an upstream error")
        void malformed() {
            when(executor.execute(any(HttpRequest.class))).thenReturn(json("{not json"));

            assertThrows(UpstreamException.class, () -> client.search("acme", 5));
        }
    }

    @Nested
    @DisplayName("Company facts")
    class CompanyFacts {

        @Test
        @DisplayName("Profile maps name, status, date, codes and registered office")
        void profile() {
            when(executor.execute(any(HttpRequest.class))).thenReturn(json("""
                    {"company_number":"12345678","company_name":"ACME ROBOTICS LIMITED",
                     "company_status":"active","date_of_creation":"2026-02-10","sic_codes":["62012","62020"],
                     "registered_office_address":{"address_line_1":"1 High Street","address_line_2":"Floor 2",
                       "locality":"London","postal_code":"EC1A 1BB","country":"England"}}"""));

            CompanyProfile profile = client.profile("12345678").orElseThrow();

            assertEquals("ACME ROBOTICS LIMITED", profile.name());
            assertEquals("active", profile.status());
            assertEquals(LocalDate.of(2026, 2, 10), profile.registrationDate());
            assertEquals(List.of("62012", "62020"), profile.classificationCodes());
            assertEquals("1 High Street, Floor 2", profile.address().street());
            assertEquals("EC1A 1BB", profile.address().postcode());
            assertEquals("London", profile.address().locality());
            assertEquals("England", profile.address().country());
        }

        @Test
        @DisplayName("Unknown company is empty, not an error")
        void unknownCompany() {
            when(executor.execute(any(HttpRequest.class))).thenReturn(new HttpResult(404, "", "", ""));

            assertTrue(client.profile("00000000").isEmpty());
        }

        @Test
        @DisplayName("Unparseable creation date is left empty")
        void badDate() {
            when(executor.execute(any(HttpRequest.class))).thenReturn(json("""
                    {"company_number":"12345678","company_name":"ACME","date_of_creation":"soon"}"""));

            assertNull(client.profile("12345678").orElseThrow().registrationDate());
        }

        @Test
        @DisplayName("Officers map countries, nationality and resignation")
        void officers() {
            when(executor.execute(any(HttpRequest.class))).thenReturn(json("""
                    {"items":[
                      {"name":"SHARMA, Priya","officer_role":"director","address":{"country":"India"},
                       "country_of_residence":"India","nationality":"Indian"},
                      {"name":"JONES, Tom","officer_role":"secretary","resigned_on":"2025-01-01"}
                    ]}"""));

            List<Officer> officers = client.officers("12345678");

            assertEquals(new Officer("SHARMA, Priya", "director", "India", "India", "Indian", false), officers.get(0));
            assertTrue(officers.get(1).resigned());
            assertTrue(capturedRequest().uri().getPath().endsWith("/company/12345678/officers"));
        }

        @Test
        @DisplayName("Corporate owners fall back to the registration country")
        void owners() {
            when(executor.execute(any(HttpRequest.class))).thenReturn(json("""
                    {"items":[
                      {"kind":"corporate-entity-person-with-significant-control","name":"ACME GMBH",
                       "identification":{"country_registered":"Germany"}},
                      {"kind":"individual-person-with-significant-control","name":"Hans Muller",
                       "address":{"country":"Germany"},"ceased_on":"2025-06-01"}
                    ]}"""));

            List<BeneficialOwner> owners = client.owners("12345678");

            assertEquals("Germany", owners.get(0).country());
            assertTrue(owners.get(0).isCorporate());
            assertTrue(owners.get(0).isActive());
            assertFalse(owners.get(1).isActive());
        }
    }

    @Nested
    @DisplayName("Incorporations")
    class Incorporations {

        @Test
        @DisplayName("Pages through advanced search until a short page")
        void pagesUntilShortPage() {
            StringBuilder full = new StringBuilder("{\"items\":[");
            for (int i = 0; i < 100; i++) {
                if (i > 0) {
                    full.append(',');
                }
                full.append(String.format("{\"company_number\":\"%08d\",\"company_name\":\"CO %d\","
                        + "\"date_of_creation\":\"2026-02-20\"}", i, i));
            }
            full.append("]}");
            when(executor.execute(any(HttpRequest.class)))
                    .thenReturn(json(full.toString()))
                    .thenReturn(json("{\"items\":[{\"company_number\":\"99999999\",\"company_name\":\"LAST\"}]}"));

            List<Incorporation> result = client.incorporatedBetween(LocalDate.of(2026, 2, 1),
                    LocalDate.of(2026, 3, 1), 140);

            assertEquals(101, result.size());
            assertEquals("99999999", result.get(100).registryNumber());
            ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
            verify(executor, times(2)).execute(captor.capture());
            String second = captor.getAllValues().get(1).uri().toString();
            assertTrue(second.contains("size=40"));
            assertTrue(second.contains("start_index=100"));
            assertTrue(second.contains("incorporated_from=2026-02-01"));
        }

        @Test
        @DisplayName("An empty listing stops paging")
        void emptyListing() {
            when(executor.execute(any(HttpRequest.class))).thenReturn(new HttpResult(404, "", "", ""));

            assertTrue(client.incorporatedBetween(LocalDate.of(2026, 2, 1), LocalDate.of(2026, 3, 1), 10).isEmpty());
        }
    }

    @Test
    @DisplayName("Query strings keep parameter order and URL-encode values")
    void queryEncoding() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", "a b/c");
        params.put("n", "1");

        assertEquals("?q=a+b%2Fc&n=1", CompaniesHouseClient.query(params));
        assertEquals("", CompaniesHouseClient.query(Map.of()));
    }
}
