package com.expansion.leads.enrichment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PageHelpersTest {

    @Nested
    @DisplayName("ContactLinkFinder")
    class LinkFinder {

        private final ContactLinkFinder finder = new ContactLinkFinder(2);

        @Test
        void sameHostKeywordLinksOnly() {
            PageFetchResult page = new PageFetchResult("https://www.acme.co.uk", 200, "home", List.of(
                    new PageLink("https://www.acme.co.uk/contact-us#form", "Get in touch"),
                    new PageLink("https://twitter.com/acme", "Contact on Twitter"),
                    new PageLink("https://acme.co.uk/products", "Products"),
                    new PageLink("https://acme.co.uk/legal", "Imprint")));

            assertEquals(List.of("https://www.acme.co.uk/contact-us", "https://acme.co.uk/legal"),
                    finder.find(page, "https://www.acme.co.uk"));
        }

        @Test
        void cappedAtMaxLinks() {
            PageFetchResult page = new PageFetchResult("https://acme.co.uk", 200, "home", List.of(
                    new PageLink("https://acme.co.uk/contact", ""),
                    new PageLink("https://acme.co.uk/about", ""),
                    new PageLink("https://acme.co.uk/privacy", "")));

            assertEquals(2, finder.find(page, "https://acme.co.uk").size());
        }
    }

    @Nested
    @DisplayName("HiringIntentDetector")
    class Hiring {

        private final HiringIntentDetector detector = new HiringIntentDetector();

        @Test
        void careersLink() {
            assertTrue(detector.detect(List.of(new PageFetchResult("https://acme.co.uk", 200, "home",
                    List.of(new PageLink("https://acme.co.uk/join-us", "Join"))))));
        }

        @Test
        void sponsorshipPhrase() {
            assertTrue(detector.detect(List.of(new PageFetchResult("https://acme.co.uk", 200,
                    "We offer Visa Sponsorship for engineers", List.of()))));
        }

        @Test
        void noSignal() {
            assertFalse(detector.detect(List.of(new PageFetchResult("https://acme.co.uk", 200,
                    "Industrial robots", List.of(new PageLink("/products", "Products"))))));
        }

        @ParameterizedTest
        @DisplayName("Wording that rules sponsorship out is not hiring intent")
        @CsvSource(delimiter = '|', value = {
                "Please note we are unable to offer visa sponsorship for any role.",
                "We cannot sponsor visas at this time",
                "No sponsorship available for this position",
                "Applicants must have the right to work in the UK",
                "We do not offer sponsorship",
                "Unfortunately we are not in a position to sponsor applicants"
        })
        void negatedSponsorship(String text) {
            assertFalse(detector.detect(List.of(new PageFetchResult("https://acme.co.uk", 200, text, List.of()))));
        }

        @Test
        @DisplayName("A refusal on one page cancels a careers link on another")
        void refusalOverridesCareersLink() {
            PageFetchResult home = new PageFetchResult("https://acme.co.uk", 200, "Industrial robots",
                    List.of(new PageLink("https://acme.co.uk/careers", "Careers")));
            PageFetchResult careers = new PageFetchResult("https://acme.co.uk/careers", 200,
                    "Current vacancies. Candidates must already have the right to work in the UK.", List.of());

            assertFalse(detector.detect(List.of(home, careers)));
        }
    }

    @Nested
    @DisplayName("DomainDenyList")
    class DenyList {

        private final DomainDenyList denyList = new DomainDenyList(List.of(" LinkedIn.com ", "gov.uk", ""));

        @ParameterizedTest
        @CsvSource({
                "https://www.linkedin.com/company/acme, true",
                "https://uk.linkedin.com/in/jane, true",
                "https://www.gov.uk/guidance, true",
                "https://notlinkedin.com, false",
                "https://acme.co.uk, false",
                "'', true"
        })
        void isDenied(String url, boolean expected) {
            assertEquals(expected, denyList.isDenied(url));
        }
    }

    @Nested
    @DisplayName("UrlUtils")
    class Urls {

        @Test
        void hostStripsWwwAndPort() {
            assertEquals("acme.co.uk", UrlUtils.host("https://WWW.Acme.co.uk:8443/path?q=1"));
            assertEquals("acme.co.uk", UrlUtils.host("acme.co.uk/about"));
            assertEquals("", UrlUtils.host("not a url"));
        }

        @Test
        void baseUrlKeepsSchemeAndAuthority() {
            assertEquals("https://www.acme.co.uk", UrlUtils.baseUrl("https://www.acme.co.uk/contact?x=1#top"));
            assertEquals("http://acme.co.uk:8080", UrlUtils.baseUrl("http://acme.co.uk:8080/"));
        }

        @Test
        void sameHostIgnoresWww() {
            assertTrue(UrlUtils.sameHost("https://www.acme.co.uk/a", "http://acme.co.uk"));
            assertFalse(UrlUtils.sameHost("https://acme.com", "https://acme.co.uk"));
        }
    }
}
