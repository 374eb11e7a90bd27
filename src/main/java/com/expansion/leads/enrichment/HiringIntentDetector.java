package com.expansion.leads.enrichment;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Looks for hiring activity on pages that were already fetched: careers or vacancy links,
 * or visa sponsorship language in the text. A page that rules sponsorship out ("unable to
 * sponsor", "must have the right to work") cancels every positive match.
 */
public class HiringIntentDetector {

    private static final List<String> LINK_KEYWORDS = List.of(
            "careers", "jobs", "vacancies", "join-us", "join us", "work-with-us", "work with us");
    private static final List<String> TEXT_PHRASES = List.of(
            "visa sponsorship", "sponsor licence", "skilled worker visa", "we are hiring",
            "we're hiring", "current vacancies", "open positions");

    private static final Pattern NEGATIVE_PHRASES = Pattern.compile(String.join("|",
            "\\b(no|without)\\s+(visa\\s+)?sponsorship\\b",
            "\\b(unable|not able|cannot|can not|can['’]t|do not|does not|don['’]t|doesn['’]t"
                    + "|will not|won['’]t)\\s+(to\\s+)?((offer|provide)\\s+)?(visa\\s+)?sponsor",
            "\\bnot\\s+in\\s+a\\s+position\\s+to\\s+sponsor",
            "\\bsponsorship\\s+is\\s+not\\s+(available|offered)",
            "\\bmust\\s+(already\\s+)?have\\s+(the\\s+)?(full\\s+|existing\\s+)?right\\s+to\\s+work\\b"));

    public boolean detect(List<PageFetchResult> pages) {
        boolean positive = false;
        for (PageFetchResult page : pages) {
            String text = page.text().toLowerCase(Locale.ROOT);
            if (NEGATIVE_PHRASES.matcher(text).find()) {
                return false;
            }
            positive = positive || hasHiringLink(page) || TEXT_PHRASES.stream().anyMatch(text::contains);
        }
        return positive;
    }

    private static boolean hasHiringLink(PageFetchResult page) {
        for (PageLink link : page.links()) {
            String haystack = (link.href() + " " + link.text()).toLowerCase(Locale.ROOT);
            if (LINK_KEYWORDS.stream().anyMatch(haystack::contains)) {
                return true;
            }
        }
        return false;
    }
}
