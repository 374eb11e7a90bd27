package com.expansion.leads.enrichment;

import com.expansion.leads.config.EnrichmentConfig;
import com.expansion.leads.core.model.VerificationLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Stage B: fetches candidates in rank order and verifies one as the official site.
 *
 * <p>A homepage scoring at least the VERIFIED threshold has its same-site contact and legal pages
 * fetched as well; the best score across them counts and their evidence is merged. Verification
 * stops at the first VERIFIED candidate. Otherwise the best-scoring candidate is kept, as
 * PLAUSIBLE when it reaches that threshold and at level NONE below it.</p>
 */
public class WebsiteVerifier {
    private static final Logger log = LoggerFactory.getLogger(WebsiteVerifier.class);

    private final PageFetcher fetcher;
    private final PageVerifier pageVerifier;
    private final ContactLinkFinder linkFinder;
    private final EnrichmentConfig config;

    public WebsiteVerifier(PageFetcher fetcher, PageVerifier pageVerifier, EnrichmentConfig config) {
        this.fetcher = fetcher;
        this.pageVerifier = pageVerifier;
        this.linkFinder = new ContactLinkFinder(config.getMaxContactLinks());
        this.config = config;
    }

    public VerificationOutcome verify(EnrichmentTarget target, List<String> candidates) {
        VerificationOutcome best = VerificationOutcome.nothingFetched();
        int bestScore = -1;

        for (String candidate : candidates) {
            PageFetchResult home = fetcher.fetch(candidate);
            if (!home.isSuccess()) {
                log.debug("verify.fetch.failed url={} status={}", candidate, home.status());
                continue;
            }

            PageScore homeScore = pageVerifier.score(target, home.text());
            int score = homeScore.score();
            Set<String> evidence = new LinkedHashSet<>(homeScore.evidence());
            List<PageFetchResult> pages = new ArrayList<>();
            pages.add(home);

            if (score >= config.getVerifiedThreshold()) {
                for (String link : linkFinder.find(home, candidate)) {
                    PageFetchResult page = fetcher.fetch(link);
                    if (!page.isSuccess()) {
                        continue;
                    }
                    pages.add(page);
                    PageScore pageScore = pageVerifier.score(target, page.text());
                    score = Math.max(score, pageScore.score());
                    evidence.addAll(pageScore.evidence());
                }
            }

            log.debug("verify.candidate url={} score={}", candidate, score);
            if (score > bestScore) {
                bestScore = score;
                best = new VerificationOutcome(candidate, levelFor(score), score, List.copyOf(evidence), pages);
            }
            if (best.level() == VerificationLevel.VERIFIED) {
                break;
            }
        }
        return best;
    }

    private VerificationLevel levelFor(int score) {
        if (score >= config.getVerifiedThreshold()) {
            return VerificationLevel.VERIFIED;
        }
        if (score >= config.getPlausibleThreshold()) {
            return VerificationLevel.PLAUSIBLE;
        }
        return VerificationLevel.NONE;
    }
}
