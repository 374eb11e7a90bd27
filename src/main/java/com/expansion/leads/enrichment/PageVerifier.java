package com.expansion.leads.enrichment;

import com.expansion.leads.config.EnrichmentConfig;
import com.expansion.leads.core.model.EnrichmentResult;
import com.expansion.leads.rules.TextNormalizer;
import com.expansion.leads.similarity.NameSimilarity;
import com.expansion.leads.similarity.TokenSetSimilarity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Scores how strongly a page's text proves it belongs to the target entity.
 *
 * <ul>
 *   <li>registry number as a whole word: +6</li>
 *   <li>registered postcode, spacing ignored: +3</li>
 *   <li>name similarity at or above the strong threshold: +2, else at or above the moderate one: +1</li>
 *   <li>two or more of the above: confirmation bonus</li>
 * </ul>
 * The total is capped at 10.
 */
public class PageVerifier {

    private static final int REGISTRY_NUMBER_POINTS = 6;
    private static final int POSTCODE_POINTS = 3;
    private static final int STRONG_NAME_POINTS = 2;
    private static final int MODERATE_NAME_POINTS = 1;

    private final EnrichmentConfig config;
    private final TextNormalizer normalizer;
    private final NameSimilarity similarity = new TokenSetSimilarity();

    public PageVerifier(EnrichmentConfig config, TextNormalizer normalizer) {
        this.config = config;
        this.normalizer = normalizer;
    }

    public PageScore score(EnrichmentTarget target, String pageText) {
        if (pageText == null || pageText.isBlank()) {
            return PageScore.zero();
        }
        String text = pageText.length() > config.getPageTextLimit()
                ? pageText.substring(0, config.getPageTextLimit()) : pageText;
        String upper = text.toUpperCase(Locale.ROOT);

        List<String> evidence = new ArrayList<>();
        int score = 0;
        int checks = 0;

        String number = target.registryNumber().toUpperCase(Locale.ROOT);
        if (!number.isEmpty()
                && Pattern.compile("\\b" + Pattern.quote(number) + "\\b").matcher(upper).find()) {
            score += REGISTRY_NUMBER_POINTS;
            checks++;
            evidence.add("Company number found");
        }

        String postcode = normalizer.compactPostcode(target.postcode());
        if (!postcode.isEmpty() && upper.replaceAll("\\s+", "").contains(postcode)) {
            score += POSTCODE_POINTS;
            checks++;
            evidence.add("Registered postcode found");
        }

        String name = normalizer.entityNormalize(target.name());
        if (!name.isEmpty()) {
            int sim = similarity.ratio(name, normalizer.alnumWords(text));
            if (sim >= config.getStrongNameSimilarity()) {
                score += STRONG_NAME_POINTS;
                checks++;
                evidence.add("Name similarity strong (" + sim + ")");
            } else if (sim >= config.getModerateNameSimilarity()) {
                score += MODERATE_NAME_POINTS;
                checks++;
                evidence.add("Name similarity moderate (" + sim + ")");
            }
        }

        if (checks >= 2 && config.getConfirmationBonus() > 0) {
            score += config.getConfirmationBonus();
            evidence.add("Independent checks agree");
        }

        return new PageScore(Math.min(score, EnrichmentResult.MAX_VERIFICATION_SCORE), evidence);
    }
}
