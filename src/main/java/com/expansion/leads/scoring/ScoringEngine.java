package com.expansion.leads.scoring;

import com.expansion.leads.config.ScoringConfig;
import com.expansion.leads.core.model.Bucket;
import com.expansion.leads.core.model.EnrichmentResult;
import com.expansion.leads.core.model.ScoreResult;
import com.expansion.leads.core.model.Signal;
import com.expansion.leads.core.model.SignalNames;
import com.expansion.leads.core.model.SignalSet;
import com.expansion.leads.core.model.VerificationLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Combines a source base weight and extracted signals into a bounded score, a bucket and a rationale.
 *
 * <p>Contributions are applied in a fixed order and summed before clamping to [0, 100]. The result
 * depends only on its inputs; recency is already pinned to the run date by the signal extractor.
 * {@link #rescore} is the only way a score changes afterwards: it adds enrichment points to the
 * pre-enrichment score under the same clamp.</p>
 */
public class ScoringEngine {
    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    private final ScoringConfig config;

    public ScoringEngine(ScoringConfig config) {
        this.config = config;
    }

    /**
     * Scores one entity.
     *
     * @param route   sponsor route, or empty for an entity known only from the registry
     * @param signals signals extracted for the entity
     */
    public ScoreResult score(String route, SignalSet signals) {
        List<String> rationale = new ArrayList<>();
        int total = 0;

        if (route != null && !route.isBlank()) {
            int base = config.routeBasePoints(route);
            total += contribute(rationale, base, "Sponsor route: " + route.trim());
        } else {
            total += contribute(rationale, config.getIncorporationBasePoints(), "Registry incorporation");
        }

        total += flag(rationale, signals, SignalNames.CORPORATE_BENEFICIAL_OWNER,
                config.getCorporateOwnerPoints(), "Corporate beneficial owner");
        total += flag(rationale, signals, SignalNames.FOREIGN_BENEFICIAL_OWNER,
                config.getForeignOwnerPoints(), "Foreign beneficial owner");
        total += flag(rationale, signals, SignalNames.FOREIGN_OFFICER_RESIDENCE,
                config.getOfficerResidencePoints(), "Officer resident outside UK");
        total += flag(rationale, signals, SignalNames.FOREIGN_OFFICER_ADDRESS,
                config.getOfficerAddressPoints(), "Officer address outside UK");
        total += flag(rationale, signals, SignalNames.FOREIGN_OFFICER_NATIONALITY,
                config.getOfficerNationalityPoints(), "Officer nationality non-UK");
        total += flag(rationale, signals, SignalNames.SUBSIDIARY_NAME,
                config.getSubsidiaryNamePoints(), "Name suggests UK subsidiary");
        total += flag(rationale, signals, SignalNames.MULTIPLE_DIRECTORS,
                config.getMultipleDirectorsPoints(), "Multiple active directors");
        total += flag(rationale, signals, SignalNames.PRIORITY_COUNTRY,
                config.getPriorityCountryPoints(), "Priority country link");

        Optional<Signal> recency = signals.get(SignalNames.RECENT_REGISTRATION);
        if (recency.isPresent()) {
            int days = recency.get().value();
            total += contribute(rationale, config.recencyPoints(days), "Registered " + days + " days ago");
        }

        int mailboxHits = signals.value(SignalNames.MAILBOX_ADDRESS_PENALTY);
        if (mailboxHits > 0) {
            int penalty = Math.min(config.getMailboxPenaltyCap(), mailboxHits * config.getMailboxPenaltyPerPhrase());
            total += contribute(rationale, -penalty, "Shared-office or mailbox address");
        }

        if (signals.isFired(SignalNames.SECTOR_PENALTY)) {
            total += contribute(rationale, -config.getSectorPenaltyPoints(), "Sector deprioritised");
        } else if (signals.isFired(SignalNames.SECTOR_BOOST)) {
            total += contribute(rationale, config.getSectorBoostPoints(), "Sector boost");
        }

        int score = ScoreResult.clamp(total);
        log.debug("score.computed raw={} score={}", total, score);
        return new ScoreResult(score, bucket(score), truncate(rationale, List.of()));
    }

    /**
     * Adds enrichment-derived points to the pre-enrichment score.
     *
     * @param preEnrichment the score computed from signals alone
     * @param enrichment    enrichment outcome for the same entity
     */
    public ScoreResult rescore(ScoreResult preEnrichment, EnrichmentResult enrichment) {
        List<String> extra = new ArrayList<>();
        int total = preEnrichment.score();
        if (enrichment.level() == VerificationLevel.VERIFIED) {
            total += contribute(extra, config.getVerifiedSitePoints(), "Website verified");
        } else if (enrichment.level() == VerificationLevel.PLAUSIBLE) {
            total += contribute(extra, config.getPlausibleSitePoints(), "Website plausible");
        }
        if (enrichment.hiringIntent()) {
            total += contribute(extra, config.getHiringIntentPoints(), "Hiring activity on website");
        }
        int score = ScoreResult.clamp(total);
        return new ScoreResult(score, bucket(score), truncate(preEnrichment.rationale(), extra));
    }

    public Bucket bucket(int score) {
        return Bucket.fromScore(score, config.getHotThreshold(), config.getMediumThreshold());
    }

    private static int flag(List<String> rationale, SignalSet signals, String name, int points, String label) {
        if (!signals.isFired(name)) {
            return 0;
        }
        return contribute(rationale, points, label);
    }

    private static int contribute(List<String> rationale, int points, String label) {
        if (points != 0) {
            rationale.add(label + " (" + (points > 0 ? "+" : "") + points + ")");
        }
        return points;
    }

    /**
     * Keeps trailing entries (enrichment facts) intact, trimming the earlier ones to fit.
     */
    private static List<String> truncate(List<String> leading, List<String> trailing) {
        List<String> out = new ArrayList<>();
        int room = Math.max(0, ScoreResult.MAX_RATIONALE - Math.min(trailing.size(), ScoreResult.MAX_RATIONALE));
        for (int i = 0; i < leading.size() && i < room; i++) {
            out.add(leading.get(i));
        }
        for (String entry : trailing) {
            if (out.size() >= ScoreResult.MAX_RATIONALE) {
                break;
            }
            out.add(entry);
        }
        return out;
    }
}
