package com.expansion.leads.scoring;

import com.expansion.leads.config.ScoringConfig;

/**
 * Short reviewer hint about which visa conversation a lead is likely to need.
 */
public final class VisaHints {

    private VisaHints() {
    }

    public static String hint(boolean sponsorSourced, String route, int score, ScoringConfig config) {
        String r = route != null ? route : "";
        if (sponsorSourced) {
            if (r.contains("UK Expansion Worker")) {
                return "Likely UK Expansion Worker / sponsor compliance";
            }
            if (r.contains("Senior or Specialist Worker")) {
                return "GBM Senior/Specialist Worker route";
            }
            if (r.contains("Skilled Worker")) {
                return "Skilled Worker sponsor / compliance";
            }
            return "Sponsor compliance / worker routes";
        }
        if (score >= config.getHotThreshold()) {
            return "Strong overseas-linked incorporation (Expansion Worker likely)";
        }
        if (score >= config.getMediumThreshold()) {
            return "Possible overseas-linked incorporation (review)";
        }
        return "Watchlist";
    }
}
