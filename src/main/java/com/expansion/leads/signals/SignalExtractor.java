package com.expansion.leads.signals;

import com.expansion.leads.config.ScoringConfig;
import com.expansion.leads.core.model.BeneficialOwner;
import com.expansion.leads.core.model.Officer;
import com.expansion.leads.core.model.Signal;
import com.expansion.leads.core.model.SignalNames;
import com.expansion.leads.core.model.SignalSet;
import com.expansion.leads.rules.TextNormalizer;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives named signals from registry facts.
 *
 * <p>Pure and deterministic: the same facts and the same {@code asOf} date always give the same
 * signals in the same order. Missing fields produce no signal. Only active officers and owners count.</p>
 */
public class SignalExtractor {

    private static final Pattern SUBSIDIARY_NAME = Pattern.compile(
            "\\(UK\\b|\\s(UK|EUROPE|INTERNATIONAL|GLOBAL|HOLDINGS|GROUP)\\b", Pattern.CASE_INSENSITIVE);

    private final ScoringConfig config;
    private final TextNormalizer normalizer;
    private final List<MailboxPhrase> mailboxPhrases;
    private final Set<String> priorityCountries;

    public SignalExtractor(ScoringConfig config, TextNormalizer normalizer) {
        this.config = config;
        this.normalizer = normalizer;
        this.mailboxPhrases = new ArrayList<>();
        for (String phrase : config.getMailboxPhrases()) {
            String words = normalizer.alnumWords(phrase);
            if (!words.isEmpty()) {
                mailboxPhrases.add(new MailboxPhrase(words,
                        Pattern.compile("\\b" + words.replace(" ", "\\s+") + "\\b")));
            }
        }
        this.priorityCountries = new LinkedHashSet<>();
        for (String country : config.getPriorityCountries()) {
            priorityCountries.add(normalizer.canonicalCountry(country));
        }
    }

    public SignalSet extract(EntityFacts facts, LocalDate asOf) {
        List<Signal> signals = new ArrayList<>();
        List<Officer> officers = facts.officers().stream().filter(Officer::isActive).toList();
        List<BeneficialOwner> owners = facts.owners().stream().filter(BeneficialOwner::isActive).toList();

        addOfficerSignals(officers, signals);
        addOwnerSignals(owners, signals);
        addDirectorSignal(officers, signals);
        addPriorityCountrySignal(officers, signals);
        addSubsidiaryNameSignal(facts.name(), signals);
        addRecencySignal(facts.registrationDate(), asOf, signals);
        addRegisteredOfficeSignal(facts, signals);
        addMailboxSignal(facts, signals);
        addSectorSignal(facts.classificationCodes(), signals);

        return new SignalSet(signals);
    }

    private void addOfficerSignals(List<Officer> officers, List<Signal> signals) {
        List<String> address = new ArrayList<>();
        List<String> residence = new ArrayList<>();
        List<String> nationality = new ArrayList<>();
        for (Officer officer : officers) {
            if (!normalizer.isDomesticCountry(officer.addressCountry())) {
                address.add(describe(officer.name()) + " address in " + officer.addressCountry().trim());
            }
            if (!normalizer.isDomesticCountry(officer.residenceCountry())) {
                residence.add(describe(officer.name()) + " resident in " + officer.residenceCountry().trim());
            }
            if (!normalizer.isDomesticNationality(officer.nationality())) {
                nationality.add(describe(officer.name()) + " nationality " + officer.nationality().trim());
            }
        }
        if (!address.isEmpty()) {
            signals.add(Signal.count(SignalNames.FOREIGN_OFFICER_ADDRESS, address.size(), address));
        }
        if (!residence.isEmpty()) {
            signals.add(Signal.count(SignalNames.FOREIGN_OFFICER_RESIDENCE, residence.size(), residence));
        }
        if (!nationality.isEmpty()) {
            signals.add(Signal.count(SignalNames.FOREIGN_OFFICER_NATIONALITY, nationality.size(), nationality));
        }
    }

    private void addOwnerSignals(List<BeneficialOwner> owners, List<Signal> signals) {
        List<String> corporate = new ArrayList<>();
        List<String> foreign = new ArrayList<>();
        for (BeneficialOwner owner : owners) {
            if (owner.isCorporate()) {
                corporate.add(describe(owner.name()) + " (" + owner.kind() + ")");
            }
            if (!normalizer.isDomesticCountry(owner.country())) {
                foreign.add(describe(owner.name()) + " in " + owner.country().trim());
            }
        }
        if (!corporate.isEmpty()) {
            signals.add(Signal.flag(SignalNames.CORPORATE_BENEFICIAL_OWNER, corporate));
        }
        if (!foreign.isEmpty()) {
            signals.add(Signal.flag(SignalNames.FOREIGN_BENEFICIAL_OWNER, foreign));
        }
    }

    private void addDirectorSignal(List<Officer> officers, List<Signal> signals) {
        long directors = officers.stream().filter(Officer::isDirector).count();
        if (directors >= 2) {
            signals.add(Signal.count(SignalNames.MULTIPLE_DIRECTORS, (int) directors,
                    List.of(directors + " active directors")));
        }
    }

    private void addPriorityCountrySignal(List<Officer> officers, List<Signal> signals) {
        Set<String> hits = new LinkedHashSet<>();
        for (Officer officer : officers) {
            for (String country : List.of(officer.addressCountry(), officer.residenceCountry())) {
                String canonical = normalizer.canonicalCountry(country);
                if (!canonical.isEmpty() && priorityCountries.contains(canonical)) {
                    hits.add(canonical);
                }
            }
        }
        if (!hits.isEmpty()) {
            signals.add(Signal.flag(SignalNames.PRIORITY_COUNTRY, List.copyOf(hits)));
        }
    }

    private void addSubsidiaryNameSignal(String name, List<Signal> signals) {
        String collapsed = name.trim().replaceAll("\\s+", " ");
        if (!collapsed.isEmpty() && SUBSIDIARY_NAME.matcher(collapsed).find()) {
            signals.add(Signal.flag(SignalNames.SUBSIDIARY_NAME, List.of("Name: " + collapsed)));
        }
    }

    private void addRecencySignal(LocalDate registered, LocalDate asOf, List<Signal> signals) {
        if (registered == null || asOf == null) {
            return;
        }
        long days = ChronoUnit.DAYS.between(registered, asOf);
        if (days < 0 || days > config.maxRecencyDays()) {
            return;
        }
        signals.add(new Signal(SignalNames.RECENT_REGISTRATION, (int) days,
                List.of("Registered " + registered + " (" + days + " days)")));
    }

    private void addRegisteredOfficeSignal(EntityFacts facts, List<Signal> signals) {
        String country = facts.address().country();
        if (!normalizer.isDomesticCountry(country)) {
            signals.add(Signal.flag(SignalNames.FOREIGN_REGISTERED_OFFICE,
                    List.of("Registered office in " + country)));
        }
    }

    private void addMailboxSignal(EntityFacts facts, List<Signal> signals) {
        String text = normalizer.alnumWords(facts.address().street() + " " + facts.address().locality());
        if (text.isEmpty()) {
            return;
        }
        List<String> matched = new ArrayList<>();
        for (MailboxPhrase phrase : mailboxPhrases) {
            if (phrase.pattern().matcher(text).find()) {
                matched.add("Address mentions '" + phrase.words() + "'");
            }
        }
        if (!matched.isEmpty()) {
            signals.add(Signal.count(SignalNames.MAILBOX_ADDRESS_PENALTY, matched.size(), matched));
        }
    }

    private void addSectorSignal(List<String> codes, List<Signal> signals) {
        for (String code : codes) {
            String c = code.trim().toLowerCase(Locale.ROOT);
            if (c.isEmpty()) {
                continue;
            }
            String penalty = firstKeywordMatch(c, config.getSectorPenaltyKeywords());
            if (penalty != null) {
                signals.add(Signal.flag(SignalNames.SECTOR_PENALTY,
                        List.of("Classification " + code.trim() + " matches '" + penalty + "'")));
                return;
            }
            String boost = firstKeywordMatch(c, config.getSectorBoostKeywords());
            if (boost != null) {
                signals.add(Signal.flag(SignalNames.SECTOR_BOOST,
                        List.of("Classification " + code.trim() + " matches '" + boost + "'")));
                return;
            }
        }
    }

    /**
     * Numeric keywords match as a code prefix, others as a case-insensitive substring.
     */
    private static String firstKeywordMatch(String code, List<String> keywords) {
        for (String keyword : keywords) {
            String k = keyword.trim().toLowerCase(Locale.ROOT);
            if (k.isEmpty()) {
                continue;
            }
            boolean numeric = k.chars().allMatch(Character::isDigit);
            if (numeric ? code.startsWith(k) : code.contains(k)) {
                return keyword.trim();
            }
        }
        return null;
    }

    private record MailboxPhrase(String words, Pattern pattern) {
    }

    private static String describe(String name) {
        return name == null || name.isBlank() ? "(unnamed)" : name.trim();
    }
}
