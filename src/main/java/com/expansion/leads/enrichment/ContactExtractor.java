package com.expansion.leads.enrichment;

import com.expansion.leads.config.EnrichmentConfig;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts public contact details from page text.
 *
 * <p>Emails are limited to role mailboxes (info@, hr@, ...) unless personal addresses are
 * allowed, then ranked: preferred role prefixes first, addresses on the site's own domain next,
 * free-mail domains last. Phone numbers need at least nine digits and are deduplicated by digits.</p>
 */
public class ContactExtractor {

    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+\\-]+@[A-Za-z0-9.\\-]+\\.[A-Za-z]{2,}");
    private static final Pattern PHONE = Pattern.compile("\\+?\\d[\\d\\-\\s().]{8,}\\d");
    private static final int MIN_PHONE_DIGITS = 9;
    private static final int MAX_EMAIL_LENGTH = 120;

    private static final Set<String> PLACEHOLDER_DOMAINS = Set.of(
            "example.com", "example.org", "domain.com", "email.com", "yourdomain.com", "sentry.io");
    private static final Set<String> FILE_SUFFIXES = Set.of("png", "jpg", "jpeg", "gif", "svg", "webp");
    private static final Set<String> FREE_MAIL = Set.of(
            "gmail.com", "yahoo.com", "hotmail.com", "outlook.com", "icloud.com");

    private final EnrichmentConfig config;

    public ContactExtractor(EnrichmentConfig config) {
        this.config = config;
    }

    public ContactDetails extract(List<String> pageTexts, String websiteHost) {
        String combined = String.join(" ", pageTexts);
        return new ContactDetails(extractEmails(combined, websiteHost), extractPhones(combined));
    }

    List<String> extractEmails(String text, String websiteHost) {
        Set<String> found = new LinkedHashSet<>();
        Matcher m = EMAIL.matcher(text);
        while (m.find()) {
            String email = m.group().toLowerCase(Locale.ROOT);
            if (email.length() > MAX_EMAIL_LENGTH) {
                continue;
            }
            String domain = email.substring(email.indexOf('@') + 1);
            String tld = domain.substring(domain.lastIndexOf('.') + 1);
            if (PLACEHOLDER_DOMAINS.stream().anyMatch(d -> domain.equals(d) || domain.endsWith("." + d))
                    || FILE_SUFFIXES.contains(tld)) {
                continue;
            }
            if (!config.isIncludePersonalEmails() && rolePrefixIndex(email) < 0) {
                continue;
            }
            found.add(email);
        }

        String host = websiteHost != null ? websiteHost.toLowerCase(Locale.ROOT) : "";
        List<String> ranked = new ArrayList<>(found);
        ranked.sort(Comparator.<String>comparingInt(e -> -rank(e, host))
                .thenComparingInt(String::length)
                .thenComparing(Comparator.naturalOrder()));
        return ranked.size() > config.getMaxEmails() ? List.copyOf(ranked.subList(0, config.getMaxEmails())) : ranked;
    }

    List<String> extractPhones(String text) {
        Map<String, String> byDigits = new LinkedHashMap<>();
        Matcher m = PHONE.matcher(text);
        while (m.find() && byDigits.size() < config.getMaxPhones()) {
            String candidate = m.group().trim();
            String digits = candidate.replaceAll("\\D", "");
            if (digits.length() < MIN_PHONE_DIGITS) {
                continue;
            }
            byDigits.putIfAbsent(digits, candidate.replaceAll("\\s+", " "));
        }
        return List.copyOf(byDigits.values());
    }

    private int rank(String email, String host) {
        int score = 0;
        int index = rolePrefixIndex(email);
        if (index >= 0) {
            score += 50 - index;
        }
        if (!host.isEmpty() && email.endsWith("@" + host)) {
            score += 25;
        }
        String domain = email.substring(email.indexOf('@') + 1);
        if (FREE_MAIL.contains(domain)) {
            score -= 10;
        }
        return score;
    }

    /**
     * Position of the email's role prefix in the configured preference list, or -1.
     * "info@", "info.uk@" and "hr-team@" count; "information@" does not.
     */
    private int rolePrefixIndex(String email) {
        String local = email.substring(0, email.indexOf('@'));
        List<String> prefixes = config.getRoleEmailPrefixes();
        for (int i = 0; i < prefixes.size(); i++) {
            String prefix = prefixes.get(i).toLowerCase(Locale.ROOT);
            if (local.equals(prefix)) {
                return i;
            }
            if (local.startsWith(prefix) && local.length() > prefix.length()) {
                char next = local.charAt(prefix.length());
                if (next == '.' || next == '-' || next == '_' || Character.isDigit(next)) {
                    return i;
                }
            }
        }
        return -1;
    }
}
