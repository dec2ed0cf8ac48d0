package com.aiusage.attribution.normalization;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalizes email addresses to canonical user ids.
 *
 * Trims, lower-cases and rewrites configured alias domains to their primary
 * domain, so {@code Jane.Doe@Corp-Old.com} and {@code jane.doe@corp.com} become one user.
 * Values that are not syntactically emails are rejected.
 */
@Slf4j
public class EmailNormalizer {

    private static final Pattern EMAIL = Pattern.compile("^[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}$");

    private final Map<String, String> aliasDomains;

    public EmailNormalizer(Map<String, String> aliasDomains) {
        Map<String, String> normalized = new HashMap<>();
        if (aliasDomains != null) {
            aliasDomains.forEach((alias, primary) -> normalized.put(
                    alias.trim().toLowerCase(Locale.ROOT), primary.trim().toLowerCase(Locale.ROOT)));
        }
        this.aliasDomains = Map.copyOf(normalized);
    }

    public Optional<String> normalize(String email) {
        if (email == null) {
            return Optional.empty();
        }
        String candidate = email.trim().toLowerCase(Locale.ROOT);
        if (!EMAIL.matcher(candidate).matches()) {
            log.debug("Rejecting malformed email hint '{}'", email);
            return Optional.empty();
        }
        int at = candidate.lastIndexOf('@');
        String domain = candidate.substring(at + 1);
        String primary = aliasDomains.get(domain);
        return Optional.of(primary == null ? candidate : candidate.substring(0, at + 1) + primary);
    }

    public boolean isValid(String email) {
        return normalize(email).isPresent();
    }
}
