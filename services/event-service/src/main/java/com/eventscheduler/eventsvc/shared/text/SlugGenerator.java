package com.eventscheduler.eventsvc.shared.text;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.text.Normalizer;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Builds URL slugs of the form {@code <slugified-text>-<5 random chars>}.
 */
@Component
public class SlugGenerator {

    static final int SUFFIX_LENGTH = 5;
    static final int MAX_BASE_LENGTH = 50;
    private static final int MAX_ATTEMPTS = 10;
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern INVALID = Pattern.compile("[^a-z0-9\\s-]");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s-]+");

    private final SecureRandom random = new SecureRandom();

    /**
     * Lower-cases {@code text}, strips accents and punctuation and joins words with single hyphens.
     */
    public String slugify(String text) {
        if (text == null) {
            return "";
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKD);
        normalized = DIACRITICS.matcher(normalized).replaceAll("");
        normalized = INVALID.matcher(normalized.toLowerCase(Locale.ROOT)).replaceAll("");
        normalized = SEPARATORS.matcher(normalized.trim()).replaceAll("-");
        if (normalized.length() > MAX_BASE_LENGTH) {
            normalized = normalized.substring(0, MAX_BASE_LENGTH);
        }
        return stripHyphens(normalized);
    }

    public String generate(String text) {
        String base = slugify(text);
        String suffix = randomSuffix();
        return base.isEmpty() ? suffix : base + "-" + suffix;
    }

    /**
     * Generates slugs until {@code taken} rejects one.
     */
    public String generateUnique(String text, Predicate<String> taken) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String slug = generate(text);
            if (!taken.test(slug)) {
                return slug;
            }
        }
        throw new IllegalStateException("Could not generate a unique slug after " + MAX_ATTEMPTS + " attempts");
    }

    private String randomSuffix() {
        StringBuilder sb = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    private static String stripHyphens(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '-') start++;
        while (end > start && value.charAt(end - 1) == '-') end--;
        return value.substring(start, end);
    }
}
