package org.novelfinder.search.text;

import com.ibm.icu.text.Transliterator;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns titles into ASCII slugs such as {@code my-cultivation-journey}.
 *
 * <p>Non-Latin scripts are transliterated, accents dropped, the text lower-cased and every run of
 * characters outside {@code [a-z0-9]} collapsed into a single {@code -}.</p>
 */
public final class Slugifier {
    private static final String SEPARATOR = "-";

    private static final Pattern QUOTES = Pattern.compile("'+");
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern DIGIT_GROUPING = Pattern.compile("(?<=\\d),(?=\\d)");
    private static final Pattern DISALLOWED = Pattern.compile("[^-a-z0-9]+");
    private static final Pattern DUPLICATE_SEPARATOR = Pattern.compile("-{2,}");

    // Transliterator instances are not safe for concurrent use.
    private static final Transliterator TO_LATIN_ASCII = Transliterator.getInstance("Any-Latin; Latin-ASCII");

    private Slugifier() {}

    public static String slugify(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String slug = QUOTES.matcher(text).replaceAll(SEPARATOR);
        slug = transliterate(slug);
        slug = Normalizer.normalize(slug, Normalizer.Form.NFKD);
        slug = COMBINING_MARKS.matcher(slug).replaceAll("");
        slug = slug.toLowerCase(Locale.ROOT);
        slug = QUOTES.matcher(slug).replaceAll("");
        slug = DIGIT_GROUPING.matcher(slug).replaceAll("");
        slug = DISALLOWED.matcher(slug).replaceAll(SEPARATOR);
        slug = DUPLICATE_SEPARATOR.matcher(slug).replaceAll(SEPARATOR);
        return stripSeparators(slug);
    }

    private static synchronized String transliterate(String text) {
        return TO_LATIN_ASCII.transliterate(text);
    }

    private static String stripSeparators(String slug) {
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '-') {
            end--;
        }
        return slug.substring(start, end);
    }
}
