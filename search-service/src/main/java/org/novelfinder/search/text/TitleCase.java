package org.novelfinder.search.text;

/**
 * Title-cases display titles the way Python's {@code str.title()} does after lower-casing.
 *
 * <p>A cased letter is title-cased when the character before it is not a cased letter, and
 * lower-cased otherwise. Digits and apostrophes therefore start a new word:
 * {@code "it's 1st"} becomes {@code "It'S 1St"}.</p>
 */
public final class TitleCase {
    private TitleCase() {}

    public static String apply(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        boolean previousCased = false;
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            if (isCased(cp)) {
                out.appendCodePoint(previousCased ? Character.toLowerCase(cp) : Character.toTitleCase(cp));
                previousCased = true;
            } else {
                out.appendCodePoint(cp);
                previousCased = false;
            }
            i += Character.charCount(cp);
        }
        return out.toString();
    }

    private static boolean isCased(int cp) {
        return Character.isUpperCase(cp) || Character.isLowerCase(cp) || Character.isTitleCase(cp);
    }
}
