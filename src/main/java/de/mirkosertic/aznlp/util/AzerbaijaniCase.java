package de.mirkosertic.aznlp.util;

import com.ibm.icu.text.Normalizer2;

/**
 * Azerbaijani (Turkic) case conversion.
 *
 * <p>Azerbaijani distinguishes dotted and dotless I:</p>
 * <ul>
 *   <li>{@code I} (U+0049) lowercases to {@code ı} (U+0131)</li>
 *   <li>{@code İ} (U+0130) lowercases to {@code i} (U+0069)</li>
 *   <li>{@code i} uppercases to {@code İ}, {@code ı} uppercases to {@code I}</li>
 * </ul>
 *
 * <p>All other code points use the standard Unicode mapping. Every mapping is one code point
 * to one code point, so a converted string always has the same code point count as its input.
 * All methods are stateless and safe for concurrent use.</p>
 */
public final class AzerbaijaniCase {

    private static final int DOTLESS_SMALL_I = 'ı';
    private static final int DOTTED_CAPITAL_I = 'İ';

    private static final Normalizer2 NFC = Normalizer2.getNFCInstance();

    private AzerbaijaniCase() {
        // Utility class, no instances
    }

    /**
     * Returns the Azerbaijani-aware lowercase form of a code point.
     */
    public static int lower(final int codePoint) {
        if (codePoint == 'I') {
            return DOTLESS_SMALL_I;
        }
        if (codePoint == DOTTED_CAPITAL_I) {
            return 'i';
        }
        return Character.toLowerCase(codePoint);
    }

    /**
     * Returns the Azerbaijani-aware uppercase form of a code point.
     */
    public static int upper(final int codePoint) {
        if (codePoint == 'i') {
            return DOTTED_CAPITAL_I;
        }
        if (codePoint == DOTLESS_SMALL_I) {
            return 'I';
        }
        return Character.toUpperCase(codePoint);
    }

    /**
     * Lowercases every code point of {@code text} with {@link #lower(int)}.
     *
     * @param text the text to convert (must not be null)
     * @return the lowercased text
     */
    public static String toLowerCase(final String text) {
        final StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> sb.appendCodePoint(lower(cp)));
        return sb.toString();
    }

    /**
     * Uppercases every code point of {@code text} with {@link #upper(int)}.
     *
     * @param text the text to convert (must not be null)
     * @return the uppercased text
     */
    public static String toUpperCase(final String text) {
        final StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> sb.appendCodePoint(upper(cp)));
        return sb.toString();
    }

    /**
     * Returns {@code text} with its first code point uppercased.
     */
    public static String upperFirst(final String text) {
        if (text.isEmpty()) {
            return text;
        }
        final int first = text.codePointAt(0);
        return new StringBuilder(text.length())
                .appendCodePoint(upper(first))
                .append(text, Character.charCount(first), text.length())
                .toString();
    }

    /**
     * Reports whether every letter in {@code text} is uppercase. Text without letters is not
     * considered uppercase.
     */
    public static boolean isAllUpper(final String text) {
        boolean hasLetter = false;
        for (int i = 0; i < text.length(); ) {
            final int cp = text.codePointAt(i);
            if (Character.isLetter(cp)) {
                hasLetter = true;
                if (!Character.isUpperCase(cp)) {
                    return false;
                }
            }
            i += Character.charCount(cp);
        }
        return hasLetter;
    }

    /**
     * Transfers the case pattern of {@code original} onto {@code replacement}.
     *
     * <p>An all-uppercase original yields an all-uppercase replacement, an original starting with
     * an uppercase letter yields a replacement with an uppercase first letter, anything else
     * leaves the replacement unchanged.</p>
     *
     * @param original    the text whose case pattern is copied
     * @param replacement the text to adapt
     * @return the case-adapted replacement
     */
    public static String applyCase(final String original, final String replacement) {
        if (original.isEmpty() || replacement.isEmpty()) {
            return replacement;
        }
        if (isAllUpper(original)) {
            return toUpperCase(replacement);
        }
        if (Character.isUpperCase(original.codePointAt(0))) {
            return upperFirst(replacement);
        }
        return replacement;
    }

    /**
     * Unicode NFC normalization, so that decomposed input (o + U+0308) matches the precomposed
     * letters the suffix grammar and the dictionary are written in.
     *
     * @param text the text to normalize (must not be null)
     * @return {@code text} itself if it already is NFC, otherwise its composed form
     */
    public static String toNfc(final String text) {
        if (NFC.isNormalized(text)) {
            return text;
        }
        return NFC.normalize(text);
    }
}
