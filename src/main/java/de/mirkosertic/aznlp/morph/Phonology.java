package de.mirkosertic.aznlp.morph;

import de.mirkosertic.aznlp.util.AzerbaijaniCase;

/**
 * Vowel and consonant classification plus the vowel harmony predicates the suffix walker
 * validates against.
 *
 * <p>Azerbaijani has nine vowels. Back vowels are {@code a ı o u}, front vowels are
 * {@code e ə i ö ü}; every vowel belongs to exactly one of the two classes. Both cases are
 * classified, including the Turkic {@code I}/{@code İ} pair. Code points outside the
 * alphabet, including unpaired surrogates, are neither vowels nor consonants.</p>
 */
public final class Phonology {

    /**
     * Sentinel returned by {@link #lastVowel} and {@link #firstVowel} when no vowel exists.
     */
    public static final int NO_VOWEL = -1;

    /**
     * The nine Azerbaijani vowels in lowercase.
     */
    static final int[] VOWELS = {'a', 'e', 'ə', 'i', 'ı', 'o', 'ö', 'u', 'ü'};

    private Phonology() {
    }

    public static boolean isVowel(final int cp) {
        return isBackVowel(cp) || isFrontVowel(cp);
    }

    public static boolean isBackVowel(final int cp) {
        return switch (cp) {
            case 'a', 'A', 'ı', 'I', 'o', 'O', 'u', 'U' -> true;
            default -> false;
        };
    }

    public static boolean isFrontVowel(final int cp) {
        return switch (cp) {
            case 'e', 'E', 'ə', 'Ə', 'i', 'İ', 'ö', 'Ö', 'ü', 'Ü' -> true;
            default -> false;
        };
    }

    /**
     * Reports whether {@code cp} is one of the voiceless consonants {@code p ç t k q f s ş x h}.
     * Expects lowercase input.
     */
    public static boolean isVoiceless(final int cp) {
        return switch (cp) {
            case 'p', 'ç', 't', 'k', 'q', 'f', 's', 'ş', 'x', 'h' -> true;
            default -> false;
        };
    }

    /**
     * Returns the last vowel of {@code text}, or {@link #NO_VOWEL}.
     */
    public static int lastVowel(final CharSequence text) {
        int i = text.length();
        while (i > 0) {
            final int cp = Character.codePointBefore(text, i);
            if (isVowel(cp)) {
                return cp;
            }
            i -= Character.charCount(cp);
        }
        return NO_VOWEL;
    }

    /**
     * Returns the last vowel among the first {@code end} code points of {@code codePoints},
     * or {@link #NO_VOWEL}.
     */
    static int lastVowel(final int[] codePoints, final int end) {
        for (int i = end - 1; i >= 0; i--) {
            if (isVowel(codePoints[i])) {
                return codePoints[i];
            }
        }
        return NO_VOWEL;
    }

    /**
     * Returns the first vowel of {@code text}, or {@link #NO_VOWEL}.
     */
    public static int firstVowel(final CharSequence text) {
        int i = 0;
        while (i < text.length()) {
            final int cp = Character.codePointAt(text, i);
            if (isVowel(cp)) {
                return cp;
            }
            i += Character.charCount(cp);
        }
        return NO_VOWEL;
    }

    /**
     * A valid stem has at least two code points and contains at least one vowel.
     */
    public static boolean isValidStem(final CharSequence text) {
        final int[] codePoints = text.codePoints().toArray();
        return isValidStem(codePoints, codePoints.length);
    }

    static boolean isValidStem(final int[] codePoints, final int end) {
        return end >= 2 && lastVowel(codePoints, end) != NO_VOWEL;
    }

    /**
     * Two-way harmony: a back stem vowel requires a back suffix vowel, a front one a front
     * suffix vowel. A stem without vowels accepts any suffix.
     */
    public static boolean matchesBackFront(final int stemLastVowel, final int suffixVowel) {
        if (stemLastVowel == NO_VOWEL) {
            return true;
        }
        return isBackVowel(AzerbaijaniCase.lower(stemLastVowel)) == isBackVowel(AzerbaijaniCase.lower(suffixVowel));
    }

    /**
     * Four-way harmony: the suffix vowel must equal {@link #fourWayTarget(int)} of the stem's last
     * vowel. A stem without vowels accepts any suffix.
     */
    public static boolean matchesFourWay(final int stemLastVowel, final int suffixVowel) {
        if (stemLastVowel == NO_VOWEL) {
            return true;
        }
        return AzerbaijaniCase.lower(suffixVowel) == fourWayTarget(AzerbaijaniCase.lower(stemLastVowel));
    }

    /**
     * Returns the high vowel a four-way harmonic suffix takes after the (lowercase) vowel {@code v}:
     * {@code a ı → ı}, {@code o u → u}, {@code e ə i → i}, {@code ö ü → ü}. Anything else maps
     * to {@code i}.
     */
    public static int fourWayTarget(final int v) {
        return switch (v) {
            case 'a', 'ı' -> 'ı';
            case 'o', 'u' -> 'u';
            case 'ö', 'ü' -> 'ü';
            default -> 'i';
        };
    }
}
