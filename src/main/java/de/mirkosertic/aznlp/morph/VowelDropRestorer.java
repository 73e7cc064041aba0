package de.mirkosertic.aznlp.morph;

import de.mirkosertic.aznlp.util.AzerbaijaniCase;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Restores a vowel dropped from a stem under suffixation, e.g. oğl(um) to oğul, burn(u) to
 * burun, ağz(ı) to ağız.
 *
 * <p>A vowel is inserted into the rightmost two-consonant cluster of the stem and the result is
 * looked up in the dictionary. If several vowels produce known words, the one predicted by
 * four-way harmony with the preceding vowel wins (aln gives alın, not alan).</p>
 */
public final class VowelDropRestorer {

    private static final int MIN_STEM_LENGTH = 3;

    private final StemDictionary dictionary;

    public VowelDropRestorer(final StemDictionary dictionary) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
    }

    /**
     * @param stem a contracted stem, usually the stem of a walker analysis
     * @return the restored lowercase dictionary form, or empty if none or more than one
     * ambiguous candidate exists
     */
    public Optional<String> tryRestore(final String stem) {
        final int[] codePoints = AzerbaijaniCase.toLowerCase(stem).codePoints().toArray();
        if (codePoints.length < MIN_STEM_LENGTH) {
            return Optional.empty();
        }

        int insertAt = -1;
        for (int i = codePoints.length - 1; i > 0; i--) {
            if (!Phonology.isVowel(codePoints[i]) && !Phonology.isVowel(codePoints[i - 1])) {
                insertAt = i;
                break;
            }
        }
        if (insertAt < 1) {
            return Optional.empty();
        }

        final int prefixVowel = Phonology.lastVowel(codePoints, insertAt);
        if (prefixVowel == Phonology.NO_VOWEL) {
            return Optional.empty();
        }

        final String prefix = new String(codePoints, 0, insertAt);
        final String rest = new String(codePoints, insertAt, codePoints.length - insertAt);
        final List<String> matches = new ArrayList<>();
        final List<Integer> inserted = new ArrayList<>();
        for (final int vowel : Phonology.VOWELS) {
            final String candidate = prefix + Character.toString(vowel) + rest;
            if (dictionary.isKnownStem(candidate)) {
                matches.add(candidate);
                inserted.add(vowel);
            }
        }

        if (matches.size() == 1) {
            return Optional.of(matches.get(0));
        }
        final int target = Phonology.fourWayTarget(prefixVowel);
        for (int i = 0; i < matches.size(); i++) {
            if (inserted.get(i) == target) {
                return Optional.of(matches.get(i));
            }
        }
        return Optional.empty();
    }
}
