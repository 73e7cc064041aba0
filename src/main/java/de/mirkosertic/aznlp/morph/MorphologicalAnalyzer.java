package de.mirkosertic.aznlp.morph;

import de.mirkosertic.aznlp.util.AzerbaijaniCase;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decomposes Azerbaijani words into stem and suffix chain.
 *
 * <p>All grammatical decompositions are returned, deduplicated and ranked:</p>
 * <ol>
 *   <li>analyses whose stem is in the dictionary come first</li>
 *   <li>among known stems the longer stem wins, among unknown stems the shorter one</li>
 *   <li>then fewer morphemes, then the tag sequence in lexicographic order</li>
 * </ol>
 * <p>The word itself is appended as a suffix-less analysis if it is a valid stem.</p>
 *
 * <p>Instances are immutable and safe for concurrent use; each call works on its own buffers.</p>
 */
public final class MorphologicalAnalyzer {

    /**
     * Words longer than this (in UTF-8 bytes) are never analyzed.
     */
    public static final int MAX_WORD_BYTES = 256;

    private static final Comparator<Candidate> RANKING = (a, b) -> {
        if (a.known() != b.known()) {
            return a.known() ? -1 : 1;
        }
        final int byStem = a.known()
                ? Integer.compare(b.stemLength(), a.stemLength())
                : Integer.compare(a.stemLength(), b.stemLength());
        if (byStem != 0) {
            return byStem;
        }
        final int byDepth = Integer.compare(a.analysis().morphemes().size(), b.analysis().morphemes().size());
        if (byDepth != 0) {
            return byDepth;
        }
        return a.tagsKey().compareTo(b.tagsKey());
    };

    private final StemDictionary dictionary;
    private final SuffixGrammar grammar;

    public MorphologicalAnalyzer(final StemDictionary dictionary) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        this.grammar = SuffixGrammar.getInstance();
    }

    /**
     * Analyzes a single word.
     *
     * @param word the word, expected in NFC (must not be null)
     * @return the ranked analyses; empty for an empty word, a single suffix-less analysis for a
     * word over {@link #MAX_WORD_BYTES} or one that has no decomposition at all
     */
    public List<Analysis> analyze(final String word) {
        Objects.requireNonNull(word, "word");
        if (word.isEmpty()) {
            return List.of();
        }
        if (exceedsMaxLength(word)) {
            return List.of(Analysis.bare(word));
        }

        final List<Candidate> candidates = new ArrayList<>();
        final Set<String> seen = new HashSet<>();
        for (final Analysis analysis : new SuffixWalker(grammar, word).walk()) {
            final String tagsKey = analysis.tagsKey();
            if (seen.add(analysis.stem() + '\u0000' + tagsKey)) {
                candidates.add(new Candidate(analysis, tagsKey, isKnown(analysis.stem()),
                        analysis.stem().codePointCount(0, analysis.stem().length())));
            }
        }
        candidates.sort(RANKING);

        final List<Analysis> results = new ArrayList<>(candidates.size() + 1);
        for (final Candidate candidate : candidates) {
            results.add(candidate.analysis());
        }
        if (results.isEmpty() || Phonology.isValidStem(AzerbaijaniCase.toLowerCase(word))) {
            results.add(Analysis.bare(word));
        }
        return List.copyOf(results);
    }

    /**
     * Dictionary lookup of a stem in any casing.
     */
    public boolean isKnown(final String stem) {
        return dictionary.isKnownStem(AzerbaijaniCase.toLowerCase(stem));
    }

    /**
     * Reports whether {@code word} is longer than {@link #MAX_WORD_BYTES} when encoded as UTF-8.
     * An unpaired surrogate counts as three bytes.
     */
    public static boolean exceedsMaxLength(final String word) {
        if (word.length() > MAX_WORD_BYTES) {
            return true;
        }
        int bytes = 0;
        for (int i = 0; i < word.length(); i++) {
            final char c = word.charAt(i);
            if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < word.length()
                    && Character.isLowSurrogate(word.charAt(i + 1))) {
                bytes += 4;
                i++;
            } else {
                bytes += 3;
            }
        }
        return bytes > MAX_WORD_BYTES;
    }

    private record Candidate(Analysis analysis, String tagsKey, boolean known, int stemLength) {
    }
}
