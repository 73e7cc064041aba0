package de.mirkosertic.aznlp.morph;

import de.mirkosertic.aznlp.util.AzerbaijaniCase;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Backtracking right-to-left suffix stripper for a single word.
 *
 * <p>An instance owns two code point buffers of the word, one in its original case and one
 * lowercased. k/q restoration overwrites a stem's final {@code y}/{@code ğ} in both buffers for
 * the duration of one recursive call and puts it back afterwards, so a walker must never be
 * shared between threads or reused for a second word.</p>
 */
final class SuffixWalker {

    /**
     * Upper bound on the number of stripped suffixes in one analysis.
     */
    static final int MAX_DEPTH = 10;

    private final SuffixGrammar grammar;
    private final int[] original;
    private final int[] lower;
    private final Morpheme[] chain = new Morpheme[MAX_DEPTH];
    private final List<Analysis> results = new ArrayList<>();

    SuffixWalker(final SuffixGrammar grammar, final String word) {
        this.grammar = grammar;
        this.original = word.codePoints().toArray();
        this.lower = Arrays.stream(original).map(AzerbaijaniCase::lower).toArray();
    }

    /**
     * Enumerates every decomposition the grammar permits, in search order and with duplicates.
     */
    List<Analysis> walk() {
        for (final FsmState terminal : grammar.terminalStates()) {
            walk(original.length, terminal, 0);
        }
        return results;
    }

    /**
     * Strips one more suffix leading into {@code state} from the first {@code pos} code points.
     * {@code depth} is the number of suffixes already stripped, held in {@code chain[0..depth)}
     * outermost first.
     */
    private void walk(final int pos, final FsmState state, final int depth) {
        if (state == FsmState.INITIAL) {
            if (pos > 0 && Phonology.isValidStem(lower, pos)) {
                record(pos, depth);
            }
            return;
        }
        if (depth >= MAX_DEPTH || pos < grammar.minSuffixLength(state)) {
            return;
        }

        for (final SuffixRule rule : grammar.rulesInto(state)) {
            for (int i = 0; i < rule.surfaceCount(); i++) {
                final int[] surface = rule.surfaceCodePoints(i);
                final int stemEnd = pos - surface.length;
                if (stemEnd < 0 || !endsWith(pos, surface)) {
                    continue;
                }
                if (!harmonyHolds(rule.harmony(), stemEnd, rule.surfaceFirstVowel(i))) {
                    continue;
                }
                if (!assimilationHolds(rule, surface[0], stemEnd)) {
                    continue;
                }

                chain[depth] = new Morpheme(new String(original, stemEnd, surface.length), rule.tag());

                for (final FsmState from : rule.fromStates()) {
                    walk(stemEnd, from, depth + 1);

                    if (stemEnd > 0 && Phonology.isVowel(surface[0])) {
                        final int last = lower[stemEnd - 1];
                        if (last == 'y') {
                            walkRestored(stemEnd, 'k', from, depth + 1);
                        } else if (last == 'ğ') {
                            walkRestored(stemEnd, 'q', from, depth + 1);
                        }
                    }
                }
            }
        }
    }

    /**
     * Replaces the softened consonant before {@code stemEnd} with its underlying form (ürəy-i to
     * ürək, otağ-ı to otaq), walks on, and restores the buffers.
     */
    private void walkRestored(final int stemEnd, final int restored, final FsmState state, final int depth) {
        final int index = stemEnd - 1;
        final int savedOriginal = original[index];
        final int savedLower = lower[index];

        original[index] = Character.isUpperCase(savedOriginal) ? AzerbaijaniCase.upper(restored) : restored;
        lower[index] = restored;
        try {
            walk(stemEnd, state, depth);
        } finally {
            original[index] = savedOriginal;
            lower[index] = savedLower;
        }
    }

    private boolean endsWith(final int pos, final int[] surface) {
        final int offset = pos - surface.length;
        for (int i = 0; i < surface.length; i++) {
            if (lower[offset + i] != surface[i]) {
                return false;
            }
        }
        return true;
    }

    private boolean harmonyHolds(final HarmonyKind harmony, final int stemEnd, final int suffixVowel) {
        if (harmony == HarmonyKind.NONE || suffixVowel == Phonology.NO_VOWEL) {
            return true;
        }
        final int stemVowel = Phonology.lastVowel(lower, stemEnd);
        return switch (harmony) {
            case BACK_FRONT -> Phonology.matchesBackFront(stemVowel, suffixVowel);
            case FOUR_WAY -> Phonology.matchesFourWay(stemVowel, suffixVowel);
            case NONE -> true;
        };
    }

    /**
     * d/t alternation: the t-form requires a voiceless consonant before it, the d-form is refused
     * after one. {@code q} takes the d-form by orthographic convention (otaqda), and the copula
     * accepts both forms everywhere.
     */
    private boolean assimilationHolds(final SuffixRule rule, final int first, final int stemEnd) {
        if (!rule.isDtAlternating() || stemEnd == 0 || rule.tag() == MorphTag.COPULA) {
            return true;
        }
        final int preceding = lower[stemEnd - 1];
        if (first == 't') {
            return Phonology.isVoiceless(preceding);
        }
        if (first == 'd') {
            return !Phonology.isVoiceless(preceding) || preceding == 'q';
        }
        return true;
    }

    private void record(final int stemLength, final int depth) {
        final List<Morpheme> morphemes = new ArrayList<>(depth);
        for (int i = depth - 1; i >= 0; i--) {
            morphemes.add(chain[i]);
        }
        results.add(new Analysis(new String(original, 0, stemLength), morphemes));
    }
}
