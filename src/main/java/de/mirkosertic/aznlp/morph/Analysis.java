package de.mirkosertic.aznlp.morph;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One decomposition of a word into a stem and its suffix chain.
 *
 * <p>Morphemes are ordered left to right, starting with the one attached directly to the stem.
 * The stem followed by all surfaces spells the analyzed word, except where a softened
 * {@code y}/{@code ğ} before a vowel-initial suffix was restored to {@code k}/{@code q}
 * in the stem (ürəyi is analyzed as ürək + i).</p>
 *
 * @param stem      the stem in the casing of the analyzed word
 * @param morphemes the suffix chain, empty for a bare stem
 */
public record Analysis(String stem, List<Morpheme> morphemes) {

    public Analysis {
        Objects.requireNonNull(stem, "stem");
        morphemes = List.copyOf(morphemes);
    }

    /**
     * Analysis of a word as a stem without suffixes.
     */
    public static Analysis bare(final String word) {
        return new Analysis(word, List.of());
    }

    public boolean hasMorphemes() {
        return !morphemes.isEmpty();
    }

    /**
     * The suffix attached directly to the stem.
     *
     * @throws IllegalStateException if there are no morphemes
     */
    public Morpheme innermost() {
        if (morphemes.isEmpty()) {
            throw new IllegalStateException("Bare analysis of " + stem + " has no morphemes");
        }
        return morphemes.get(0);
    }

    /**
     * Tag labels joined with {@code |}, e.g. {@code Plural|CaseAbl}. Identifies the suffix chain
     * for deduplication and is the final ranking tie-breaker.
     */
    public String tagsKey() {
        return morphemes.stream()
                .map(m -> m.tag().label())
                .collect(Collectors.joining("|"));
    }

    /**
     * Debug form, e.g. {@code kitab[Plural:lar|Poss1Pl:ımız|CaseAbl:dan]}.
     */
    @Override
    public String toString() {
        if (morphemes.isEmpty()) {
            return stem;
        }
        return morphemes.stream()
                .map(m -> m.tag().label() + ":" + m.surface())
                .collect(Collectors.joining("|", stem + "[", "]"));
    }
}
