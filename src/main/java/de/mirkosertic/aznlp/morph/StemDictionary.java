package de.mirkosertic.aznlp.morph;

/**
 * Lexicon of known stems. Lookups only influence ranking, an unknown stem never blocks an
 * analysis.
 */
@FunctionalInterface
public interface StemDictionary {

    /**
     * @param stem a lowercase stem
     * @return true if the stem is a known lemma
     */
    boolean isKnownStem(String stem);

    /**
     * A dictionary that knows nothing. Stemming then relies on the grammar alone.
     */
    static StemDictionary empty() {
        return stem -> false;
    }
}
