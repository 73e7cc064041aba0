package de.mirkosertic.aznlp.morph;

/**
 * How a suffix vowel has to agree with the last vowel of the stem it attaches to.
 */
public enum HarmonyKind {
    /** Invariant suffix, e.g. the causative {@code -t}. */
    NONE,
    /** Two-way a/ə alternation, e.g. {@code -lar/-lər}. */
    BACK_FRONT,
    /** Four-way ı/i/u/ü alternation, e.g. {@code -ım/-im/-um/-üm}. */
    FOUR_WAY
}
