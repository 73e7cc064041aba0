package de.mirkosertic.aznlp.morph;

/**
 * Position in the morphotactic chain.
 *
 * <p>The grammar is written in forward (left-to-right) order: each rule names the states it may
 * follow and the state it leads to. {@link #INITIAL} is the stem boundary; the walker strips
 * suffixes right to left and accepts a parse once it has traced back to it.</p>
 */
public enum FsmState {
    INITIAL,
    AFTER_COPULA,
    AFTER_QUESTION,
    NOUN_AFTER_CASE,
    NOUN_AFTER_POSS,
    NOUN_AFTER_PLURAL,
    NOUN_AFTER_DERIV,
    VERB_AFTER_PERSON,
    VERB_AFTER_TENSE,
    VERB_AFTER_NEG,
    VERB_AFTER_VOICE
}
