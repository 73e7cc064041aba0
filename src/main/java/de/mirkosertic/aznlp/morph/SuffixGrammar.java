package de.mirkosertic.aznlp.morph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static de.mirkosertic.aznlp.morph.FsmState.AFTER_COPULA;
import static de.mirkosertic.aznlp.morph.FsmState.AFTER_QUESTION;
import static de.mirkosertic.aznlp.morph.FsmState.INITIAL;
import static de.mirkosertic.aznlp.morph.FsmState.NOUN_AFTER_CASE;
import static de.mirkosertic.aznlp.morph.FsmState.NOUN_AFTER_DERIV;
import static de.mirkosertic.aznlp.morph.FsmState.NOUN_AFTER_PLURAL;
import static de.mirkosertic.aznlp.morph.FsmState.NOUN_AFTER_POSS;
import static de.mirkosertic.aznlp.morph.FsmState.VERB_AFTER_NEG;
import static de.mirkosertic.aznlp.morph.FsmState.VERB_AFTER_PERSON;
import static de.mirkosertic.aznlp.morph.FsmState.VERB_AFTER_TENSE;
import static de.mirkosertic.aznlp.morph.FsmState.VERB_AFTER_VOICE;
import static de.mirkosertic.aznlp.morph.HarmonyKind.BACK_FRONT;
import static de.mirkosertic.aznlp.morph.HarmonyKind.FOUR_WAY;
import static de.mirkosertic.aznlp.morph.HarmonyKind.NONE;

/**
 * The Azerbaijani suffix table.
 *
 * <p>Rules are written in forward morphotactic order: {@code fromStates} lists the states a
 * suffix may follow, {@code toState} the state reached after it. The walker runs the table
 * backwards, starting at every {@link #terminalStates() terminal state}.</p>
 *
 * <p>The table and its derived indices are built once on first use and never change, so a single
 * instance is shared by every analyzer and thread.</p>
 */
public final class SuffixGrammar {

    private static final class Holder {
        private static final SuffixGrammar INSTANCE = new SuffixGrammar(buildRules());
    }

    private final List<SuffixRule> rules;
    private final Map<FsmState, List<SuffixRule>> rulesByToState;
    private final Map<FsmState, Integer> minSuffixLength;
    private final Set<FsmState> terminalStates;

    private SuffixGrammar(final List<SuffixRule> rules) {
        this.rules = List.copyOf(rules);

        final Map<FsmState, List<SuffixRule>> byState = new EnumMap<>(FsmState.class);
        final Map<FsmState, Integer> minLength = new EnumMap<>(FsmState.class);
        for (final SuffixRule rule : this.rules) {
            byState.computeIfAbsent(rule.toState(), k -> new ArrayList<>()).add(rule);
            minLength.merge(rule.toState(), rule.minSurfaceLength(), Math::min);
        }
        byState.replaceAll((state, list) -> List.copyOf(list));

        this.rulesByToState = Collections.unmodifiableMap(byState);
        this.minSuffixLength = Collections.unmodifiableMap(minLength);
        this.terminalStates = Collections.unmodifiableSet(EnumSet.copyOf(byState.keySet()));
    }

    public static SuffixGrammar getInstance() {
        return Holder.INSTANCE;
    }

    /**
     * All rules in declaration order.
     */
    public List<SuffixRule> rules() {
        return rules;
    }

    /**
     * Rules leading into {@code state}, in declaration order. Empty for {@link FsmState#INITIAL}.
     */
    public List<SuffixRule> rulesInto(final FsmState state) {
        return rulesByToState.getOrDefault(state, List.of());
    }

    /**
     * Length in code points of the shortest allomorph of any rule leading into {@code state}, or
     * {@link Integer#MAX_VALUE} if no rule does.
     */
    public int minSuffixLength(final FsmState state) {
        return minSuffixLength.getOrDefault(state, Integer.MAX_VALUE);
    }

    /**
     * Every distinct {@code toState} of the table, in enum order.
     */
    public Set<FsmState> terminalStates() {
        return terminalStates;
    }

    private static SuffixRule rule(final MorphTag tag, final HarmonyKind harmony, final List<FsmState> fromStates,
                                   final FsmState toState, final String... surfaces) {
        return new SuffixRule(tag, harmony, fromStates, toState, Arrays.asList(surfaces));
    }

    private static List<FsmState> from(final FsmState... states) {
        return List.of(states);
    }

    private static List<SuffixRule> buildRules() {
        final List<FsmState> nounBase = from(INITIAL, NOUN_AFTER_PLURAL, NOUN_AFTER_DERIV);
        final List<FsmState> caseBase = from(INITIAL, NOUN_AFTER_POSS, NOUN_AFTER_PLURAL, NOUN_AFTER_DERIV);
        final List<FsmState> derivBase = from(INITIAL, NOUN_AFTER_DERIV);
        final List<FsmState> tenseBase = from(INITIAL, VERB_AFTER_NEG, VERB_AFTER_VOICE);

        return List.of(
                // Noun chain
                rule(MorphTag.PLURAL, BACK_FRONT, derivBase, NOUN_AFTER_PLURAL,
                        "lar", "lər"),
                rule(MorphTag.POSS_1SG, FOUR_WAY, nounBase, NOUN_AFTER_POSS,
                        "ım", "im", "um", "üm", "m"),
                rule(MorphTag.POSS_2SG, FOUR_WAY, nounBase, NOUN_AFTER_POSS,
                        "ın", "in", "un", "ün", "n"),
                rule(MorphTag.POSS_3SG, FOUR_WAY, nounBase, NOUN_AFTER_POSS,
                        "sı", "si", "su", "sü", "ı", "i", "u", "ü"),
                rule(MorphTag.POSS_1PL, FOUR_WAY, nounBase, NOUN_AFTER_POSS,
                        "ımız", "imiz", "umuz", "ümüz", "mız", "miz", "muz", "müz"),
                rule(MorphTag.POSS_2PL, FOUR_WAY, nounBase, NOUN_AFTER_POSS,
                        "ınız", "iniz", "unuz", "ünüz", "nız", "niz", "nuz", "nüz"),
                rule(MorphTag.POSS_3PL, BACK_FRONT, nounBase, NOUN_AFTER_POSS,
                        "ları", "ləri"),

                rule(MorphTag.CASE_GEN, FOUR_WAY, caseBase, NOUN_AFTER_CASE,
                        "nın", "nin", "nun", "nün", "ın", "in", "un", "ün"),
                rule(MorphTag.CASE_DAT, BACK_FRONT, caseBase, NOUN_AFTER_CASE,
                        "ya", "yə", "na", "nə", "a", "ə"),
                rule(MorphTag.CASE_ACC, FOUR_WAY, caseBase, NOUN_AFTER_CASE,
                        "nı", "ni", "nu", "nü", "ı", "i", "u", "ü"),
                rule(MorphTag.CASE_LOC, BACK_FRONT, caseBase, NOUN_AFTER_CASE,
                        "nda", "ndə", "da", "də", "ta", "tə"),
                rule(MorphTag.CASE_ABL, BACK_FRONT, caseBase, NOUN_AFTER_CASE,
                        "ndan", "ndən", "dan", "dən", "tan", "tən"),
                rule(MorphTag.CASE_INS, BACK_FRONT, caseBase, NOUN_AFTER_CASE,
                        "la", "lə"),

                rule(MorphTag.DERIV_AGENT, FOUR_WAY, derivBase, NOUN_AFTER_DERIV,
                        "çı", "çi", "çu", "çü"),
                rule(MorphTag.DERIV_ABSTRACT, FOUR_WAY, derivBase, NOUN_AFTER_DERIV,
                        "lıq", "lik", "luq", "lük"),
                rule(MorphTag.DERIV_PRIV, FOUR_WAY, derivBase, NOUN_AFTER_DERIV,
                        "sız", "siz", "suz", "süz"),
                rule(MorphTag.DERIV_POSS, FOUR_WAY, derivBase, NOUN_AFTER_DERIV,
                        "lı", "li", "lu", "lü"),
                // Denominal verb, moves the parse from the noun into the verb chain
                rule(MorphTag.DERIV_VERB, BACK_FRONT, derivBase, VERB_AFTER_VOICE,
                        "laş", "ləş"),

                rule(MorphTag.COPULA, FOUR_WAY,
                        from(INITIAL, NOUN_AFTER_CASE, NOUN_AFTER_POSS, NOUN_AFTER_PLURAL, NOUN_AFTER_DERIV,
                                VERB_AFTER_TENSE),
                        AFTER_COPULA,
                        "dır", "dir", "dur", "dür", "tır", "tir", "tur", "tür"),

                // Verb chain
                rule(MorphTag.NEGATION, BACK_FRONT, from(INITIAL, VERB_AFTER_VOICE), VERB_AFTER_NEG,
                        "ma", "mə"),

                rule(MorphTag.VOICE_PASS, FOUR_WAY, from(INITIAL), VERB_AFTER_VOICE,
                        "ıl", "il", "ul", "ül"),
                rule(MorphTag.VOICE_REFLEX, FOUR_WAY, from(INITIAL), VERB_AFTER_VOICE,
                        "ın", "in", "un", "ün"),
                rule(MorphTag.VOICE_RECIP, FOUR_WAY, from(INITIAL), VERB_AFTER_VOICE,
                        "ış", "iş", "uş", "üş"),
                // Short causative, lexically conditioned
                rule(MorphTag.VOICE_CAUS, NONE, from(INITIAL), VERB_AFTER_VOICE,
                        "t"),
                rule(MorphTag.VOICE_CAUS, FOUR_WAY, from(INITIAL), VERB_AFTER_VOICE,
                        "ır", "ir", "ur", "ür"),

                rule(MorphTag.TENSE_PAST_DEF, FOUR_WAY,
                        from(INITIAL, VERB_AFTER_NEG, VERB_AFTER_VOICE, VERB_AFTER_TENSE), VERB_AFTER_TENSE,
                        "dı", "di", "du", "dü", "tı", "ti", "tu", "tü"),
                rule(MorphTag.TENSE_PAST_INDEF, FOUR_WAY, tenseBase, VERB_AFTER_TENSE,
                        "mış", "miş", "muş", "müş"),
                rule(MorphTag.TENSE_PRESENT, FOUR_WAY, tenseBase, VERB_AFTER_TENSE,
                        "ır", "ir", "ur", "ür"),
                rule(MorphTag.TENSE_FUTURE, BACK_FRONT, tenseBase, VERB_AFTER_TENSE,
                        "acaq", "əcək"),
                rule(MorphTag.TENSE_AORIST, BACK_FRONT, tenseBase, VERB_AFTER_TENSE,
                        "ar", "ər"),

                rule(MorphTag.MOOD_OBLIG, BACK_FRONT, tenseBase, VERB_AFTER_TENSE,
                        "malı", "məli"),
                rule(MorphTag.MOOD_COND, BACK_FRONT, tenseBase, VERB_AFTER_TENSE,
                        "sa", "sə"),

                rule(MorphTag.PARTICIPLE, BACK_FRONT, tenseBase, VERB_AFTER_TENSE,
                        "an", "ən"),
                rule(MorphTag.GERUND, BACK_FRONT, tenseBase, VERB_AFTER_TENSE,
                        "araq", "ərək"),

                rule(MorphTag.PERS_1SG, BACK_FRONT, from(VERB_AFTER_TENSE), VERB_AFTER_PERSON,
                        "əm", "am", "m"),
                rule(MorphTag.PERS_2SG, BACK_FRONT, from(VERB_AFTER_TENSE), VERB_AFTER_PERSON,
                        "sən", "san", "n"),
                rule(MorphTag.PERS_1PL, FOUR_WAY, from(VERB_AFTER_TENSE), VERB_AFTER_PERSON,
                        "ıq", "ik", "uq", "ük", "q", "k"),
                rule(MorphTag.PERS_2PL, FOUR_WAY, from(VERB_AFTER_TENSE), VERB_AFTER_PERSON,
                        "sınız", "siniz", "sunuz", "sünüz", "nız", "niz", "nuz", "nüz"),
                // Same surface as the noun plural, only after a tense or mood marker
                rule(MorphTag.PERS_3, BACK_FRONT, from(VERB_AFTER_TENSE), VERB_AFTER_PERSON,
                        "lar", "lər"),

                rule(MorphTag.QUESTION, FOUR_WAY,
                        from(INITIAL, VERB_AFTER_PERSON, AFTER_COPULA, VERB_AFTER_TENSE), AFTER_QUESTION,
                        "mı", "mi", "mu", "mü")
        );
    }
}
