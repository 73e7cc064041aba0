package de.mirkosertic.aznlp.morph;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Grammatical category of a stripped suffix.
 *
 * <p>{@link #label()} is the stable external name ({@code "Plural"}, {@code "Poss1Sg"}, ...) used
 * in debug output and as the deterministic tie-breaker when ranking analyses.</p>
 */
public enum MorphTag {

    PLURAL("Plural", Category.NUMBER),
    POSS_1SG("Poss1Sg", Category.POSSESSIVE),
    POSS_2SG("Poss2Sg", Category.POSSESSIVE),
    POSS_3SG("Poss3Sg", Category.POSSESSIVE),
    POSS_1PL("Poss1Pl", Category.POSSESSIVE),
    POSS_2PL("Poss2Pl", Category.POSSESSIVE),
    POSS_3PL("Poss3Pl", Category.POSSESSIVE),

    CASE_GEN("CaseGen", Category.CASE),
    CASE_DAT("CaseDat", Category.CASE),
    CASE_ACC("CaseAcc", Category.CASE),
    CASE_LOC("CaseLoc", Category.CASE),
    CASE_ABL("CaseAbl", Category.CASE),
    CASE_INS("CaseIns", Category.CASE),

    DERIV_AGENT("DerivAgent", Category.DERIVATION),
    DERIV_ABSTRACT("DerivAbstract", Category.DERIVATION),
    DERIV_PRIV("DerivPriv", Category.DERIVATION),
    DERIV_POSS("DerivPoss", Category.DERIVATION),
    DERIV_VERB("DerivVerb", Category.DERIVATION),

    COPULA("Copula", Category.COPULA),

    VOICE_PASS("VoicePass", Category.VOICE),
    VOICE_REFLEX("VoiceReflex", Category.VOICE),
    VOICE_RECIP("VoiceRecip", Category.VOICE),
    VOICE_CAUS("VoiceCaus", Category.VOICE),

    NEGATION("Negation", Category.NEGATION),

    TENSE_PAST_DEF("TensePastDef", Category.TENSE),
    TENSE_PAST_INDEF("TensePastIndef", Category.TENSE),
    TENSE_PRESENT("TensePresent", Category.TENSE),
    TENSE_FUTURE("TenseFuture", Category.TENSE),
    TENSE_AORIST("TenseAorist", Category.TENSE),

    MOOD_OBLIG("MoodOblig", Category.MOOD),
    MOOD_COND("MoodCond", Category.MOOD),
    MOOD_IMPER("MoodImper", Category.MOOD),

    PARTICIPLE("Participle", Category.PARTICIPLE),
    PARTICIPLE_ADJ("ParticipleAdj", Category.PARTICIPLE),
    GERUND("Gerund", Category.GERUND),

    PERS_1SG("Pers1Sg", Category.PERSON),
    PERS_2SG("Pers2Sg", Category.PERSON),
    PERS_1PL("Pers1Pl", Category.PERSON),
    PERS_2PL("Pers2Pl", Category.PERSON),
    PERS_3("Pers3", Category.PERSON),

    QUESTION("Question", Category.QUESTION);

    /**
     * Coarse grouping of tags.
     */
    public enum Category {
        NUMBER,
        POSSESSIVE,
        CASE,
        DERIVATION,
        COPULA,
        VOICE,
        NEGATION,
        TENSE,
        MOOD,
        PARTICIPLE,
        GERUND,
        PERSON,
        QUESTION
    }

    private static final Map<String, MorphTag> BY_LABEL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MorphTag::label, Function.identity()));

    private final String label;
    private final Category category;

    MorphTag(final String label, final Category category) {
        this.label = label;
        this.category = category;
    }

    public String label() {
        return label;
    }

    public Category category() {
        return category;
    }

    /**
     * Tense, mood, participle, gerund and derivational suffixes. Stripping one of these from a
     * dictionary word still yields a different lexical item's base, unlike case, possessive or
     * negation endings, which frequently coincide with the tail of an unrelated lemma.
     */
    public boolean isProductive() {
        return switch (category) {
            case TENSE, MOOD, PARTICIPLE, GERUND, DERIVATION -> true;
            default -> false;
        };
    }

    /**
     * Parses a tag from its {@link #label()}.
     *
     * @throws IllegalArgumentException if no tag has this label
     */
    public static MorphTag fromLabel(final String label) {
        final MorphTag tag = BY_LABEL.get(label);
        if (tag == null) {
            throw new IllegalArgumentException("Unknown morph tag: " + label);
        }
        return tag;
    }

    @Override
    public String toString() {
        return label;
    }
}
