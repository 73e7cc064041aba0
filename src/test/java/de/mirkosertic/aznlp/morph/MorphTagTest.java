package de.mirkosertic.aznlp.morph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MorphTag")
class MorphTagTest {

    @Test
    @DisplayName("Labels are the external tag names")
    void labels() {
        assertThat(MorphTag.PLURAL.label()).isEqualTo("Plural");
        assertThat(MorphTag.POSS_1PL.label()).isEqualTo("Poss1Pl");
        assertThat(MorphTag.CASE_ABL.label()).isEqualTo("CaseAbl");
        assertThat(MorphTag.TENSE_PAST_INDEF.label()).isEqualTo("TensePastIndef");
        assertThat(MorphTag.QUESTION.toString()).isEqualTo("Question");
    }

    @Test
    @DisplayName("Every label parses back to its tag")
    void labelRoundTrip() {
        for (final MorphTag tag : MorphTag.values()) {
            assertThat(MorphTag.fromLabel(tag.label())).isSameAs(tag);
        }
        assertThat(Arrays.stream(MorphTag.values()).map(MorphTag::label).distinct()).hasSize(MorphTag.values().length);
    }

    @Test
    @DisplayName("Unknown labels are rejected")
    void unknownLabel() {
        assertThatThrownBy(() -> MorphTag.fromLabel("Dual"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Dual");
        assertThatThrownBy(() -> MorphTag.fromLabel("plural"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Productive tags are tense, mood, participle, gerund and derivation")
    void productive() {
        final EnumSet<MorphTag> productive = EnumSet.noneOf(MorphTag.class);
        for (final MorphTag tag : MorphTag.values()) {
            if (tag.isProductive()) {
                productive.add(tag);
            }
        }
        assertThat(productive).contains(MorphTag.TENSE_AORIST, MorphTag.MOOD_COND, MorphTag.PARTICIPLE,
                MorphTag.GERUND, MorphTag.DERIV_AGENT, MorphTag.DERIV_VERB);
        assertThat(productive).doesNotContain(MorphTag.CASE_DAT, MorphTag.POSS_3SG, MorphTag.NEGATION,
                MorphTag.PLURAL, MorphTag.COPULA, MorphTag.PERS_3, MorphTag.VOICE_PASS, MorphTag.QUESTION);
    }

    @Test
    @DisplayName("Categories group related tags")
    void categories() {
        assertThat(MorphTag.CASE_GEN.category()).isEqualTo(MorphTag.Category.CASE);
        assertThat(MorphTag.POSS_2SG.category()).isEqualTo(MorphTag.Category.POSSESSIVE);
        assertThat(MorphTag.VOICE_RECIP.category()).isEqualTo(MorphTag.Category.VOICE);
        assertThat(MorphTag.PERS_1PL.category()).isEqualTo(MorphTag.Category.PERSON);
    }
}
