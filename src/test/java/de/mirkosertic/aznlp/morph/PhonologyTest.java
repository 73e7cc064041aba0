package de.mirkosertic.aznlp.morph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Phonology")
class PhonologyTest {

    @ParameterizedTest
    @ValueSource(strings = {"a", "e", "ə", "i", "ı", "o", "ö", "u", "ü", "A", "E", "Ə", "İ", "I", "O", "Ö", "U", "Ü"})
    @DisplayName("Every vowel is either back or front, never both")
    void vowelsAreBackXorFront(final String vowel) {
        final int cp = vowel.codePointAt(0);
        assertThat(Phonology.isVowel(cp)).isTrue();
        assertThat(Phonology.isBackVowel(cp) ^ Phonology.isFrontVowel(cp)).isTrue();
    }

    @Test
    @DisplayName("Back and front classes")
    void backAndFront() {
        assertThat(Phonology.isBackVowel('a')).isTrue();
        assertThat(Phonology.isBackVowel('ı')).isTrue();
        assertThat(Phonology.isBackVowel('I')).isTrue();
        assertThat(Phonology.isFrontVowel('ə')).isTrue();
        assertThat(Phonology.isFrontVowel('İ')).isTrue();
        assertThat(Phonology.isFrontVowel('ü')).isTrue();
    }

    @Test
    @DisplayName("Consonants, digits and unpaired surrogates are not vowels")
    void nonVowels() {
        assertThat(Phonology.isVowel('k')).isFalse();
        assertThat(Phonology.isVowel('ğ')).isFalse();
        assertThat(Phonology.isVowel('5')).isFalse();
        assertThat(Phonology.isVowel('\uD800')).isFalse();
    }

    @Test
    @DisplayName("Voiceless consonants")
    void voiceless() {
        for (final char c : "pçtkqfsşxh".toCharArray()) {
            assertThat(Phonology.isVoiceless(c)).as("%s", c).isTrue();
        }
        for (final char c : "bcdgğjlmnrvyz".toCharArray()) {
            assertThat(Phonology.isVoiceless(c)).as("%s", c).isFalse();
        }
        assertThat(Phonology.isVoiceless('a')).isFalse();
    }

    @Test
    @DisplayName("lastVowel and firstVowel scan the right direction")
    void lastAndFirstVowel() {
        assertThat(Phonology.lastVowel("kitab")).isEqualTo('a');
        assertThat(Phonology.lastVowel("ürək")).isEqualTo('ə');
        assertThat(Phonology.lastVowel("str")).isEqualTo(Phonology.NO_VOWEL);
        assertThat(Phonology.lastVowel("")).isEqualTo(Phonology.NO_VOWEL);
        assertThat(Phonology.firstVowel("ımız")).isEqualTo('ı');
        assertThat(Phonology.firstVowel("lər")).isEqualTo('ə');
        assertThat(Phonology.firstVowel("t")).isEqualTo(Phonology.NO_VOWEL);
    }

    @Test
    @DisplayName("A valid stem has two code points and a vowel")
    void validStem() {
        assertThat(Phonology.isValidStem("ev")).isTrue();
        assertThat(Phonology.isValidStem("kitab")).isTrue();
        assertThat(Phonology.isValidStem("a")).isFalse();
        assertThat(Phonology.isValidStem("st")).isFalse();
        assertThat(Phonology.isValidStem("")).isFalse();
    }

    @Test
    @DisplayName("Two-way harmony compares backness")
    void backFrontHarmony() {
        assertThat(Phonology.matchesBackFront('a', 'a')).isTrue();
        assertThat(Phonology.matchesBackFront('u', 'a')).isTrue();
        assertThat(Phonology.matchesBackFront('ə', 'ə')).isTrue();
        assertThat(Phonology.matchesBackFront('a', 'ə')).isFalse();
        assertThat(Phonology.matchesBackFront('i', 'a')).isFalse();
        assertThat(Phonology.matchesBackFront('A', 'a')).isTrue();
        assertThat(Phonology.matchesBackFront(Phonology.NO_VOWEL, 'ə')).isTrue();
    }

    @Test
    @DisplayName("Four-way harmony requires the exact high vowel")
    void fourWayHarmony() {
        assertThat(Phonology.matchesFourWay('a', 'ı')).isTrue();
        assertThat(Phonology.matchesFourWay('o', 'u')).isTrue();
        assertThat(Phonology.matchesFourWay('ə', 'i')).isTrue();
        assertThat(Phonology.matchesFourWay('ö', 'ü')).isTrue();
        assertThat(Phonology.matchesFourWay('o', 'ı')).isFalse();
        assertThat(Phonology.matchesFourWay('e', 'ü')).isFalse();
        assertThat(Phonology.matchesFourWay('I', 'ı')).isTrue();
        assertThat(Phonology.matchesFourWay(Phonology.NO_VOWEL, 'ü')).isTrue();
    }

    @Test
    @DisplayName("fourWayTarget maps every vowel and falls back to i")
    void fourWayTarget() {
        assertThat(Phonology.fourWayTarget('a')).isEqualTo('ı');
        assertThat(Phonology.fourWayTarget('ı')).isEqualTo('ı');
        assertThat(Phonology.fourWayTarget('o')).isEqualTo('u');
        assertThat(Phonology.fourWayTarget('u')).isEqualTo('u');
        assertThat(Phonology.fourWayTarget('e')).isEqualTo('i');
        assertThat(Phonology.fourWayTarget('ə')).isEqualTo('i');
        assertThat(Phonology.fourWayTarget('i')).isEqualTo('i');
        assertThat(Phonology.fourWayTarget('ö')).isEqualTo('ü');
        assertThat(Phonology.fourWayTarget('ü')).isEqualTo('ü');
        assertThat(Phonology.fourWayTarget('x')).isEqualTo('i');
    }
}
