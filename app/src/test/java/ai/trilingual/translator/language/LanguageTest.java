package ai.trilingual.translator.language;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class LanguageTest {

    @Test
    void targetsAreTheOtherTwoLanguagesInDeclarationOrder() {
        assertThat(Language.targetsFor(Language.ENGLISH)).containsExactly(Language.FRENCH, Language.POLISH);
        assertThat(Language.targetsFor(Language.FRENCH)).containsExactly(Language.ENGLISH, Language.POLISH);
        assertThat(Language.targetsFor(Language.POLISH)).containsExactly(Language.ENGLISH, Language.FRENCH);
    }

    @Test
    void parsesNamesDisplayNamesAndCodes() {
        assertThat(Language.from("POLISH")).isEqualTo(Language.POLISH);
        assertThat(Language.from(" French ")).isEqualTo(Language.FRENCH);
        assertThat(Language.from("en")).isEqualTo(Language.ENGLISH);
    }

    @Test
    void rejectsUnknownLanguage() {
        assertThatThrownBy(() -> Language.from("german"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported language");
        assertThatThrownBy(() -> Language.from(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Language must be provided");
    }

    @Test
    void textsReplaceOneSlotAtATime() {
        LanguageTexts texts = LanguageTexts.empty()
                .with(Language.FRENCH, "Bonjour.")
                .with(Language.POLISH, "Witaj.");

        assertThat(texts.get(Language.ENGLISH)).isEmpty();
        assertThat(texts.get(Language.FRENCH)).isEqualTo("Bonjour.");
        assertThat(texts.get(Language.POLISH)).isEqualTo("Witaj.");
        assertThat(texts.isEmpty()).isFalse();
        assertThat(new LanguageTexts(null, null, null).isEmpty()).isTrue();
    }
}
