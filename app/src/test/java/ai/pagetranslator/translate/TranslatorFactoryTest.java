package ai.pagetranslator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class TranslatorFactoryTest {

    @Test
    void selectsTranslatorPerMode() {
        Translator production = (text, source, target) -> "prod:" + text;
        TranslatorFactory factory = new TranslatorFactory(() -> production, new PassThroughTranslator(), new MockTranslator());

        assertThat(factory.select(TranslationMode.PRODUCTION)).isSameAs(production);
        assertThat(factory.select(TranslationMode.DRY_RUN).translate("Hello", "en", "de")).isEqualTo("Hello");
        assertThat(factory.select(TranslationMode.MOCK).translate("Hello\n\nWorld", "en", "de"))
                .isEqualTo("[MOCK] Hello\n\n[MOCK] World");
    }

    @Test
    void createsProductionTranslatorOnlyWhenSelected() {
        AtomicInteger created = new AtomicInteger();
        TranslatorFactory factory = new TranslatorFactory(() -> {
            created.incrementAndGet();
            return new PassThroughTranslator();
        }, new PassThroughTranslator(), new MockTranslator());

        factory.select(TranslationMode.MOCK);
        factory.select(TranslationMode.DRY_RUN);

        assertThat(created).hasValue(0);
    }

    @Test
    void parsesModeNames() {
        assertThat(TranslationMode.from("dry-run")).isEqualTo(TranslationMode.DRY_RUN);
        assertThat(TranslationMode.from(" Mock ")).isEqualTo(TranslationMode.MOCK);
        assertThat(TranslationMode.from("")).isEqualTo(TranslationMode.PRODUCTION);
        assertThat(TranslationMode.PRODUCTION.isOffline()).isFalse();
        assertThatThrownBy(() -> TranslationMode.from("turbo")).isInstanceOf(IllegalArgumentException.class);
    }
}
