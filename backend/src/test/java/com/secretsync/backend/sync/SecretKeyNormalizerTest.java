package com.secretsync.backend.sync;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SecretKeyNormalizerTest {

    private final SecretKeyNormalizer normalizer = new SecretKeyNormalizer();

    @Test
    void turkishLettersFoldToAscii() {
        assertThat(normalizer.normalize("STONKİ_TEST")).isEqualTo("STONKI_TEST");
        assertThat(normalizer.normalize("şablon")).isEqualTo("sablon");
        assertThat(normalizer.normalize("ığdır")).isEqualTo("igdir");
        assertThat(normalizer.normalize("ÇAĞRI_ŞİFRE")).isEqualTo("CAGRI_SIFRE");
    }

    @ParameterizedTest
    @CsvSource({
            "café,cafe",
            "Straße,Strasse",
            "Ørsted,Orsted",
            "Łódź,Lodz",
            "ﬁle,file",
            "Ｘ２,X2",
            "smörgåsbord,smorgasbord"
    })
    void pinnedTransliterations(String input, String expected) {
        assertThat(normalizer.normalize(input)).isEqualTo(expected);
    }

    @Test
    void invalidCharactersBecomeUnderscores() {
        assertThat(normalizer.normalize("db password")).isEqualTo("db_password");
        assertThat(normalizer.normalize("a/b:c")).isEqualTo("a_b_c");
        assertThat(normalizer.normalize("key😀")).isEqualTo("key_");
        assertThat(normalizer.normalize("日本")).isEqualTo("__");
    }

    @Test
    void validKeysAreUntouched() {
        assertThat(normalizer.normalize("API_KEY")).isEqualTo("API_KEY");
        assertThat(normalizer.normalize("tls.crt")).isEqualTo("tls.crt");
        assertThat(normalizer.normalize("my-key-01")).isEqualTo("my-key-01");
    }

    @Test
    void emptyInputStaysEmpty() {
        assertThat(normalizer.normalize("")).isEmpty();
        assertThat(normalizer.normalize(null)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "API_KEY", "STONKİ_TEST", "şablon", "日本語キー", "a b\tc\n", "ﬁ½²", "İıŞş", "..--__",
            "\u0301", "Ω≈ç√∫", "emoji🔑key"})
    void normalizationIsIdempotentAndWellFormed(String key) {
        String once = normalizer.normalize(key);
        assertThat(normalizer.normalize(once)).isEqualTo(once);
        assertThat(once).matches("[-._a-zA-Z0-9]*");
    }

    @Test
    void laterKeyWinsOnCollision() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("a b", "1");
        entries.put("a_b", "2");

        NormalizedPayload normalized = normalizer.normalizeKeys(new SecretPayload(entries));

        assertThat(normalized.entries()).containsExactly(Map.entry("a_b", "2"));
        assertThat(normalized.collisions())
                .containsExactly(new NormalizedPayload.KeyCollision("a_b", "a b", "a_b"));
    }

    @Test
    void dottedKeysAreDistinctFromUnderscoredKeys() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("a.b", "1");
        entries.put("a_b", "2");

        NormalizedPayload normalized = normalizer.normalizeKeys(new SecretPayload(entries));

        assertThat(normalized.entries()).containsExactly(Map.entry("a.b", "1"), Map.entry("a_b", "2"));
        assertThat(normalized.collisions()).isEmpty();
    }

    @Test
    void emptyKeysAreDropped() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("", "orphan");
        entries.put("API_KEY", "x");

        NormalizedPayload normalized = normalizer.normalizeKeys(new SecretPayload(entries));

        assertThat(normalized.entries()).containsOnlyKeys("API_KEY");
        assertThat(normalized.droppedKeys()).containsExactly("");
    }
}
