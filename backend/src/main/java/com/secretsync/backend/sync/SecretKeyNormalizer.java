package com.secretsync.backend.sync;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps arbitrary secret keys onto the Kubernetes secret key syntax {@code [-._a-zA-Z0-9]+}.
 *
 * <p>Letters are first folded to their closest ASCII form: a fixed table covers letters that have
 * no Unicode decomposition (dotless i, sharp s, ligatures, stroked letters), then NFKD
 * decomposition with combining marks stripped handles accents and compatibility forms
 * ({@code İ -> I}, {@code ş -> s}, {@code ﬁ -> fi}). Every code point still outside the allowed
 * set becomes a single {@code _}. The result is deterministic and idempotent.
 */
@Slf4j
@Component
public class SecretKeyNormalizer {

    private static final Map<Character, String> TRANSLITERATIONS = Map.ofEntries(
            Map.entry('ı', "i"),
            Map.entry('ß', "ss"),
            Map.entry('æ', "ae"),
            Map.entry('Æ', "AE"),
            Map.entry('ø', "o"),
            Map.entry('Ø', "O"),
            Map.entry('œ', "oe"),
            Map.entry('Œ', "OE"),
            Map.entry('đ', "d"),
            Map.entry('Đ', "D"),
            Map.entry('ð', "d"),
            Map.entry('Ð', "D"),
            Map.entry('þ', "th"),
            Map.entry('Þ', "TH"),
            Map.entry('ł', "l"),
            Map.entry('Ł', "L")
    );

    private static final char REPLACEMENT = '_';

    public String normalize(String key) {
        if (key == null || key.isEmpty()) {
            return "";
        }
        String folded = StringUtils.stripAccents(Normalizer.normalize(transliterate(key), Normalizer.Form.NFKD));
        StringBuilder normalized = new StringBuilder(folded.length());
        folded.codePoints().forEach(cp -> normalized.append(isAllowed(cp) ? (char) cp : REPLACEMENT));
        String result = normalized.toString();
        if (!result.equals(key)) {
            log.warn("Secret key normalized: '{}' -> '{}'", key, result);
        }
        return result;
    }

    /**
     * Normalizes every key of the payload. A later key whose normalized form is already taken
     * replaces the earlier value; keys that normalize to nothing are dropped.
     */
    public NormalizedPayload normalizeKeys(SecretPayload payload) {
        Map<String, String> entries = new LinkedHashMap<>();
        Map<String, String> origins = new LinkedHashMap<>();
        List<NormalizedPayload.KeyCollision> collisions = new ArrayList<>();
        List<String> dropped = new ArrayList<>();

        for (Map.Entry<String, String> entry : payload.entries().entrySet()) {
            String originalKey = entry.getKey();
            String normalizedKey = normalize(originalKey);
            if (normalizedKey.isEmpty()) {
                log.warn("Secret key '{}' normalizes to an empty key and is skipped", originalKey);
                dropped.add(originalKey);
                continue;
            }
            String previous = origins.put(normalizedKey, originalKey);
            if (previous != null) {
                log.warn("Secret key collision on '{}': '{}' replaces '{}'", normalizedKey, originalKey, previous);
                collisions.add(new NormalizedPayload.KeyCollision(normalizedKey, previous, originalKey));
                // keep the winner at the position of its own key
                entries.remove(normalizedKey);
            }
            entries.put(normalizedKey, entry.getValue());
        }
        return new NormalizedPayload(entries, collisions, dropped);
    }

    private String transliterate(String key) {
        StringBuilder out = null;
        for (int i = 0; i < key.length(); i++) {
            String replacement = TRANSLITERATIONS.get(key.charAt(i));
            if (replacement != null && out == null) {
                out = new StringBuilder(key.length() + 4).append(key, 0, i);
            }
            if (out != null) {
                out.append(replacement != null ? replacement : String.valueOf(key.charAt(i)));
            }
        }
        return out == null ? key : out.toString();
    }

    private static boolean isAllowed(int cp) {
        return (cp >= 'a' && cp <= 'z')
                || (cp >= 'A' && cp <= 'Z')
                || (cp >= '0' && cp <= '9')
                || cp == '-' || cp == '.' || cp == '_';
    }
}
