package com.secretsync.backend.sync;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.secretsync.backend.exception.PayloadParseException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes the raw secret bytes into a flat string map. Error messages name keys and positions only;
 * Jackson's own messages are not propagated because they quote the offending input. Anything after
 * the top-level value is rejected, so a truncated or concatenated payload never reaches the sink.
 */
@Component
@RequiredArgsConstructor
public class SecretPayloadParser {

    private final ObjectMapper objectMapper;

    public SecretPayload parse(byte[] raw) {
        if (raw == null || raw.length == 0) {
            throw new PayloadParseException("Secret payload is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(raw);
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("Secret payload is not valid JSON" + describe(e.getLocation()));
        } catch (IOException e) {
            throw new PayloadParseException("Secret payload could not be read");
        }
        if (root == null || !root.isObject()) {
            throw new PayloadParseException("Secret payload must be a JSON object, got "
                    + (root == null || root.isMissingNode() ? "nothing" : root.getNodeType()));
        }

        Map<String, String> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!value.isTextual()) {
                throw new PayloadParseException("Value of key '" + field.getKey()
                        + "' must be a JSON string, got " + value.getNodeType());
            }
            entries.put(field.getKey(), value.textValue());
        }
        return new SecretPayload(entries);
    }

    private String describe(JsonLocation location) {
        if (location == null || location.getLineNr() < 0) {
            return "";
        }
        return " (line " + location.getLineNr() + ", column " + location.getColumnNr() + ")";
    }
}
