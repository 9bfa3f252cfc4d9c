package io.calcrelay.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Masks credentials in JSON trees before they are written to the audit log
 * or printed. Content keys, UUIDs and absolute paths stay readable.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final TextNode MASK_NODE = TextNode.valueOf(MASK);
    private static final List<String> SENSITIVE_KEY_PARTS = List.of(
            "secret", "token", "password", "passwd", "authorization", "credential", "apikey", "api_key"
    );
    private static final int MIN_OPAQUE_LENGTH = 24;
    private static final Pattern OPAQUE_VALUE = Pattern.compile("[A-Za-z0-9+/=_\\-:.]+");
    private static final Pattern CONTENT_KEY = Pattern.compile("[0-9a-f]{64}");
    private static final Pattern UUID_VALUE = Pattern.compile("[0-9a-fA-F]{8}(-[0-9a-fA-F]{4}){3}-[0-9a-fA-F]{12}");

    private SensitiveDataMasker() {
    }

    /**
     * Returns a masked deep copy; the input is left untouched.
     */
    public static JsonNode masked(JsonNode input) {
        if (input == null) {
            return null;
        }
        JsonNode copy = input.deepCopy();
        maskInPlace(copy);
        return copy;
    }

    public static String maskSecret(String secret) {
        return secret == null || secret.isEmpty() ? "" : MASK;
    }

    private static void maskInPlace(JsonNode node) {
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                JsonNode value = object.get(name);
                if (isSensitiveKey(name) || isOpaqueText(value)) {
                    object.set(name, MASK_NODE);
                } else {
                    maskInPlace(value);
                }
            }
        } else if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                if (isOpaqueText(array.get(i))) {
                    array.set(i, MASK_NODE);
                } else {
                    maskInPlace(array.get(i));
                }
            }
        }
    }

    static boolean isSensitiveKey(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        return SENSITIVE_KEY_PARTS.stream().anyMatch(lower::contains);
    }

    private static boolean isOpaqueText(JsonNode value) {
        return value != null && value.isTextual() && likelySecretValue(value.textValue());
    }

    static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        if (v.length() < MIN_OPAQUE_LENGTH || v.startsWith("/")) {
            return false;
        }
        if (CONTENT_KEY.matcher(v).matches() || UUID_VALUE.matcher(v).matches()) {
            return false;
        }
        return OPAQUE_VALUE.matcher(v).matches();
    }
}
