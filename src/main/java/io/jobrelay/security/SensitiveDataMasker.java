package io.jobrelay.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.jobrelay.util.Jsons;

import java.util.HashSet;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks credentials in job configs, run results, stored errors and audit details before they
 * reach stdout or the audit log.
 *
 * <p>Three things are masked: values under well-known secret key names, values under the keys a
 * job config lists itself in {@value #SENSITIVE_KEYS_FIELD}, and secrets embedded in strings
 * (URL passwords, {@code key=value} pairs, bearer tokens). Stored rows are never modified.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";
    public static final String SENSITIVE_KEYS_FIELD = "sensitiveKeys";

    private static final Set<String> SECRET_KEY_FRAGMENTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential",
            "private_key", "dsn"
    );
    private static final Pattern URL_PASSWORD = Pattern.compile("(\\b[a-zA-Z][a-zA-Z0-9+.-]*://[^:/@\\s]+:)([^@/\\s]+)(@)");
    private static final Pattern KEY_VALUE = Pattern.compile("(\\b[A-Za-z_][A-Za-z0-9_.-]*)(\\s*[=:]\\s*)([^\\s,;&\"']+)");
    private static final Pattern BEARER = Pattern.compile("(?i)(bearer\\s+)[A-Za-z0-9._~+/=-]+");
    private static final Pattern BARE_TOKEN = Pattern.compile("^[A-Za-z0-9+/=_\\-]{32,}$");

    private SensitiveDataMasker() {
    }

    /**
     * Masks a job config, honouring its own {@value #SENSITIVE_KEYS_FIELD} list.
     */
    public static JsonNode maskedConfig(JsonNode config) {
        return masked(config, declaredSensitiveKeys(config));
    }

    public static JsonNode masked(JsonNode input) {
        return masked(input, Set.of());
    }

    public static JsonNode masked(JsonNode input, Set<String> extraKeys) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = input.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String key = field.getKey();
                boolean secret = isSensitiveKey(key) || extraKeys.contains(key.toLowerCase(Locale.ROOT));
                if (secret && !field.getValue().isNull()) {
                    out.put(key, MASK);
                } else {
                    out.set(key, masked(field.getValue(), extraKeys));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            input.forEach(value -> out.add(masked(value, extraKeys)));
            return out;
        }
        if (input.isTextual()) {
            String text = input.asText("");
            return BARE_TOKEN.matcher(text.trim()).matches() && mixesLettersAndDigits(text)
                    ? TextNode.valueOf(MASK)
                    : TextNode.valueOf(maskText(text));
        }
        return input;
    }

    /**
     * Masks secrets embedded in free text such as a handler error message.
     */
    public static String maskText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String out = URL_PASSWORD.matcher(text).replaceAll("$1" + Matcher.quoteReplacement(MASK) + "$3");
        out = BEARER.matcher(out).replaceAll("$1" + Matcher.quoteReplacement(MASK));
        Matcher kv = KEY_VALUE.matcher(out);
        StringBuilder sb = new StringBuilder();
        while (kv.find()) {
            String replacement = isSensitiveKey(kv.group(1)) && !MASK.equals(kv.group(3))
                    ? kv.group(1) + kv.group(2) + MASK
                    : kv.group();
            kv.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        kv.appendTail(sb);
        return sb.toString();
    }

    public static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        return SECRET_KEY_FRAGMENTS.stream().anyMatch(key::contains);
    }

    static Set<String> declaredSensitiveKeys(JsonNode config) {
        JsonNode declared = config == null ? null : config.get(SENSITIVE_KEYS_FIELD);
        if (declared == null || !declared.isArray()) {
            return Set.of();
        }
        Set<String> keys = new HashSet<>();
        for (JsonNode key : declared) {
            if (key.isTextual() && !key.asText().isBlank()) {
                keys.add(key.asText().trim().toLowerCase(Locale.ROOT));
            }
        }
        return keys;
    }

    private static boolean mixesLettersAndDigits(String value) {
        return value.chars().anyMatch(Character::isDigit) && value.chars().anyMatch(Character::isLetter);
    }
}
