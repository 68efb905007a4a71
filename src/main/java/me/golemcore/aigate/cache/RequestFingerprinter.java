package me.golemcore.aigate.cache;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.aigate.infrastructure.config.AiGateProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Derives the cache key of a generation request.
 *
 * <p>
 * The fingerprint is a SHA-256 over the normalized prompt, the lower-cased
 * task type and the configured context keys (sorted). Any other context entry,
 * such as a request id or timestamp, is ignored so equivalent requests hit the
 * same entry. Every field is length-prefixed, so no prompt or context value can
 * spell out the boundary of another field.
 */
@Component
public class RequestFingerprinter {

    public static final int PREFIX_LENGTH = 12;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final AiGateProperties properties;

    public RequestFingerprinter(AiGateProperties properties) {
        this.properties = properties;
    }

    public String fingerprint(String prompt, String taskType, Map<String, String> context) {
        StringBuilder material = new StringBuilder();
        appendField(material, normalizePrompt(prompt));
        appendField(material, taskType == null ? "" : taskType.trim().toLowerCase(Locale.ROOT));

        Map<String, String> relevant = new TreeMap<>();
        if (context != null) {
            for (String key : properties.getCache().getContextKeys()) {
                String value = context.get(key);
                if (value != null) {
                    relevant.put(key, value.trim());
                }
            }
        }
        for (Map.Entry<String, String> entry : relevant.entrySet()) {
            appendField(material, entry.getKey());
            appendField(material, entry.getValue());
        }

        return sha256(material.toString());
    }

    private static void appendField(StringBuilder material, String value) {
        material.append(value.length()).append(':').append(value);
    }

    static String normalizePrompt(String prompt) {
        if (prompt == null) {
            return "";
        }
        String normalized = Normalizer.normalize(prompt, Normalizer.Form.NFC);
        return WHITESPACE.matcher(normalized.trim()).replaceAll(" ");
    }

    public static String prefix(String fingerprint) {
        if (fingerprint == null) {
            return null;
        }
        return fingerprint.length() <= PREFIX_LENGTH ? fingerprint : fingerprint.substring(0, PREFIX_LENGTH);
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
