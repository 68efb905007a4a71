package me.golemcore.aigate.routing;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static degraded answers loaded from {@code classpath:fallback/templates.json}.
 *
 * <p>
 * Templates are grouped by task family (assessment help, recommendations).
 * Within a group the variant is chosen from one context entry (framework id,
 * risk level), falling back to the group default.
 */
@Component
@Slf4j
public class FallbackTemplateCatalog {

    static final String TEMPLATES_FILE = "fallback/templates.json";

    private final ObjectMapper objectMapper;
    private TemplatesConfig config = new TemplatesConfig();

    public FallbackTemplateCatalog(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        ClassPathResource resource = new ClassPathResource(TEMPLATES_FILE);
        if (!resource.exists()) {
            log.warn("[Fallback] No {} found, only basic messages will be served", TEMPLATES_FILE);
            return;
        }
        try (InputStream is = resource.getInputStream()) {
            config = objectMapper.readValue(is, TemplatesConfig.class);
            log.info("[Fallback] Loaded {} template groups", config.getGroups().size());
        } catch (IOException e) {
            throw new IllegalStateException("Invalid fallback templates in " + TEMPLATES_FILE, e);
        }
    }

    /**
     * Template for a task type, or empty if no group serves it.
     */
    public Optional<Match> find(String taskType, Map<String, String> context) {
        if (taskType == null) {
            return Optional.empty();
        }
        String normalizedTask = taskType.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Group> entry : config.getGroups().entrySet()) {
            Group group = entry.getValue();
            if (!group.getTaskTypes().contains(normalizedTask)) {
                continue;
            }
            String requested = context != null && group.getContextKey() != null
                    ? context.get(group.getContextKey())
                    : null;
            String variant = normalizeVariant(requested);
            Template template = variant != null ? group.getVariants().get(variant) : null;
            if (template == null) {
                variant = group.getDefaultVariant();
                template = variant != null ? group.getVariants().get(variant) : null;
            }
            if (template != null) {
                return Optional.of(new Match(entry.getKey() + "/" + variant, template));
            }
        }
        return Optional.empty();
    }

    public Optional<Template> getServiceUnavailable() {
        return Optional.ofNullable(config.getServiceUnavailable());
    }

    public List<String> getGroupNames() {
        return List.copyOf(config.getGroups().keySet());
    }

    // "ISO 27001" -> "iso27001", "high_risk" -> "high"
    static String normalizeVariant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        if (normalized.endsWith("risk") && normalized.length() > "risk".length()) {
            normalized = normalized.substring(0, normalized.length() - "risk".length());
        }
        return normalized;
    }

    public record Match(String key, Template template) {
    }

    @Data
    public static class TemplatesConfig {
        private Map<String, Group> groups = new LinkedHashMap<>();
        private Template serviceUnavailable;
    }

    @Data
    public static class Group {
        private List<String> taskTypes = new ArrayList<>();
        private String contextKey;
        private String defaultVariant;
        private Map<String, Template> variants = new LinkedHashMap<>();
    }

    @Data
    public static class Template {
        private String text;
        private double confidence = 0.5;
    }
}
