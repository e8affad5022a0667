package me.golemcore.assistant.domain.service;

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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.component.ToolComponent;
import me.golemcore.assistant.domain.model.ToolCategory;
import me.golemcore.assistant.domain.model.ToolMetadata;
import me.golemcore.assistant.domain.model.ToolStats;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Supplier;

/**
 * Catalogue of available tools keyed by name, listed in name order.
 *
 * <p>
 * Tools are discovered at startup from every {@link ToolComponent} bean. Each
 * bean is loaded on its own: a tool that fails to load is logged and skipped,
 * the rest are still registered. After startup the catalogue is only read.
 */
@Component
@Slf4j
public class ToolRegistry {

    private static final String USAGE_FOOTER = """

            To use a tool, respond with:
            [TOOL: tool_name(parameter1, parameter2)]

            For example:
            [TOOL: web_search("Python tutorials")]
            [TOOL: read_file("notes.txt")]
            """;

    private final ListableBeanFactory beanFactory;
    private final NavigableMap<String, ToolComponent> tools = new ConcurrentSkipListMap<>();

    public ToolRegistry(ListableBeanFactory beanFactory) {
        this.beanFactory = beanFactory;
    }

    @PostConstruct
    public void init() {
        if (beanFactory == null) {
            return;
        }
        log.info("[Tools] Discovering tools...");
        Map<String, Supplier<ToolComponent>> loaders = new LinkedHashMap<>();
        for (String beanName : beanFactory.getBeanNamesForType(ToolComponent.class)) {
            loaders.put(beanName, () -> beanFactory.getBean(beanName, ToolComponent.class));
        }
        int loaded = discover(loaders);
        log.info("[Tools] Tool registry initialized with {} tools", loaded);
    }

    /**
     * Loads and registers every tool supplied. Failures are isolated per tool.
     *
     * @return number of tools registered
     */
    public int discover(Map<String, Supplier<ToolComponent>> loaders) {
        int loaded = 0;
        for (Map.Entry<String, Supplier<ToolComponent>> entry : loaders.entrySet()) {
            try {
                register(entry.getValue().get());
                loaded++;
            } catch (RuntimeException e) {
                log.error("[Tools] Error loading tool from {}: {}", entry.getKey(), e.getMessage(), e);
            }
        }
        return loaded;
    }

    /**
     * Registers a tool by its declared name. Re-registering a name overwrites the
     * previous entry.
     */
    public void register(ToolComponent tool) {
        ToolMetadata metadata = tool.getMetadata();
        if (metadata == null || metadata.getName() == null || metadata.getName().isBlank()) {
            throw new IllegalArgumentException("Tool metadata must declare a name: " + tool.getClass().getName());
        }
        if (metadata.getCategory() == null) {
            throw new IllegalArgumentException("Tool metadata must declare a category: " + metadata.getName());
        }
        if (metadata.getDangerLevel() == null) {
            throw new IllegalArgumentException("Tool metadata must declare a danger level: " + metadata.getName());
        }
        String name = metadata.getName();
        if (ToolConfirmationPolicy.ALWAYS_CONFIRM.contains(name) && !metadata.isRequiresConfirmation()) {
            log.warn("[Tools] Tool {} does not declare confirmation but is always confirmed", name);
        }
        ToolComponent previous = tools.put(name, tool);
        if (previous != null) {
            log.warn("[Tools] Tool {} already registered, overwriting", name);
        }
        log.info("[Tools] Registered tool: {}", name);
    }

    public boolean unregister(String name) {
        boolean removed = name != null && tools.remove(name) != null;
        if (removed) {
            log.info("[Tools] Unregistered tool: {}", name);
        }
        return removed;
    }

    public Optional<ToolComponent> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(name));
    }

    public Optional<ToolMetadata> getMetadata(String name) {
        return get(name).map(ToolComponent::getMetadata);
    }

    public List<ToolMetadata> list() {
        return tools.values().stream()
                .map(ToolComponent::getMetadata)
                .toList();
    }

    public List<ToolMetadata> byCategory(ToolCategory category) {
        return tools.values().stream()
                .map(ToolComponent::getMetadata)
                .filter(metadata -> metadata.getCategory() == category)
                .toList();
    }

    public int size() {
        return tools.size();
    }

    /**
     * Describes the catalogue for the model, grouped by category.
     */
    public String getToolsDescription() {
        StringBuilder description = new StringBuilder("Available tools:\n\n");
        for (ToolCategory category : ToolCategory.values()) {
            List<ToolMetadata> categoryTools = byCategory(category);
            if (categoryTools.isEmpty()) {
                continue;
            }
            description.append(category.getId().toUpperCase(Locale.ROOT)).append(" TOOLS:\n");
            for (ToolMetadata metadata : categoryTools) {
                description.append("- ").append(metadata.signature())
                        .append(": ").append(metadata.getDescription()).append('\n');
                if (!metadata.getExamples().isEmpty()) {
                    description.append("  Example: ").append(metadata.getExamples().get(0)).append('\n');
                }
            }
            description.append('\n');
        }
        description.append(USAGE_FOOTER);
        return description.toString();
    }

    /**
     * Usage help for a single tool.
     */
    public String getUsageHelp(ToolMetadata metadata) {
        StringBuilder help = new StringBuilder();
        help.append(metadata.signature()).append("\n").append(metadata.getDescription()).append('\n');
        metadata.getParameters().forEach(p -> help.append("  ").append(p.getName())
                .append(" (").append(p.getType()).append(p.isRequired() ? ", required" : ", optional")
                .append("): ").append(p.getDescription() != null ? p.getDescription() : "").append('\n'));
        if (metadata.isRequiresConfirmation()) {
            help.append("Requires user confirmation.\n");
        }
        metadata.getExamples().forEach(example -> help.append("Example: ").append(example).append('\n'));
        return help.toString();
    }

    public ToolStats getStats() {
        Map<String, Integer> byCategory = new TreeMap<>();
        Map<String, Integer> byDanger = new TreeMap<>();
        int enabled = 0;
        for (ToolComponent tool : tools.values()) {
            ToolMetadata metadata = tool.getMetadata();
            byCategory.merge(metadata.getCategory().getId(), 1, Integer::sum);
            byDanger.merge(metadata.getDangerLevel().getId(), 1, Integer::sum);
            if (tool.isEnabled()) {
                enabled++;
            }
        }
        return ToolStats.builder()
                .totalTools(tools.size())
                .toolsByCategory(byCategory)
                .toolsByDangerLevel(byDanger)
                .enabledTools(enabled)
                .build();
    }
}
