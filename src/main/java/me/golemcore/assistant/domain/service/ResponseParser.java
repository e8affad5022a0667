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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.model.ToolCall;
import me.golemcore.assistant.domain.model.ToolMetadata;
import me.golemcore.assistant.domain.model.ToolParameter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts tool calls written as {@code [TOOL: name(arguments)]} from model
 * output.
 *
 * <p>
 * Matches are returned left to right. Positional arguments are mapped to named
 * parameters by the tool's declared parameter order; {@code key=value}
 * arguments map by name. Tools the registry does not know still produce a call
 * (the executor rejects them), using the well-known single-argument conventions
 * when the name is familiar. Parsing never throws: when the arguments cannot be
 * mapped unambiguously the parameters are left empty.
 */
@Component
@Slf4j
public class ResponseParser {

    private static final Pattern TOOL_CALL_PATTERN = Pattern.compile("\\[TOOL:\\s*(\\w+)\\((.*?)\\)\\]",
            Pattern.DOTALL);
    private static final Pattern NAMED_ARGUMENT = Pattern.compile("^(\\w+)\\s*=\\s*(.*)$", Pattern.DOTALL);

    private static final Map<String, List<String>> WELL_KNOWN_PARAMETERS = Map.of(
            "web_search", List.of("query"),
            "read_file", List.of("path"),
            "write_file", List.of("path", "content"),
            "delete_file", List.of("path"),
            "list_directory", List.of("path"),
            "system_command", List.of("command"));

    private final ToolRegistry toolRegistry;
    private final ToolConfirmationPolicy confirmationPolicy;

    public ResponseParser(ToolRegistry toolRegistry, ToolConfirmationPolicy confirmationPolicy) {
        this.toolRegistry = toolRegistry;
        this.confirmationPolicy = confirmationPolicy;
    }

    public List<ToolCall> parse(String response) {
        if (response == null || response.isEmpty()) {
            return List.of();
        }
        List<ToolCall> calls = new ArrayList<>();
        Matcher matcher = TOOL_CALL_PATTERN.matcher(response);
        while (matcher.find()) {
            String toolName = matcher.group(1);
            Map<String, Object> parameters = mapArguments(toolName, matcher.group(2));
            calls.add(ToolCall.builder()
                    .id(toolName + "_" + calls.size())
                    .toolName(toolName)
                    .parameters(parameters)
                    .requiresConfirmation(confirmationPolicy.requiresConfirmation(toolName))
                    .build());
        }
        if (!calls.isEmpty()) {
            log.debug("[Parser] Extracted {} tool call(s)", calls.size());
        }
        return calls;
    }

    private Map<String, Object> mapArguments(String toolName, String rawArguments) {
        String raw = rawArguments != null ? rawArguments.trim() : "";
        if (raw.isEmpty()) {
            return new LinkedHashMap<>();
        }

        Optional<ToolMetadata> metadata = toolRegistry.getMetadata(toolName);
        List<ToolParameter> declared = metadata.map(ToolMetadata::getParameters).orElse(null);
        List<String> names = declared != null
                ? declared.stream().map(ToolParameter::getName).toList()
                : WELL_KNOWN_PARAMETERS.get(toolName);
        if (names == null || names.isEmpty()) {
            return new LinkedHashMap<>();
        }

        List<String> arguments = splitArguments(raw);
        Map<String, Object> parameters = new LinkedHashMap<>();

        if (isNamedForm(arguments)) {
            for (String argument : arguments) {
                Matcher named = NAMED_ARGUMENT.matcher(argument);
                if (named.matches() && names.contains(named.group(1))) {
                    String name = named.group(1);
                    parameters.put(name, convert(stripQuotes(named.group(2).trim()), typeOf(declared, name)));
                }
            }
            return parameters;
        }

        if (names.size() == 1) {
            parameters.put(names.get(0), convert(stripQuotes(raw), typeOf(declared, names.get(0))));
            return parameters;
        }
        if (arguments.size() <= names.size() && fitsDeclaredTypes(declared, names, arguments)) {
            for (int i = 0; i < arguments.size(); i++) {
                String name = names.get(i);
                parameters.put(name, convert(stripQuotes(arguments.get(i)), typeOf(declared, name)));
            }
            return parameters;
        }
        // "best pizza in Rome, Italy" is one query, not a query and a count
        if (isSoleTextParameter(declared, names)) {
            log.debug("[Parser] Arguments of {} do not fit its parameters, using them as one {} value",
                    toolName, names.get(0));
            parameters.put(names.get(0), stripQuotes(raw));
            return parameters;
        }
        log.debug("[Parser] {} arguments do not fit the {} parameters of {}, leaving parameters empty",
                arguments.size(), names.size(), toolName);
        return new LinkedHashMap<>();
    }

    private static boolean fitsDeclaredTypes(List<ToolParameter> declared, List<String> names,
            List<String> arguments) {
        for (int i = 0; i < arguments.size(); i++) {
            String type = typeOf(declared, names.get(i));
            String value = stripQuotes(arguments.get(i));
            boolean typed = ToolParameter.TYPE_INTEGER.equals(type) || ToolParameter.TYPE_BOOLEAN.equals(type);
            if (typed && convert(value, type) instanceof String) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when the first parameter is the only one that takes free text.
     */
    private static boolean isSoleTextParameter(List<ToolParameter> declared, List<String> names) {
        if (!ToolParameter.TYPE_STRING.equals(typeOf(declared, names.get(0)))) {
            return false;
        }
        return names.stream().skip(1).noneMatch(name -> ToolParameter.TYPE_STRING.equals(typeOf(declared, name)));
    }

    private static boolean isNamedForm(List<String> arguments) {
        return arguments.stream().allMatch(a -> !startsWithQuote(a) && NAMED_ARGUMENT.matcher(a).matches());
    }

    /**
     * Splits on commas that are outside quotes and brackets.
     */
    static List<String> splitArguments(String raw) {
        List<String> arguments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        int depth = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == '\\' && i + 1 < raw.length()) {
                    current.append(raw.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
            case '"', '\'' -> {
                quote = c;
                current.append(c);
            }
            case '(', '[', '{' -> {
                depth++;
                current.append(c);
            }
            case ')', ']', '}' -> {
                depth = Math.max(0, depth - 1);
                current.append(c);
            }
            case ',' -> {
                if (depth == 0) {
                    arguments.add(current.toString().trim());
                    current.setLength(0);
                } else {
                    current.append(c);
                }
            }
            default -> current.append(c);
            }
        }
        arguments.add(current.toString().trim());
        return arguments;
    }

    /**
     * Removes one layer of surrounding quote characters.
     */
    static String stripQuotes(String value) {
        String result = value;
        if (startsWithQuote(result)) {
            result = result.substring(1);
        }
        if (!result.isEmpty() && isQuote(result.charAt(result.length() - 1))) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static boolean startsWithQuote(String value) {
        return !value.isEmpty() && isQuote(value.charAt(0));
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }

    private static String typeOf(List<ToolParameter> declared, String name) {
        if (declared == null) {
            return ToolParameter.TYPE_STRING;
        }
        return declared.stream()
                .filter(p -> p.getName().equals(name))
                .map(ToolParameter::getType)
                .findFirst()
                .orElse(ToolParameter.TYPE_STRING);
    }

    private static Object convert(String value, String type) {
        if (ToolParameter.TYPE_INTEGER.equals(type)) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return value;
            }
        }
        if (ToolParameter.TYPE_BOOLEAN.equals(type)) {
            String normalized = value.trim();
            if ("true".equalsIgnoreCase(normalized) || "false".equalsIgnoreCase(normalized)) {
                return Boolean.parseBoolean(normalized);
            }
        }
        return value;
    }
}
