package me.golemcore.assistant.security;

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
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Detects path traversal and command injection patterns in tool arguments
 * before they reach the sandbox. Stateless and thread-safe.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class InjectionGuard {

    private static final List<Pattern> COMMAND_INJECTION_PATTERNS = List.of(
            Pattern.compile(";"),
            Pattern.compile("\\|"),
            Pattern.compile("&&|\\|\\|"),
            Pattern.compile("`[^`]*`"),
            Pattern.compile("\\$\\([^)]*\\)"),
            Pattern.compile("\\$\\{[^}]*\\}"),
            Pattern.compile("[<>]"),
            Pattern.compile("[\\r\\n]"));

    private static final List<Pattern> PATH_TRAVERSAL_PATTERNS = List.of(
            Pattern.compile("\\.\\./"),
            Pattern.compile("\\.\\.\\\\"),
            Pattern.compile("%2e%2e%2f", Pattern.CASE_INSENSITIVE),
            Pattern.compile("%2e%2e/", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.\\.%2f", Pattern.CASE_INSENSITIVE),
            Pattern.compile("%2e%2e%5c", Pattern.CASE_INSENSITIVE),
            Pattern.compile("/etc/passwd", Pattern.CASE_INSENSITIVE),
            Pattern.compile("C:\\\\Windows", Pattern.CASE_INSENSITIVE));

    /**
     * Detect shell metacharacters that chain, substitute or redirect commands.
     */
    public boolean detectCommandInjection(String input) {
        if (input == null || input.isBlank()) {
            return false;
        }

        for (Pattern pattern : COMMAND_INJECTION_PATTERNS) {
            if (pattern.matcher(input).find()) {
                log.warn("[Security] Command injection detected: pattern={}", pattern.pattern());
                return true;
            }
        }
        return false;
    }

    /**
     * Detect path traversal attempts.
     */
    public boolean detectPathTraversal(String input) {
        if (input == null || input.isBlank()) {
            return false;
        }

        for (Pattern pattern : PATH_TRAVERSAL_PATTERNS) {
            if (pattern.matcher(input).find()) {
                log.warn("[Security] Path traversal detected: pattern={}", pattern.pattern());
                return true;
            }
        }
        return false;
    }
}
