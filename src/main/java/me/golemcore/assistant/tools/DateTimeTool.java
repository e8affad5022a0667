package me.golemcore.assistant.tools;

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

import me.golemcore.assistant.domain.component.ToolComponent;
import me.golemcore.assistant.domain.model.DangerLevel;
import me.golemcore.assistant.domain.model.ToolCategory;
import me.golemcore.assistant.domain.model.ToolMetadata;
import me.golemcore.assistant.domain.model.ToolParameter;
import me.golemcore.assistant.domain.model.ToolResult;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Component
@Lazy
public class DateTimeTool implements ToolComponent {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private static final ToolMetadata METADATA = ToolMetadata.builder()
            .name("datetime")
            .description("Get the current date and time, optionally in a given timezone")
            .category(ToolCategory.UTILITY)
            .parameter(ToolParameter.builder()
                    .name("timezone")
                    .description("Timezone such as 'Europe/London' or 'UTC' (default: server timezone)")
                    .required(false)
                    .build())
            .dangerLevel(DangerLevel.SAFE)
            .requiresConfirmation(false)
            .example("[TOOL: datetime(\"UTC\")]")
            .build();

    private final Clock clock;

    public DateTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolMetadata getMetadata() {
        return METADATA;
    }

    @Override
    public CompletableFuture<ToolResult> execute(String sessionId, Map<String, Object> parameters) {
        Object timezone = parameters.get("timezone");
        ZoneId zoneId;
        if (timezone != null && !timezone.toString().isBlank()) {
            try {
                zoneId = ZoneId.of(timezone.toString().trim());
            } catch (DateTimeException e) {
                return CompletableFuture.completedFuture(ToolResult.failure("Invalid timezone: " + timezone));
            }
        } else {
            zoneId = clock.getZone();
        }

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        String formatted = now.format(FORMATTER);
        Map<String, Object> data = Map.of(
                "datetime", formatted,
                "timezone", zoneId.getId(),
                "timestamp", now.toInstant().toEpochMilli(),
                "day_of_week", now.getDayOfWeek().name());
        return CompletableFuture.completedFuture(ToolResult.success(formatted, data));
    }
}
