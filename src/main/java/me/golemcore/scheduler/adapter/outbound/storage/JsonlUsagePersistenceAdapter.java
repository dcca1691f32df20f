package me.golemcore.scheduler.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.UsageDelta;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.UsagePersistencePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Append-only usage log on the local filesystem.
 *
 * <p>
 * Each delta is one JSON line in
 * {@code <base-path>/usage/<tenant>/<yyyy-MM-dd>.jsonl}, the date taken from
 * the delta's timestamp in the application clock's zone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonlUsagePersistenceAdapter implements UsagePersistencePort {

    private static final String LOG_PREFIX = "[Usage]";
    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String NEWLINE = "\n";

    private final SchedulerProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Object appendLock = new Object();
    private Path usageDir;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getBasePath();
        Path basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        this.usageDir = basePath.resolve(properties.getStorage().getUsageDirectory()).normalize();
        try {
            Files.createDirectories(usageDir);
            log.info("{} Usage log at: {}", LOG_PREFIX, usageDir);
        } catch (IOException e) {
            log.error("{} Failed to create usage directory {}", LOG_PREFIX, usageDir, e);
        }
    }

    @Override
    public CompletableFuture<Void> persistUsageDelta(UsageDelta delta) {
        return CompletableFuture.runAsync(() -> {
            try {
                String line = objectMapper.writeValueAsString(delta) + NEWLINE;
                Path file = fileFor(delta);
                synchronized (appendLock) {
                    Files.createDirectories(file.getParent());
                    Files.writeString(file, line, StandardCharsets.UTF_8,
                            StandardOpenOption.CREATE,
                            StandardOpenOption.APPEND);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append usage for tenant " + delta.getTenantId(), e);
            }
        });
    }

    @Override
    public List<UsageDelta> loadUsageSince(Instant since) {
        List<UsageDelta> result = new ArrayList<>();
        if (usageDir == null || !Files.isDirectory(usageDir)) {
            return result;
        }
        LocalDate firstDay = LocalDate.ofInstant(since, clock.getZone()).minusDays(1);
        try (Stream<Path> tenants = Files.list(usageDir)) {
            for (Path tenantDir : tenants.filter(Files::isDirectory).toList()) {
                try (Stream<Path> files = Files.list(tenantDir)) {
                    for (Path file : files.filter(p -> p.getFileName().toString().endsWith(JSONL_EXTENSION))
                            .toList()) {
                        if (isOnOrAfter(file, firstDay)) {
                            readFile(file, since, result);
                        }
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list usage files in " + usageDir, e);
        }
        log.debug("{} Loaded {} usage records since {}", LOG_PREFIX, result.size(), since);
        return result;
    }

    private void readFile(Path file, Instant since, List<UsageDelta> sink) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("{} Failed to read {}: {}", LOG_PREFIX, file, e.getMessage());
            return;
        }
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                UsageDelta delta = objectMapper.readValue(line, UsageDelta.class);
                if (delta.getTimestamp() != null && !delta.getTimestamp().isBefore(since)) {
                    sink.add(delta);
                }
            } catch (JsonProcessingException e) {
                log.debug("{} Skipping malformed line in {}: {}", LOG_PREFIX, file, e.getMessage());
            }
        }
    }

    private static boolean isOnOrAfter(Path file, LocalDate firstDay) {
        String name = file.getFileName().toString();
        String date = name.substring(0, name.length() - JSONL_EXTENSION.length());
        try {
            return !LocalDate.parse(date).isBefore(firstDay);
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    Path fileFor(UsageDelta delta) {
        Instant timestamp = delta.getTimestamp() != null ? delta.getTimestamp() : clock.instant();
        LocalDate day = LocalDate.ofInstant(timestamp, clock.getZone());
        Path file = usageDir.resolve(safeSegment(delta.getTenantId())).resolve(day + JSONL_EXTENSION).normalize();
        if (!file.startsWith(usageDir)) {
            throw new IllegalArgumentException("Usage path escapes usage directory: " + file);
        }
        return file;
    }

    static String safeSegment(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            return "_unknown";
        }
        String safe = tenantId.replaceAll("[^A-Za-z0-9._-]", "_");
        return safe.startsWith(".") ? "_" + safe : safe;
    }
}
