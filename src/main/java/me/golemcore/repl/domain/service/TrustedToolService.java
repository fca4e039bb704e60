package me.golemcore.repl.domain.service;

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
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.repl.domain.model.TrustSettings;
import me.golemcore.repl.port.outbound.StoragePort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * Persists tool trust across sessions in {@code preferences/trusted-tools.json}.
 *
 * <p>
 * Effective trust for a project is global trust plus project trust, minus the
 * project's deny list. All mutations are read-modify-write cycles executed one
 * at a time on a dedicated thread, so concurrent "trust" clicks never lose each
 * other's entries. A mutation never touches entries other than the one it
 * names. If the existing file cannot be parsed, the mutation fails instead of
 * replacing the file.
 *
 * <p>
 * Every mutation returns a future. Callers that fire and forget must still log
 * its failure.
 */
@Service
@Slf4j
public class TrustedToolService {

    static final String PREFERENCES_DIR = "preferences";
    static final String TRUST_FILE = "trusted-tools.json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Executor writeExecutor;
    private final ExecutorService ownedExecutor;
    private final Clock clock;

    @Autowired
    public TrustedToolService(StoragePort storagePort, Clock clock) {
        this.storagePort = storagePort;
        this.ownedExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "trusted-tools-writer");
            thread.setDaemon(true);
            return thread;
        });
        this.writeExecutor = ownedExecutor;
        this.clock = clock;
    }

    // Visible for testing
    TrustedToolService(StoragePort storagePort, Executor writeExecutor, Clock clock) {
        this.storagePort = storagePort;
        this.writeExecutor = writeExecutor;
        this.ownedExecutor = null;
        this.clock = clock;
    }

    @PreDestroy
    public void shutdown() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    /**
     * Tools trusted for the given project: global and project trust, minus the
     * project's deny list. Unreadable storage yields an empty set.
     */
    public Set<String> loadTrustedTools(String projectPath) {
        TrustSettings settings;
        try {
            settings = readSettings();
        } catch (RuntimeException e) { // NOSONAR - a session must start without persisted trust
            log.warn("[Trust] Failed to load trusted tools, starting with none: {}", e.getMessage());
            return new LinkedHashSet<>();
        }

        Set<String> trusted = new LinkedHashSet<>(settings.getGlobalTrusted());
        if (projectPath != null) {
            trusted.addAll(settings.getProjectTrusted().getOrDefault(projectPath, List.of()));
            trusted.removeAll(settings.getProjectDenied().getOrDefault(projectPath, List.of()));
        }
        return trusted;
    }

    public Set<String> getDeniedTools(String projectPath) {
        try {
            return new LinkedHashSet<>(readSettings().getProjectDenied().getOrDefault(projectPath, List.of()));
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Trust] Failed to load denied tools: {}", e.getMessage());
            return new LinkedHashSet<>();
        }
    }

    /**
     * Trusts a tool globally, or for one project. With {@code global=false} and no
     * project path nothing is stored.
     */
    public CompletableFuture<Void> saveTrustedTool(String toolName, String projectPath, boolean global) {
        return mutate("trust " + toolName, settings -> {
            if (global) {
                addUnique(settings.getGlobalTrusted(), toolName);
            } else if (projectPath != null) {
                addUnique(settings.getProjectTrusted().computeIfAbsent(projectPath, k -> new ArrayList<>()),
                        toolName);
            }
        });
    }

    public CompletableFuture<Void> removeTrustedTool(String toolName, String projectPath, boolean global) {
        return mutate("untrust " + toolName, settings -> {
            if (global) {
                settings.getGlobalTrusted().remove(toolName);
            } else if (projectPath != null) {
                List<String> projectTrusted = settings.getProjectTrusted().get(projectPath);
                if (projectTrusted != null) {
                    projectTrusted.remove(toolName);
                }
            }
        });
    }

    /**
     * Denies a tool for one project. The deny list overrides global trust, and the
     * tool is removed from the project's trusted list.
     */
    public CompletableFuture<Void> saveDeniedTool(String toolName, String projectPath) {
        return mutate("deny " + toolName, settings -> {
            addUnique(settings.getProjectDenied().computeIfAbsent(projectPath, k -> new ArrayList<>()), toolName);
            List<String> projectTrusted = settings.getProjectTrusted().get(projectPath);
            if (projectTrusted != null) {
                projectTrusted.remove(toolName);
            }
        });
    }

    public CompletableFuture<Void> removeDeniedTool(String toolName, String projectPath) {
        return mutate("undeny " + toolName, settings -> {
            List<String> denied = settings.getProjectDenied().get(projectPath);
            if (denied != null) {
                denied.remove(toolName);
            }
        });
    }

    private CompletableFuture<Void> mutate(String action, Consumer<TrustSettings> change) {
        return CompletableFuture.runAsync(() -> {
            TrustSettings settings = readSettings();
            change.accept(settings);
            settings.setUpdatedAt(clock.instant().toString());
            storagePort.putTextAtomic(PREFERENCES_DIR, TRUST_FILE, toJson(settings), false).join();
            log.debug("[Trust] Persisted: {}", action);
        }, writeExecutor);
    }

    private TrustSettings readSettings() {
        String json = storagePort.getText(PREFERENCES_DIR, TRUST_FILE).join();
        if (json == null || json.isBlank()) {
            return new TrustSettings();
        }
        try {
            TrustSettings settings = objectMapper.readValue(json, TrustSettings.class);
            normalize(settings);
            return settings;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Refusing to overwrite unreadable " + TRUST_FILE, e);
        }
    }

    private void normalize(TrustSettings settings) {
        TrustSettings defaults = new TrustSettings();
        if (settings.getGlobalTrusted() == null) {
            settings.setGlobalTrusted(defaults.getGlobalTrusted());
        }
        if (settings.getProjectTrusted() == null) {
            settings.setProjectTrusted(defaults.getProjectTrusted());
        }
        if (settings.getProjectDenied() == null) {
            settings.setProjectDenied(defaults.getProjectDenied());
        }
    }

    private String toJson(TrustSettings settings) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(settings);
        } catch (JsonProcessingException e) {
            throw new CompletionException(e);
        }
    }

    private static void addUnique(List<String> list, String value) {
        if (!list.contains(value)) {
            list.add(value);
        }
    }
}
