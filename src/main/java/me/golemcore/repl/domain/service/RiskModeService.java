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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.repl.domain.model.ReplPreferences;
import me.golemcore.repl.port.outbound.StoragePort;
import me.golemcore.repl.security.CommandSafetyPolicy;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Owns the "full power" risk mode flag.
 *
 * <p>
 * When enabled, any shell command that the {@link CommandSafetyPolicy} does not
 * block is approved without prompting. The policy itself is never bypassed.
 * The default comes from {@code preferences/config.json} (field
 * {@code fullPowerRiskMode}); a missing file or field means disabled.
 */
@Service
@Slf4j
public class RiskModeService {

    static final String PREFERENCES_DIR = "preferences";
    static final String CONFIG_FILE = "config.json";

    private final StoragePort storagePort;
    private final CommandSafetyPolicy commandSafetyPolicy;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private volatile boolean enabled;

    public RiskModeService(StoragePort storagePort, CommandSafetyPolicy commandSafetyPolicy) {
        this.storagePort = storagePort;
        this.commandSafetyPolicy = commandSafetyPolicy;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * True only when risk mode is on and the command is not on the always-deny
     * list.
     */
    public boolean shouldAutoApprove(String command) {
        return enabled && !commandSafetyPolicy.isBlocked(command);
    }

    /**
     * Reads the persisted default and applies it. Unreadable preferences count as
     * disabled.
     */
    public boolean loadPreference() {
        try {
            String json = storagePort.getText(PREFERENCES_DIR, CONFIG_FILE).join();
            enabled = json != null && !json.isBlank()
                    && objectMapper.readValue(json, ReplPreferences.class).isRiskModeEnabled();
        } catch (JsonProcessingException | RuntimeException e) { // NOSONAR - fall back to disabled
            log.debug("[RiskMode] No readable preference, defaulting to disabled: {}", e.getMessage());
            enabled = false;
        }
        log.info("[RiskMode] Full power risk mode {}", enabled ? "ENABLED" : "disabled");
        return enabled;
    }

    /**
     * Switches the flag in memory and persists it as the new default.
     *
     * @return completes when the preference is written; completes exceptionally
     *         (after logging) if the write fails, while the in-memory flag keeps
     *         the new value
     */
    public CompletableFuture<Void> setEnabled(boolean value) {
        this.enabled = value;
        log.info("[RiskMode] Full power risk mode {}", value ? "ENABLED" : "disabled");
        return savePreference(value);
    }

    public boolean toggle() {
        boolean next = !enabled;
        setEnabled(next);
        return next;
    }

    /**
     * Rewrites the preference file with the given flag, keeping every other key
     * already stored there.
     */
    public CompletableFuture<Void> savePreference(boolean value) {
        return storagePort.getText(PREFERENCES_DIR, CONFIG_FILE)
                .thenApply(existing -> withRiskMode(existing, value))
                .thenCompose(json -> storagePort.putTextAtomic(PREFERENCES_DIR, CONFIG_FILE, json, false))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.warn("[RiskMode] Failed to persist risk mode preference: {}",
                                rootMessage(error));
                    } else {
                        log.debug("[RiskMode] Persisted fullPowerRiskMode={}", value);
                    }
                });
    }

    private String withRiskMode(String existing, boolean value) {
        ReplPreferences preferences = new ReplPreferences();
        if (existing != null && !existing.isBlank()) {
            try {
                preferences = objectMapper.readValue(existing, ReplPreferences.class);
            } catch (JsonProcessingException e) {
                log.warn("[RiskMode] Existing {} is not valid JSON, rewriting it", CONFIG_FILE);
            }
        }
        preferences.setFullPowerRiskMode(value);
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(preferences);
        } catch (JsonProcessingException e) {
            throw new CompletionException(e);
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current instanceof CompletionException) {
            current = current.getCause();
        }
        return current.getMessage();
    }
}
