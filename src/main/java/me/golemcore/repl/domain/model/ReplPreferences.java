package me.golemcore.repl.domain.model;

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

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * User-level REPL preferences stored as JSON. Only the risk-mode flag is
 * interpreted here; any other keys written by other tools are kept as-is so a
 * rewrite never drops them.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReplPreferences {

    private Boolean fullPowerRiskMode;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> otherFields = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> otherFields() {
        return otherFields;
    }

    @JsonAnySetter
    public void putOtherField(String key, Object value) {
        otherFields.put(key, value);
    }

    /**
     * Absence of the flag means risk mode is disabled.
     */
    @JsonIgnore
    public boolean isRiskModeEnabled() {
        return Boolean.TRUE.equals(fullPowerRiskMode);
    }
}
