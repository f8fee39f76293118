package me.golemcore.hub.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A tool advertised by a tool server: name, JSON parameter schema and declared
 * side-effect class.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ToolDescriptor {

    private String name;
    private String description;
    private Map<String, Object> inputSchema; // JSON Schema

    @Builder.Default
    private RiskClass sideEffect = RiskClass.RISKY;

    /**
     * Creates a descriptor without input parameters.
     */
    public static ToolDescriptor simple(String name, String description, RiskClass sideEffect) {
        return ToolDescriptor.builder()
                .name(name)
                .description(description)
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .sideEffect(sideEffect)
                .build();
    }
}
