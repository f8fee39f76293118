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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything the broker needs to open (and reopen) a tool server connection.
 * The URI scheme selects the transport, e.g. {@code stdio:npx -y server-fs}.
 */
@Data
@Builder
public class ToolServerSpec {

    private String name;
    private String uri;

    @Builder.Default
    private Map<String, String> env = new HashMap<>();

    /**
     * Capabilities the hub expects; the advertised schema must satisfy them.
     */
    @Builder.Default
    private List<ToolDescriptor> declaredCapabilities = new ArrayList<>();

    /**
     * Tool names forced to {@link RiskClass#RISKY} regardless of annotations.
     */
    @Builder.Default
    private Set<String> riskyTools = new HashSet<>();

    @Builder.Default
    private int startupTimeoutSeconds = 30;
}
