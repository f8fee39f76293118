package me.golemcore.hub.adapter.inbound.web.dto;

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

import lombok.Data;
import me.golemcore.hub.domain.model.ToolDescriptor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Connects a tool server at runtime. {@code uri} uses a transport scheme,
 * e.g. {@code stdio:npx -y @modelcontextprotocol/server-filesystem /tmp}.
 */
@Data
public class ConnectToolServerRequest {
    private String name;
    private String uri;
    private Map<String, String> env = new HashMap<>();
    private List<ToolDescriptor> declaredCapabilities = new ArrayList<>();
    private List<String> riskyTools = new ArrayList<>();
}
