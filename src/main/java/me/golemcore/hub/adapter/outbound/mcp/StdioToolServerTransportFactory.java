package me.golemcore.hub.adapter.outbound.mcp;

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

import me.golemcore.hub.domain.model.ToolServerSpec;
import me.golemcore.hub.port.outbound.ToolServerTransport;
import me.golemcore.hub.port.outbound.ToolServerTransportFactory;
import org.springframework.stereotype.Component;

/**
 * Handles {@code stdio:<shell command>} URIs by spawning the command as a
 * child process.
 */
@Component
public class StdioToolServerTransportFactory implements ToolServerTransportFactory {

    static final String SCHEME = "stdio:";

    @Override
    public boolean supports(String uri) {
        return uri != null && uri.startsWith(SCHEME) && uri.length() > SCHEME.length();
    }

    @Override
    public ToolServerTransport create(ToolServerSpec spec) {
        String command = spec.getUri().substring(SCHEME.length()).trim();
        String name = spec.getName() != null ? spec.getName() : command.split("\\s+")[0];
        return new StdioToolServerTransport(name, command, spec.getEnv());
    }
}
