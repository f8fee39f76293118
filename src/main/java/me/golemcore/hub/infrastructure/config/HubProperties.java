package me.golemcore.hub.infrastructure.config;

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
import me.golemcore.hub.domain.model.AutonomyLevel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the hub, bound from
 * application.properties.
 *
 * <p>
 * All hub configuration is organized under the {@code hub.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - where memory, snapshots, sessions and the
 * audit log live</li>
 * <li>{@link BrokerProperties} - tool server connections, timeouts and
 * reconnection</li>
 * <li>{@link ContextProperties} - prompt layers and token budget</li>
 * <li>{@link AutonomyProperties} - loop bounds, retries, risk thresholds</li>
 * <li>{@link CouncilProperties} - reviewers and review timeout</li>
 * <li>{@link ModelProperties} - model provider</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "hub")
@Data
public class HubProperties {

    private StorageProperties storage = new StorageProperties();
    private BrokerProperties broker = new BrokerProperties();
    private ContextProperties context = new ContextProperties();
    private MemoryProperties memory = new MemoryProperties();
    private AutonomyProperties autonomy = new AutonomyProperties();
    private CouncilProperties council = new CouncilProperties();
    private ModelProperties model = new ModelProperties();

    @Data
    public static class StorageProperties {
        private String basePath = System.getProperty("user.home") + "/.golemcore/hub";
    }

    @Data
    public static class BrokerProperties {
        private long defaultInvokeTimeoutMs = 30_000;
        private int startupTimeoutSeconds = 30;
        private int notificationQueueCapacity = 256;
        private ReconnectProperties reconnect = new ReconnectProperties();
        private Map<String, ServerProperties> servers = new LinkedHashMap<>();
    }

    @Data
    public static class ReconnectProperties {
        private long initialBackoffMs = 1_000;
        private long maxBackoffMs = 30_000;
        private double multiplier = 2.0;
        private int maxAttempts = 5;
    }

    @Data
    public static class ServerProperties {
        private String command;
        private Map<String, String> env = new HashMap<>();
        private boolean autoConnect = true;
        private List<String> expectedTools = new ArrayList<>();
        private List<String> riskyTools = new ArrayList<>();
    }

    @Data
    public static class ContextProperties {
        private String systemPrompt = "You are an autonomous agent coordinated by GolemCore Hub. "
                + "Answer with a single JSON action or a plain text answer when the goal is met.";
        private String developerPrompt = "";
        private int defaultBudgetTokens = 4_000;
        private int activeTurns = 12;
        private int memoryLimit = 10;
        private int summaryMaxChars = 1_200;
    }

    @Data
    public static class MemoryProperties {
        private int defaultSearchLimit = 10;
    }

    @Data
    public static class AutonomyProperties {
        private AutonomyLevel defaultLevel = AutonomyLevel.MEDIUM;
        private int maxRetries = 3;
        private int maxSteps = 10;
        private long modelTimeoutMs = 60_000;
        private long retryInitialBackoffMs = 1_000;
        private long retryMaxBackoffMs = 30_000;
        private double costThreshold = 1.0;
        private List<String> safePatterns = new ArrayList<>();
        private ScriptToolProperties scriptTool = new ScriptToolProperties();
    }

    @Data
    public static class ScriptToolProperties {
        private String server;
        private String name = "run_script";
    }

    @Data
    public static class CouncilProperties {
        private long reviewTimeoutMs = 15_000;
        private Map<String, ReviewerProperties> reviewers = new LinkedHashMap<>();
    }

    @Data
    public static class ReviewerProperties {
        private String type = "model";
        private String persona;
        private String server;
        private String tool;
        private double weight = 1.0;
    }

    @Data
    public static class ModelProperties {
        private String provider = "none";
        private String modelName;
        private String apiKey;
        private String baseUrl;
        private long timeoutMs = 60_000;
        private Double temperature;
    }
}
