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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hub.adapter.outbound.council.ReviewerAgentFactory;
import me.golemcore.hub.domain.broker.ToolServerBroker;
import me.golemcore.hub.domain.council.ReviewerRegistry;
import me.golemcore.hub.port.outbound.ModelPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration that wires shared infrastructure and starts the hub.
 *
 * <p>
 * On startup it logs the model provider and storage location and connects
 * every tool server configured under {@code hub.broker.servers.*} with
 * {@code auto-connect=true}. A server that fails to connect is logged and
 * skipped; the hub still starts.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final HubProperties properties;
    private final ToolServerBroker broker;
    private final ModelPort modelPort;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService taskRunExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "task-run-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ReviewerRegistry reviewerRegistry(ReviewerAgentFactory reviewerAgentFactory) {
        return new ReviewerRegistry(reviewerAgentFactory.createConfiguredReviewers());
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Hub v{} starting...", version);
        log.info("Model Provider: {} (available: {})", modelPort.getProviderId(), modelPort.isAvailable());
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("Default Autonomy: {}", properties.getAutonomy().getDefaultLevel());

        broker.connectConfiguredServers();

        log.info("GolemCore Hub started with {} tool server connection(s)", broker.listConnections().size());
    }
}
