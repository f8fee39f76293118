package me.golemcore.hub.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.hub.adapter.inbound.web.dto.RememberRequest;
import me.golemcore.hub.domain.model.MemoryItem;
import me.golemcore.hub.domain.model.MemoryScoredItem;
import me.golemcore.hub.domain.service.MemoryService;
import me.golemcore.hub.infrastructure.config.HubProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/memory")
@RequiredArgsConstructor
public class MemoryController {

    private final MemoryService memoryService;
    private final HubProperties properties;

    @PostMapping
    public Mono<ResponseEntity<MemoryItem>> remember(@RequestBody RememberRequest request) {
        String id = memoryService.remember(request.getContent(), request.getTags(), request.getSource());
        MemoryItem item = memoryService.get(id)
                .orElseThrow(() -> new IllegalStateException("Memory item vanished: " + id));
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(item));
    }

    @GetMapping
    public Mono<ResponseEntity<List<MemoryScoredItem>>> search(
            @RequestParam(required = false) String query,
            @RequestParam(required = false) List<String> tags,
            @RequestParam(required = false) Integer limit) {
        int effectiveLimit = limit != null ? limit : properties.getMemory().getDefaultSearchLimit();
        return Mono.just(ResponseEntity.ok(memoryService.scoredSearch(query, tags, effectiveLimit)));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<MemoryItem>> get(@PathVariable String id) {
        MemoryItem item = memoryService.get(id)
                .orElseThrow(() -> new NoSuchElementException("Unknown memory item: " + id));
        return Mono.just(ResponseEntity.ok(item));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> forget(@PathVariable String id) {
        memoryService.forget(id);
        return Mono.just(ResponseEntity.noContent().build());
    }
}
