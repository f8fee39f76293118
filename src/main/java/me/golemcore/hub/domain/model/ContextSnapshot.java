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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, token-budgeted composition of context layers produced once per turn.
 * Used both as model input and as the client transparency view.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContextSnapshot {

    private String sessionId;

    @Builder.Default
    private List<ContextLayer> layers = new ArrayList<>();

    private int totalTokens;
    private int budgetTokens;

    /**
     * Ids of memory items included in the MEMORY layer.
     */
    @Builder.Default
    private List<String> memoryItemIds = new ArrayList<>();

    public Optional<ContextLayer> getLayer(LayerKind kind) {
        if (layers == null) {
            return Optional.empty();
        }
        return layers.stream().filter(layer -> layer.getKind() == kind).findFirst();
    }

    public double percentageSum() {
        if (layers == null) {
            return 0.0;
        }
        return layers.stream().mapToDouble(ContextLayer::getPercentage).sum();
    }

    /**
     * Renders the snapshot as a single prompt, layers in order, empty layers
     * skipped.
     */
    public String toPrompt() {
        StringBuilder sb = new StringBuilder();
        if (layers == null) {
            return "";
        }
        for (ContextLayer layer : layers) {
            if (layer.getContent() == null || layer.getContent().isBlank()) {
                continue;
            }
            sb.append("## ").append(layer.getKind()).append(" (").append(layer.getSource()).append(")\n");
            sb.append(layer.getContent()).append("\n\n");
        }
        return sb.toString().trim();
    }
}
