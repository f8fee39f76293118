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

/**
 * One attributed layer of a composed context.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContextLayer {

    private LayerKind kind;
    private String source;
    private String content;
    private int tokens;

    /**
     * Size the layer would have had without budget truncation.
     */
    private int naturalTokens;

    private boolean truncated;

    /**
     * Share of the snapshot total, in percent.
     */
    private double percentage;
}
