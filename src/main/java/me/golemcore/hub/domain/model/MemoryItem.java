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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A remembered fact. Never updated in place: superseding facts are stored as
 * new items and removal is a tombstone kept by the store.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemoryItem {

    private String id;
    private String content;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    /**
     * Session the item was learned in, if any.
     */
    private String source;

    private Instant createdAt;

    /**
     * Monotonic insertion sequence; breaks ordering ties deterministically.
     */
    private long sequence;
}
