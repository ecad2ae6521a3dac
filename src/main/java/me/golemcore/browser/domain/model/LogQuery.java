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

package me.golemcore.browser.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.EnumSet;
import java.util.Set;

/**
 * Query over the captured console and network logs.
 */
@Data
@Builder
public class LogQuery {

    @Builder.Default
    private Set<LogKind> kinds = EnumSet.allOf(LogKind.class);
    @Builder.Default
    private ConsoleLogFilter consoleFilter = ConsoleLogFilter.none();
    @Builder.Default
    private NetworkLogFilter networkFilter = NetworkLogFilter.none();
    private Integer limit;
    private boolean clear;

    public boolean includes(LogKind kind) {
        return kinds == null || kinds.isEmpty() || kinds.contains(kind);
    }
}
