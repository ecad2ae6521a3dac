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

import java.util.List;
import java.util.Locale;

/**
 * Console log filter. Supplied clauses are combined with AND; an empty filter
 * matches everything.
 */
@Data
@Builder
public class ConsoleLogFilter {

    private List<String> types;
    private String search;

    public static ConsoleLogFilter none() {
        return ConsoleLogFilter.builder().build();
    }

    public boolean matches(ConsoleLogEntry entry) {
        if (types != null && !types.isEmpty() && !types.contains(entry.getType())) {
            return false;
        }
        if (search != null && !search.isEmpty()) {
            String text = entry.getText() != null ? entry.getText().toLowerCase(Locale.ROOT) : "";
            return text.contains(search.toLowerCase(Locale.ROOT));
        }
        return true;
    }
}
