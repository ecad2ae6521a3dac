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
import java.util.regex.Pattern;

/**
 * Network log filter. Supplied clauses are combined with AND. Status clauses
 * never match entries that carry no status (request starts and failures).
 */
@Data
@Builder
public class NetworkLogFilter {

    private List<String> methods;
    private List<Integer> statusCodes;
    private Integer statusMin;
    private Integer statusMax;
    private Pattern urlPattern;
    private List<String> resourceTypes;
    private boolean failedOnly;

    public static NetworkLogFilter none() {
        return NetworkLogFilter.builder().build();
    }

    public boolean matches(NetworkLogEntry entry) {
        if (failedOnly && entry.getPhase() != NetworkPhase.FAILED) {
            return false;
        }
        if (methods != null && !methods.isEmpty() && !matchesMethod(entry.getMethod())) {
            return false;
        }
        if (statusCodes != null && !statusCodes.isEmpty()
                && (entry.getStatus() == null || !statusCodes.contains(entry.getStatus()))) {
            return false;
        }
        if ((statusMin != null || statusMax != null) && !inStatusRange(entry.getStatus())) {
            return false;
        }
        if (urlPattern != null && (entry.getUrl() == null || !urlPattern.matcher(entry.getUrl()).find())) {
            return false;
        }
        return resourceTypes == null || resourceTypes.isEmpty() || resourceTypes.contains(entry.getResourceType());
    }

    private boolean matchesMethod(String method) {
        if (method == null) {
            return false;
        }
        String normalized = method.toUpperCase(Locale.ROOT);
        return methods.stream().anyMatch(candidate -> candidate.toUpperCase(Locale.ROOT).equals(normalized));
    }

    private boolean inStatusRange(Integer status) {
        if (status == null) {
            return false;
        }
        if (statusMin != null && status < statusMin) {
            return false;
        }
        return statusMax == null || status <= statusMax;
    }
}
