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

/**
 * Parameters of a launch or CDP attach.
 */
@Data
@Builder
public class LaunchRequest {

    @Builder.Default
    private BrowserKind browserType = BrowserKind.CHROMIUM;
    private boolean headless;
    private String cdpEndpoint;
    private Integer debugPort;
    private Viewport viewport;
    private WindowPosition windowPosition;

    public boolean isCdp() {
        return cdpEndpoint != null && !cdpEndpoint.isBlank();
    }

    public record Viewport(int width, int height) {
    }

    public record WindowPosition(int x, int y) {
    }
}
