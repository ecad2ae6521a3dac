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

package me.golemcore.browser.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.model.ResourceListChangedEvent;
import me.golemcore.browser.infrastructure.event.SpringEventBus;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named screenshot artifacts. Saving under an existing name replaces the
 * previous image. Artifacts outlive browser sessions and are only dropped with
 * the process.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScreenshotStore {

    public static final String URI_PREFIX = "screenshot://";

    private final SpringEventBus eventBus;

    private final Object lock = new Object();
    private final Map<String, byte[]> screenshots = new LinkedHashMap<>();

    public void save(String name, byte[] png) {
        synchronized (lock) {
            screenshots.put(name, png.clone());
        }
        log.debug("Stored screenshot '{}' ({} bytes)", name, png.length);
        eventBus.publish(new ResourceListChangedEvent(URI_PREFIX + name));
    }

    public Optional<byte[]> find(String name) {
        synchronized (lock) {
            byte[] png = screenshots.get(name);
            return png != null ? Optional.of(png.clone()) : Optional.empty();
        }
    }

    /**
     * Artifact names in the order they were first stored.
     */
    public List<String> names() {
        synchronized (lock) {
            return List.copyOf(screenshots.keySet());
        }
    }
}
