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

package me.golemcore.browser.infrastructure.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Event bus implementation using Spring's ApplicationEventPublisher.
 *
 * <p>
 * Events are delivered synchronously to all registered Spring
 * {@code @EventListener} methods, on the publishing thread.
 *
 * <p>
 * Usage:
 *
 * <pre>{@code
 * eventBus.publish(new ResourceUpdatedEvent("console://logs"));
 * }</pre>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventBus {

    private final ApplicationEventPublisher eventPublisher;

    /**
     * Publish an event.
     */
    public void publish(Object event) {
        log.trace("Publishing event: {}", event);
        eventPublisher.publishEvent(event);
    }
}
