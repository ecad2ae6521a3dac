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

package me.golemcore.browser.port.outbound;

import me.golemcore.browser.domain.model.ElementLocator;
import me.golemcore.browser.domain.model.LocatorResolution;

/**
 * Operations on a single browser page.
 */
public interface PageHandle {

    /**
     * Navigate to a URL and wait for the load event.
     */
    void navigate(String url);

    /**
     * Resolve a selector or text locator to the elements it currently matches.
     * Waits up to the page default timeout for at least one element to appear.
     *
     * @param locator
     *            the locator to resolve
     * @return the typed resolution, never {@code null}
     */
    LocatorResolution resolve(ElementLocator locator);

    /**
     * Capture the viewport, or the whole scrollable page when
     * {@code fullPage} is set.
     *
     * @return PNG bytes
     */
    byte[] screenshot(boolean fullPage);

    /**
     * Evaluate a JavaScript function expression in the page, passing
     * {@code argument} to it.
     *
     * @return the function's return value converted to Java collections and
     *         primitives
     */
    Object evaluate(String expression, Object argument);

    /**
     * Subscribe to console and network events of this page.
     */
    void addEventListener(PageEventListener listener);

    boolean isClosed();

    void close();
}
