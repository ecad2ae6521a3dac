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

package me.golemcore.browser.adapter.outbound.browser;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Request;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitForSelectorState;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.browser.domain.model.ElementLocator;
import me.golemcore.browser.domain.model.LocatorResolution;
import me.golemcore.browser.domain.model.PageRequest;
import me.golemcore.browser.port.outbound.PageEventListener;
import me.golemcore.browser.port.outbound.PageHandle;

/**
 * {@link PageHandle} over a Playwright {@link Page}.
 *
 * <p>
 * Locators are strict: a {@link Locator} matching several elements refuses to
 * act, so {@link #resolve(ElementLocator)} reports the match count and hands
 * out a second target narrowed with {@link Locator#first()}.
 */
@Slf4j
class PlaywrightPageHandle implements PageHandle {

    private final Page page;

    PlaywrightPageHandle(Page page) {
        this.page = page;
    }

    @Override
    public void navigate(String url) {
        page.navigate(url);
    }

    @Override
    public LocatorResolution resolve(ElementLocator locator) {
        Locator matches = locator.isText() ? page.getByText(locator.value()) : page.locator(locator.value());

        int count = matches.count();
        if (count == 0) {
            try {
                matches.first().waitFor(new Locator.WaitForOptions().setState(WaitForSelectorState.ATTACHED));
            } catch (TimeoutError e) {
                log.debug("No element for {}: {}", locator.describe(), e.getMessage());
                return LocatorResolution.notFound();
            }
            count = matches.count();
        }

        if (count == 0) {
            return LocatorResolution.notFound();
        }
        if (count == 1) {
            return LocatorResolution.single(new PlaywrightElementTarget(matches));
        }
        return LocatorResolution.multiple(count, new PlaywrightElementTarget(matches),
                new PlaywrightElementTarget(matches.first()));
    }

    @Override
    public byte[] screenshot(boolean fullPage) {
        return page.screenshot(new Page.ScreenshotOptions().setFullPage(fullPage));
    }

    @Override
    public Object evaluate(String expression, Object argument) {
        return page.evaluate(expression, argument);
    }

    @Override
    public void addEventListener(PageEventListener listener) {
        page.onConsoleMessage(message -> listener.onConsoleMessage(message.type(), message.text()));
        page.onRequest(request -> listener.onRequest(toPageRequest(request)));
        page.onResponse(response -> listener.onResponse(toPageRequest(response.request()),
                response.status(), response.statusText()));
        page.onRequestFailed(request -> listener.onRequestFailed(toPageRequest(request), request.failure()));
    }

    @Override
    public boolean isClosed() {
        return page.isClosed();
    }

    @Override
    public void close() {
        page.close();
    }

    private static PageRequest toPageRequest(Request request) {
        return new PageRequest(request.url(), request.method(), request.resourceType());
    }
}
