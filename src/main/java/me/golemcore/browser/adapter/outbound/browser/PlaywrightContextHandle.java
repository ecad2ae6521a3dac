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

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import me.golemcore.browser.port.outbound.BrowserContextHandle;
import me.golemcore.browser.port.outbound.PageHandle;

class PlaywrightContextHandle implements BrowserContextHandle {

    private final BrowserContext context;
    private final int defaultTimeoutMs;

    PlaywrightContextHandle(BrowserContext context, int defaultTimeoutMs) {
        this.context = context;
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    @Override
    public PageHandle newPage() {
        Page page = context.newPage();
        page.setDefaultTimeout(defaultTimeoutMs);
        return new PlaywrightPageHandle(page);
    }

    @Override
    public void close() {
        context.close();
    }
}
