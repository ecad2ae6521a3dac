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
import me.golemcore.browser.port.outbound.ElementTarget;

class PlaywrightElementTarget implements ElementTarget {

    private final Locator locator;

    PlaywrightElementTarget(Locator locator) {
        this.locator = locator;
    }

    @Override
    public void click() {
        locator.click();
    }

    @Override
    public void pressSequentially(String text, double delayMs) {
        locator.pressSequentially(text, new Locator.PressSequentiallyOptions().setDelay(delayMs));
    }

    @Override
    public void selectOption(String value) {
        locator.selectOption(value);
    }

    @Override
    public void hover() {
        locator.hover();
    }

    @Override
    public byte[] screenshot() {
        return locator.screenshot();
    }

    Locator getLocator() {
        return locator;
    }
}
