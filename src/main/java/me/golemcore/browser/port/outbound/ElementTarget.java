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

/**
 * The element set a locator resolved to. Every action fails if the set
 * contains more than one element.
 */
public interface ElementTarget {

    void click();

    /**
     * Type the text one key at a time.
     *
     * @param delayMs
     *            pause between key presses
     */
    void pressSequentially(String text, double delayMs);

    void selectOption(String value);

    void hover();

    byte[] screenshot();
}
