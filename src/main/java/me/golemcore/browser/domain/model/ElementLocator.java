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

/**
 * Addresses page elements either by CSS selector or by visible text.
 */
public record ElementLocator(Kind kind, String value) {

    public enum Kind {
        SELECTOR, TEXT
    }

    public static ElementLocator bySelector(String selector) {
        return new ElementLocator(Kind.SELECTOR, selector);
    }

    public static ElementLocator byText(String text) {
        return new ElementLocator(Kind.TEXT, text);
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    /**
     * Human-readable form used in result messages: the selector itself, or
     * {@code element with text <text>}.
     */
    public String describe() {
        return isText() ? "element with text " + value : value;
    }
}
