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
 * Element-targeting actions that share the resolve, act and retry-on-first
 * policy.
 */
public enum ElementAction {

    CLICK("click"), FILL("fill"), SELECT("select"), HOVER("hover");

    private final String verb;

    ElementAction(String verb) {
        this.verb = verb;
    }

    public String getVerb() {
        return verb;
    }
}
