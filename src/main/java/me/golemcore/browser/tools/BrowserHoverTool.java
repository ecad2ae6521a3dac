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

package me.golemcore.browser.tools;

import me.golemcore.browser.domain.model.ElementAction;
import me.golemcore.browser.domain.model.ElementLocator;
import me.golemcore.browser.domain.service.BrowserActionService;
import org.springframework.stereotype.Component;

@Component
public class BrowserHoverTool extends AbstractElementActionTool {

    public BrowserHoverTool(BrowserActionService actionService) {
        super(actionService, ElementAction.HOVER, ElementLocator.Kind.SELECTOR);
    }

    @Override
    protected String name() {
        return "browser_hover";
    }

    @Override
    protected String description() {
        return "Hover an element on the page using CSS selector";
    }

    @Override
    protected String locatorDescription() {
        return "CSS selector for element to hover";
    }
}
