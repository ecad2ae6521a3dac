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

package me.golemcore.browser.domain.component;

import me.golemcore.browser.domain.model.ToolDefinition;
import me.golemcore.browser.domain.model.ToolResult;

import java.util.Map;

public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with its JSON Schema, as advertised in the
     * tool catalog.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with the specified arguments. Called on the browser
     * thread of {@link me.golemcore.browser.domain.service.ToolDispatcher};
     * implementations block until the browser finished.
     *
     * @param parameters
     *            the call arguments as a map
     * @return the tool execution result
     * @throws IllegalArgumentException
     *             if the arguments are invalid
     */
    ToolResult execute(Map<String, Object> parameters);

    /**
     * Whether the dispatcher must make sure a browser session is active before
     * calling {@link #execute(Map)}. Only the lifecycle tools opt out.
     */
    default boolean requiresActiveSession() {
        return true;
    }

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
