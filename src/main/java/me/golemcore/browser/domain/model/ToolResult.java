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

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private String error;
    @Builder.Default
    private List<Attachment> attachments = List.of();

    /**
     * Creates a successful tool result with output text.
     */
    public static ToolResult success(String output) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .build();
    }

    /**
     * Creates a successful tool result with output text and an inline
     * attachment.
     */
    public static ToolResult success(String output, Attachment attachment) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .attachments(List.of(attachment))
                .build();
    }

    /**
     * Creates a failed tool result with an error message.
     */
    public static ToolResult failure(String error) {
        return ToolResult.builder()
                .success(false)
                .error(error)
                .build();
    }

    /**
     * Maps an action outcome onto a tool result, keeping the message on both
     * paths.
     */
    public static ToolResult from(ActionResult result) {
        return result.isSuccess() ? success(result.getMessage()) : failure(result.getMessage());
    }
}
