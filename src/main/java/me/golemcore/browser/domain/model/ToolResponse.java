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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Uniform outward envelope of a tool call: typed content parts plus an error
 * flag.
 */
public record ToolResponse(List<ContentPart> content, @JsonProperty("isError") boolean isError) {

    public static ToolResponse from(ToolResult result) {
        List<ContentPart> parts = new ArrayList<>();
        String text = result.isSuccess() ? result.getOutput() : result.getError();
        parts.add(ContentPart.text(text != null ? text : ""));
        if (result.getAttachments() != null) {
            for (Attachment attachment : result.getAttachments()) {
                if (attachment.getType() == Attachment.Type.IMAGE && attachment.getData() != null) {
                    parts.add(ContentPart.image(attachment.getData(), attachment.getMimeType()));
                }
            }
        }
        return new ToolResponse(List.copyOf(parts), !result.isSuccess());
    }

    public static ToolResponse error(String message) {
        return new ToolResponse(List.of(ContentPart.text(message)), true);
    }

    /**
     * A {@code text} part carries {@code text}; an {@code image} part carries
     * base64 {@code data} and its {@code mimeType}.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ContentPart(String type, String text, String data, String mimeType) {

        public static ContentPart text(String text) {
            return new ContentPart("text", text, null, null);
        }

        public static ContentPart image(byte[] bytes, String mimeType) {
            return new ContentPart("image", null, Base64.getEncoder().encodeToString(bytes), mimeType);
        }
    }
}
