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

/**
 * Binary payload returned inline with a tool result (currently screenshots).
 */
@Data
@Builder
public class Attachment {

    public enum Type {
        IMAGE
    }

    private Type type;
    private byte[] data;
    private String filename;
    private String mimeType;

    public static Attachment png(String name, byte[] data) {
        return Attachment.builder()
                .type(Type.IMAGE)
                .data(data)
                .filename(name + ".png")
                .mimeType("image/png")
                .build();
    }
}
