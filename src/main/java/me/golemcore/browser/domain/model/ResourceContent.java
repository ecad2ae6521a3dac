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

/**
 * Contents of a resource: {@code text} for textual resources, base64
 * {@code blob} for binary ones.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceContent(String uri, String mimeType, String text, String blob) {

    public static ResourceContent text(String uri, String mimeType, String text) {
        return new ResourceContent(uri, mimeType, text, null);
    }

    public static ResourceContent blob(String uri, String mimeType, String blob) {
        return new ResourceContent(uri, mimeType, null, blob);
    }
}
