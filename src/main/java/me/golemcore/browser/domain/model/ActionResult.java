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
 * Result of a browser action. Failures are values, never exceptions.
 */
@Data
@Builder
public class ActionResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String message;
    private byte[] image;

    public static ActionResult success(String message) {
        return ActionResult.builder()
                .success(true)
                .message(message)
                .build();
    }

    public static ActionResult success(String message, byte[] image) {
        return ActionResult.builder()
                .success(true)
                .message(message)
                .image(image)
                .build();
    }

    public static ActionResult failure(String message) {
        return ActionResult.builder()
                .success(false)
                .message(message)
                .build();
    }
}
