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

package me.golemcore.browser.domain.service;

import lombok.RequiredArgsConstructor;
import me.golemcore.browser.capture.BrowserEventCapture;
import me.golemcore.browser.domain.model.BrowserResource;
import me.golemcore.browser.domain.model.ConsoleLogEntry;
import me.golemcore.browser.domain.model.ResourceContent;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Catalog of readable resources: the console log and one entry per stored
 * screenshot.
 */
@Service
@RequiredArgsConstructor
public class BrowserResourceService {

    private static final String TEXT_PLAIN = "text/plain";
    private static final String IMAGE_PNG = "image/png";

    private final BrowserEventCapture eventCapture;
    private final ScreenshotStore screenshotStore;

    public List<BrowserResource> listResources() {
        List<BrowserResource> resources = new ArrayList<>();
        resources.add(new BrowserResource(BrowserEventCapture.CONSOLE_RESOURCE_URI, TEXT_PLAIN,
                "Browser console logs"));
        for (String name : screenshotStore.names()) {
            resources.add(new BrowserResource(ScreenshotStore.URI_PREFIX + name, IMAGE_PNG, "Screenshot: " + name));
        }
        return resources;
    }

    /**
     * @throws ResourceNotFoundException
     *             if the URI is neither the console log nor a stored screenshot
     */
    public ResourceContent readResource(String uri) {
        if (BrowserEventCapture.CONSOLE_RESOURCE_URI.equals(uri)) {
            String text = eventCapture.getConsoleEntries().stream()
                    .map(ConsoleLogEntry::format)
                    .collect(Collectors.joining("\n"));
            return ResourceContent.text(uri, TEXT_PLAIN, text);
        }

        if (uri != null && uri.startsWith(ScreenshotStore.URI_PREFIX)) {
            String name = uri.substring(ScreenshotStore.URI_PREFIX.length());
            return screenshotStore.find(name)
                    .map(png -> ResourceContent.blob(uri, IMAGE_PNG, Base64.getEncoder().encodeToString(png)))
                    .orElseThrow(() -> new ResourceNotFoundException(uri));
        }

        throw new ResourceNotFoundException(uri);
    }
}
