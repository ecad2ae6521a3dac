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

import me.golemcore.browser.port.outbound.ElementTarget;

/**
 * Outcome of resolving an {@link ElementLocator} against the current page.
 *
 * <p>
 * For {@link Status#MULTIPLE_MATCHES} the {@code target} still addresses the
 * whole match set (and will refuse to act), while {@code first} is narrowed to
 * the first match in document order.
 */
public final class LocatorResolution {

    public enum Status {
        NOT_FOUND, SINGLE_MATCH, MULTIPLE_MATCHES
    }

    private static final LocatorResolution NOT_FOUND = new LocatorResolution(Status.NOT_FOUND, 0, null, null);

    private final Status status;
    private final int matchCount;
    private final ElementTarget target;
    private final ElementTarget first;

    private LocatorResolution(Status status, int matchCount, ElementTarget target, ElementTarget first) {
        this.status = status;
        this.matchCount = matchCount;
        this.target = target;
        this.first = first;
    }

    public static LocatorResolution notFound() {
        return NOT_FOUND;
    }

    public static LocatorResolution single(ElementTarget target) {
        return new LocatorResolution(Status.SINGLE_MATCH, 1, target, target);
    }

    public static LocatorResolution multiple(int matchCount, ElementTarget target, ElementTarget first) {
        if (matchCount < 2) {
            throw new IllegalArgumentException("Multiple matches require at least two elements, got " + matchCount);
        }
        return new LocatorResolution(Status.MULTIPLE_MATCHES, matchCount, target, first);
    }

    public Status getStatus() {
        return status;
    }

    public int getMatchCount() {
        return matchCount;
    }

    public ElementTarget getTarget() {
        return target;
    }

    public ElementTarget getFirst() {
        return first;
    }
}
