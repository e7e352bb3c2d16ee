package com.klubtool.backend.modules.calendar.application;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Request-derived inputs of an ICS rendering.
 *
 * @param host        host part of event UIDs; blank means the configured fallback host
 * @param absoluteUrl turns a relative detail path into an absolute URL; null when no request is available,
 *                    in which case URL lines are omitted
 */
public record IcsRenderContext(String host, UnaryOperator<String> absoluteUrl) {

    public static IcsRenderContext detached() {
        return new IcsRenderContext(null, null);
    }

    Optional<String> absolute(String path) {
        if (absoluteUrl == null || path == null || path.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(absoluteUrl.apply(path)).filter(url -> !url.isEmpty());
    }
}
