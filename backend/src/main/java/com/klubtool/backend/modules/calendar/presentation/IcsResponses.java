package com.klubtool.backend.modules.calendar.presentation;

import java.nio.charset.StandardCharsets;

import com.klubtool.backend.modules.calendar.application.IcsRenderContext;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.CacheControl;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * Response helpers shared by every endpoint that returns an ICS document.
 */
public final class IcsResponses {

    public static final MediaType TEXT_CALENDAR = new MediaType("text", "calendar", StandardCharsets.UTF_8);

    private IcsResponses() {
    }

    public static IcsRenderContext renderContext(HttpServletRequest request) {
        String host = request.getHeader(HttpHeaders.HOST);
        return new IcsRenderContext(host, path -> ServletUriComponentsBuilder.fromContextPath(request)
                .path(path)
                .toUriString());
    }

    public static ResponseEntity<String> attachment(String body, String filename) {
        return build(body, ContentDisposition.attachment().filename(filename).build());
    }

    public static ResponseEntity<String> inline(String body) {
        return build(body, ContentDisposition.inline().build());
    }

    private static ResponseEntity<String> build(String body, ContentDisposition disposition) {
        return ResponseEntity.ok()
                .contentType(TEXT_CALENDAR)
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .cacheControl(CacheControl.noCache().cachePrivate())
                .body(body);
    }
}
