package com.webauth.backend.modules.auth.presentation;

import java.nio.charset.StandardCharsets;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

final class HtmlResponses {

    static final MediaType TEXT_HTML_UTF8 = new MediaType(MediaType.TEXT_HTML, StandardCharsets.UTF_8);

    private HtmlResponses() {
    }

    static ResponseEntity<String> page(String html) {
        return ResponseEntity.ok().contentType(TEXT_HTML_UTF8).body(html);
    }

    static ResponseEntity.BodyBuilder seeOther(String location) {
        return ResponseEntity.status(HttpStatus.SEE_OTHER).header(HttpHeaders.LOCATION, location);
    }

    static ResponseEntity<Void> found(String location) {
        return ResponseEntity.status(HttpStatus.FOUND).header(HttpHeaders.LOCATION, location).build();
    }

    /**
     * Form values are compared after trimming; an all-whitespace value counts as missing.
     */
    static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
