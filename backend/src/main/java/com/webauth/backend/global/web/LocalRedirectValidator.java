package com.webauth.backend.global.web;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

import org.springframework.web.util.UriUtils;

/**
 * Validates post-login redirect targets so they can only point back into this application.
 * <p>
 * Accepted targets start with a single {@code /}, contain no scheme, backslash, control character
 * or raw whitespace, and stay inside the root after {@code .}/{@code ..} segments are resolved.
 * The path is percent-decoded once, canonicalised and re-encoded; query and fragment are kept
 * as given. Validating an accepted result again yields the same result.
 */
public final class LocalRedirectValidator {

    public static final String DEFAULT_TARGET = "/";

    private static final Result REJECTED = new Result(false, DEFAULT_TARGET);

    private LocalRedirectValidator() {
    }

    public static Result validate(String target) {
        if (target == null || target.isEmpty() || containsForbidden(target)) {
            return REJECTED;
        }
        if (!target.startsWith("/") || target.startsWith("//")) {
            return REJECTED;
        }

        String rest = target;
        String fragment = null;
        int hash = rest.indexOf('#');
        if (hash >= 0) {
            fragment = rest.substring(hash + 1);
            rest = rest.substring(0, hash);
        }
        String query = null;
        int question = rest.indexOf('?');
        if (question >= 0) {
            query = rest.substring(question + 1);
            rest = rest.substring(0, question);
        }

        String decoded;
        try {
            decoded = UriUtils.decode(rest, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            return REJECTED;
        }
        if (containsForbidden(decoded)) {
            return REJECTED;
        }

        String path = canonicalPath(decoded);
        if (path == null) {
            return REJECTED;
        }

        StringBuilder safe = new StringBuilder(path);
        if (query != null) {
            safe.append('?').append(query);
        }
        if (fragment != null) {
            safe.append('#').append(fragment);
        }
        return new Result(true, safe.toString());
    }

    /**
     * Returns the validated target, or {@value #DEFAULT_TARGET} when it is not a safe local path.
     */
    public static String safeOrDefault(String target) {
        return validate(target).safe();
    }

    private static String canonicalPath(String decoded) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : decoded.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (segments.isEmpty()) {
                    return null;
                }
                segments.removeLast();
                continue;
            }
            segments.addLast(segment);
        }

        StringBuilder path = new StringBuilder();
        Iterator<String> it = segments.iterator();
        while (it.hasNext()) {
            path.append('/').append(UriUtils.encodePathSegment(it.next(), StandardCharsets.UTF_8));
        }
        if (path.length() == 0) {
            return "/";
        }
        if (decoded.endsWith("/")) {
            path.append('/');
        }
        return path.toString();
    }

    private static boolean containsForbidden(String value) {
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch < 0x20 || ch == 0x7f || ch == '\\' || Character.isWhitespace(ch) || Character.isSpaceChar(ch)) {
                return true;
            }
        }
        return false;
    }

    public record Result(boolean ok, String safe) {
    }
}
