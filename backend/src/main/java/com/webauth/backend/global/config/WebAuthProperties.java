package com.webauth.backend.global.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonValue;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

/**
 * Validated application settings bound from {@code webauth.*}.
 * Invalid combinations fail startup; SMTP settings are checked lazily by the mailer.
 */
@ConfigurationProperties(prefix = "webauth")
public record WebAuthProperties(
        String appName,
        String baseUrl,
        Session session,
        Tokens tokens,
        Password password,
        Smtp smtp,
        Sse sse
) {

    public WebAuthProperties {
        session = session != null ? session : new Session(null, null, null);
        tokens = tokens != null ? tokens : new Tokens(null, null, null, null);
        password = password != null ? password : new Password(null, null, null, null, null);
        smtp = smtp != null ? smtp : new Smtp(null, null, null, null);
        sse = sse != null ? sse : new Sse(null, null, null, null, null, null);

        List<String> problems = new ArrayList<>();
        if (!StringUtils.hasText(appName)) {
            problems.add("webauth.app-name is required");
        }
        if (!StringUtils.hasText(baseUrl)) {
            problems.add("webauth.base-url is required");
        }
        session.collectProblems(problems);
        tokens.collectProblems(problems);
        password.collectProblems(problems);
        sse.collectProblems(problems);
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid webauth configuration: " + String.join("; ", problems));
        }
        baseUrl = stripTrailingSlash(baseUrl);
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static void requirePositive(List<String> problems, String key, Integer value) {
        if (value != null && value <= 0) {
            problems.add(key + " must be positive");
        }
    }

    private static void requirePositive(List<String> problems, String key, Duration value) {
        if (value != null && (value.isZero() || value.isNegative())) {
            problems.add(key + " must be a positive duration");
        }
    }

    public record Session(String cookieName, Duration expires, Integer tokenSize) {

        public Session {
            cookieName = StringUtils.hasText(cookieName) ? cookieName.trim() : "session";
            expires = expires != null ? expires : Duration.ofHours(24);
        }

        void collectProblems(List<String> problems) {
            requirePositive(problems, "webauth.session.expires", expires);
            requirePositive(problems, "webauth.session.token-size", tokenSize);
        }
    }

    /**
     * Optional overrides for reset and confirm tokens. Unset values fall back to the token kind defaults.
     */
    public record Tokens(Integer resetSize, Duration resetExpires, Integer confirmSize, Duration confirmExpires) {

        void collectProblems(List<String> problems) {
            requirePositive(problems, "webauth.tokens.reset-size", resetSize);
            requirePositive(problems, "webauth.tokens.reset-expires", resetExpires);
            requirePositive(problems, "webauth.tokens.confirm-size", confirmSize);
            requirePositive(problems, "webauth.tokens.confirm-expires", confirmExpires);
        }
    }

    /**
     * Argon2id cost parameters. {@code memoryKib} is expressed in kibibytes.
     */
    public record Password(Integer saltLength, Integer hashLength, Integer parallelism, Integer memoryKib,
                           Integer iterations) {

        public Password {
            saltLength = saltLength != null ? saltLength : 16;
            hashLength = hashLength != null ? hashLength : 32;
            parallelism = parallelism != null ? parallelism : 1;
            memoryKib = memoryKib != null ? memoryKib : 65536;
            iterations = iterations != null ? iterations : 3;
        }

        void collectProblems(List<String> problems) {
            requirePositive(problems, "webauth.password.salt-length", saltLength);
            requirePositive(problems, "webauth.password.hash-length", hashLength);
            requirePositive(problems, "webauth.password.parallelism", parallelism);
            requirePositive(problems, "webauth.password.memory-kib", memoryKib);
            requirePositive(problems, "webauth.password.iterations", iterations);
        }
    }

    /**
     * SMTP submission settings. The account username doubles as the sender address.
     */
    public record Smtp(String host, Integer port, String username, String password) {

        static final String REDACTED = "[REDACTED]";

        public Smtp {
            host = host != null ? host.trim() : "";
            username = username != null ? username.trim() : "";
            password = password != null ? password : "";
        }

        public boolean isValid() {
            return StringUtils.hasText(host)
                    && port != null && port > 0
                    && StringUtils.hasText(username)
                    && StringUtils.hasText(password);
        }

        @JsonValue
        public Map<String, Object> redacted() {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("host", host);
            view.put("port", port);
            view.put("username", username);
            view.put("password", password.isEmpty() ? "" : REDACTED);
            return view;
        }

        @Override
        public String toString() {
            return "Smtp" + redacted();
        }
    }

    /**
     * Event stream settings. {@code maxStreams} bounds the number of concurrently open streams;
     * an idle stream gets a comment line every {@code heartbeat} so a vanished client is noticed.
     */
    public record Sse(String allowOrigin, Integer queueCapacity, Duration sendTimeout, Integer maxStreams,
                      Duration heartbeat, List<String> events) {

        public Sse {
            allowOrigin = allowOrigin != null ? allowOrigin.trim() : "";
            queueCapacity = queueCapacity != null ? queueCapacity : 10;
            sendTimeout = sendTimeout != null ? sendTimeout : Duration.ofSeconds(1);
            maxStreams = maxStreams != null ? maxStreams : 100;
            heartbeat = heartbeat != null ? heartbeat : Duration.ofSeconds(15);
            events = events != null ? List.copyOf(events) : List.of();
        }

        void collectProblems(List<String> problems) {
            requirePositive(problems, "webauth.sse.queue-capacity", queueCapacity);
            requirePositive(problems, "webauth.sse.send-timeout", sendTimeout);
            requirePositive(problems, "webauth.sse.max-streams", maxStreams);
            requirePositive(problems, "webauth.sse.heartbeat", heartbeat);
        }
    }
}
