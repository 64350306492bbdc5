package com.webauth.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class LocalRedirectValidatorTest {

    @Test
    void localPathIsKept() {
        assertThat(LocalRedirectValidator.validate("/user"))
                .isEqualTo(new LocalRedirectValidator.Result(true, "/user"));
        assertThat(LocalRedirectValidator.validate("/a/b/")).extracting(LocalRedirectValidator.Result::safe)
                .isEqualTo("/a/b/");
    }

    @Test
    void dotSegmentsAreResolvedAndQueryKept() {
        assertThat(LocalRedirectValidator.validate("/a/./b/../c?x=1#top"))
                .isEqualTo(new LocalRedirectValidator.Result(true, "/a/c?x=1#top"));
    }

    @Test
    void encodedSlashesCannotEscapeTheHost() {
        assertThat(LocalRedirectValidator.safeOrDefault("/%2F%2Fevil.example")).isEqualTo("/evil.example");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "user",
            "//evil.example",
            "https://evil.example/",
            "/\\evil.example",
            "/a b",
            "/a\tb",
            "/a%0d%0aSet-Cookie:x",
            "/../etc/passwd",
            "/a/../../b",
            "/%zz"
    })
    void unsafeTargetsFallBackToRoot(String target) {
        assertThat(LocalRedirectValidator.validate(target))
                .isEqualTo(new LocalRedirectValidator.Result(false, LocalRedirectValidator.DEFAULT_TARGET));
    }

    @Test
    void nullTargetFallsBackToRoot() {
        assertThat(LocalRedirectValidator.safeOrDefault(null)).isEqualTo("/");
    }

    @ParameterizedTest
    @ValueSource(strings = {"/caf%C3%A9/menu", "/a/./b/../c?x=1", "/x%41y", "/"})
    void validatingAnAcceptedTargetAgainIsStable(String target) {
        String once = LocalRedirectValidator.safeOrDefault(target);

        assertThat(LocalRedirectValidator.validate(once))
                .isEqualTo(new LocalRedirectValidator.Result(true, once));
    }
}
