package com.webauth.backend;

import static org.assertj.core.api.Assertions.assertThat;

import com.webauth.backend.global.security.SessionCookieFilter;
import com.webauth.backend.modules.sse.application.EventBroadcaster;
import com.webauth.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;

@SpringBootTest
class WebAuthApplicationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    ApplicationContext context;

    @Test
    void contextLoadsWithSecurityWiring() {
        assertThat(context.getBean(PasswordEncoder.class)).isInstanceOf(Argon2PasswordEncoder.class);
        assertThat(context.getBean(SecurityFilterChain.class)).isNotNull();
        assertThat(context.getBean(SessionCookieFilter.class)).isNotNull();
        assertThat(context.getBean(EventBroadcaster.class).isRunning()).isTrue();
    }

    @Test
    void passwordEncoderRoundTripsThroughTheContextBean() {
        PasswordEncoder encoder = context.getBean(PasswordEncoder.class);

        String encoded = encoder.encode("secret");

        assertThat(encoded).startsWith("$argon2id$");
        assertThat(encoder.matches("secret", encoded)).isTrue();
    }
}
