package com.webauth.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import com.webauth.backend.global.config.WebAuthProperties;

import org.springframework.stereotype.Component;

/**
 * Subjects and plain-text bodies for the account emails.
 */
@Component
public class AuthMailComposer {

    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final DateTimeFormatter EXPIRES_FORMAT =
            DateTimeFormatter.ofPattern("MMMM d, yyyy h:mm a z", Locale.US);

    private final String appName;
    private final String baseUrl;

    public AuthMailComposer(WebAuthProperties properties) {
        this.appName = properties.appName();
        this.baseUrl = properties.baseUrl();
    }

    public MailContent forgot(ForgotAction action, String email, String username, IssuedToken token) {
        String subject = "%s forgot %s request".formatted(appName, action.value());
        if (username == null || username.isEmpty()) {
            return new MailContent(subject, notRegistered(email));
        }
        String body = switch (action) {
            case PASSWORD -> """

                    To reset your password for %s, please visit %s/reset?rtoken=%s by %s.

                    You can ignore this message if you did not request a reset password for %s.
                    """.formatted(appName, baseUrl, token.value(), formatExpires(token.expires()), appName);
            case USER -> """

                    Your user name for %s is %s.
                    """.formatted(appName, username);
        };
        return new MailContent(subject, body);
    }

    public MailContent confirmRequest(String email, String username, IssuedToken token) {
        String subject = "%s confirm email".formatted(appName);
        if (username == null || username.isEmpty()) {
            return new MailContent(subject, notRegistered(email));
        }
        return new MailContent(subject, """

                To confirm your email for %s, please visit %s/confirm?ctoken=%s by %s.

                You can ignore this message if you did not request to confirm an email for %s.
                """.formatted(appName, baseUrl, token.value(), formatExpires(token.expires()), appName));
    }

    public MailContent registration(String fullName, String username, IssuedToken token) {
        return new MailContent("%s registration".formatted(appName), """

                %s,

                Thank you for registering for %s. Your username is %s.

                Please visit %s/confirm?ctoken=%s by %s to confirm your account.

                You can ignore this message if you did not register for an account.
                """.formatted(fullName, appName, username, baseUrl, token.value(), formatExpires(token.expires())));
    }

    public MailContent confirmed(String username) {
        return new MailContent("%s email confirmed".formatted(appName), """

                The email address for %s on %s has been confirmed.

                You can now log in at %s/login.
                """.formatted(username, appName, baseUrl));
    }

    private String notRegistered(String email) {
        return """

                The email address %s is not registered for %s.

                If you would like to register for %s, please visit %s/register.
                """.formatted(email, appName, appName, baseUrl);
    }

    private static String formatExpires(OffsetDateTime expires) {
        return expires.atZoneSameInstant(UTC).format(EXPIRES_FORMAT);
    }
}
