package com.webauth.backend.modules.auth.presentation;

import java.util.List;
import java.util.Map;

import com.webauth.backend.global.error.ProblemException;
import com.webauth.backend.modules.audit.application.EventJournal;
import com.webauth.backend.modules.audit.domain.EventName;
import com.webauth.backend.modules.auth.application.AuthError;
import com.webauth.backend.modules.auth.application.AuthException;
import com.webauth.backend.modules.auth.application.AuthMailComposer;
import com.webauth.backend.modules.auth.application.IdentityService;
import com.webauth.backend.modules.auth.application.MailContent;
import com.webauth.backend.modules.auth.application.TokenService;
import com.webauth.backend.modules.auth.domain.TokenKind;
import com.webauth.backend.modules.auth.domain.UserProfile;
import com.webauth.backend.modules.auth.presentation.view.FormPage;
import com.webauth.backend.modules.auth.presentation.view.PageRenderer;
import com.webauth.backend.modules.mail.application.SmtpMailer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Email confirmation. The token is claimed before the account changes; steps after the
 * account is marked confirmed are best effort.
 */
@RestController
public class ConfirmController {

    private static final Logger log = LoggerFactory.getLogger(ConfirmController.class);

    private final IdentityService identityService;
    private final TokenService tokenService;
    private final EventJournal eventJournal;
    private final SmtpMailer smtpMailer;
    private final AuthMailComposer mailComposer;
    private final PageRenderer pageRenderer;

    public ConfirmController(
            IdentityService identityService,
            TokenService tokenService,
            EventJournal eventJournal,
            SmtpMailer smtpMailer,
            AuthMailComposer mailComposer,
            PageRenderer pageRenderer
    ) {
        this.identityService = identityService;
        this.tokenService = tokenService;
        this.eventJournal = eventJournal;
        this.smtpMailer = smtpMailer;
        this.mailComposer = mailComposer;
        this.pageRenderer = pageRenderer;
    }

    @GetMapping("/confirm")
    public ResponseEntity<String> form(@RequestParam(name = "ctoken", defaultValue = "") String confirmToken) {
        return HtmlResponses.page(pageRenderer.form(FormPage.CONFIRM, "", Map.of("ctoken", confirmToken)));
    }

    @PostMapping("/confirm")
    public ResponseEntity<String> confirm(@RequestParam(name = "ctoken", defaultValue = "") String rawToken) {
        String confirmToken = HtmlResponses.trim(rawToken);
        Map<String, String> values = Map.of("ctoken", confirmToken);

        if (confirmToken.isEmpty()) {
            return rerender(AuthMessages.MISSING_CONFIRM_TOKEN, values);
        }

        String username;
        try {
            username = tokenService.consume(TokenKind.CONFIRM, confirmToken);
        } catch (AuthException ex) {
            if (ex.is(AuthError.USER_NOT_FOUND) || ex.is(AuthError.TOKEN_NOT_FOUND)) {
                log.warn("confirm rejected, unknown token");
                return rerender(AuthMessages.INVALID_CONFIRM_TOKEN, values);
            }
            if (ex.is(AuthError.CONFIRM_TOKEN_EXPIRED)) {
                log.warn("confirm rejected, expired token");
                return rerender(AuthMessages.EXPIRED_CONFIRM_TOKEN, values);
            }
            throw ex;
        }

        try {
            identityService.confirmUser(username);
        } catch (AuthException ex) {
            if (ex.is(AuthError.USER_ALREADY_CONFIRMED)) {
                log.info("confirm ignored, already confirmed username={}", username);
                return rerender(AuthMessages.ALREADY_CONFIRMED, values);
            }
            throw new ProblemException(HttpStatus.INTERNAL_SERVER_ERROR, "CONFIRM_FAILED",
                    "unable to confirm user", ex);
        }

        eventJournal.tryWrite(EventName.CONFIRMED, true, username, "confirmed user");
        log.info("confirmed user username={}", username);
        sendConfirmedEmail(username);

        return HtmlResponses.seeOther("/login").build();
    }

    private void sendConfirmedEmail(String username) {
        try {
            UserProfile user = identityService.userByName(username);
            MailContent content = mailComposer.confirmed(username);
            smtpMailer.sendMessage(smtpMailer.defaultFrom(), List.of(user.email()), content.subject(), content.body());
        } catch (RuntimeException ex) {
            log.error("unable to send confirmed email username={}", username, ex);
        }
    }

    private ResponseEntity<String> rerender(String message, Map<String, String> values) {
        return HtmlResponses.page(pageRenderer.form(FormPage.CONFIRM, message, values));
    }
}
