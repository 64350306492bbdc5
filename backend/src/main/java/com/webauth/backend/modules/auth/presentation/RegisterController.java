package com.webauth.backend.modules.auth.presentation;

import java.util.List;
import java.util.Map;

import com.webauth.backend.modules.audit.application.EventJournal;
import com.webauth.backend.modules.audit.domain.EventName;
import com.webauth.backend.modules.auth.application.AuthMailComposer;
import com.webauth.backend.modules.auth.application.IdentityService;
import com.webauth.backend.modules.auth.application.IssuedToken;
import com.webauth.backend.modules.auth.application.MailContent;
import com.webauth.backend.modules.auth.application.TokenService;
import com.webauth.backend.modules.auth.domain.TokenKind;
import com.webauth.backend.modules.auth.presentation.view.FormPage;
import com.webauth.backend.modules.auth.presentation.view.PageRenderer;
import com.webauth.backend.modules.mail.application.SmtpMailer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RegisterController {

    private static final Logger log = LoggerFactory.getLogger(RegisterController.class);

    private final IdentityService identityService;
    private final TokenService tokenService;
    private final EventJournal eventJournal;
    private final SmtpMailer smtpMailer;
    private final AuthMailComposer mailComposer;
    private final PageRenderer pageRenderer;

    public RegisterController(
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

    @GetMapping("/register")
    public ResponseEntity<String> form() {
        return HtmlResponses.page(pageRenderer.form(FormPage.REGISTER, "", Map.of()));
    }

    @PostMapping("/register")
    public ResponseEntity<String> register(
            @RequestParam(name = "username", defaultValue = "") String rawUsername,
            @RequestParam(name = "fullName", defaultValue = "") String rawFullName,
            @RequestParam(name = "email", defaultValue = "") String rawEmail,
            @RequestParam(name = "password1", defaultValue = "") String rawPassword1,
            @RequestParam(name = "password2", defaultValue = "") String rawPassword2
    ) {
        String username = HtmlResponses.trim(rawUsername);
        String fullName = HtmlResponses.trim(rawFullName);
        String email = HtmlResponses.trim(rawEmail);
        String password1 = HtmlResponses.trim(rawPassword1);
        String password2 = HtmlResponses.trim(rawPassword2);
        Map<String, String> values = Map.of("username", username, "fullName", fullName, "email", email);

        if (username.isEmpty() || fullName.isEmpty() || email.isEmpty() || password1.isEmpty() || password2.isEmpty()) {
            return rerender(AuthMessages.MISSING_REQUIRED, values);
        }
        if (!SmtpMailer.isValidAddress(email)) {
            return rerender(AuthMessages.INVALID_EMAIL, values);
        }
        if (!password1.equals(password2)) {
            return rerender(AuthMessages.PASSWORD_MISMATCH, values);
        }
        if (identityService.existsByUsername(username)) {
            log.warn("registration rejected, username exists username={}", username);
            eventJournal.tryWrite(EventName.REGISTER, false, username, "username already exists");
            return rerender(AuthMessages.USERNAME_EXISTS, values);
        }
        if (identityService.existsByEmail(email)) {
            log.warn("registration rejected, email exists username={}", username);
            eventJournal.tryWrite(EventName.REGISTER, false, username, "email already exists: " + email);
            return rerender(AuthMessages.EMAIL_EXISTS, values);
        }

        try {
            identityService.register(username, fullName, email, password1);
        } catch (RuntimeException ex) {
            eventJournal.tryWrite(EventName.REGISTER, false, username, "registration failed");
            throw ex;
        }
        log.info("registered user username={}", username);
        eventJournal.tryWrite(EventName.REGISTER, true, username, "registered user");
        sendRegistrationEmail(username, fullName, email);

        return HtmlResponses.seeOther("/login").build();
    }

    private void sendRegistrationEmail(String username, String fullName, String email) {
        try {
            IssuedToken token = tokenService.issue(TokenKind.CONFIRM, username);
            eventJournal.tryWrite(EventName.SAVE_TOKEN, true, username, "saved confirm token");
            MailContent content = mailComposer.registration(fullName, username, token);
            smtpMailer.sendMessage(smtpMailer.defaultFrom(), List.of(email), content.subject(), content.body());
        } catch (RuntimeException ex) {
            log.error("unable to send registration email username={}", username, ex);
        }
    }

    private ResponseEntity<String> rerender(String message, Map<String, String> values) {
        return HtmlResponses.page(pageRenderer.form(FormPage.REGISTER, message, values));
    }
}
