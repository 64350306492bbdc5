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
public class ConfirmRequestController {

    static final String CONFIRM_REQUEST_ACTION = "confirm_request";

    private static final Logger log = LoggerFactory.getLogger(ConfirmRequestController.class);

    private final IdentityService identityService;
    private final TokenService tokenService;
    private final EventJournal eventJournal;
    private final SmtpMailer smtpMailer;
    private final AuthMailComposer mailComposer;
    private final PageRenderer pageRenderer;

    public ConfirmRequestController(
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

    @GetMapping("/confirm_request")
    public ResponseEntity<String> form() {
        return HtmlResponses.page(pageRenderer.form(FormPage.CONFIRM_REQUEST, "", Map.of()));
    }

    @PostMapping("/confirm_request")
    public ResponseEntity<String> confirmRequest(
            @RequestParam(name = "email", defaultValue = "") String rawEmail,
            @RequestParam(name = "action", defaultValue = "") String rawAction
    ) {
        String email = HtmlResponses.trim(rawEmail);
        String action = HtmlResponses.trim(rawAction);
        Map<String, String> values = Map.of("email", email);

        if (action.isEmpty()) {
            return rerender(AuthMessages.MISSING_ACTION, values);
        }
        if (email.isEmpty()) {
            return rerender(AuthMessages.MISSING_EMAIL, values);
        }
        if (!CONFIRM_REQUEST_ACTION.equals(action)) {
            log.warn("confirm request rejected, invalid action={}", action);
            return rerender(AuthMessages.INVALID_ACTION, values);
        }

        String username = ForgotController.usernameOrEmpty(identityService, email);
        IssuedToken token = tokenService.issue(TokenKind.CONFIRM, username);
        if (!token.isEmpty()) {
            eventJournal.tryWrite(EventName.SAVE_TOKEN, true, username, "saved confirm token");
        }

        MailContent content = mailComposer.confirmRequest(email, username, token);
        smtpMailer.sendMessage(smtpMailer.defaultFrom(), List.of(email), content.subject(), content.body());
        log.info("confirm request handled registered={}", !username.isEmpty());

        return HtmlResponses.page(pageRenderer.notice("Confirm Request", AuthMessages.CONFIRM_REQUEST_SENT));
    }

    private ResponseEntity<String> rerender(String message, Map<String, String> values) {
        return HtmlResponses.page(pageRenderer.form(FormPage.CONFIRM_REQUEST, message, values));
    }
}
