package com.webauth.backend.modules.auth.presentation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.webauth.backend.modules.audit.application.EventJournal;
import com.webauth.backend.modules.audit.domain.EventName;
import com.webauth.backend.modules.auth.application.AuthError;
import com.webauth.backend.modules.auth.application.AuthException;
import com.webauth.backend.modules.auth.application.AuthMailComposer;
import com.webauth.backend.modules.auth.application.ForgotAction;
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

/**
 * Username reminder and password reset requests. The outcome page never reveals whether the
 * address is registered.
 */
@RestController
public class ForgotController {

    private static final Logger log = LoggerFactory.getLogger(ForgotController.class);

    private final IdentityService identityService;
    private final TokenService tokenService;
    private final EventJournal eventJournal;
    private final SmtpMailer smtpMailer;
    private final AuthMailComposer mailComposer;
    private final PageRenderer pageRenderer;

    public ForgotController(
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

    @GetMapping("/forgot")
    public ResponseEntity<String> form() {
        return HtmlResponses.page(pageRenderer.form(FormPage.FORGOT, "", Map.of()));
    }

    @PostMapping("/forgot")
    public ResponseEntity<String> forgot(
            @RequestParam(name = "email", defaultValue = "") String rawEmail,
            @RequestParam(name = "action", defaultValue = "") String rawAction
    ) {
        String email = HtmlResponses.trim(rawEmail);
        String actionValue = HtmlResponses.trim(rawAction);
        Map<String, String> values = Map.of("email", email);

        if (actionValue.isEmpty()) {
            return rerender(AuthMessages.MISSING_ACTION, values);
        }
        if (email.isEmpty()) {
            return rerender(AuthMessages.MISSING_EMAIL, values);
        }
        Optional<ForgotAction> action = ForgotAction.parse(actionValue);
        if (action.isEmpty()) {
            log.warn("forgot rejected, invalid action={}", actionValue);
            return rerender(AuthMessages.INVALID_ACTION, values);
        }

        String username = usernameOrEmpty(identityService, email);
        IssuedToken token = tokenService.issue(TokenKind.RESET, username);
        if (!token.isEmpty()) {
            eventJournal.tryWrite(EventName.SAVE_TOKEN, true, username, "saved reset token");
        }

        MailContent content = mailComposer.forgot(action.get(), email, username, token);
        smtpMailer.sendMessage(smtpMailer.defaultFrom(), List.of(email), content.subject(), content.body());
        log.info("forgot {} request handled registered={}", action.get().value(), !username.isEmpty());

        return HtmlResponses.page(pageRenderer.notice("Forgot", AuthMessages.FORGOT_SENT));
    }

    /**
     * An unregistered address continues with an empty username so the response looks the same.
     */
    static String usernameOrEmpty(IdentityService identityService, String email) {
        try {
            return identityService.usernameByEmail(email);
        } catch (AuthException ex) {
            if (!ex.is(AuthError.USER_NOT_FOUND)) {
                throw ex;
            }
            log.debug("no user registered for the requested email");
            return "";
        }
    }

    private ResponseEntity<String> rerender(String message, Map<String, String> values) {
        return HtmlResponses.page(pageRenderer.form(FormPage.FORGOT, message, values));
    }
}
