package com.webauth.backend.modules.auth.presentation;

import java.util.Map;

import com.webauth.backend.modules.audit.application.EventJournal;
import com.webauth.backend.modules.audit.domain.EventName;
import com.webauth.backend.modules.auth.application.AuthError;
import com.webauth.backend.modules.auth.application.AuthException;
import com.webauth.backend.modules.auth.application.IdentityService;
import com.webauth.backend.modules.auth.application.TokenService;
import com.webauth.backend.modules.auth.domain.TokenKind;
import com.webauth.backend.modules.auth.presentation.view.FormPage;
import com.webauth.backend.modules.auth.presentation.view.PageRenderer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ResetController {

    private static final Logger log = LoggerFactory.getLogger(ResetController.class);

    private final IdentityService identityService;
    private final TokenService tokenService;
    private final EventJournal eventJournal;
    private final PageRenderer pageRenderer;

    public ResetController(
            IdentityService identityService,
            TokenService tokenService,
            EventJournal eventJournal,
            PageRenderer pageRenderer
    ) {
        this.identityService = identityService;
        this.tokenService = tokenService;
        this.eventJournal = eventJournal;
        this.pageRenderer = pageRenderer;
    }

    @GetMapping("/reset")
    public ResponseEntity<String> form(@RequestParam(name = "rtoken", defaultValue = "") String resetToken) {
        return HtmlResponses.page(pageRenderer.form(FormPage.RESET, "", Map.of("rtoken", resetToken)));
    }

    @PostMapping("/reset")
    public ResponseEntity<String> reset(
            @RequestParam(name = "rtoken", defaultValue = "") String rawToken,
            @RequestParam(name = "password1", defaultValue = "") String rawPassword1,
            @RequestParam(name = "password2", defaultValue = "") String rawPassword2
    ) {
        String resetToken = HtmlResponses.trim(rawToken);
        String password1 = HtmlResponses.trim(rawPassword1);
        String password2 = HtmlResponses.trim(rawPassword2);
        Map<String, String> values = Map.of("rtoken", resetToken);

        if (resetToken.isEmpty() || password1.isEmpty() || password2.isEmpty()) {
            return rerender(AuthMessages.MISSING_REQUIRED, values);
        }
        if (!password1.equals(password2)) {
            return rerender(AuthMessages.PASSWORD_MISMATCH, values);
        }

        String username;
        try {
            username = tokenService.consume(TokenKind.RESET, resetToken);
        } catch (AuthException ex) {
            String message;
            if (ex.is(AuthError.USER_NOT_FOUND) || ex.is(AuthError.TOKEN_NOT_FOUND)) {
                message = AuthMessages.INVALID_RESET_TOKEN;
            } else if (ex.is(AuthError.RESET_TOKEN_EXPIRED)) {
                message = AuthMessages.EXPIRED_RESET_TOKEN;
            } else {
                throw ex;
            }
            log.warn("password reset rejected reason={}", ex.getCode());
            eventJournal.tryWrite(EventName.RESET_PASS, false, "", ex.getError().message());
            return rerender(message, values);
        }

        identityService.updatePassword(username, password1);
        eventJournal.tryWrite(EventName.RESET_PASS, true, username, "password reset");
        log.info("password reset username={}", username);

        return HtmlResponses.seeOther("/login").build();
    }

    private ResponseEntity<String> rerender(String message, Map<String, String> values) {
        return HtmlResponses.page(pageRenderer.form(FormPage.RESET, message, values));
    }
}
