package com.webauth.backend.modules.auth.presentation;

import java.util.Map;

import com.webauth.backend.global.security.SessionCookies;
import com.webauth.backend.global.web.LocalRedirectValidator;
import com.webauth.backend.modules.audit.application.EventJournal;
import com.webauth.backend.modules.audit.domain.EventName;
import com.webauth.backend.modules.auth.application.AuthError;
import com.webauth.backend.modules.auth.application.AuthException;
import com.webauth.backend.modules.auth.application.IdentityService;
import com.webauth.backend.modules.auth.application.IssuedToken;
import com.webauth.backend.modules.auth.application.TokenService;
import com.webauth.backend.modules.auth.domain.TokenKind;
import com.webauth.backend.modules.auth.presentation.view.FormPage;
import com.webauth.backend.modules.auth.presentation.view.PageRenderer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class LoginController {

    private static final Logger log = LoggerFactory.getLogger(LoginController.class);

    private final IdentityService identityService;
    private final TokenService tokenService;
    private final EventJournal eventJournal;
    private final SessionCookies sessionCookies;
    private final PageRenderer pageRenderer;

    public LoginController(
            IdentityService identityService,
            TokenService tokenService,
            EventJournal eventJournal,
            SessionCookies sessionCookies,
            PageRenderer pageRenderer
    ) {
        this.identityService = identityService;
        this.tokenService = tokenService;
        this.eventJournal = eventJournal;
        this.sessionCookies = sessionCookies;
        this.pageRenderer = pageRenderer;
    }

    @GetMapping("/login")
    public ResponseEntity<String> form(@RequestParam(name = "r", defaultValue = "") String redirect) {
        return HtmlResponses.page(pageRenderer.form(FormPage.LOGIN, "", Map.of("r", redirect)));
    }

    @PostMapping("/login")
    public ResponseEntity<String> login(
            @RequestParam(name = "username", defaultValue = "") String rawUsername,
            @RequestParam(name = "password", defaultValue = "") String rawPassword,
            @RequestParam(name = "remember", defaultValue = "") String rawRemember,
            @RequestParam(name = "r", defaultValue = "") String redirect
    ) {
        String username = HtmlResponses.trim(rawUsername);
        String password = HtmlResponses.trim(rawPassword);
        boolean remember = !HtmlResponses.trim(rawRemember).isEmpty();
        Map<String, String> values = Map.of("username", username, "r", redirect);

        String missing = missingFieldMessage(username, password);
        if (missing != null) {
            return HtmlResponses.page(pageRenderer.form(FormPage.LOGIN, missing, values));
        }

        try {
            identityService.authenticate(username, password);
        } catch (AuthException ex) {
            if (!ex.is(AuthError.USER_NOT_FOUND) && !ex.is(AuthError.INCORRECT_PASSWORD)) {
                throw ex;
            }
            log.warn("login failed username={} reason={}", username, ex.getCode());
            eventJournal.tryWrite(EventName.LOGIN, false, username, ex.getError().message());
            return HtmlResponses.page(pageRenderer.form(FormPage.LOGIN, AuthMessages.LOGIN_FAILED, values));
        }

        IssuedToken session = tokenService.issue(TokenKind.SESSION, username);
        eventJournal.tryWrite(EventName.LOGIN, true, username, "logged in");
        log.info("login succeeded username={} remember={}", username, remember);

        return HtmlResponses.seeOther(LocalRedirectValidator.safeOrDefault(redirect))
                .header(HttpHeaders.SET_COOKIE, sessionCookies.issue(session, remember).toString())
                .build();
    }

    private static String missingFieldMessage(String username, String password) {
        if (username.isEmpty() && password.isEmpty()) {
            return AuthMessages.MISSING_USERNAME_AND_PASSWORD;
        }
        if (username.isEmpty()) {
            return AuthMessages.MISSING_USERNAME;
        }
        if (password.isEmpty()) {
            return AuthMessages.MISSING_PASSWORD;
        }
        return null;
    }
}
