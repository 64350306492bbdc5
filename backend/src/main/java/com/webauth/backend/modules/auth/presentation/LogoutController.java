package com.webauth.backend.modules.auth.presentation;

import com.webauth.backend.global.security.SessionCookies;
import com.webauth.backend.modules.audit.application.EventJournal;
import com.webauth.backend.modules.audit.domain.EventName;
import com.webauth.backend.modules.auth.application.AuthError;
import com.webauth.backend.modules.auth.application.AuthException;
import com.webauth.backend.modules.auth.application.SessionResolver;
import com.webauth.backend.modules.auth.application.TokenService;
import com.webauth.backend.modules.auth.domain.TokenKind;
import com.webauth.backend.modules.auth.domain.UserProfile;
import com.webauth.backend.modules.auth.presentation.view.PageRenderer;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class LogoutController {

    private static final Logger log = LoggerFactory.getLogger(LogoutController.class);

    private final TokenService tokenService;
    private final EventJournal eventJournal;
    private final SessionCookies sessionCookies;
    private final PageRenderer pageRenderer;

    public LogoutController(
            TokenService tokenService,
            EventJournal eventJournal,
            SessionCookies sessionCookies,
            PageRenderer pageRenderer
    ) {
        this.tokenService = tokenService;
        this.eventJournal = eventJournal;
        this.sessionCookies = sessionCookies;
        this.pageRenderer = pageRenderer;
    }

    @GetMapping("/logout")
    public ResponseEntity<String> logout(
            HttpServletRequest request,
            @RequestAttribute(name = SessionResolver.CURRENT_USER_ATTRIBUTE, required = false) UserProfile user
    ) {
        String sessionValue = sessionCookies.read(request);
        if (!sessionValue.isEmpty()) {
            try {
                tokenService.remove(TokenKind.SESSION, sessionValue);
            } catch (AuthException ex) {
                if (!ex.is(AuthError.TOKEN_NOT_FOUND)) {
                    throw ex;
                }
                log.debug("session already gone at logout");
            }
        }
        String username = user != null ? user.username() : "";
        eventJournal.tryWrite(EventName.LOGOUT, true, username, "logged out");

        return ResponseEntity.ok()
                .contentType(HtmlResponses.TEXT_HTML_UTF8)
                .header(HttpHeaders.SET_COOKIE, sessionCookies.clear().toString())
                .body(pageRenderer.notice("Logout", AuthMessages.LOGGED_OUT));
    }
}
