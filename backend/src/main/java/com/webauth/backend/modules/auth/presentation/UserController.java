package com.webauth.backend.modules.auth.presentation;

import com.webauth.backend.modules.audit.application.EventJournal;
import com.webauth.backend.modules.auth.application.IdentityService;
import com.webauth.backend.modules.auth.application.SessionResolver;
import com.webauth.backend.modules.auth.domain.UserProfile;
import com.webauth.backend.modules.auth.presentation.view.PageRenderer;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RestController;

/**
 * Account pages. {@code /users} and {@code /events} are restricted to administrators by the security chain.
 */
@RestController
public class UserController {

    private final IdentityService identityService;
    private final EventJournal eventJournal;
    private final PageRenderer pageRenderer;

    public UserController(IdentityService identityService, EventJournal eventJournal, PageRenderer pageRenderer) {
        this.identityService = identityService;
        this.eventJournal = eventJournal;
        this.pageRenderer = pageRenderer;
    }

    @GetMapping("/user")
    public ResponseEntity<String> user(
            @RequestAttribute(name = SessionResolver.CURRENT_USER_ATTRIBUTE, required = false) UserProfile user
    ) {
        return HtmlResponses.page(pageRenderer.user(user != null ? user : UserProfile.EMPTY));
    }

    @GetMapping("/users")
    public ResponseEntity<String> users() {
        return HtmlResponses.page(pageRenderer.users(identityService.listUsers()));
    }

    @GetMapping("/events")
    public ResponseEntity<String> events() {
        return HtmlResponses.page(pageRenderer.events(eventJournal.listEvents()));
    }
}
