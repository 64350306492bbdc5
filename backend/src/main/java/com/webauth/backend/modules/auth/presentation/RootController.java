package com.webauth.backend.modules.auth.presentation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {

    @GetMapping("/")
    public ResponseEntity<Void> root() {
        return HtmlResponses.found("/user");
    }

    /**
     * Well-known URL for changing passwords, used by password managers.
     */
    @GetMapping("/.well-known/change-password")
    public ResponseEntity<Void> changePassword() {
        return HtmlResponses.found("/forgot");
    }
}
