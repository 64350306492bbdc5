package com.webauth.backend.modules.auth.presentation.view;

import java.util.List;
import java.util.Map;

import com.webauth.backend.modules.audit.domain.AuthEvent;
import com.webauth.backend.modules.auth.domain.UserProfile;

/**
 * Produces the HTML documents served by the auth flows. All values are escaped by implementations.
 */
public interface PageRenderer {

    /**
     * @param values previously submitted, non-secret field values to echo back
     */
    String form(FormPage page, String message, Map<String, String> values);

    String notice(String title, String message);

    String user(UserProfile user);

    String users(List<UserProfile> users);

    String events(List<AuthEvent> events);
}
