package com.webauth.backend.modules.auth.presentation.view;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

import com.webauth.backend.global.config.WebAuthProperties;
import com.webauth.backend.modules.audit.domain.AuthEvent;
import com.webauth.backend.modules.auth.domain.UserProfile;

import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

@Component
public class HtmlPageRenderer implements PageRenderer {

    private final String appName;

    public HtmlPageRenderer(WebAuthProperties properties) {
        this.appName = properties.appName();
    }

    @Override
    public String form(FormPage page, String message, Map<String, String> values) {
        StringBuilder body = new StringBuilder();
        messageBlock(body, message);
        body.append("<form method=\"post\" action=\"").append(escape(formAction(page, values))).append("\">\n");
        switch (page) {
            case REGISTER -> {
                input(body, "text", "username", "User Name", values);
                input(body, "text", "fullName", "Full Name", values);
                input(body, "email", "email", "Email", values);
                input(body, "password", "password1", "Password", null);
                input(body, "password", "password2", "Confirm Password", null);
            }
            case LOGIN -> {
                input(body, "text", "username", "User Name", values);
                input(body, "password", "password", "Password", null);
                body.append("<label><input type=\"checkbox\" name=\"remember\"> Remember me</label>\n");
            }
            case FORGOT -> {
                input(body, "email", "email", "Email", values);
                body.append("<label><input type=\"radio\" name=\"action\" value=\"user\"> Forgot user name</label>\n");
                body.append("<label><input type=\"radio\" name=\"action\" value=\"password\"> Forgot password</label>\n");
            }
            case CONFIRM_REQUEST -> {
                input(body, "email", "email", "Email", values);
                hidden(body, "action", "confirm_request");
            }
            case RESET -> {
                hidden(body, "rtoken", value(values, "rtoken"));
                input(body, "password", "password1", "New Password", null);
                input(body, "password", "password2", "Confirm Password", null);
            }
            case CONFIRM -> input(body, "text", "ctoken", "Token", values);
        }
        body.append("<button type=\"submit\">").append(escape(page.title())).append("</button>\n");
        body.append("</form>\n");
        return document(page.title(), body);
    }

    @Override
    public String notice(String title, String message) {
        StringBuilder body = new StringBuilder();
        body.append("<p>").append(escape(message)).append("</p>\n");
        return document(title, body);
    }

    @Override
    public String user(UserProfile user) {
        StringBuilder body = new StringBuilder();
        if (user.isEmpty()) {
            body.append("<p>You are not logged in. <a href=\"/login\">Login</a></p>\n");
            return document("User", body);
        }
        body.append("<dl>\n");
        term(body, "User Name", user.username());
        term(body, "Full Name", user.fullName());
        term(body, "Email", user.email());
        term(body, "Confirmed", String.valueOf(user.confirmed()));
        term(body, "Admin", String.valueOf(user.admin()));
        term(body, "Created", format(user.created()));
        if (user.lastLogin().isPresent()) {
            term(body, "Last Login", format(user.lastLogin().time()) + " (" + user.lastLogin().result() + ")");
        }
        body.append("</dl>\n<p><a href=\"/logout\">Logout</a></p>\n");
        return document("User", body);
    }

    @Override
    public String users(List<UserProfile> users) {
        StringBuilder body = new StringBuilder("<table>\n");
        row(body, "th", "User Name", "Full Name", "Email", "Admin", "Confirmed", "Created");
        for (UserProfile user : users) {
            row(body, "td", user.username(), user.fullName(), user.email(), String.valueOf(user.admin()),
                    String.valueOf(user.confirmed()), format(user.created()));
        }
        body.append("</table>\n");
        return document("Users", body);
    }

    @Override
    public String events(List<AuthEvent> events) {
        StringBuilder body = new StringBuilder("<table>\n");
        row(body, "th", "Name", "Success", "User Name", "Message", "Created");
        for (AuthEvent event : events) {
            row(body, "td", event.getName().value(), String.valueOf(event.isSuccess()), event.getUsername(),
                    event.getMessage(), format(event.getCreated()));
        }
        body.append("</table>\n");
        return document("Events", body);
    }

    private String document(String title, StringBuilder body) {
        return "<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"utf-8\">\n<title>"
                + escape(appName + " - " + title) + "</title>\n</head>\n<body>\n<h1>" + escape(title) + "</h1>\n"
                + body + "</body>\n</html>\n";
    }

    private static String formAction(FormPage page, Map<String, String> values) {
        String redirect = value(values, "r");
        if (page == FormPage.LOGIN && !redirect.isEmpty()) {
            return page.action() + "?r=" + URLEncoder.encode(redirect, StandardCharsets.UTF_8);
        }
        return page.action();
    }

    private static void messageBlock(StringBuilder body, String message) {
        if (message != null && !message.isEmpty()) {
            body.append("<p class=\"message\">").append(escape(message)).append("</p>\n");
        }
    }

    private static void input(StringBuilder body, String type, String name, String label, Map<String, String> values) {
        body.append("<label>").append(escape(label)).append(" <input type=\"").append(type)
                .append("\" name=\"").append(name).append("\"");
        String current = value(values, name);
        if (!current.isEmpty()) {
            body.append(" value=\"").append(escape(current)).append("\"");
        }
        body.append("></label>\n");
    }

    private static void hidden(StringBuilder body, String name, String value) {
        body.append("<input type=\"hidden\" name=\"").append(name).append("\" value=\"")
                .append(escape(value)).append("\">\n");
    }

    private static void term(StringBuilder body, String term, String description) {
        body.append("<dt>").append(escape(term)).append("</dt><dd>").append(escape(description)).append("</dd>\n");
    }

    private static void row(StringBuilder body, String cell, String... values) {
        body.append("<tr>");
        for (String value : values) {
            body.append('<').append(cell).append('>').append(escape(value)).append("</").append(cell).append('>');
        }
        body.append("</tr>\n");
    }

    private static String value(Map<String, String> values, String name) {
        if (values == null) {
            return "";
        }
        String value = values.get(name);
        return value != null ? value : "";
    }

    private static String format(OffsetDateTime time) {
        return time != null ? time.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME) : "";
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
