package com.webauth.backend.modules.auth.presentation.view;

public enum FormPage {
    REGISTER("Register", "/register"),
    LOGIN("Login", "/login"),
    FORGOT("Forgot", "/forgot"),
    CONFIRM_REQUEST("Confirm Request", "/confirm_request"),
    RESET("Reset Password", "/reset"),
    CONFIRM("Confirm", "/confirm");

    private final String title;
    private final String action;

    FormPage(String title, String action) {
        this.title = title;
        this.action = action;
    }

    public String title() {
        return title;
    }

    public String action() {
        return action;
    }
}
