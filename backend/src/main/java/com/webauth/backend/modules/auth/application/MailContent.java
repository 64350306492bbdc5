package com.webauth.backend.modules.auth.application;

public record MailContent(String subject, String body) {
}
