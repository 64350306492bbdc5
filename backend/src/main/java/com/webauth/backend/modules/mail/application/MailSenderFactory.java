package com.webauth.backend.modules.mail.application;

import com.webauth.backend.global.config.WebAuthProperties;

import org.springframework.mail.javamail.JavaMailSender;

/**
 * Builds the transport used for submission from the configured SMTP account.
 */
public interface MailSenderFactory {

    JavaMailSender create(WebAuthProperties.Smtp smtp);
}
