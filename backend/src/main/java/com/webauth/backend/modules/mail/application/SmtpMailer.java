package com.webauth.backend.modules.mail.application;

import java.util.ArrayList;
import java.util.List;

import com.webauth.backend.global.config.WebAuthProperties;

import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

/**
 * Plain-text mail submission over authenticated SMTP.
 * Configuration and addresses are validated before any connection is attempted.
 */
@Service
public class SmtpMailer {

    private static final Logger log = LoggerFactory.getLogger(SmtpMailer.class);

    private final WebAuthProperties.Smtp smtp;
    private final JavaMailSender mailSender;

    public SmtpMailer(WebAuthProperties properties, MailSenderFactory mailSenderFactory) {
        this.smtp = properties.smtp();
        this.mailSender = mailSenderFactory.create(smtp);
        log.info("mailer configured smtp={}", smtp);
    }

    /**
     * Address of the configured SMTP account, used as the sender for every outgoing message.
     */
    public String defaultFrom() {
        return smtp.username();
    }

    public void sendMessage(String from, List<String> recipients, String subject, String body) {
        if (!smtp.isValid()) {
            throw new MailerException(MailerError.INVALID_CONFIG);
        }
        InternetAddress fromAddress = parseAddress(from, MailerError.INVALID_FROM);
        if (recipients == null || recipients.isEmpty()) {
            throw new MailerException(MailerError.NO_RECIPIENTS);
        }
        List<InternetAddress> toAddresses = new ArrayList<>(recipients.size());
        for (String recipient : recipients) {
            toAddresses.add(parseAddress(recipient, MailerError.INVALID_RECIPIENT));
        }

        try {
            MimeMessage message = mailSender.createMimeMessage();
            message.setFrom(fromAddress);
            message.setRecipients(Message.RecipientType.TO, toAddresses.toArray(new InternetAddress[0]));
            message.setSubject(subject, "UTF-8");
            message.setText(body, "UTF-8");
            mailSender.send(message);
        } catch (MessagingException | MailException ex) {
            throw new MailerException(MailerError.SEND_FAILED, ex.getMessage(), ex);
        }
        log.info("sent email to={} subject={}", recipients, subject);
    }

    /**
     * RFC 5322 syntax check without any delivery attempt.
     */
    public static boolean isValidAddress(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        try {
            new InternetAddress(value, true);
            return true;
        } catch (AddressException ex) {
            return false;
        }
    }

    private static InternetAddress parseAddress(String value, MailerError error) {
        if (value == null || value.isBlank()) {
            throw new MailerException(error, "empty address", null);
        }
        try {
            return new InternetAddress(value, true);
        } catch (AddressException ex) {
            throw new MailerException(error, value, ex);
        }
    }
}
