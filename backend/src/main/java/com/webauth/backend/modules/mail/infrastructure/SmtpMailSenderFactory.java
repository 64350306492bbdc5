package com.webauth.backend.modules.mail.infrastructure;

import java.nio.charset.StandardCharsets;
import java.util.Properties;

import com.webauth.backend.global.config.WebAuthProperties;
import com.webauth.backend.modules.mail.application.MailSenderFactory;

import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.stereotype.Component;

@Component
public class SmtpMailSenderFactory implements MailSenderFactory {

    @Override
    public JavaMailSender create(WebAuthProperties.Smtp smtp) {
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(smtp.host());
        if (smtp.port() != null) {
            sender.setPort(smtp.port());
        }
        sender.setUsername(smtp.username());
        sender.setPassword(smtp.password());
        sender.setDefaultEncoding(StandardCharsets.UTF_8.name());

        Properties props = sender.getJavaMailProperties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.auth.mechanisms", "PLAIN");
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.connectiontimeout", "10000");
        props.put("mail.smtp.timeout", "10000");
        return sender;
    }
}
