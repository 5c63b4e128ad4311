package com.sporehub.backend.delivery.mail;

import org.springframework.boot.autoconfigure.mail.MailProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

/**
 * Always provides a {@link JavaMailSender} (also without spring.mail.host), with socket timeouts
 * so a stalled SMTP server cannot hold a delivery thread forever.
 */
@Configuration
@EnableConfigurationProperties(MailProperties.class)
public class MailConfig {

    static final String DEFAULT_TIMEOUT_MS = "10000";

    @Bean
    public JavaMailSender javaMailSender(MailProperties p) {
        var s = new JavaMailSenderImpl();
        s.setHost(p.getHost());
        if (p.getPort() != null) s.setPort(p.getPort());
        s.setUsername(p.getUsername());
        s.setPassword(p.getPassword());
        if (p.getProtocol() != null) s.setProtocol(p.getProtocol());
        if (p.getDefaultEncoding() != null) s.setDefaultEncoding(p.getDefaultEncoding().name());

        var props = s.getJavaMailProperties();
        props.setProperty("mail.smtp.connectiontimeout", DEFAULT_TIMEOUT_MS);
        props.setProperty("mail.smtp.timeout", DEFAULT_TIMEOUT_MS);
        props.setProperty("mail.smtp.writetimeout", DEFAULT_TIMEOUT_MS);
        props.putAll(p.getProperties());
        return s;
    }
}
