package com.medsuy.notificationservice.service;

/**
 * Outbound email transport.
 *
 * Implementations throw {@link org.springframework.mail.MailException} subtypes on
 * failure. MailSendException is treated as transient; parse, authentication and
 * preparation failures are treated as permanent.
 */
public interface EmailSender {

    void send(String to, String subject, String htmlBody);
}
