package com.medsuy.notificationservice.service;

import com.medsuy.common.contracts.AppointmentReservedContract;
import com.medsuy.notificationservice.config.NotificationProperties;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;

/**
 * Builds the reservation confirmation email. Event fields are HTML-escaped.
 */
@Component
@RequiredArgsConstructor
public class AppointmentEmailComposer {

    private static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm");
    private static final String MISSING = "-";

    private final NotificationProperties properties;

    public EmailContent composeReservationConfirmation(AppointmentReservedContract event) {
        String datetime = event.getDatetime() != null ? event.getDatetime().format(DATETIME_FORMAT) : MISSING;

        String html = "<h2>Tu turno fue reservado correctamente</h2>"
                + "<p><strong>Especialidad:</strong> " + escape(event.getSpecialty()) + "</p>"
                + "<p><strong>Médico:</strong> " + escape(event.getDoctor()) + "</p>"
                + "<p><strong>Fecha y hora:</strong> " + datetime + "</p>"
                + "<p><strong>Sucursal:</strong> " + escape(event.getBranch()) + "</p>"
                + "<br>"
                + "<p>Gracias por usar MedSUY</p>";

        return new EmailContent(properties.getMail().getReservationSubject(), html);
    }

    private static String escape(String value) {
        return value == null || value.isBlank() ? MISSING : HtmlUtils.htmlEscape(value, StandardCharsets.UTF_8.name());
    }

    @Value
    public static class EmailContent {
        String subject;
        String htmlBody;
    }
}
