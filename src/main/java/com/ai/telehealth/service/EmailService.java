package com.ai.telehealth.service;

import com.ai.telehealth.dto.ParticipantProfile;
import com.ai.telehealth.entity.Appointment;
import jakarta.mail.internet.MimeMessage;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import jakarta.mail.MessagingException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Outgoing e-mail. Every method reports delivery as a boolean and never throws, so a
 * mail outage cannot undo the scheduling write that triggered it.
 */
@Service
public class EmailService {

    private static final Logger log = LoggerFactory.getLogger(EmailService.class);

    private static final DateTimeFormatter WHEN = DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy 'at' hh:mm a", Locale.ENGLISH);
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("hh:mm a", Locale.ENGLISH);
    private static final String SIGNATURE = "Klararety Health Platform";

    private final JavaMailSender mailSender;
    private final String fromAddress;

    public EmailService(JavaMailSender mailSender,
                        @Value("${telehealth.mail.from:no-reply@telehealth.local}") String fromAddress) {
        this.mailSender = mailSender;
        this.fromAddress = fromAddress;
    }

    /**
     * Sends a multipart/alternative message with a plain-text and an HTML body.
     */
    public boolean sendEmail(String toEmail, String subject, String htmlBody, String textBody) {
        if (StringUtils.isBlank(toEmail)) {
            log.warn("Email sending aborted: recipient address is missing (subject: {})", subject);
            return false;
        }
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");
            helper.setTo(toEmail);
            helper.setFrom(fromAddress);
            helper.setSubject(subject);
            helper.setText(StringUtils.defaultIfBlank(textBody, "Please view this email in an HTML compatible email client."), htmlBody);
            mailSender.send(message);
            log.info("Email sent to {}: {}", toEmail, subject);
            return true;
        } catch (MessagingException | MailException ex) {
            log.error("Failed to send email to {}: {}", toEmail, ex.getMessage());
            return false;
        }
    }

    public boolean sendAppointmentConfirmation(Appointment appointment, ParticipantProfile patient, ParticipantProfile provider) {
        String when = appointment.getScheduledTime().format(WHEN);
        String type = appointment.getAppointmentType().getDisplayName();
        String subject = "Appointment Confirmed: " + type + " with Dr. " + provider.lastName();

        String html = page("Appointment Confirmed",
                "<p>Dear " + escape(patient.firstName()) + ",</p>"
                        + "<p>Your appointment has been booked:</p>"
                        + details(provider, when, type));
        String text = "APPOINTMENT CONFIRMED\n\nDear " + patient.firstName() + ",\n\n"
                + "Provider: " + provider.fullName() + "\nDate/Time: " + when + "\nType: " + type + "\n\n" + SIGNATURE;
        return sendEmail(patient.email(), subject, html, text);
    }

    public boolean sendAppointmentCancellation(Appointment appointment, ParticipantProfile patient, ParticipantProfile provider) {
        String when = appointment.getScheduledTime().format(WHEN);
        String subject = "Appointment Cancelled with Dr. " + provider.lastName();

        String html = page("Appointment Cancelled",
                "<p>Dear " + escape(patient.firstName()) + ",</p>"
                        + "<p>Your appointment with <strong>" + escape(provider.fullName()) + "</strong> on "
                        + escape(when) + " has been cancelled.</p>"
                        + "<p>Please book a new slot if you still need a consultation.</p>");
        String text = "APPOINTMENT CANCELLED\n\nDear " + patient.firstName() + ",\n\n"
                + "Your appointment with " + provider.fullName() + " on " + when + " has been cancelled.\n\n" + SIGNATURE;
        return sendEmail(patient.email(), subject, html, text);
    }

    public boolean sendAppointmentRescheduled(Appointment appointment, ParticipantProfile patient,
                                              ParticipantProfile provider, LocalDateTime previousTime) {
        String when = appointment.getScheduledTime().format(WHEN);
        String before = previousTime != null ? previousTime.format(WHEN) : "N/A";
        String subject = "Appointment Rescheduled with Dr. " + provider.lastName();

        String html = page("Appointment Rescheduled",
                "<p>Dear " + escape(patient.firstName()) + ",</p>"
                        + "<p>Your appointment has been moved.</p>"
                        + "<ul><li><strong>Previous time:</strong> " + escape(before) + "</li>"
                        + "<li><strong>New time:</strong> " + escape(when) + "</li></ul>");
        String text = "APPOINTMENT RESCHEDULED\n\nDear " + patient.firstName() + ",\n\n"
                + "Previous time: " + before + "\nNew time: " + when + "\n\n" + SIGNATURE;
        return sendEmail(patient.email(), subject, html, text);
    }

    public boolean sendAccessCode(Appointment appointment, ParticipantProfile patient, ParticipantProfile provider,
                                  String accessCode, Duration validity) {
        String date = appointment.getScheduledTime().format(DATE);
        String time = appointment.getScheduledTime().format(TIME);
        long minutes = validity.toMinutes();
        String subject = "Access Code for Your Video Consultation with Dr. " + provider.lastName();

        String html = page("Video Consultation Access Code",
                "<p>Dear " + escape(patient.firstName()) + ",</p>"
                        + "<p>Here is your access code for the upcoming video consultation:</p>"
                        + "<div style='background-color:#f0f0f0;padding:10px;text-align:center;font-size:24px;"
                        + "letter-spacing:5px;font-weight:bold;'>" + escape(accessCode) + "</div>"
                        + "<ul><li><strong>Provider:</strong> " + escape(provider.fullName()) + "</li>"
                        + "<li><strong>Date:</strong> " + escape(date) + "</li>"
                        + "<li><strong>Time:</strong> " + escape(time) + "</li></ul>"
                        + "<p>This code will expire in " + minutes + " minutes.</p>");
        String text = "VIDEO CONSULTATION ACCESS CODE\n\nDear " + patient.firstName() + ",\n\n"
                + accessCode + "\n\nProvider: " + provider.fullName() + "\nDate: " + date + "\nTime: " + time
                + "\n\nThis code will expire in " + minutes + " minutes.\n\n" + SIGNATURE;
        return sendEmail(patient.email(), subject, html, text);
    }

    public boolean sendAppointmentReminder(Appointment appointment, ParticipantProfile patient, ParticipantProfile provider) {
        String when = appointment.getScheduledTime().format(WHEN);
        String type = appointment.getAppointmentType().getDisplayName();
        String subject = "Reminder: Your " + type + " with Dr. " + provider.lastName();

        String html = page("Appointment Reminder",
                "<p>Dear " + escape(patient.firstName()) + ",</p>"
                        + "<p>This is a reminder of your upcoming appointment:</p>"
                        + details(provider, when, type)
                        + "<p>If you need to reschedule, please contact us as soon as possible.</p>");
        String text = "APPOINTMENT REMINDER\n\nDear " + patient.firstName() + ",\n\n"
                + "Provider: " + provider.fullName() + "\nDate/Time: " + when + "\nType: " + type
                + "\n\nIf you need to reschedule, please contact us as soon as possible.\n\n" + SIGNATURE;
        return sendEmail(patient.email(), subject, html, text);
    }

    private static String details(ParticipantProfile provider, String when, String type) {
        return "<ul><li><strong>Provider:</strong> " + escape(provider.fullName()) + "</li>"
                + "<li><strong>Date/Time:</strong> " + escape(when) + "</li>"
                + "<li><strong>Type:</strong> " + escape(type) + "</li></ul>";
    }

    private static String page(String title, String content) {
        return "<!doctype html><html><head><meta charset='utf-8'/></head><body style='font-family:Arial,sans-serif;padding:20px;'>"
                + "<div style='max-width:600px;margin:0 auto;border:1px solid #eee;padding:20px;'>"
                + "<h2>" + escape(title) + "</h2>" + content
                + "<p>Thank you,<br>" + SIGNATURE + "</p></div></body></html>";
    }

    private static String escape(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }
}
