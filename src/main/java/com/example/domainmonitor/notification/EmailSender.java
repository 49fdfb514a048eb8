package com.example.domainmonitor.notification;

import com.example.domainmonitor.domain.ChannelConfig;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

import java.io.UnsupportedEncodingException;

/**
 * Sends HTML email through Spring's {@link JavaMailSender}.
 */
@Slf4j
@RequiredArgsConstructor
public class EmailSender implements ChannelSender {

    private final JavaMailSender mailSender;
    private final String fromAddress;
    private final String fromName;

    @Override
    public ChannelConfig.ChannelType channelType() {
        return ChannelConfig.ChannelType.EMAIL;
    }

    @Override
    public void send(String address, NotificationMessage message) {
        try {
            MimeMessage mime = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, false, "UTF-8");
            helper.setFrom(fromAddress, fromName);
            helper.setTo(address);
            helper.setSubject(message.subject());
            helper.setText(message.html(), true);
            mailSender.send(mime);
            log.debug("Email '{}' sent to {}", message.subject(), address);
        } catch (MessagingException | UnsupportedEncodingException | MailException e) {
            throw new NotificationException("Failed to send email to " + address + ": " + e.getMessage(), e);
        }
    }
}
