package com.example.domainmonitor.notification;

import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;

@ExtendWith(MockitoExtension.class)
class EmailSenderTest {

    private final NotificationMessage message =
            new NotificationMessage("🔴 Domain example.com is unreachable", "plain", "<h2>down</h2>");

    @Mock
    private JavaMailSender mailSender;

    @Test
    void sendsHtmlFromTheConfiguredSender() throws Exception {
        // given
        given(mailSender.createMimeMessage()).willReturn(new MimeMessage(Session.getInstance(new Properties())));
        EmailSender sender = new EmailSender(mailSender, "monitor@example.com", "Domain Monitor");

        // when
        sender.send("ops@example.com", message);

        // then
        ArgumentCaptor<MimeMessage> captor = ArgumentCaptor.forClass(MimeMessage.class);
        then(mailSender).should().send(captor.capture());
        MimeMessage sent = captor.getValue();
        assertThat(sent.getSubject()).isEqualTo("🔴 Domain example.com is unreachable");
        InternetAddress from = (InternetAddress) sent.getFrom()[0];
        assertThat(from.getAddress()).isEqualTo("monitor@example.com");
        assertThat(from.getPersonal()).isEqualTo("Domain Monitor");
        assertThat(sent.getAllRecipients()[0].toString()).isEqualTo("ops@example.com");
        assertThat(sent.getContent().toString()).contains("<h2>down</h2>");
    }

    @Test
    void mailFailuresBecomeNotificationExceptions() {
        // given
        given(mailSender.createMimeMessage()).willReturn(new MimeMessage(Session.getInstance(new Properties())));
        willThrow(new MailSendException("connection refused")).given(mailSender).send(any(MimeMessage.class));
        EmailSender sender = new EmailSender(mailSender, "monitor@example.com", "Domain Monitor");

        // when / then
        assertThatThrownBy(() -> sender.send("ops@example.com", message))
                .isInstanceOf(NotificationException.class)
                .hasMessageContaining("ops@example.com")
                .hasCauseInstanceOf(MailSendException.class);
    }
}
