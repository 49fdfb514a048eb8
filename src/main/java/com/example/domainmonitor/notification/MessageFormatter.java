package com.example.domainmonitor.notification;

import com.example.domainmonitor.config.MonitorProperties;
import com.example.domainmonitor.domain.Domain;
import com.example.domainmonitor.domain.NotificationType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Renders status notifications for chat and email.
 */
@Component
public class MessageFormatter {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String FOOTER = "This is an automated message from your Domain Monitoring Service.";

    private final ZoneId displayZone;
    private final int slowResponseMillis;

    @Autowired
    public MessageFormatter(MonitorProperties properties) {
        this(ZoneId.of(properties.getNotifications().getDisplayZone()),
                properties.getNotifications().getSlowResponseMillis());
    }

    MessageFormatter(ZoneId displayZone, int slowResponseMillis) {
        this.displayZone = displayZone;
        this.slowResponseMillis = slowResponseMillis;
    }

    public NotificationMessage format(Domain domain, NotificationType type) {
        String emoji = emoji(domain, type);
        String headline = switch (type) {
            case DOWN -> "Domain " + domain.getName() + " is unreachable";
            case UP -> "Domain " + domain.getName() + " is back to normal";
            case STATUS -> "Domain " + domain.getName() + " status update";
        };
        String lastCheck = lastCheck(domain.getLastCheckAt());

        StringBuilder text = new StringBuilder()
                .append(emoji).append(' ').append(headline).append("\n\n")
                .append("Status: ").append(domain.getLastStatus()).append('\n');
        if (type == NotificationType.DOWN) {
            text.append("Error: ").append(nullToEmpty(domain.getErrorDescription())).append('\n');
        }
        text.append("Response time: ").append(domain.getTotalTime()).append("ms\n")
                .append("Last check: ").append(lastCheck);

        return new NotificationMessage(emoji + " " + headline, text.toString(), html(domain, type, emoji, headline, lastCheck));
    }

    String emoji(Domain domain, NotificationType type) {
        return switch (type) {
            case DOWN -> "🔴";
            case UP, STATUS -> domain.getTotalTime() > slowResponseMillis ? "🟠" : "🟢";
        };
    }

    String lastCheck(Instant checkedAt) {
        if (checkedAt == null) {
            return "never";
        }
        return TIME_FORMAT.format(checkedAt.atZone(displayZone)) + " (" + offsetLabel(checkedAt) + ")";
    }

    private String offsetLabel(Instant at) {
        ZoneOffset offset = displayZone.getRules().getOffset(at);
        int totalMinutes = offset.getTotalSeconds() / 60;
        if (totalMinutes == 0) {
            return "UTC";
        }
        String sign = totalMinutes > 0 ? "+" : "-";
        int hours = Math.abs(totalMinutes) / 60;
        int minutes = Math.abs(totalMinutes) % 60;
        return minutes == 0 ? "UTC" + sign + hours : String.format("UTC%s%d:%02d", sign, hours, minutes);
    }

    private String html(Domain domain, NotificationType type, String emoji, String headline, String lastCheck) {
        String color = switch (type) {
            case DOWN -> "#e74c3c";
            case UP -> "#27ae60";
            case STATUS -> "#3498db";
        };
        StringBuilder html = new StringBuilder()
                .append("<!DOCTYPE html><html><head><meta charset=\"UTF-8\"></head><body>")
                .append("<h2 style=\"color: ").append(color).append(";\">")
                .append(emoji).append(' ').append(escape(headline)).append("</h2>")
                .append("<p><strong>Status Code:</strong> ").append(domain.getLastStatus()).append("</p>");
        if (type == NotificationType.DOWN) {
            html.append("<p><strong>Error:</strong> ").append(escape(nullToEmpty(domain.getErrorDescription())))
                    .append("</p>");
        }
        return html.append("<p><strong>Response Time:</strong> ").append(domain.getTotalTime()).append("ms</p>")
                .append("<p><strong>Last Check:</strong> ").append(escape(lastCheck)).append("</p>")
                .append("<p style=\"color: #888;\">").append(FOOTER).append("</p>")
                .append("</body></html>")
                .toString();
    }

    private static String escape(String value) {
        return value.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
