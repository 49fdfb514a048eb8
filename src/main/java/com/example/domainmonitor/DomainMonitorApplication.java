package com.example.domainmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Domain Monitor - availability monitoring through external uptime providers.
 *
 * Architecture:
 * - Provider gateways → rate-limited clients for Uptrends and Site24x7
 * - Monitor orchestrator → creates, links and compensates remote monitor registrations
 * - Status reconciler → polls the latest provider checks and records domain status
 * - Notification dispatchers → Telegram and email fan-out with windowed suppression
 */
@SpringBootApplication
@EnableScheduling
public class DomainMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DomainMonitorApplication.class, args);
    }
}
