package com.example.domainmonitor;

import com.example.domainmonitor.config.MonitorProperties;
import com.example.domainmonitor.domain.ChannelConfig;
import com.example.domainmonitor.monitor.MonitorOrchestrator;
import com.example.domainmonitor.notification.NotificationService;
import com.example.domainmonitor.provider.ProviderClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class DomainMonitorApplicationTests {

    @Autowired
    private MonitorProperties properties;

    @Autowired
    private MonitorOrchestrator orchestrator;

    @Autowired
    private NotificationService notificationService;

    @Test
    void contextLoads() {
        assertNotNull(properties);
        assertNotNull(orchestrator);
        assertNotNull(notificationService);
    }

    @Test
    void providersAreRegisteredInOrder() {
        assertEquals(List.of("uptrends", "site24x7"),
                orchestrator.getProviders().stream().map(ProviderClient::name).toList());
    }

    @Test
    void channelsAreRegisteredInOrder() {
        assertEquals(List.of(ChannelConfig.ChannelType.TELEGRAM, ChannelConfig.ChannelType.EMAIL),
                notificationService.getChannels());
    }

    @Test
    void configurationIsLoaded() {
        assertFalse(properties.getReconciler().isEnabled());
        assertEquals(0, properties.getOrchestrator().getCreationDelaySeconds());
        assertEquals(20, properties.getDomains().getDefaultInterval());
        assertEquals(2, properties.getSuppression().getMinimumWindowMinutes());
    }
}
