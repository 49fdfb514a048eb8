package com.example.domainmonitor.notification;

import com.example.domainmonitor.domain.ChannelConfig;
import com.example.domainmonitor.provider.TickRateLimiter;
import com.example.domainmonitor.repository.ChannelConfigRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
class TelegramSenderTest {

    private static final String MIGRATED = "{\"ok\":false,\"error_code\":400,"
            + "\"description\":\"Bad Request: group chat was upgraded to a supergroup chat\","
            + "\"parameters\":{\"migrate_to_chat_id\":-1001234}}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final NotificationMessage message = new NotificationMessage("subject", "🔴 example.com is down", "<p/>");

    @Mock
    private ChannelConfigRepository configRepository;

    private MockWebServer server;
    private TelegramSender sender;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        sender = new TelegramSender(server.url("/bot").toString(), "TOKEN", new OkHttpClient(), objectMapper,
                new TickRateLimiter("telegram-test", Duration.ofMillis(5)), configRepository);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void sendsPlainTextToTheChat() throws Exception {
        // given
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"ok\":true}"));

        // when
        sender.send("-100", message);

        // then
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/botTOKEN/sendMessage");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("chat_id").asText()).isEqualTo("-100");
        assertThat(body.path("text").asText()).isEqualTo("🔴 example.com is down");
        then(configRepository).shouldHaveNoInteractions();
    }

    @Test
    void migratedGroupMovesConfigsAndRetriesOnce() throws Exception {
        // given
        server.enqueue(new MockResponse().setResponseCode(400).setBody(MIGRATED));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"ok\":true}"));
        given(configRepository.updateAddress(ChannelConfig.ChannelType.TELEGRAM, "-100", "-1001234")).willReturn(2);

        // when
        sender.send("-100", message);

        // then
        assertThat(server.getRequestCount()).isEqualTo(2);
        server.takeRequest();
        JsonNode retry = objectMapper.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(retry.path("chat_id").asText()).isEqualTo("-1001234");
        then(configRepository).should().updateAddress(ChannelConfig.ChannelType.TELEGRAM, "-100", "-1001234");
    }

    @Test
    void secondMigrationIsAnError() {
        // given
        server.enqueue(new MockResponse().setResponseCode(400).setBody(MIGRATED));
        server.enqueue(new MockResponse().setResponseCode(400).setBody(MIGRATED));

        // when / then
        assertThatThrownBy(() -> sender.send("-100", message))
                .isInstanceOf(NotificationException.class)
                .hasMessageContaining("another migration");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void otherBadRequestsFailWithoutRetry() {
        // given
        server.enqueue(new MockResponse().setResponseCode(400)
                .setBody("{\"ok\":false,\"description\":\"Bad Request: chat not found\"}"));

        // when / then
        assertThatThrownBy(() -> sender.send("-100", message))
                .isInstanceOf(NotificationException.class)
                .hasMessageContaining("status 400")
                .hasMessageContaining("chat not found");
        assertThat(server.getRequestCount()).isEqualTo(1);
        then(configRepository).should(never()).updateAddress(any(), anyString(), anyString());
    }

    @Test
    void serverErrorsFail() {
        server.enqueue(new MockResponse().setResponseCode(502).setBody("Bad Gateway"));

        assertThatThrownBy(() -> sender.send("-100", message))
                .isInstanceOf(NotificationException.class)
                .hasMessageContaining("status 502");
    }

    @Test
    void migrationTargetNeedsDescriptionAndChatId() {
        assertThat(sender.migrationTarget(MIGRATED)).contains("-1001234");
        assertThat(sender.migrationTarget("{\"description\":\"upgraded to a supergroup\"}")).isEmpty();
        assertThat(sender.migrationTarget("{\"description\":\"other\",\"parameters\":{\"migrate_to_chat_id\":5}}"))
                .isEmpty();
        assertThat(sender.migrationTarget("not json")).isEmpty();
    }
}
