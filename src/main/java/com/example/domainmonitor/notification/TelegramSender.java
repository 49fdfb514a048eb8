package com.example.domainmonitor.notification;

import com.example.domainmonitor.domain.ChannelConfig;
import com.example.domainmonitor.provider.TickRateLimiter;
import com.example.domainmonitor.repository.ChannelConfigRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.dao.DataAccessException;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Telegram Bot API sender. Messages go out as plain text.
 *
 * When a group has been upgraded to a supergroup the API rejects the old chat id and
 * names the new one; every config using the old id is moved and the send is retried once.
 */
@Slf4j
public class TelegramSender implements ChannelSender {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String sendMessageUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TickRateLimiter rateLimiter;
    private final ChannelConfigRepository configRepository;

    public TelegramSender(String baseUrl, String apiToken, OkHttpClient httpClient, ObjectMapper objectMapper,
                          TickRateLimiter rateLimiter, ChannelConfigRepository configRepository) {
        this.sendMessageUrl = baseUrl + apiToken + "/sendMessage";
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.configRepository = configRepository;
    }

    @Override
    public ChannelConfig.ChannelType channelType() {
        return ChannelConfig.ChannelType.TELEGRAM;
    }

    @Override
    public void send(String chatId, NotificationMessage message) {
        Optional<String> migratedTo = post(chatId, message.text());
        if (migratedTo.isPresent()) {
            String newChatId = migratedTo.get();
            log.info("Telegram group {} migrated to supergroup {}", chatId, newChatId);
            moveConfigs(chatId, newChatId);
            if (post(newChatId, message.text()).isPresent()) {
                throw new NotificationException("Telegram chat " + newChatId + " reported another migration");
            }
        }
    }

    /**
     * Sends one message.
     *
     * @return the new chat id when the API reports a supergroup migration
     */
    private Optional<String> post(String chatId, String text) {
        awaitTick();
        Request request = new Request.Builder()
                .url(sendMessageUrl)
                .post(RequestBody.create(toJson(Map.of("chat_id", chatId, "text", text)), JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.isSuccessful()) {
                log.debug("Telegram message delivered to chat {}", chatId);
                return Optional.empty();
            }
            ResponseBody responseBody = response.body();
            String body = responseBody != null ? responseBody.string() : "";
            if (response.code() == 400) {
                Optional<String> newChatId = migrationTarget(body);
                if (newChatId.isPresent()) {
                    return newChatId;
                }
            }
            throw new NotificationException("Telegram API error (status " + response.code() + "): " + body);
        } catch (IOException e) {
            throw new NotificationException("Failed to send Telegram message to chat " + chatId, e);
        }
    }

    Optional<String> migrationTarget(String body) {
        try {
            JsonNode error = objectMapper.readTree(body);
            JsonNode migrateTo = error.path("parameters").path("migrate_to_chat_id");
            if (error.path("description").asText("").contains("upgraded to a supergroup")
                    && !migrateTo.isMissingNode() && migrateTo.asLong() != 0) {
                return Optional.of(migrateTo.asText());
            }
        } catch (JsonProcessingException e) {
            log.debug("Telegram error body is not JSON: {}", body);
        }
        return Optional.empty();
    }

    private void moveConfigs(String oldChatId, String newChatId) {
        try {
            int moved = configRepository.updateAddress(ChannelConfig.ChannelType.TELEGRAM, oldChatId, newChatId);
            log.info("Moved {} Telegram configs from chat {} to {}", moved, oldChatId, newChatId);
        } catch (DataAccessException e) {
            log.error("Failed to move Telegram configs from chat {} to {}: {}", oldChatId, newChatId, e.getMessage());
        }
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new NotificationException("Could not serialize Telegram message", e);
        }
    }

    private void awaitTick() {
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted while waiting for Telegram rate limiter", e);
        } catch (IllegalStateException e) {
            throw new NotificationException(e.getMessage(), e);
        }
    }
}
