package com.my.seatbot.adapter.out.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.seatbot.domain.model.ChatUser;
import com.my.seatbot.domain.model.IncomingUpdate;
import com.my.seatbot.domain.model.TelegramOutgoingMessage;
import com.my.seatbot.domain.port.out.DelayPort;
import com.my.seatbot.domain.port.out.TelegramSendPort;
import com.my.seatbot.domain.port.out.TelegramUpdatePort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Why: keeps Bot API method names and JSON shapes out of the domain, which only sees its ports.
 *
 * <p>Every request goes through {@link ResilientTelegramApi}.
 */
@ApplicationScoped
public class TelegramBotClient implements TelegramSendPort, TelegramUpdatePort {

    static final Duration BAN_UNBAN_GAP = Duration.ofMillis(500);
    private static final Duration POLL_TIMEOUT_MARGIN = Duration.ofSeconds(5);
    private static final TypeReference<List<TelegramUpdate>> UPDATE_LIST = new TypeReference<>() {
    };

    private final ResilientTelegramApi api;
    private final ObjectMapper objectMapper;
    private final DelayPort delayPort;

    @Inject
    public TelegramBotClient(ResilientTelegramApi api, ObjectMapper objectMapper, DelayPort delayPort) {
        this.api = api;
        this.objectMapper = objectMapper;
        this.delayPort = delayPort;
    }

    @Override
    public boolean send(TelegramOutgoingMessage message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", message.chatId());
        payload.put("text", message.text());
        if (message.parseMode() != null) {
            payload.put("parse_mode", message.parseMode());
        }
        payload.put("disable_web_page_preview", true);
        return api.call("sendMessage", payload)
                .map(body -> body.path("ok").asBoolean(false))
                .orElse(false);
    }

    @Override
    public Optional<String> createInviteLink(String chatId, long expireEpochSeconds, int memberLimit) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", chatId);
        payload.put("expire_date", expireEpochSeconds);
        payload.put("member_limit", memberLimit);
        return api.call("createChatInviteLink", payload)
                .filter(body -> body.path("ok").asBoolean(false))
                .map(body -> body.path("result").path("invite_link").asText(""))
                .filter(link -> !link.isBlank());
    }

    @Override
    public void evictButAllowRejoin(String chatId, long userId) {
        Map<String, Object> ban = new LinkedHashMap<>();
        ban.put("chat_id", chatId);
        ban.put("user_id", userId);
        api.call("banChatMember", ban);
        delayPort.pause(BAN_UNBAN_GAP);
        Map<String, Object> unban = new LinkedHashMap<>(ban);
        unban.put("only_if_banned", true);
        api.call("unbanChatMember", unban);
    }

    @Override
    public List<IncomingUpdate> fetchUpdates(long offset, int timeoutSeconds) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("offset", offset);
        payload.put("timeout", timeoutSeconds);
        payload.put("allowed_updates", List.of("message", "chat_member"));
        JsonNode body = api.callOnce("getUpdates", payload,
                Duration.ofSeconds(timeoutSeconds).plus(POLL_TIMEOUT_MARGIN));
        List<TelegramUpdate> updates = objectMapper.convertValue(body.path("result"), UPDATE_LIST);
        if (updates == null) {
            return List.of();
        }
        return updates.stream().map(this::mapToDomain).toList();
    }

    // every update is mapped, even ones the dispatcher ignores, so the cursor moves past them
    private IncomingUpdate mapToDomain(TelegramUpdate update) {
        TelegramMessage message = update.message();
        if (message == null || message.chat() == null) {
            return new IncomingUpdate(update.updateId(), "", null, null, null, List.of());
        }
        List<ChatUser> newMembers = Optional.ofNullable(message.newChatMembers())
                .orElse(List.of())
                .stream()
                .map(TelegramUser::toDomain)
                .toList();
        ChatUser from = message.from() == null ? null : message.from().toDomain();
        return new IncomingUpdate(update.updateId(), String.valueOf(message.chat().id()), message.chat().type(),
                from, message.text(), newMembers);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record TelegramUpdate(@JsonProperty("update_id") long updateId,
                                  @JsonProperty("message") TelegramMessage message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record TelegramMessage(@JsonProperty("message_id") long messageId,
                                   @JsonProperty("from") TelegramUser from,
                                   @JsonProperty("chat") TelegramChat chat,
                                   @JsonProperty("text") String text,
                                   @JsonProperty("new_chat_members") List<TelegramUser> newChatMembers) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record TelegramChat(@JsonProperty("id") long id,
                                @JsonProperty("type") String type) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record TelegramUser(@JsonProperty("id") long id,
                                @JsonProperty("is_bot") boolean isBot,
                                @JsonProperty("username") String username,
                                @JsonProperty("first_name") String firstName,
                                @JsonProperty("last_name") String lastName) {

        ChatUser toDomain() {
            return new ChatUser(id, username, firstName, lastName, isBot);
        }
    }
}
