/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.lecturedesk.bot.adapter.inbound.telegram;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.lecturedesk.bot.domain.model.InboundEvent;
import me.lecturedesk.bot.domain.model.InlineKeyboard;
import me.lecturedesk.bot.domain.model.KeyboardButton;
import me.lecturedesk.bot.domain.model.MessageRef;
import me.lecturedesk.bot.domain.model.PhotoVariant;
import me.lecturedesk.bot.infrastructure.config.BotProperties;
import me.lecturedesk.bot.infrastructure.event.SpringEventBus;
import me.lecturedesk.bot.port.inbound.ChannelPort;
import me.lecturedesk.bot.port.outbound.MessengerPort;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendPhoto;
import org.telegram.telegrambots.meta.api.methods.updates.DeleteWebhook;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardRow;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * This adapter implements {@link ChannelPort} for its lifecycle,
 * {@link MessengerPort} for outbound messaging and
 * {@link LongPollingSingleThreadUpdateConsumer} for inbound updates.
 *
 * <p>
 * Inbound updates are translated into {@link InboundEvent}s and published on
 * the {@link SpringEventBus}:
 * <ul>
 * <li>callback queries become {@code BUTTON} events
 * <li>texts starting with {@code /} become {@code COMMAND} events, with the
 * slash and any {@code @botname} suffix removed
 * <li>other texts become {@code TEXT} events
 * <li>photos become {@code PHOTO} events carrying every resolution
 * <li>any other message (documents, stickers, voice) becomes {@code OTHER}
 * </ul>
 *
 * <p>
 * The single-thread consumer delivers updates one at a time, so events of a
 * user are always handled in order.
 *
 * <p>
 * The adapter is always available as a Spring bean but only starts polling if
 * {@code bot.channels.telegram.enabled=true} and a token is configured.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@SuppressWarnings("PMD.LooseCoupling") // InlineKeyboardRow is required by Telegram API, no interface available
public class TelegramAdapter implements ChannelPort, MessengerPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";
    private static final String PARSE_MODE_HTML = "HTML";
    private static final String NOT_MODIFIED = "message is not modified";
    private static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;

    private final BotProperties properties;
    private final SpringEventBus eventBus;
    private final TelegramBotsLongPollingApplication botsApplication;

    private volatile TelegramClient telegramClient;
    private volatile boolean running = false;
    private final Object lifecycleLock = new Object();

    /**
     * Package-private setter for testing, allows injecting a mock TelegramClient.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
    }

    private synchronized TelegramClient getOrCreateClient() {
        TelegramClient client = this.telegramClient;
        if (client != null) {
            return client;
        }
        String token = properties.telegramChannel().getToken();
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("Telegram token not configured");
        }
        this.telegramClient = new OkHttpTelegramClient(token);
        return this.telegramClient;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("Telegram adapter already running");
                return;
            }
            BotProperties.ChannelProperties config = properties.telegramChannel();
            if (!config.isEnabled()) {
                log.info("Telegram channel disabled");
                return;
            }
            if (config.getToken() == null || config.getToken().isBlank()) {
                log.warn("Telegram token not configured, adapter will not start");
                return;
            }

            try {
                if (config.isDropPendingUpdates()) {
                    getOrCreateClient().execute(DeleteWebhook.builder().dropPendingUpdates(true).build());
                    log.info("Dropped pending Telegram updates");
                }
                botsApplication.registerBot(config.getToken(), this);
                running = true;
                log.info("Telegram adapter started");
            } catch (TelegramApiException e) {
                if (e.getMessage() != null && e.getMessage().contains("already registered")) {
                    running = true;
                    log.warn("Telegram bot already registered; keeping existing polling session active");
                    return;
                }
                log.error("Failed to start Telegram adapter", e);
            } catch (Exception e) {
                log.error("Failed to start Telegram adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            running = false;
            try {
                botsApplication.close();
                log.info("Telegram adapter stopped");
            } catch (Exception e) {
                log.error("Error stopping Telegram adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ==================== Inbound ====================

    @Override
    public void consume(Update update) {
        InboundEvent event = null;
        if (update.hasCallbackQuery()) {
            event = toButtonEvent(update.getCallbackQuery());
        } else if (update.hasMessage()) {
            event = toMessageEvent(update.getMessage());
        }
        if (event != null) {
            eventBus.publish(event);
        }
    }

    private InboundEvent toButtonEvent(CallbackQuery callback) {
        if (callback.getMessage() == null) {
            log.warn("Callback query without associated message, ignoring");
            return null;
        }
        long chatId = callback.getMessage().getChatId();
        log.debug("Callback: {}", callback.getData());

        return InboundEvent.builder()
                .kind(InboundEvent.Kind.BUTTON)
                .userId(callback.getFrom().getId())
                .chatId(chatId)
                .username(callback.getFrom().getUserName())
                .firstName(callback.getFrom().getFirstName())
                .payload(callback.getData())
                .callbackId(callback.getId())
                .messageRef(new MessageRef(chatId, callback.getMessage().getMessageId()))
                .build();
    }

    private InboundEvent toMessageEvent(org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage) {
        User from = telegramMessage.getFrom();
        if (from == null) {
            log.debug("Message without sender in chat {}, ignoring", telegramMessage.getChatId());
            return null;
        }

        InboundEvent.InboundEventBuilder builder = InboundEvent.builder()
                .userId(from.getId())
                .chatId(telegramMessage.getChatId())
                .username(from.getUserName())
                .firstName(from.getFirstName());

        if (telegramMessage.hasText()) {
            String text = telegramMessage.getText();
            if (text.startsWith("/")) {
                String cmd = text.split("\\s+", 2)[0].substring(1).split("@")[0]; // strip / and @botname
                return builder.kind(InboundEvent.Kind.COMMAND).payload(cmd).build();
            }
            return builder.kind(InboundEvent.Kind.TEXT).payload(text).build();
        }

        if (telegramMessage.hasPhoto()) {
            List<PhotoVariant> photos = new ArrayList<>();
            for (PhotoSize size : telegramMessage.getPhoto()) {
                photos.add(new PhotoVariant(
                        size.getFileId(),
                        size.getWidth() != null ? size.getWidth() : 0,
                        size.getHeight() != null ? size.getHeight() : 0,
                        size.getFileSize() != null ? size.getFileSize() : 0L));
            }
            return builder.kind(InboundEvent.Kind.PHOTO).photos(photos).build();
        }

        return builder.kind(InboundEvent.Kind.OTHER).build();
    }

    // ==================== Outbound ====================

    @Override
    public CompletableFuture<Void> sendText(long chatId, String html, InlineKeyboard keyboard) {
        return CompletableFuture.runAsync(() -> {
            try {
                String text = html;
                if (text.length() > TELEGRAM_MAX_MESSAGE_LENGTH) {
                    text = text.substring(0, TELEGRAM_MAX_MESSAGE_LENGTH - 3) + "...";
                }
                SendMessage.SendMessageBuilder<?, ?> builder = SendMessage.builder()
                        .chatId(String.valueOf(chatId))
                        .text(text)
                        .parseMode(PARSE_MODE_HTML);
                if (keyboard != null) {
                    builder.replyMarkup(toMarkup(keyboard));
                }

                try {
                    getOrCreateClient().execute(builder.build());
                } catch (TelegramApiRequestException htmlEx) {
                    if (!isParseError(htmlEx)) {
                        throw htmlEx;
                    }
                    // Fallback: retry without formatting if HTML parsing fails
                    log.debug("HTML parse failed, retrying as plain text: {}", htmlEx.getMessage());
                    builder.text(TelegramHtmlFormatter.toPlainText(text)).parseMode(null);
                    getOrCreateClient().execute(builder.build());
                }
            } catch (Exception e) {
                log.error("Failed to send message to chat: {}", chatId, e);
                throw new RuntimeException("Failed to send message", e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> sendPhoto(long chatId, String photoReference) {
        return CompletableFuture.runAsync(() -> {
            try {
                SendPhoto sendPhoto = SendPhoto.builder()
                        .chatId(String.valueOf(chatId))
                        .photo(new InputFile(photoReference))
                        .build();
                getOrCreateClient().execute(sendPhoto);
                log.debug("Sent photo to chat: {}", chatId);
            } catch (Exception e) {
                log.error("Failed to send photo to chat: {}", chatId, e);
                throw new RuntimeException("Failed to send photo", e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> editMessage(MessageRef message, String html, InlineKeyboard keyboard) {
        return CompletableFuture.runAsync(() -> {
            try {
                EditMessageText.EditMessageTextBuilder<?, ?> builder = EditMessageText.builder()
                        .chatId(String.valueOf(message.chatId()))
                        .messageId(message.messageId())
                        .text(html)
                        .parseMode(PARSE_MODE_HTML);
                if (keyboard != null) {
                    builder.replyMarkup(toMarkup(keyboard));
                }
                getOrCreateClient().execute(builder.build());
            } catch (TelegramApiRequestException e) {
                if (isNotModified(e)) {
                    log.debug("Message {} in chat {} already up to date", message.messageId(), message.chatId());
                    return;
                }
                log.error("Failed to edit message {} in chat: {}", message.messageId(), message.chatId(), e);
                throw new RuntimeException("Failed to edit message", e);
            } catch (Exception e) {
                log.error("Failed to edit message {} in chat: {}", message.messageId(), message.chatId(), e);
                throw new RuntimeException("Failed to edit message", e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> answerCallback(String callbackId, String text, boolean alert) {
        return CompletableFuture.runAsync(() -> {
            try {
                AnswerCallbackQuery answer = AnswerCallbackQuery.builder()
                        .callbackQueryId(callbackId)
                        .text(text)
                        .showAlert(alert)
                        .build();
                getOrCreateClient().execute(answer);
            } catch (Exception e) {
                log.debug("Failed to answer callback query {}", callbackId, e);
                throw new RuntimeException("Failed to answer callback", e);
            }
        });
    }

    static InlineKeyboardMarkup toMarkup(InlineKeyboard keyboard) {
        List<InlineKeyboardRow> rows = new ArrayList<>();
        for (List<KeyboardButton> buttons : keyboard.rows()) {
            InlineKeyboardRow row = new InlineKeyboardRow();
            for (KeyboardButton button : buttons) {
                row.add(InlineKeyboardButton.builder()
                        .text(button.label())
                        .callbackData(button.callbackData())
                        .build());
            }
            rows.add(row);
        }
        return InlineKeyboardMarkup.builder().keyboard(rows).build();
    }

    private static boolean isNotModified(TelegramApiRequestException e) {
        return containsIgnoreCase(e.getApiResponse(), NOT_MODIFIED) || containsIgnoreCase(e.getMessage(), NOT_MODIFIED);
    }

    private static boolean isParseError(TelegramApiRequestException e) {
        return containsIgnoreCase(e.getApiResponse(), "can't parse entities");
    }

    private static boolean containsIgnoreCase(String text, String fragment) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(fragment);
    }
}
