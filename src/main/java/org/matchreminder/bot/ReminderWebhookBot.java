package org.matchreminder.bot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.bots.TelegramWebhookBot;
import org.telegram.telegrambots.meta.api.methods.BotApiMethod;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.util.function.Consumer;

/**
 * Webhook bot: Telegram pushes updates to the callback served by telegrambots' webhook server.
 * Replies are sent with separate API calls, so the callback itself always answers empty.
 */
public class ReminderWebhookBot extends TelegramWebhookBot {
    private static final Logger log = LoggerFactory.getLogger(ReminderWebhookBot.class);

    private final String botUsername;
    private final String botPath;
    private volatile Consumer<Update> updateHandler = update -> { };

    public ReminderWebhookBot(String botToken, String botUsername, String botPath) {
        super(botToken);
        this.botUsername = botUsername;
        this.botPath = botPath;
    }

    public void setUpdateHandler(Consumer<Update> updateHandler) {
        this.updateHandler = updateHandler;
    }

    @Override
    public BotApiMethod<?> onWebhookUpdateReceived(Update update) {
        try {
            updateHandler.accept(update);
        } catch (RuntimeException e) {
            log.error("Failed to handle update {}", update.getUpdateId(), e);
        }
        return null;
    }

    @Override
    public String getBotUsername() {
        return botUsername;
    }

    @Override
    public String getBotPath() {
        return botPath;
    }
}
