package org.matchreminder.bot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.util.function.Consumer;

/**
 * Long-polling bot: pulls updates from Telegram and hands them to the update handler.
 */
public class ReminderBot extends TelegramLongPollingBot {
    private static final Logger log = LoggerFactory.getLogger(ReminderBot.class);

    private final String botUsername;
    private volatile Consumer<Update> updateHandler = update -> { };

    public ReminderBot(String botToken, String botUsername) {
        super(botToken);
        this.botUsername = botUsername;
    }

    public void setUpdateHandler(Consumer<Update> updateHandler) {
        this.updateHandler = updateHandler;
    }

    @Override
    public void onUpdateReceived(Update update) {
        try {
            updateHandler.accept(update);
        } catch (RuntimeException e) {
            log.error("Failed to handle update {}", update.getUpdateId(), e);
        }
    }

    @Override
    public String getBotUsername() {
        return botUsername;
    }
}
