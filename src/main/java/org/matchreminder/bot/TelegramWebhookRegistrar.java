package org.matchreminder.bot;

import org.matchreminder.channel.ChannelRegistrar;
import org.telegram.telegrambots.meta.api.methods.updates.GetWebhookInfo;
import org.telegram.telegrambots.meta.api.methods.updates.SetWebhook;
import org.telegram.telegrambots.meta.api.objects.WebhookInfo;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.Optional;

/**
 * Reads and sets the bot's webhook through the Telegram Bot API.
 */
public class TelegramWebhookRegistrar implements ChannelRegistrar {
    static final String CALLBACK_PATH = "callback/";

    private final ReminderWebhookBot bot;

    public TelegramWebhookRegistrar(ReminderWebhookBot bot) {
        this.bot = bot;
    }

    @Override
    public Optional<String> currentTarget() throws TelegramApiException {
        WebhookInfo info = bot.execute(new GetWebhookInfo());
        if (info == null || info.getUrl() == null || info.getUrl().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(info.getUrl());
    }

    /**
     * The address Telegram reports once the bot is registered under {@code publicUrl}.
     */
    public static String callbackUrl(String publicUrl, String botPath) {
        String base = publicUrl.endsWith("/") ? publicUrl : publicUrl + "/";
        return base + CALLBACK_PATH + botPath;
    }

    @Override
    public void register(String target) throws TelegramApiException {
        // telegrambots appends callback/{botPath} to the url it is given
        String suffix = CALLBACK_PATH + bot.getBotPath();
        String publicUrl = target.endsWith(suffix) ? target.substring(0, target.length() - suffix.length()) : target;
        bot.setWebhook(SetWebhook.builder().url(publicUrl).build());
    }
}
