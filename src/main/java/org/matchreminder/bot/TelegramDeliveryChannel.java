package org.matchreminder.bot;

import org.matchreminder.exception.DeliveryException;
import org.matchreminder.notify.DeliveryChannel;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * Sends text through the Telegram Bot API, splitting texts longer than one message allows.
 */
public class TelegramDeliveryChannel implements DeliveryChannel {
    static final int MAX_MESSAGE_LENGTH = 4096; // Telegram limit per message

    private final AbsSender sender;

    public TelegramDeliveryChannel(AbsSender sender) {
        this.sender = sender;
    }

    @Override
    public void send(String recipientId, String text) {
        int start = 0;
        do {
            int end = Math.min(text.length(), start + MAX_MESSAGE_LENGTH);
            sendPart(recipientId, text.substring(start, end));
            start = end;
        } while (start < text.length());
    }

    private void sendPart(String recipientId, String part) {
        SendMessage sendMessage = SendMessage.builder()
                .chatId(recipientId)
                .text(part)
                .build();
        try {
            sender.execute(sendMessage);
        } catch (TelegramApiException e) {
            throw new DeliveryException(recipientId, "Telegram refused message to " + recipientId + ": " + e.getMessage(), e);
        }
    }
}
