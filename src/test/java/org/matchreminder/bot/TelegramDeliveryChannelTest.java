package org.matchreminder.bot;

import org.matchreminder.exception.DeliveryException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TelegramDeliveryChannelTest {

    @Mock
    private AbsSender sender;

    @Test
    void sendsOneMessage() throws Exception {
        new TelegramDeliveryChannel(sender).send("123", "hello");

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(sender).execute(captor.capture());
        assertThat(captor.getValue().getChatId()).isEqualTo("123");
        assertThat(captor.getValue().getText()).isEqualTo("hello");
    }

    @Test
    void splitsLongText() throws Exception {
        String text = "x".repeat(TelegramDeliveryChannel.MAX_MESSAGE_LENGTH * 2 + 10);

        new TelegramDeliveryChannel(sender).send("123", text);

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(sender, times(3)).execute(captor.capture());
        assertThat(captor.getAllValues()).extracting(SendMessage::getText)
                .extracting(String::length)
                .containsExactly(TelegramDeliveryChannel.MAX_MESSAGE_LENGTH, TelegramDeliveryChannel.MAX_MESSAGE_LENGTH, 10);
    }

    @Test
    void apiFailureBecomesDeliveryException() throws Exception {
        when(sender.execute(any(SendMessage.class))).thenThrow(new TelegramApiException("Forbidden: bot was blocked by the user"));

        assertThatThrownBy(() -> new TelegramDeliveryChannel(sender).send("42", "hello"))
                .isInstanceOfSatisfying(DeliveryException.class, e -> assertThat(e.getRecipientId()).isEqualTo("42"))
                .hasCauseInstanceOf(TelegramApiException.class);
    }
}
