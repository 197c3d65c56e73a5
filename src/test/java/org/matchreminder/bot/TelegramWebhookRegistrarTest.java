package org.matchreminder.bot;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.telegram.telegrambots.meta.api.methods.updates.GetWebhookInfo;
import org.telegram.telegrambots.meta.api.methods.updates.SetWebhook;
import org.telegram.telegrambots.meta.api.objects.WebhookInfo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TelegramWebhookRegistrarTest {

    private static final String PUBLIC_URL = "https://bot.example.org";
    private static final String BOT_PATH = "matchreminderbot";

    @Mock
    private ReminderWebhookBot bot;

    private TelegramWebhookRegistrar registrar;

    @BeforeEach
    void setUp() {
        registrar = new TelegramWebhookRegistrar(bot);
    }

    @Test
    void callbackUrlAppendsBotPath() {
        assertThat(TelegramWebhookRegistrar.callbackUrl(PUBLIC_URL, BOT_PATH))
                .isEqualTo("https://bot.example.org/callback/matchreminderbot");
        assertThat(TelegramWebhookRegistrar.callbackUrl(PUBLIC_URL + "/", BOT_PATH))
                .isEqualTo("https://bot.example.org/callback/matchreminderbot");
    }

    @Test
    @DisplayName("register hands the public url to telegrambots, which appends the callback path itself")
    void registerStripsCallbackPath() throws Exception {
        when(bot.getBotPath()).thenReturn(BOT_PATH);

        registrar.register(TelegramWebhookRegistrar.callbackUrl(PUBLIC_URL, BOT_PATH));

        ArgumentCaptor<SetWebhook> captor = ArgumentCaptor.forClass(SetWebhook.class);
        verify(bot).setWebhook(captor.capture());
        assertThat(captor.getValue().getUrl()).isEqualTo(PUBLIC_URL + "/");
    }

    @Test
    void registerKeepsUrlWithoutCallbackPath() throws Exception {
        when(bot.getBotPath()).thenReturn(BOT_PATH);

        registrar.register(PUBLIC_URL);

        ArgumentCaptor<SetWebhook> captor = ArgumentCaptor.forClass(SetWebhook.class);
        verify(bot).setWebhook(captor.capture());
        assertThat(captor.getValue().getUrl()).isEqualTo(PUBLIC_URL);
    }

    @Test
    void currentTargetReadsWebhookInfo() throws Exception {
        WebhookInfo info = mock(WebhookInfo.class);
        when(info.getUrl()).thenReturn("https://bot.example.org/callback/matchreminderbot");
        when(bot.execute(any(GetWebhookInfo.class))).thenReturn(info);

        assertThat(registrar.currentTarget()).contains("https://bot.example.org/callback/matchreminderbot");
    }

    @Test
    void blankWebhookIsNoTarget() throws Exception {
        WebhookInfo info = mock(WebhookInfo.class);
        when(info.getUrl()).thenReturn("");
        when(bot.execute(any(GetWebhookInfo.class))).thenReturn(info);

        assertThat(registrar.currentTarget()).isEmpty();
    }
}
