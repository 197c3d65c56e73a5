package org.matchreminder.bot;

import org.matchreminder.fixtures.Fixture;
import org.matchreminder.notify.DeliveryChannel;
import org.matchreminder.recipients.RecipientRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Handles chat commands arriving from either the long-polling or the webhook bot.
 */
public class CommandRouter {
    private static final Logger log = LoggerFactory.getLogger(CommandRouter.class);

    private static final DateTimeFormatter KICKOFF_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm z", Locale.ENGLISH);
    private static final int UPCOMING_LIMIT = 5;

    private final RecipientRegistry registry;
    private final DeliveryChannel channel;
    private final Supplier<List<Fixture>> fixtures;
    private final Clock clock;
    private final String teamName;

    public CommandRouter(RecipientRegistry registry, DeliveryChannel channel, Supplier<List<Fixture>> fixtures,
                         Clock clock, String teamName) {
        this.registry = registry;
        this.channel = channel;
        this.fixtures = fixtures;
        this.clock = clock;
        this.teamName = teamName;
    }

    public void route(Update update) {
        if (!update.hasMessage() || !update.getMessage().hasText()) {
            return;
        }
        String chatId = String.valueOf(update.getMessage().getChatId());
        String command = update.getMessage().getText().trim().split("\\s+")[0].toLowerCase(Locale.ROOT);
        // "/start@SomeBot" in group chats
        int at = command.indexOf('@');
        if (at > 0) {
            command = command.substring(0, at);
        }

        try {
            switch (command) {
                case "/start":
                    handleStart(chatId);
                    break;
                case "/stop":
                    handleStop(chatId);
                    break;
                case "/next":
                    handleNext(chatId);
                    break;
                default:
                    reply(chatId, helpText());
                    break;
            }
        } catch (RuntimeException e) {
            log.warn("Could not handle {} from chat {}: {}", command, chatId, e.getMessage());
        }
    }

    private void handleStart(String chatId) {
        if (registry.add(chatId)) {
            log.info("Registered chat {}", chatId);
        }
        List<Fixture> upcoming = upcoming();
        StringBuilder text = new StringBuilder()
                .append(teamName).append(" Reminder Bot is running!\n")
                .append("You will get a reminder before every match. Send /stop to unsubscribe.\n\n");
        if (upcoming.isEmpty()) {
            text.append("No upcoming matches are known right now.");
        } else {
            text.append("Upcoming matches:\n");
            text.append(upcoming.stream()
                    .limit(UPCOMING_LIMIT)
                    .map(CommandRouter::describe)
                    .collect(Collectors.joining("\n")));
        }
        reply(chatId, text.toString());
    }

    private void handleStop(String chatId) {
        if (registry.remove(chatId)) {
            log.info("Unregistered chat {}", chatId);
        }
        reply(chatId, "You will no longer receive match reminders. Send /start to subscribe again.");
    }

    private void handleNext(String chatId) {
        List<Fixture> upcoming = upcoming();
        if (upcoming.isEmpty()) {
            reply(chatId, "No upcoming matches are known right now.");
        } else {
            reply(chatId, "Next match: " + describe(upcoming.get(0)));
        }
    }

    private List<Fixture> upcoming() {
        Instant now = clock.instant();
        return fixtures.get().stream()
                .filter(fixture -> fixture.getKickoff() != null && fixture.getKickoff().toInstant().isAfter(now))
                .collect(Collectors.toList());
    }

    static String describe(Fixture fixture) {
        return fixture.getKickoff().format(KICKOFF_FORMAT) + " vs " + fixture.getOpponent().getName()
                + " (" + fixture.getCompetition().getDisplayName() + ")";
    }

    private String helpText() {
        return "Commands:\n"
                + "/start - subscribe to " + teamName + " match reminders\n"
                + "/next - show the next match\n"
                + "/stop - unsubscribe";
    }

    private void reply(String chatId, String text) {
        channel.send(chatId, text);
    }
}
