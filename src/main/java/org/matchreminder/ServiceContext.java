package org.matchreminder;

import org.matchreminder.bot.CommandRouter;
import org.matchreminder.bot.ReminderBot;
import org.matchreminder.bot.ReminderWebhookBot;
import org.matchreminder.bot.TelegramDeliveryChannel;
import org.matchreminder.bot.TelegramWebhookRegistrar;
import org.matchreminder.channel.ChannelHealthMonitor;
import org.matchreminder.channel.HealthServer;
import org.matchreminder.config.BotConfig;
import org.matchreminder.config.DeliveryMode;
import org.matchreminder.fixtures.FootballDataFixtureSource;
import org.matchreminder.notify.NotificationDispatcher;
import org.matchreminder.recipients.InMemoryRecipientRegistry;
import org.matchreminder.recipients.JsonFileRecipientRegistry;
import org.matchreminder.recipients.RecipientRegistry;
import org.matchreminder.schedule.JobScheduler;
import org.matchreminder.schedule.ReminderPlanner;
import org.matchreminder.schedule.ResyncController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.api.methods.updates.SetWebhook;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;
import org.telegram.telegrambots.updatesreceivers.DefaultWebhook;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns every long-lived collaborator of the process. Built once in {@link Main} and passed to
 * whatever needs it.
 */
public final class ServiceContext implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ServiceContext.class);

    private final BotConfig config;
    private final Clock clock;
    private final RecipientRegistry registry;
    private final ReminderBot pollingBot;
    private final ReminderWebhookBot webhookBot;
    private final NotificationDispatcher dispatcher;
    private final ExecutorService dispatchExecutor;
    private final JobScheduler scheduler;
    private final ResyncController resyncController;
    private final ChannelHealthMonitor healthMonitor;
    private final CommandRouter router;

    private HealthServer healthServer;

    private ServiceContext(BotConfig config) {
        this.config = config;
        this.clock = Clock.system(config.getZone());
        this.registry = createRegistry(config);

        AbsSender sender;
        if (config.getDeliveryMode() == DeliveryMode.WEBHOOK) {
            this.pollingBot = null;
            this.webhookBot = new ReminderWebhookBot(config.getTelegramToken(), config.getBotUsername(),
                    config.getBotUsername().toLowerCase(Locale.ROOT));
            sender = webhookBot;
        } else {
            this.pollingBot = new ReminderBot(config.getTelegramToken(), config.getBotUsername());
            this.webhookBot = null;
            sender = pollingBot;
        }
        TelegramDeliveryChannel channel = new TelegramDeliveryChannel(sender);

        this.dispatcher = new NotificationDispatcher(registry, channel, config.getTeamName());
        AtomicInteger dispatchThreads = new AtomicInteger();
        this.dispatchExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "reminder-dispatch-" + dispatchThreads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.scheduler = new JobScheduler(clock, dispatchExecutor, dispatcher);

        if (config.getFootballApiKey().isPresent()) {
            FootballDataFixtureSource source = new FootballDataFixtureSource(
                    HttpClient.newBuilder().connectTimeout(config.getHttpTimeout()).build(),
                    config.getFootballApiUrl(), config.getFootballApiKey().get(),
                    config.getTeamId(), config.getZone(), config.getHttpTimeout());
            this.resyncController = new ResyncController(source, new ReminderPlanner(), scheduler,
                    config.getLeadTimes(), clock, config.getZone(), config.getResyncTime());
        } else {
            this.resyncController = null;
        }

        this.router = new CommandRouter(registry, channel,
                () -> resyncController != null ? resyncController.getLatestFixtures() : List.of(),
                clock, config.getTeamName());

        if (webhookBot != null) {
            webhookBot.setUpdateHandler(router::route);
            String expected = config.getWebhookUrl()
                    .map(url -> TelegramWebhookRegistrar.callbackUrl(url, webhookBot.getBotPath()))
                    .orElse(null);
            this.healthMonitor = new ChannelHealthMonitor(new TelegramWebhookRegistrar(webhookBot), expected,
                    config.getWebhookCheckInterval());
        } else {
            pollingBot.setUpdateHandler(router::route);
            this.healthMonitor = null;
        }
    }

    public static ServiceContext create(BotConfig config) {
        return new ServiceContext(config);
    }

    private static RecipientRegistry createRegistry(BotConfig config) {
        RecipientRegistry registry = config.getRecipientsFile()
                .<RecipientRegistry>map(file -> new JsonFileRecipientRegistry(Paths.get(file)))
                .orElseGet(InMemoryRecipientRegistry::new);
        config.getSeedChatId().ifPresent(registry::add);
        return registry;
    }

    /**
     * Starts scheduling, inbound updates, the webhook monitor and the health endpoint.
     */
    public void start() throws IOException {
        scheduler.start();

        if (resyncController != null) {
            resyncController.start();
        } else {
            log.error("FOOTBALL_API_KEY is not set, fixture updates and reminders are disabled");
        }

        registerBot();
        if (healthMonitor != null) {
            healthMonitor.start();
        }

        healthServer = new HealthServer(config.getPort(), healthMonitor);
        healthServer.start();
        log.info("{} reminder bot started in {} mode", config.getTeamName(),
                config.getDeliveryMode().name().toLowerCase(Locale.ROOT));
    }

    private void registerBot() {
        try {
            if (pollingBot != null) {
                TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
                botsApi.registerBot(pollingBot);
                return;
            }
            if (config.getWebhookUrl().isEmpty()) {
                log.error("WEBHOOK_URL is not set, inbound commands are disabled");
                return;
            }
            DefaultWebhook webhook = new DefaultWebhook();
            webhook.setInternalUrl(config.getWebhookInternalUrl());
            TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class, webhook);
            botsApi.registerBot(webhookBot, SetWebhook.builder().url(config.getWebhookUrl().get()).build());
        } catch (TelegramApiException e) {
            log.error("Could not register the bot with Telegram, inbound commands are unavailable", e);
        }
    }

    public BotConfig getConfig() {
        return config;
    }

    public RecipientRegistry getRegistry() {
        return registry;
    }

    public JobScheduler getScheduler() {
        return scheduler;
    }

    public NotificationDispatcher getDispatcher() {
        return dispatcher;
    }

    public CommandRouter getRouter() {
        return router;
    }

    @Override
    public void close() {
        log.info("Shutting down");
        if (healthServer != null) {
            healthServer.close();
        }
        if (healthMonitor != null) {
            healthMonitor.close();
        }
        if (resyncController != null) {
            resyncController.close();
        }
        scheduler.close();
        dispatchExecutor.shutdown();
    }
}
