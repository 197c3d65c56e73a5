package org.matchreminder.config;

import org.matchreminder.exception.ConfigurationMissingException;

import java.io.IOException;
import java.io.InputStream;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Runtime configuration of the bot.
 * <p>
 * Defaults come from the classpath resource {@code reminder-bot.properties}; every key can be
 * overridden by an environment variable of the same name.
 */
public final class BotConfig {

    public static final String DEFAULTS_RESOURCE = "reminder-bot.properties";

    private final String telegramToken;
    private final String botUsername;
    private final String footballApiKey;
    private final String footballApiUrl;
    private final long teamId;
    private final String teamName;
    private final ZoneId zone;
    private final List<Duration> leadTimes;
    private final LocalTime resyncTime;
    private final String seedChatId;
    private final String recipientsFile;
    private final int port;
    private final DeliveryMode deliveryMode;
    private final String webhookUrl;
    private final String webhookInternalUrl;
    private final Duration webhookCheckInterval;
    private final Duration httpTimeout;

    private BotConfig(Map<String, String> values) {
        this.telegramToken = blankToNull(values.get("TELEGRAM_TOKEN"));
        if (telegramToken == null) {
            throw new ConfigurationMissingException("TELEGRAM_TOKEN");
        }
        this.botUsername = values.getOrDefault("BOT_USERNAME", "MatchReminderBot");
        this.footballApiKey = blankToNull(values.get("FOOTBALL_API_KEY"));
        this.footballApiUrl = values.getOrDefault("FOOTBALL_API_URL", "https://api.football-data.org/v4");
        this.teamId = parseLong(values, "TEAM_ID", 81L);
        this.teamName = values.getOrDefault("TEAM_NAME", "FC Barcelona");
        this.zone = parseZone(values.getOrDefault("TIMEZONE", "Asia/Jerusalem"));
        this.leadTimes = parseLeadHours(values.getOrDefault("LEAD_HOURS", "7,5,2"));
        this.resyncTime = parseTime(values.getOrDefault("RESYNC_TIME", "00:00"));
        this.seedChatId = blankToNull(values.get("CHAT_ID"));
        this.recipientsFile = blankToNull(values.get("RECIPIENTS_FILE"));
        this.port = parsePort(values);
        this.deliveryMode = DeliveryMode.parse(values.getOrDefault("DELIVERY_MODE", "polling"));
        this.webhookUrl = blankToNull(values.get("WEBHOOK_URL"));
        this.webhookInternalUrl = values.getOrDefault("WEBHOOK_INTERNAL_URL", "http://0.0.0.0:8443");
        this.webhookCheckInterval = Duration.ofSeconds(parsePositive(values, "WEBHOOK_CHECK_SECONDS", 60L));
        this.httpTimeout = Duration.ofSeconds(parsePositive(values, "HTTP_TIMEOUT_SECONDS", 20L));
    }

    /**
     * Loads the classpath defaults and overlays the given environment.
     */
    public static BotConfig load(Map<String, String> env) {
        Map<String, String> merged = new HashMap<>(loadDefaults());
        env.forEach((key, value) -> {
            if (value != null && !value.isBlank()) {
                merged.put(key, value.trim());
            }
        });
        return new BotConfig(merged);
    }

    /**
     * Builds a configuration from the given values only, without classpath defaults.
     */
    public static BotConfig of(Map<String, String> values) {
        return new BotConfig(values);
    }

    private static Map<String, String> loadDefaults() {
        Properties properties = new Properties();
        try (InputStream in = BotConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
        Map<String, String> defaults = new HashMap<>();
        for (String name : properties.stringPropertyNames()) {
            defaults.put(name, properties.getProperty(name).trim());
        }
        return defaults;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static long parseLong(Map<String, String> values, String key, long defaultValue) {
        String raw = blankToNull(values.get(key));
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got: " + raw, e);
        }
    }

    private static long parsePositive(Map<String, String> values, String key, long defaultValue) {
        long value = parseLong(values, key, defaultValue);
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got: " + value);
        }
        return value;
    }

    private static int parsePort(Map<String, String> values) {
        long value = parseLong(values, "PORT", 5000L);
        if (value < 1 || value > 65535) {
            throw new IllegalArgumentException("PORT must be between 1 and 65535, got: " + value);
        }
        return (int) value;
    }

    private static ZoneId parseZone(String raw) {
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("TIMEZONE is not a valid zone id: " + raw, e);
        }
    }

    private static LocalTime parseTime(String raw) {
        try {
            return LocalTime.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("RESYNC_TIME must look like HH:mm, got: " + raw, e);
        }
    }

    static List<Duration> parseLeadHours(String raw) {
        List<Duration> result = new ArrayList<>();
        for (String part : raw.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            try {
                long hours = Long.parseLong(part.trim());
                if (hours <= 0) {
                    throw new IllegalArgumentException("LEAD_HOURS values must be positive, got: " + hours);
                }
                Duration lead = Duration.ofHours(hours);
                if (!result.contains(lead)) {
                    result.add(lead);
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("LEAD_HOURS must be a comma separated list of hours, got: " + raw, e);
            }
        }
        if (result.isEmpty()) {
            throw new IllegalArgumentException("LEAD_HOURS must name at least one lead time");
        }
        result.sort(Comparator.reverseOrder());
        return Collections.unmodifiableList(result);
    }

    public String getTelegramToken() {
        return telegramToken;
    }

    public String getBotUsername() {
        return botUsername;
    }

    public Optional<String> getFootballApiKey() {
        return Optional.ofNullable(footballApiKey);
    }

    public String getFootballApiUrl() {
        return footballApiUrl;
    }

    public long getTeamId() {
        return teamId;
    }

    public String getTeamName() {
        return teamName;
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * Lead times in descending order, without duplicates.
     */
    public List<Duration> getLeadTimes() {
        return leadTimes;
    }

    public LocalTime getResyncTime() {
        return resyncTime;
    }

    public Optional<String> getSeedChatId() {
        return Optional.ofNullable(seedChatId);
    }

    public Optional<String> getRecipientsFile() {
        return Optional.ofNullable(recipientsFile);
    }

    public int getPort() {
        return port;
    }

    public DeliveryMode getDeliveryMode() {
        return deliveryMode;
    }

    public Optional<String> getWebhookUrl() {
        return Optional.ofNullable(webhookUrl);
    }

    public String getWebhookInternalUrl() {
        return webhookInternalUrl;
    }

    public Duration getWebhookCheckInterval() {
        return webhookCheckInterval;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }
}
