package org.matchreminder.fixtures;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.matchreminder.exception.FeedMalformedException;
import org.matchreminder.exception.FeedUnavailableException;
import org.matchreminder.parseObjects.MatchInfo;
import org.matchreminder.parseObjects.MatchesResponse;
import org.matchreminder.parseObjects.TeamInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads scheduled matches of one team from football-data.org (API v4).
 */
public class FootballDataFixtureSource implements FixtureSource {
    private static final Logger log = LoggerFactory.getLogger(FootballDataFixtureSource.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI matchesUri;
    private final String apiKey;
    private final long teamId;
    private final ZoneId zone;
    private final Duration timeout;

    public FootballDataFixtureSource(HttpClient httpClient, String baseUrl, String apiKey,
                                     long teamId, ZoneId zone, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.matchesUri = URI.create(baseUrl.replaceAll("/$", "") + "/teams/" + teamId + "/matches?status=SCHEDULED");
        this.apiKey = apiKey;
        this.teamId = teamId;
        this.zone = zone;
        this.timeout = timeout;
    }

    @Override
    public List<Fixture> fetch() {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(matchesUri)
                .header("X-Auth-Token", apiKey)
                .header("Accept", "application/json")
                .timeout(timeout)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new FeedUnavailableException("Fixture feed request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FeedUnavailableException("Fixture feed request interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new FeedUnavailableException("Fixture feed answered " + status + ": " + response.body(), status);
        }

        List<Fixture> fixtures = parse(response.body());
        log.debug("Fetched {} fixtures from {}", fixtures.size(), matchesUri);
        return fixtures;
    }

    List<Fixture> parse(String body) {
        MatchesResponse payload;
        try {
            payload = objectMapper.readValue(body, MatchesResponse.class);
        } catch (JsonProcessingException e) {
            throw new FeedMalformedException("Fixture feed returned unparsable JSON", e);
        }
        if (payload == null) {
            throw new FeedMalformedException("Fixture feed returned an empty document");
        }

        List<Fixture> fixtures = new ArrayList<>();
        for (MatchInfo match : payload.getMatches()) {
            fixtures.add(toFixture(match));
        }
        fixtures.sort(Comparator.comparing(Fixture::getKickoff, Comparator.nullsLast(Comparator.<ZonedDateTime>naturalOrder())));
        return fixtures;
    }

    private Fixture toFixture(MatchInfo match) {
        ZonedDateTime kickoff = null;
        if (match.getUtcDate() != null && !match.getUtcDate().isBlank()) {
            try {
                kickoff = OffsetDateTime.parse(match.getUtcDate()).atZoneSameInstant(zone);
            } catch (DateTimeParseException e) {
                throw new FeedMalformedException("Unparsable utcDate '" + match.getUtcDate()
                        + "' for match " + match.getId(), e);
            }
        }
        String id = match.getId() != null ? String.valueOf(match.getId()) : String.valueOf(match.getUtcDate());
        String competition = match.getCompetition() != null ? match.getCompetition().getName() : null;
        return new Fixture(id, kickoff, toTeam(match.getHomeTeam()), toTeam(match.getAwayTeam()), competition, teamId);
    }

    private static Team toTeam(TeamInfo info) {
        if (info == null) {
            return new Team(null, null);
        }
        return new Team(info.getId(), info.getName());
    }
}
