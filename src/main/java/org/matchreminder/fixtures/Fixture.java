package org.matchreminder.fixtures;

import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * A scheduled match as returned by a {@link FixtureSource}.
 * <p>
 * The kickoff is already normalized to the configured zone. It is {@code null} when the feed
 * listed the match without a start time; such fixtures are dropped by the planner.
 */
public final class Fixture {
    private final String id;
    private final ZonedDateTime kickoff;
    private final Team homeTeam;
    private final Team awayTeam;
    private final String competitionLabel;
    private final Team opponent;

    public Fixture(String id, ZonedDateTime kickoff, Team homeTeam, Team awayTeam,
                   String competitionLabel, long followedTeamId) {
        this.id = Objects.requireNonNull(id, "id");
        this.kickoff = kickoff;
        this.homeTeam = Objects.requireNonNull(homeTeam, "homeTeam");
        this.awayTeam = Objects.requireNonNull(awayTeam, "awayTeam");
        this.competitionLabel = competitionLabel != null ? competitionLabel : "";
        this.opponent = homeTeam.hasId(followedTeamId) ? awayTeam : homeTeam;
    }

    public String getId() {
        return id;
    }

    public ZonedDateTime getKickoff() {
        return kickoff;
    }

    public Team getHomeTeam() {
        return homeTeam;
    }

    public Team getAwayTeam() {
        return awayTeam;
    }

    public String getCompetitionLabel() {
        return competitionLabel;
    }

    public Competition getCompetition() {
        return Competition.classify(competitionLabel);
    }

    /**
     * The participant that is not the followed team.
     */
    public Team getOpponent() {
        return opponent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fixture)) return false;
        Fixture fixture = (Fixture) o;
        return id.equals(fixture.id)
                && Objects.equals(kickoff, fixture.kickoff)
                && homeTeam.equals(fixture.homeTeam)
                && awayTeam.equals(fixture.awayTeam)
                && competitionLabel.equals(fixture.competitionLabel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kickoff, homeTeam, awayTeam, competitionLabel);
    }

    @Override
    public String toString() {
        return "Fixture{" + id + " vs " + opponent + " at " + kickoff + "}";
    }
}
