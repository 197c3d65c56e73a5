package org.matchreminder.parseObjects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class MatchInfo {
    private Long id;

    @JsonProperty("utcDate")
    private String utcDate; // ISO-8601, e.g. 2025-02-22T19:00:00Z

    private String status;

    private CompetitionInfo competition;

    private TeamInfo homeTeam;

    private TeamInfo awayTeam;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getUtcDate() {
        return utcDate;
    }

    public void setUtcDate(String utcDate) {
        this.utcDate = utcDate;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public CompetitionInfo getCompetition() {
        return competition;
    }

    public void setCompetition(CompetitionInfo competition) {
        this.competition = competition;
    }

    public TeamInfo getHomeTeam() {
        return homeTeam;
    }

    public void setHomeTeam(TeamInfo homeTeam) {
        this.homeTeam = homeTeam;
    }

    public TeamInfo getAwayTeam() {
        return awayTeam;
    }

    public void setAwayTeam(TeamInfo awayTeam) {
        this.awayTeam = awayTeam;
    }
}
