package org.matchreminder.parseObjects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of {@code GET /teams/{id}/matches} on football-data.org v4.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MatchesResponse {
    private List<MatchInfo> matches = new ArrayList<>();

    public List<MatchInfo> getMatches() {
        return matches;
    }

    public void setMatches(List<MatchInfo> matches) {
        this.matches = matches != null ? matches : new ArrayList<>();
    }
}
