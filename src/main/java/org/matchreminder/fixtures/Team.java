package org.matchreminder.fixtures;

import java.util.Objects;

/**
 * One side of a fixture.
 */
public final class Team {
    public static final String UNKNOWN_NAME = "Unknown Opponent";

    private final Long id;
    private final String name;

    public Team(Long id, String name) {
        this.id = id;
        this.name = name != null && !name.isBlank() ? name : UNKNOWN_NAME;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean hasId(long teamId) {
        return id != null && id == teamId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Team)) return false;
        Team team = (Team) o;
        return Objects.equals(id, team.id) && name.equals(team.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return name;
    }
}
