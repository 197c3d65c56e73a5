package org.matchreminder.support;

import org.matchreminder.fixtures.Fixture;
import org.matchreminder.fixtures.Team;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Builders for fixtures used across tests.
 */
public final class Fixtures {
    public static final long BARCA_ID = 81L;
    public static final ZoneId ZONE = ZoneId.of("Asia/Jerusalem");
    public static final Team BARCA = new Team(BARCA_ID, "FC Barcelona");
    public static final Team REAL = new Team(86L, "Real Madrid CF");

    private Fixtures() {
    }

    public static Fixture homeMatch(String id, Instant kickoff) {
        return match(id, kickoff, "Primera Division");
    }

    public static Fixture match(String id, Instant kickoff, String competition) {
        return new Fixture(id, kickoff == null ? null : kickoff.atZone(ZONE), BARCA, REAL, competition, BARCA_ID);
    }
}
