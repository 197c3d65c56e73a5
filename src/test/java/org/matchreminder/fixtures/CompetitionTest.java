package org.matchreminder.fixtures;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CompetitionTest {

    @Test
    void classifiesByLabel() {
        assertThat(Competition.classify("UEFA Champions League")).isEqualTo(Competition.CHAMPIONS_LEAGUE);
        assertThat(Competition.classify("LaLiga EA Sports")).isEqualTo(Competition.LA_LIGA);
        assertThat(Competition.classify("Primera Division")).isEqualTo(Competition.LEAGUE);
    }

    @Test
    void everythingElseIsLeague() {
        assertThat(Competition.classify("Copa del Rey")).isEqualTo(Competition.LEAGUE);
        assertThat(Competition.classify(null)).isEqualTo(Competition.LEAGUE);
    }

    @Test
    void opponentIsTheOtherSide() {
        Team barca = new Team(81L, "FC Barcelona");
        Team betis = new Team(90L, "Real Betis");

        assertThat(new Fixture("1", null, barca, betis, "LaLiga", 81L).getOpponent()).isEqualTo(betis);
        assertThat(new Fixture("2", null, betis, barca, "LaLiga", 81L).getOpponent()).isEqualTo(betis);
    }
}
