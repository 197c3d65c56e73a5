package org.matchreminder.fixtures;

import org.matchreminder.exception.FeedMalformedException;
import org.matchreminder.exception.FeedUnavailableException;

import java.util.List;

/**
 * Supplier of upcoming fixtures.
 */
public interface FixtureSource {

    /**
     * Fetches the upcoming fixtures, kickoffs normalized to the configured zone, in kickoff order.
     *
     * @throws FeedUnavailableException when the feed cannot be reached or answers with a non-success status
     * @throws FeedMalformedException   when the payload or a timestamp in it cannot be parsed
     */
    List<Fixture> fetch();
}
