package org.matchreminder.channel;

import java.util.Optional;

/**
 * Access to the platform's record of where inbound updates for this bot are delivered.
 */
public interface ChannelRegistrar {

    /**
     * The currently registered target, empty if none is registered.
     */
    Optional<String> currentTarget() throws Exception;

    /**
     * Points the platform at {@code target}.
     */
    void register(String target) throws Exception;
}
