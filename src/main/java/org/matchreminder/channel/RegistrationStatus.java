package org.matchreminder.channel;

public enum RegistrationStatus {
    /** The platform delivers updates to the expected address. */
    MATCHED,
    /** The platform points elsewhere (or nowhere); re-registration is attempted every tick. */
    MISMATCHED,
    /** The last check could not query the platform. */
    UNKNOWN
}
