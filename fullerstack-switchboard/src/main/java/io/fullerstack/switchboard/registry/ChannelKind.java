package io.fullerstack.switchboard.registry;

/**
 * Subscriber multiplicity of a declared name.
 */
public enum ChannelKind {
    /** Any number of members, dispatched in order. */
    CHANNEL,
    /** Exactly one member, required before the hub is considered wired. */
    SLOT,
    /** At most one member. */
    SINGLE
}
