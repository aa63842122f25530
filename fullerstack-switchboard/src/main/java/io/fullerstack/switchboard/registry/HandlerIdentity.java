package io.fullerstack.switchboard.registry;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a handler kind: a display name for diagnostics plus a uniqueness key that is
 * stable per concrete handler kind.
 *
 * <p>Identities order by display name first, then key, so diagnostics that list handlers
 * are reproducible.
 *
 * @param displayName short name shown in error chains and graph labels
 * @param key         stable key, the fully qualified class name for class-derived identities
 */
public record HandlerIdentity(String displayName, String key) implements Comparable<HandlerIdentity> {

    private static final Comparator<HandlerIdentity> ORDER =
        Comparator.comparing(HandlerIdentity::displayName).thenComparing(HandlerIdentity::key);

    public HandlerIdentity {
        Objects.requireNonNull(displayName, "displayName cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
        if (displayName.isBlank()) {
            throw new IllegalArgumentException("displayName cannot be blank");
        }
        if (key.isBlank()) {
            throw new IllegalArgumentException("key cannot be blank");
        }
    }

    /**
     * Identity derived from a handler class. Anonymous and local classes fall back to
     * their binary name.
     */
    public static HandlerIdentity of(Class<?> kind) {
        Objects.requireNonNull(kind, "kind cannot be null");
        String simple = kind.getSimpleName();
        return new HandlerIdentity(simple.isEmpty() ? kind.getName() : simple, kind.getName());
    }

    /**
     * Identity whose display name doubles as its key.
     */
    public static HandlerIdentity of(String name) {
        return new HandlerIdentity(name, name);
    }

    @Override
    public int compareTo(HandlerIdentity other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
