package io.fullerstack.switchboard.registry;

/**
 * Decides whether repeated subscriptions of the same handler kind fold their declarations
 * into the reachability graph again.
 */
public enum SubscriptionPolicy {

    /**
     * Every subscription folds its own listen/emit cross product. Instances of one kind that
     * are wired differently are all checked.
     */
    PER_INSTANCE("per-instance"),

    /**
     * Only the first subscription of a kind folds edges; later ones are assumed to be wired
     * identically and are collapsed into the same graph contribution.
     */
    PER_KIND("per-kind");

    private final String key;

    SubscriptionPolicy(String key) {
        this.key = key;
    }

    /**
     * Configuration spelling of this policy.
     */
    public String key() {
        return key;
    }
}
