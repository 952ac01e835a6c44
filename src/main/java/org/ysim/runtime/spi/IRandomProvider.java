package org.ysim.runtime.spi;

import java.util.Random;

/**
 * Provides deterministic randomness scoped to a simulation run.
 * Implementations must be pure with respect to the provided seed and support derivation of
 * child providers for independent sub-streams.
 * <p>
 * Every random decision of the slot loop draws from a provider derived for its own scope
 * (sampling per slot, selection and execution per actor and slot, population phases per day),
 * so the outcome does not depend on the order in which worker threads run.
 * </p>
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be &gt; 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Provides access to an underlying {@link Random} instance for APIs that require it
     * (e.g., {@code Collections.shuffle}).
     *
     * @return the Random instance
     */
    Random asJavaRandom();

    /**
     * Creates a derived provider that is deterministically based on this provider's seed and the
     * given scope/key. Deriving does not consume values from this provider.
     *
     * @param scope a stable, descriptive scope name (e.g., "activity", "actor")
     * @param key   a stable numeric key (e.g., slot, actor id)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
