package de.zeus.planner.config;

/**
 * How the near-horizon load margin is derived.
 */
public enum RiskMode {
    /** PV deficit and temperature outlook. */
    DYNAMIC,
    /** Sigma scaling over p10/p90 forecast bands. */
    PROBABILISTIC
}
