package tech.yump.rotation.health;

/**
 * Result of a synthetic login against one dependent.
 */
public enum VerifyOutcome {
    /** The dependent authenticated with the candidate. */
    AUTHENTICATED,
    /** The dependent answered and refused the candidate. */
    REJECTED,
    /** The dependent could not be reached in time. */
    UNAVAILABLE
}
