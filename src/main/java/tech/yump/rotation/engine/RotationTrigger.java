package tech.yump.rotation.engine;

/**
 * What created a rotation job.
 */
public enum RotationTrigger {
    SCHEDULED,
    MANUAL,
    FORCED
}
