package tech.yump.rotation.engine;

import tech.yump.rotation.core.RotationException;

public class JobNotFoundException extends RotationException {
    public JobNotFoundException(String jobId) {
        super("Rotation job not found: " + jobId);
    }
}
