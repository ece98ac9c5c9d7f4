package com.khartoum.launchpad.exception;

/**
 * Thrown both for unknown jobs and for jobs the caller does not own, so the
 * two cases are indistinguishable to the client.
 */
public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException() {
        super("Job not found");
    }
}
