package dev.kms.core;

public class VersionExhaustedException extends KMSException {
    public VersionExhaustedException(long counter) {
        super("No versions left after " + counter);
    }
}
