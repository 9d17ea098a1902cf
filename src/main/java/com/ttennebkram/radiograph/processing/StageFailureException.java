package com.ttennebkram.radiograph.processing;

/**
 * Thrown when a stage cannot process the image it was given.
 * Carries the name of the failing stage.
 */
public class StageFailureException extends RuntimeException {

    private final String stageName;

    public StageFailureException(String stageName, String message) {
        super(stageName + ": " + message);
        this.stageName = stageName;
    }

    public StageFailureException(String stageName, String message, Throwable cause) {
        super(stageName + ": " + message, cause);
        this.stageName = stageName;
    }

    public String getStageName() {
        return stageName;
    }
}
