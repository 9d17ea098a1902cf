package com.ttennebkram.radiograph;

/**
 * Why an image could not be enhanced. The caller keeps the original image.
 */
public final class ProcessingFailure {

    /** Stage name used when the input itself is unusable. */
    public static final String INPUT_STAGE = "Input";

    private final String stageName;
    private final String message;
    private final Throwable cause;

    public ProcessingFailure(String stageName, String message, Throwable cause) {
        this.stageName = stageName;
        this.message = message;
        this.cause = cause;
    }

    public String getStageName() {
        return stageName;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Underlying exception, if any.
     */
    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return "ProcessingFailure{stage=" + stageName + ", message=" + message + "}";
    }
}
