package org.example.webverse.service.host;

/**
 * The act of invoking a named stage failed: the stage is unknown, crashed, or
 * answered nothing. Unlike generation failures this cannot be recovered inside
 * the stage.
 */
public class StageInvocationException extends RuntimeException {

    private final String stage;

    public StageInvocationException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageInvocationException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
