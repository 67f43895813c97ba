package pl.marcinmilkowski.sense_shift.pipeline;

/**
 * A run aborted in a named stage.
 */
public class PipelineException extends Exception {

    public enum Stage {
        LOAD,
        PARTITION,
        SAMPLING,
        SNAPSHOT,
        SCORING
    }

    private final Stage stage;

    public PipelineException(Stage stage, Throwable cause) {
        super("Stage " + stage + " failed: "
            + (cause.getMessage() != null ? cause.getMessage() : cause.toString()), cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
