package lls.proc.exceptions;

/**
 * Failure of a pre- or post-processing stage (flash correction, trimming, channel
 * registration, MIP merging, folder relocation). Fatal to the item: remaining stages are not run.
 */
public class PipelineStageException extends LLSProcessingException {

    private final String stage;

    public PipelineStageException(String stage, String message, Throwable cause) {
        super(stage + " failed: " + message, cause);
        this.stage = stage;
    }

    public PipelineStageException(String stage, String message) {
        super(stage + " failed: " + message);
        this.stage = stage;
    }

    /**
     * @return human readable name of the stage that failed
     */
    public String getStage() {
        return stage;
    }
}
