package fun.fengwk.a11y.core.service.batch;

/**
 * Thrown when a batch-level failure aborts a batch run.
 *
 * @author fengwk
 */
public class BatchAnalysisException extends RuntimeException {

    public BatchAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

}
