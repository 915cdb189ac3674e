package in.papersim.service.exit;

/**
 * Strategy-family specific exit logic.
 */
public interface ExitEvaluator {

    /**
     * Never throws: every failure is reported as {@link ExitCheck#failed(String)}.
     */
    ExitCheck evaluate(ExitRequest request);
}
