package io.verbatim.analyze;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides what happens when a rule throws. The analyzer drops the failed rule's signals for the
 * node and continues if the handler returns normally.
 */
public interface RuleErrorHandler {

  /** Rethrows, aborting the analysis. */
  RuleErrorHandler DEFAULT =
      e -> {
        throw e;
      };

  void handleRuleError(RuleExecutionException e);

  /**
   * Creates a lenient handler that logs the failure and lets the analysis continue.
   *
   * @return a lenient error handler
   */
  static RuleErrorHandler lenient() {
    Logger log = LoggerFactory.getLogger(RuleErrorHandler.class);
    return e -> log.warn("Skipping failed rule: {}", e.getMessage(), e);
  }
}
