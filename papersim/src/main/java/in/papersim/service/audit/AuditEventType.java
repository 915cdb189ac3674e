package in.papersim.service.audit;

/**
 * Reasons the reconciler refused to write a transition.
 */
public enum AuditEventType {
    TIMESTAMP_VIOLATION_ON_FILL,
    TIMESTAMP_VIOLATION_ON_CLOSE,
    TIMESTAMP_VIOLATION_ON_CANCEL,
    MISSING_FILLED_AT_ON_CLOSE,
    UNKNOWN_STRATEGY_TYPE,
    SPREAD_TRADE_PRICE_LEVEL_EXIT
}
