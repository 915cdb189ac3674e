package in.papersim.service.exit;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Result of one exit evaluation: failed, no exit, or exit.
 *
 * A failed check carries an error and must never be treated as "no exit".
 */
public final class ExitCheck {

    private final String error;
    private final ExitDecision decision;
    private final BigDecimal currentPrice;

    private ExitCheck(String error, ExitDecision decision, BigDecimal currentPrice) {
        this.error = error;
        this.decision = decision;
        this.currentPrice = currentPrice;
    }

    public static ExitCheck failed(String error) {
        return new ExitCheck(error, null, null);
    }

    public static ExitCheck noExit(BigDecimal currentPrice) {
        return new ExitCheck(null, null, currentPrice);
    }

    public static ExitCheck exit(ExitDecision decision) {
        return new ExitCheck(null, decision, decision.currentPrice());
    }

    public boolean isFailed() {
        return error != null;
    }

    public boolean isExit() {
        return decision != null;
    }

    public String error() {
        return error;
    }

    public Optional<ExitDecision> decision() {
        return Optional.ofNullable(decision);
    }

    /**
     * Latest known price, may be null.
     */
    public BigDecimal currentPrice() {
        return currentPrice;
    }

    @Override
    public String toString() {
        if (isFailed()) return "ExitCheck[failed: " + error + "]";
        if (isExit()) return "ExitCheck[exit: " + decision + "]";
        return "ExitCheck[no exit, price=" + currentPrice + "]";
    }
}
