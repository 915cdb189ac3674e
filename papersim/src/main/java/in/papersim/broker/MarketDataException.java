package in.papersim.broker;

/**
 * Failure talking to the market data provider (timeout, HTTP error, non-zero provider code, bad payload).
 */
public class MarketDataException extends Exception {

    public MarketDataException(String message) {
        super(message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
