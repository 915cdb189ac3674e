package in.papersim.broker;

import in.papersim.domain.data.Candle;
import in.papersim.domain.data.Timeframe;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Remote market data source for historical bars and last traded price.
 *
 * Implementations strip the perpetual suffix from symbols and bound every call with a timeout.
 */
public interface MarketDataClient {

    /**
     * Fetch up to {@code limit} bars ending at {@code endTime}, ordered oldest first.
     * The newest bar may still be in progress.
     *
     * @throws MarketDataException on timeout, transport error or an error response
     */
    List<Candle> getKlines(String symbol, Timeframe timeframe, int limit, Instant endTime) throws MarketDataException;

    /**
     * Last traded price, empty when the provider has no quote for the symbol.
     *
     * @throws MarketDataException on timeout, transport error or an error response
     */
    Optional<BigDecimal> getCurrentPrice(String symbol) throws MarketDataException;

    /**
     * Provider code for logs and metrics.
     */
    String getProviderCode();
}
