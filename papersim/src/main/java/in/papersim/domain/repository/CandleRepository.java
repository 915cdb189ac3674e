package in.papersim.domain.repository;

import in.papersim.domain.data.Candle;
import in.papersim.domain.data.Timeframe;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the kline cache.
 */
public interface CandleRepository {

    /**
     * Insert candles in batch.
     * Uses unique constraint (symbol, timeframe, start_time); an existing bar is left untouched.
     *
     * @return number of rows actually inserted
     */
    int insertBatch(List<Candle> candles);

    /**
     * Find bars with start in [from, to], ordered ascending.
     */
    List<Candle> findRange(String symbol, Timeframe timeframe, Instant from, Instant to);

    /**
     * Find the newest cached bar.
     */
    Optional<Candle> findLatest(String symbol, Timeframe timeframe);
}
