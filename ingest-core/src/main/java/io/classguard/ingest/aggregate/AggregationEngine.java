package io.classguard.ingest.aggregate;

import io.classguard.store.model.Channel;
import io.classguard.store.model.Reading;
import io.classguard.store.repository.ReadingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Downsamples stored readings into fixed-width buckets for chart series.
 * Buckets are aligned to {@code since}; buckets without readings are still
 * emitted, with a count of zero and no means, so series stay evenly spaced.
 */
public class AggregationEngine {

    private static final Logger logger = LoggerFactory.getLogger(AggregationEngine.class);

    private final ReadingRepository repository;

    public AggregationEngine(ReadingRepository repository) {
        this.repository = repository;
    }

    /**
     * Aggregates {@code [since, until)} and returns the trailing
     * {@code lastNBuckets} buckets in chronological order. Readings before the
     * first returned bucket are never read from the store.
     */
    public List<AggregateBucket> aggregate(Instant since, Instant until, Duration bucketWidth, int lastNBuckets) {
        if (since == null || until == null || bucketWidth == null
                || !until.isAfter(since) || bucketWidth.isZero() || bucketWidth.isNegative() || lastNBuckets <= 0) {
            logger.debug("Empty aggregation for since={}, until={}, width={}, buckets={}",
                    since, until, bucketWidth, lastNBuckets);
            return Collections.emptyList();
        }

        long widthMillis = Math.max(1, bucketWidth.toMillis());
        long spanMillis = until.toEpochMilli() - since.toEpochMilli();
        long totalBuckets = (spanMillis + widthMillis - 1) / widthMillis;
        long firstIndex = Math.max(0, totalBuckets - lastNBuckets);
        int size = (int) (totalBuckets - firstIndex);
        Instant scanStart = since.plusMillis(firstIndex * widthMillis);

        Accumulator[] accumulators = new Accumulator[size];
        for (int i = 0; i < size; i++) {
            accumulators[i] = new Accumulator();
        }

        try (Stream<Reading> readings = repository.rangeScan(scanStart, until)) {
            readings.forEach(reading -> {
                Instant ts = reading.getTimestamp();
                if (ts == null) {
                    return;
                }
                long offset = ts.toEpochMilli() - scanStart.toEpochMilli();
                int index = (int) (offset / widthMillis);
                if (offset >= 0 && index < size) {
                    accumulators[index].add(reading);
                }
            });
        }

        List<AggregateBucket> buckets = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            Instant start = scanStart.plusMillis(i * widthMillis);
            buckets.add(accumulators[i].toBucket(start, Duration.ofMillis(widthMillis)));
        }
        return buckets;
    }

    private static final class Accumulator {
        private final Map<Channel, double[]> sums = new EnumMap<>(Channel.class);
        private int count;

        void add(Reading reading) {
            count++;
            for (Channel channel : Channel.values()) {
                Double value = reading.get(channel);
                if (value != null && !value.isNaN()) {
                    double[] acc = sums.computeIfAbsent(channel, c -> new double[2]);
                    acc[0] += value;
                    acc[1]++;
                }
            }
        }

        AggregateBucket toBucket(Instant start, Duration width) {
            Map<Channel, Double> means = new EnumMap<>(Channel.class);
            for (Map.Entry<Channel, double[]> entry : sums.entrySet()) {
                double[] acc = entry.getValue();
                means.put(entry.getKey(), acc[0] / acc[1]);
            }
            return new AggregateBucket(start, width, count, means);
        }
    }
}
