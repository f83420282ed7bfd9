package io.classguard.ingest.aggregate;

import io.classguard.store.model.Channel;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * One time bucket of a chart series: channel means over the readings that fell
 * into {@code [bucketStart, bucketStart + width)}.
 */
public final class AggregateBucket {

    private final Instant bucketStart;
    private final Duration width;
    private final int count;
    private final Map<Channel, Double> means;

    public AggregateBucket(Instant bucketStart, Duration width, int count, Map<Channel, Double> means) {
        this.bucketStart = bucketStart;
        this.width = width;
        this.count = count;
        this.means = means.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(means));
    }

    public Instant getBucketStart() { return bucketStart; }
    public Instant getBucketEnd() { return bucketStart.plus(width); }
    public Duration getWidth() { return width; }
    public int getCount() { return count; }
    public Map<Channel, Double> getMeans() { return means; }

    /** Empty when no reading in this bucket carried the channel. */
    public OptionalDouble mean(Channel channel) {
        Double value = means.get(channel);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    @Override
    public String toString() {
        return "AggregateBucket{start=" + bucketStart + ", count=" + count + ", means=" + means + '}';
    }
}
