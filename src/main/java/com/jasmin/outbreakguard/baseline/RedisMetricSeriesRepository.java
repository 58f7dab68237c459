package com.jasmin.outbreakguard.baseline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.outbreakguard.exceptions.SurveillanceException;
import com.jasmin.outbreakguard.models.DataSource;
import com.jasmin.outbreakguard.models.MetricPoint;
import com.jasmin.outbreakguard.models.SeriesKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Series stored as Redis sorted sets scored by epoch millis.
 * <p>
 * Keys: {@code <prefix>:<region>:<source>:<metric>} holds JSON points,
 * {@code <prefix>:index:<region>} the set of {@code <source>:<metric>} members,
 * {@code <prefix>:appends:<region>:<source>:<metric>} the write counter.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "outbreak-guard.baseline", name = "backend", havingValue = "redis")
public class RedisMetricSeriesRepository implements MetricSeriesRepository {

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final BaselineProperties props;

    @Override
    public List<MetricPoint> load(SeriesKey key) {
        Set<String> members = redis.opsForZSet().range(seriesKey(key), 0, -1);
        if (members == null || members.isEmpty()) {
            return List.of();
        }
        List<MetricPoint> out = new ArrayList<>(members.size());
        for (String m : members) {
            MetricPoint p = fromJson(m);
            if (p != null) out.add(p);
        }
        return List.copyOf(out);
    }

    @Override
    public Optional<Instant> latestTimestamp(SeriesKey key) {
        Set<ZSetOperations.TypedTuple<String>> top = redis.opsForZSet().reverseRangeWithScores(seriesKey(key), 0, 0);
        if (top == null || top.isEmpty()) {
            return Optional.empty();
        }
        Double score = top.iterator().next().getScore();
        return score == null ? Optional.empty() : Optional.of(Instant.ofEpochMilli(score.longValue()));
    }

    @Override
    public void upsert(SeriesKey key, MetricPoint point) {
        String sk = seriesKey(key);
        double score = point.getTimestamp().toEpochMilli();
        redis.opsForZSet().removeRangeByScore(sk, score, score);
        redis.opsForZSet().add(sk, toJson(point), score);
        redis.opsForValue().increment(appendsKey(key));
        redis.opsForSet().add(indexKey(key.getRegion()), key.getSource().code() + ":" + key.getMetric());
    }

    @Override
    public int evictBefore(SeriesKey key, Instant floor) {
        Long removed = redis.opsForZSet().removeRangeByScore(seriesKey(key), Double.NEGATIVE_INFINITY, floor.toEpochMilli() - 1);
        return removed == null ? 0 : removed.intValue();
    }

    @Override
    public Set<SeriesKey> keys(String region) {
        Set<String> members = redis.opsForSet().members(indexKey(region));
        Set<SeriesKey> out = new TreeSet<>();
        if (members == null) {
            return out;
        }
        for (String m : members) {
            int sep = m.indexOf(':');
            if (sep <= 0) continue;
            DataSource source = DataSource.fromCode(m.substring(0, sep));
            if (source == null) {
                log.warn("Ignoring unknown source in series index {}: {}", indexKey(region), m);
                continue;
            }
            out.add(SeriesKey.of(region, source, m.substring(sep + 1)));
        }
        return out;
    }

    @Override
    public long appendCount(SeriesKey key) {
        String v = redis.opsForValue().get(appendsKey(key));
        if (v == null) {
            return 0L;
        }
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException ex) {
            log.warn("Corrupt append counter at {}: {}", appendsKey(key), v);
            return 0L;
        }
    }

    /** Constructs the sorted-set key of a series. */
    private String seriesKey(SeriesKey key) {
        return props.getKeyPrefix() + ":" + key;
    }

    private String appendsKey(SeriesKey key) {
        return props.getKeyPrefix() + ":appends:" + key;
    }

    private String indexKey(String region) {
        return props.getKeyPrefix() + ":index:" + region;
    }

    private String toJson(MetricPoint p) {
        try {
            return objectMapper.writeValueAsString(p);
        } catch (JsonProcessingException e) {
            throw new SurveillanceException("cannot serialize point at " + p.getTimestamp(), e);
        }
    }

    /** Parses a stored point; unreadable members are logged and skipped. */
    private MetricPoint fromJson(String json) {
        try {
            return objectMapper.readValue(json, MetricPoint.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable series member: {}", json, e);
            return null;
        }
    }
}
