package com.jasmin.outbreakguard.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.outbreakguard.models.Anomaly;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Pushes emitted anomalies, one JSON message each, to the alerting side.
 * Delivery is best effort: failures are logged and never reach the detection caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyPublisher {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final PublisherProperties props;

    /** @return number of anomalies actually sent */
    public int publish(List<Anomaly> anomalies) {
        if (!props.isEnabled() || anomalies.isEmpty()) {
            return 0;
        }
        int sent = 0;
        for (Anomaly anomaly : anomalies) {
            try {
                String json = objectMapper.writeValueAsString(anomaly);
                redisTemplate.convertAndSend(props.getChannel(), json);
                sent++;
            } catch (JsonProcessingException e) {
                log.error("Failed to serialize anomaly {}", anomaly.getId(), e);
            } catch (RuntimeException e) {
                log.error("Failed to publish anomaly {} to {}", anomaly.getId(), props.getChannel(), e);
            }
        }
        log.debug("Published {}/{} anomalies to {}", sent, anomalies.size(), props.getChannel());
        return sent;
    }
}
