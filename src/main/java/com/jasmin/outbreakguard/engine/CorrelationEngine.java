package com.jasmin.outbreakguard.engine;

import com.jasmin.outbreakguard.constants.Constants;
import com.jasmin.outbreakguard.models.Anomaly;
import com.jasmin.outbreakguard.models.DataSource;
import com.jasmin.outbreakguard.models.EvaluationWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Cross-source corroboration inside one region and evaluation window. When at
 * least two distinct data sources raised anomalies, they share a correlation
 * group, each member moves one severity level up (capped at critical) and its
 * confidence moves toward the group maximum. Uncorroborated anomalies pass
 * through unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CorrelationEngine {

    private final EngineProperties cfg;

    public List<Anomaly> correlate(EvaluationWindow window, List<Anomaly> candidates) {
        EngineProperties.Correlation c = cfg.getCorrelation();
        if (!c.isEnabled() || candidates.size() < 2) {
            return candidates;
        }

        Map<String, List<Anomaly>> byRegion = new LinkedHashMap<>();
        for (Anomaly a : candidates) {
            byRegion.computeIfAbsent(a.getRegion(), r -> new ArrayList<>()).add(a);
        }

        List<Anomaly> out = new ArrayList<>(candidates.size());
        for (Map.Entry<String, List<Anomaly>> e : byRegion.entrySet()) {
            out.addAll(correlateRegion(e.getKey(), window, e.getValue(), c));
        }
        return out;
    }

    private List<Anomaly> correlateRegion(String region, EvaluationWindow window, List<Anomaly> members,
                                          EngineProperties.Correlation c) {
        Set<DataSource> sources = EnumSet.noneOf(DataSource.class);
        List<Anomaly> grouped = new ArrayList<>();
        double maxConfidence = 0.0;
        for (Anomaly a : members) {
            if (window.contains(a.getTimestamp())) {
                grouped.add(a);
                sources.add(a.getDataSource());
                maxConfidence = Math.max(maxConfidence, a.getConfidence());
            }
        }
        if (sources.size() < c.getMinSources()) {
            return members;
        }

        String groupId = groupId(region, window, grouped);
        List<String> sourceCodes = sources.stream().map(DataSource::code).toList();
        log.info("Correlated {} anomalies in {} across sources {} (group {})",
                grouped.size(), region, sourceCodes, groupId);

        List<Anomaly> out = new ArrayList<>(members.size());
        for (Anomaly a : members) {
            if (!window.contains(a.getTimestamp())) {
                out.add(a);
                continue;
            }
            double boosted = a.getConfidence() + (maxConfidence - a.getConfidence()) * c.getConfidenceBoost();
            out.add(a.toBuilder()
                    .correlationGroupId(groupId)
                    .severity(a.getSeverity().elevate())
                    .confidence(boosted)
                    .metadataEntry(Constants.META_PRE_CORRELATION_SEVERITY, a.getSeverity().code())
                    .metadataEntry(Constants.META_CORRELATED_SOURCES, sourceCodes)
                    .build());
        }
        return out;
    }

    /** Name-based group id derived from the region, window and the ids of the grouped anomalies. */
    static String groupId(String region, EvaluationWindow window, List<Anomaly> members) {
        Set<String> ids = new TreeSet<>();
        for (Anomaly a : members) {
            ids.add(a.getId());
        }
        String seed = "group|" + region + "|" + window.getFrom() + "|" + window.getTo() + "|" + String.join(",", ids);
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
