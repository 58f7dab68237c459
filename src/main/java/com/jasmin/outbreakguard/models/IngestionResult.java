package com.jasmin.outbreakguard.models;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** Outcome of a batch ingestion; a rejected reading never blocks the rest of the batch. */
@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IngestionResult {
    private int accepted;
    // Older than the retention floor of their series
    private int dropped;
    private List<Rejection> rejected = new ArrayList<>();

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Rejection {
        private int index;
        private List<String> problems;
    }
}
