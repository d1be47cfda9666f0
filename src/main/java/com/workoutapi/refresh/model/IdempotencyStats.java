package com.workoutapi.refresh.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IdempotencyStats {
    String storeKind;
    long processedCount;
    long ttlSeconds;
}
