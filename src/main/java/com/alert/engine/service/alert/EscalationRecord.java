package com.alert.engine.service.alert;

import java.time.Instant;
import java.util.List;

public record EscalationRecord(int level, Instant escalatedAt, List<String> escalatedTo, String reason) {

    public EscalationRecord {
        escalatedTo = escalatedTo == null ? List.of() : List.copyOf(escalatedTo);
    }
}
