package com.gt.vsrs.model;

import java.time.Instant;

// version is local optimistic locking state and is never sent to the data API
public record RetentionRecord(String id,
                              String itemId,
                              Instant dueAt,
                              double intervalDays,
                              double ease,
                              int reps,
                              int lapses,
                              long version) {

    public RetentionRecord withVersion(long newVersion) {
        return new RetentionRecord(id, itemId, dueAt, intervalDays, ease, reps, lapses, newVersion);
    }

    public boolean isDue(Instant now) {
        return !dueAt.isAfter(now);
    }
}
