package com.gt.vsrs.scheduling;

import com.gt.vsrs.model.Grade;
import com.gt.vsrs.model.RetentionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;

/**
 * SM-2 style scheduling. Computes the next retention state of a card from its current state and a grade.
 * <p>
 * The computation is pure and total: any record, grade and instant produce a valid record whose interval is at
 * least the relapse interval and at most maxIntervalDays, whose ease is within [easeFloor, easeCeiling] and whose due
 * time is after {@code now}.
 */
@Component
public class RetentionScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetentionScheduler.class);

    static final double MINUTES_PER_DAY = 24 * 60;
    static final double MILLIS_PER_DAY = MINUTES_PER_DAY * 60 * 1000;
    static final double MIN_SUCCESS_INTERVAL_DAYS = 1;

    private final SchedulingProps props;

    public RetentionScheduler(SchedulingProps props) {
        this.props = props;
    }

    public RetentionRecord initialRecord(String itemId, Instant now) {
        return initialRecord(UUID.randomUUID().toString(), itemId, now);
    }

    public RetentionRecord initialRecord(String recordId, String itemId, Instant now) {
        return new RetentionRecord(recordId, itemId, now, 0, props.initialEase(), 0, 0, 0);
    }

    // Brings a record from outside the scheduler into range: ease within bounds, interval within [0, maxIntervalDays]
    public RetentionRecord normalize(RetentionRecord record) {
        return new RetentionRecord(record.id(), record.itemId(), record.dueAt(), normalizeInterval(record.intervalDays()),
                normalizeEase(record.ease()), Math.max(record.reps(), 0), Math.max(record.lapses(), 0), record.version());
    }

    public RetentionRecord transition(RetentionRecord record, Grade grade, Instant now) {
        double currentEase = normalizeEase(record.ease());
        double currentInterval = normalizeInterval(record.intervalDays());
        int currentReps = Math.max(record.reps(), 0);
        int currentLapses = Math.max(record.lapses(), 0);

        if (grade.isLapse()) {
            double newEase = Math.max(currentEase - props.lapsePenalty(), props.easeFloor());
            double newInterval = getRelapseIntervalDays();

            return new RetentionRecord(record.id(), record.itemId(), dueAt(now, newInterval), newInterval, newEase,
                    0, currentLapses + 1, record.version());
        }

        int newReps = currentReps + 1;
        double newEase = clampEase(currentEase + easeDelta(grade));
        double newInterval = Math.min(getMaxIntervalDays(),
                Math.max(MIN_SUCCESS_INTERVAL_DAYS, calculateSuccessInterval(grade, newReps, currentInterval, newEase)));

        return new RetentionRecord(record.id(), record.itemId(), dueAt(now, newInterval), newInterval, newEase,
                newReps, currentLapses, record.version());
    }

    public double getRelapseIntervalDays() {
        return Math.max(props.relapseIntervalMinutes(), 1) / MINUTES_PER_DAY;
    }

    public double getMaxIntervalDays() {
        return Math.max(props.maxIntervalDays(), MIN_SUCCESS_INTERVAL_DAYS);
    }

    private double calculateSuccessInterval(Grade grade, int newReps, double currentInterval, double newEase) {
        if (newReps == 1) {
            return grade == Grade.Easy ? props.easySeedDays() : props.firstSeedDays();
        }

        if (grade == Grade.Hard) {
            return currentInterval * props.hardMultiplier();
        }

        double goodInterval = currentInterval * newEase;
        if (newReps == 2) {
            goodInterval = Math.max(props.secondSeedDays(), goodInterval);
        }

        return grade == Grade.Easy ? goodInterval * props.easyBonus() : goodInterval;
    }

    private double easeDelta(Grade grade) {
        switch (grade) {
            case Hard:
                return props.hardEaseDelta();
            case Easy:
                return props.easyEaseDelta();
            default:
                return 0;
        }
    }

    // Records ingested from the data API are not trusted to be in range
    private double normalizeEase(double ease) {
        if (!Double.isFinite(ease)) {
            log.warn("Non-finite ease {} replaced with initial ease", ease);
            return props.initialEase();
        }

        return clampEase(ease);
    }

    private double normalizeInterval(double intervalDays) {
        if (!Double.isFinite(intervalDays) || intervalDays <= 0) {
            return 0;
        }

        return Math.min(intervalDays, getMaxIntervalDays());
    }

    private double clampEase(double ease) {
        return Math.min(Math.max(ease, props.easeFloor()), props.easeCeiling());
    }

    private static Instant dueAt(Instant now, double intervalDays) {
        return now.plusMillis(Math.round(intervalDays * MILLIS_PER_DAY));
    }
}
