package com.gt.vsrs.session;

import com.gt.vsrs.card.CardStore;
import com.gt.vsrs.model.CardView;
import com.gt.vsrs.model.Grade;
import com.gt.vsrs.model.RetentionRecord;
import com.gt.vsrs.model.SessionState;
import com.gt.vsrs.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Sequences a bounded run of due cards.
 * <p>
 * Idle -> Active on start. While Active, the next due card is read fresh from the store each time. Reaching the cap,
 * or running out of due cards after at least one review, moves to Prompt where the caller decides to start another run
 * or end the session. Running out with nothing reviewed goes straight back to Idle.
 * <p>
 * Session state lives only in memory and the cap never affects scheduling.
 */
@Component
public class ReviewSessionManager {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionManager.class);

    private final CardStore cardStore;
    private final int sessionCap;

    private SessionState state = SessionState.Idle;
    private int reviewedCount = 0;

    @Autowired
    public ReviewSessionManager(CardStore cardStore,
                                @Value("${vsrs.session.cap:10}") int sessionCap) {
        if (sessionCap < 1) {
            throw new IllegalArgumentException("Session cap must be positive, was " + sessionCap);
        }

        this.cardStore = cardStore;
        this.sessionCap = sessionCap;
    }

    public synchronized Optional<CardView> startSession(Instant now) {
        reviewedCount = 0;
        state = SessionState.Active;
        log.debug("Review session started");

        return nextDueCard(now);
    }

    public synchronized Optional<CardView> nextDueCard(Instant now) {
        if (state != SessionState.Active) {
            return Optional.empty();
        }

        if (reviewedCount >= sessionCap) {
            moveTo(SessionState.Prompt);
            return Optional.empty();
        }

        List<CardView> dueCards = cardStore.getDue(now);
        if (dueCards.isEmpty()) {
            moveTo(reviewedCount > 0 ? SessionState.Prompt : SessionState.Idle);
            return Optional.empty();
        }

        return Optional.of(dueCards.get(0));
    }

    public synchronized RetentionRecord gradeCard(String recordId, Grade grade, Instant now) {
        RetentionRecord updated = cardStore.applyGrade(recordId, grade, now);
        // Grades outside a running session still reschedule the card but do not count towards the cap
        if (state == SessionState.Active) {
            reviewedCount++;
        }

        return updated;
    }

    public synchronized void endSession() {
        reviewedCount = 0;
        moveTo(SessionState.Idle);
    }

    public synchronized SessionStatus getSessionStatus() {
        return new SessionStatus(state, reviewedCount, sessionCap);
    }

    private void moveTo(SessionState newState) {
        if (state != newState) {
            log.debug("Review session {} -> {} after {} reviews", state, newState, reviewedCount);
            state = newState;
        }
    }
}
