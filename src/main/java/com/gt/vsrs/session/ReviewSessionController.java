package com.gt.vsrs.session;

import com.gt.vsrs.model.CardView;
import com.gt.vsrs.model.Grade;
import com.gt.vsrs.model.RetentionRecord;
import com.gt.vsrs.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Optional;

@RestController
@RequestMapping("/rest/review")
public class ReviewSessionController {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionController.class);

    private final ReviewSessionManager reviewSessionManager;

    public ReviewSessionController(ReviewSessionManager reviewSessionManager) {
        this.reviewSessionManager = reviewSessionManager;
    }

    @PostMapping(value = "/start", produces = "application/json")
    public ResponseEntity<CardView> startSession() {
        return toResponse(reviewSessionManager.startSession(Instant.now()));
    }

    // 204 when there is no card to show, the session status tells the caller why
    @GetMapping(value = "/next", produces = "application/json")
    public ResponseEntity<CardView> nextDueCard() {
        return toResponse(reviewSessionManager.nextDueCard(Instant.now()));
    }

    @PostMapping(value = "/grade", consumes = "application/json", produces = "application/json")
    public RetentionRecord gradeCard(@RequestBody GradeRequest request) {
        return reviewSessionManager.gradeCard(request.recordId(), request.grade(), Instant.now());
    }

    @PostMapping("/end")
    public void endSession() {
        reviewSessionManager.endSession();
    }

    @GetMapping(value = "/status", produces = "application/json")
    public SessionStatus getSessionStatus() {
        return reviewSessionManager.getSessionStatus();
    }

    private static ResponseEntity<CardView> toResponse(Optional<CardView> card) {
        return card.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.status(HttpStatus.NO_CONTENT).build());
    }

    private record GradeRequest(String recordId, Grade grade) { }
}
