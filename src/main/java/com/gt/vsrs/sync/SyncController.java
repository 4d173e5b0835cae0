package com.gt.vsrs.sync;

import com.gt.vsrs.model.ContentCorrection;
import com.gt.vsrs.model.Item;
import com.gt.vsrs.security.AuthSession;
import com.gt.vsrs.sync.model.DataApiSnapshot;
import com.gt.vsrs.sync.model.IngestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/rest/sync")
public class SyncController {

    private static final Logger log = LoggerFactory.getLogger(SyncController.class);

    private final ReconciliationEngine reconciliationEngine;

    public SyncController(ReconciliationEngine reconciliationEngine) {
        this.reconciliationEngine = reconciliationEngine;
    }

    @PostMapping(value = "/snapshot", consumes = "application/json", produces = "application/json")
    public IngestResult ingestSnapshot(@RequestBody DataApiSnapshot snapshot,
                                       @AuthenticationPrincipal AuthSession authSession) {
        return reconciliationEngine.ingestSnapshot(authSession, snapshot, Instant.now());
    }

    @PostMapping(value = "/refresh", produces = "application/json")
    public IngestResult refreshFromRemote(@AuthenticationPrincipal AuthSession authSession) {
        return reconciliationEngine.refreshFromRemote(authSession, Instant.now());
    }

    @PostMapping(value = "/correction", consumes = "application/json", produces = "application/json")
    public Item pushCorrection(@RequestBody CorrectionRequest request,
                               @AuthenticationPrincipal AuthSession authSession) {
        return reconciliationEngine.pushCorrection(authSession, request.itemId(),
                ContentCorrection.fromNullable(request.text(), request.translation()), Instant.now());
    }

    private record CorrectionRequest(String itemId, String text, String translation) { }
}
