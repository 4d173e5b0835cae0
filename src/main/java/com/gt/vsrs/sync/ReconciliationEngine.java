package com.gt.vsrs.sync;

import com.gt.vsrs.card.CardStore;
import com.gt.vsrs.card.RetentionRecordDao;
import com.gt.vsrs.exception.AuthRequiredException;
import com.gt.vsrs.exception.NotFoundException;
import com.gt.vsrs.exception.ValidationException;
import com.gt.vsrs.item.ItemDao;
import com.gt.vsrs.model.ContentCorrection;
import com.gt.vsrs.model.Item;
import com.gt.vsrs.model.RetentionRecord;
import com.gt.vsrs.model.ReviewEvent;
import com.gt.vsrs.review.ReviewEventDao;
import com.gt.vsrs.scheduling.RetentionScheduler;
import com.gt.vsrs.security.AuthSession;
import com.gt.vsrs.sync.model.DataApiSnapshot;
import com.gt.vsrs.sync.model.IngestResult;
import com.gt.vsrs.sync.model.ValidatedSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keeps the local store in step with the data API.
 * <p>
 * The data API is the system of record for item content, the local store for scheduling state between syncs.
 * On ingest, item content from the snapshot replaces local content, unseen records are seeded from the snapshot,
 * existing records keep their local scheduling state and review events are merged by id. Seeded records are brought
 * into the scheduler's ease and interval bounds. A snapshot is validated as a whole and applied in a single
 * transaction, so ingesting the same snapshot again changes nothing.
 * <p>
 * Ingest never modifies the scheduling fields of an existing record, so it does not contend with grading.
 */
@Component
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final CardStore cardStore;
    private final ItemDao itemDao;
    private final RetentionRecordDao retentionRecordDao;
    private final ReviewEventDao reviewEventDao;
    private final RetentionScheduler retentionScheduler;
    private final SnapshotValidator snapshotValidator;
    private final DataApiClient dataApiClient;
    private final TransactionTemplate transactionTemplate;

    private final ReentrantLock ingestLock = new ReentrantLock();

    @Autowired
    public ReconciliationEngine(CardStore cardStore,
                                ItemDao itemDao,
                                RetentionRecordDao retentionRecordDao,
                                ReviewEventDao reviewEventDao,
                                RetentionScheduler retentionScheduler,
                                SnapshotValidator snapshotValidator,
                                DataApiClient dataApiClient,
                                TransactionTemplate transactionTemplate) {
        this.cardStore = cardStore;
        this.itemDao = itemDao;
        this.retentionRecordDao = retentionRecordDao;
        this.reviewEventDao = reviewEventDao;
        this.retentionScheduler = retentionScheduler;
        this.snapshotValidator = snapshotValidator;
        this.dataApiClient = dataApiClient;
        this.transactionTemplate = transactionTemplate;
    }

    public IngestResult ingestSnapshot(AuthSession session, DataApiSnapshot snapshot, Instant now) {
        requireSession(session, now);

        ingestLock.lock();
        try {
            ValidatedSnapshot validated = snapshotValidator.validate(snapshot, now);
            IngestResult result = transactionTemplate.execute(status -> applySnapshot(validated, now));

            log.info("Ingested snapshot for {}: {}", session.username(), result);
            return result;
        } finally {
            ingestLock.unlock();
        }
    }

    public IngestResult refreshFromRemote(AuthSession session, Instant now) {
        requireSession(session, now);

        DataApiSnapshot snapshot = dataApiClient.fetchSnapshot(session);
        return ingestSnapshot(session, snapshot, now);
    }

    public Item pushCorrection(AuthSession session, String itemId, ContentCorrection correction, Instant now) {
        requireSession(session, now);

        Item current = cardStore.getItem(itemId);
        if (current == null) {
            throw new NotFoundException("Item " + itemId + " not found");
        }
        if (correction.isEmpty()) {
            return current;
        }
        if (correction.text().isSet() && (correction.text().getValue() == null || correction.text().getValue().isBlank())) {
            throw new ValidationException("Item text cannot be blank");
        }

        if (dataApiClient.updateWordContent(session, itemId, correction) == 0) {
            throw new NotFoundException("Item " + itemId + " not found in the data API");
        }

        return cardStore.correctContent(itemId, correction);
    }

    private IngestResult applySnapshot(ValidatedSnapshot snapshot, Instant now) {
        int itemsInserted = 0;
        int itemsUpdated = 0;
        int recordsInserted = 0;
        int recordsInitialized = 0;

        Map<String, Item> localItems = itemDao.getItems(snapshot.items().stream().map(Item::id).toList()).stream()
                .collect(Collectors.toMap(Item::id, Function.identity()));
        for (Item remote : snapshot.items()) {
            Item local = localItems.get(remote.id());
            if (local == null) {
                itemDao.createItem(remote);
                itemsInserted++;
            } else {
                Item merged = new Item(local.id(), remote.text(), remote.translation(), remote.language(),
                        remote.chapter(), remote.group(), remote.sentence(), local.createdAt());
                if (!merged.equals(local)) {
                    itemDao.updateItem(merged);
                    itemsUpdated++;
                }
            }
        }

        Set<String> localRecordIds = retentionRecordDao.getRecords(snapshot.records().stream().map(RetentionRecord::id).toList()).stream()
                .map(RetentionRecord::id)
                .collect(Collectors.toSet());
        for (RetentionRecord remote : snapshot.records()) {
            if (!localRecordIds.contains(remote.id())) {
                retentionRecordDao.createRecord(retentionScheduler.normalize(remote));
                recordsInserted++;
            }
        }

        // Snapshot words without a card anywhere still get a record
        Set<String> itemIdsWithRecords = new HashSet<>();
        snapshot.records().forEach(record -> itemIdsWithRecords.add(record.itemId()));
        retentionRecordDao.getRecordsForItems(snapshot.items().stream().map(Item::id).toList())
                .forEach(record -> itemIdsWithRecords.add(record.itemId()));
        for (Item item : snapshot.items()) {
            if (!itemIdsWithRecords.contains(item.id())) {
                retentionRecordDao.createRecord(retentionScheduler.initialRecord(item.id(), now));
                recordsInitialized++;
            }
        }

        Set<String> existingReviewIds = reviewEventDao.getExistingReviewEventIds(snapshot.reviews().stream().map(ReviewEvent::id).toList());
        int reviewsInserted = 0;
        for (ReviewEvent review : snapshot.reviews()) {
            if (!existingReviewIds.contains(review.id())) {
                reviewEventDao.appendReviewEvent(review);
                reviewsInserted++;
            }
        }

        return new IngestResult(itemsInserted, itemsUpdated, recordsInserted, recordsInitialized,
                reviewsInserted, snapshot.reviews().size() - reviewsInserted);
    }

    private static void requireSession(AuthSession session, Instant now) {
        if (!AuthSession.isValid(session, now)) {
            throw new AuthRequiredException("Sign in to sync with the data API");
        }
    }
}
