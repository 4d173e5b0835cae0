package com.gt.vsrs.card;

import com.gt.vsrs.exception.ConflictException;
import com.gt.vsrs.exception.DaoException;
import com.gt.vsrs.exception.NotFoundException;
import com.gt.vsrs.exception.ValidationException;
import com.gt.vsrs.item.ItemDao;
import com.gt.vsrs.model.*;
import com.gt.vsrs.review.ReviewEventDao;
import com.gt.vsrs.scheduling.RetentionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable storage for items, their retention records and the review log.
 * <p>
 * Every item has exactly one retention record. Both are created together and removed together, and a grade
 * updates the record and appends its review event in the same transaction.
 */
@Component
public class CardStore {

    private static final Logger log = LoggerFactory.getLogger(CardStore.class);

    private final ItemDao itemDao;
    private final RetentionRecordDao retentionRecordDao;
    private final ReviewEventDao reviewEventDao;
    private final RetentionScheduler retentionScheduler;
    private final TransactionTemplate transactionTemplate;

    private final Set<String> gradesInFlight = ConcurrentHashMap.newKeySet();

    @Autowired
    public CardStore(ItemDao itemDao,
                     RetentionRecordDao retentionRecordDao,
                     ReviewEventDao reviewEventDao,
                     RetentionScheduler retentionScheduler,
                     TransactionTemplate transactionTemplate) {
        this.itemDao = itemDao;
        this.retentionRecordDao = retentionRecordDao;
        this.reviewEventDao = reviewEventDao;
        this.retentionScheduler = retentionScheduler;
        this.transactionTemplate = transactionTemplate;
    }

    public CreatedItem create(ItemDefaults defaults, Instant now) {
        if (defaults.text() == null || defaults.text().isBlank()) {
            throw new ValidationException("Item text is required");
        }
        if (defaults.language() == null) {
            throw new ValidationException("Item language is required");
        }

        Item item = new Item(UUID.randomUUID().toString(),
                defaults.text().strip(),
                defaults.translation(),
                defaults.language(),
                defaults.chapter(),
                defaults.group(),
                defaults.sentence(),
                now);
        RetentionRecord record = retentionScheduler.initialRecord(item.id(), now);

        transactionTemplate.executeWithoutResult(status -> {
            itemDao.createItem(item);
            retentionRecordDao.createRecord(record);
        });

        log.debug("Created item {} with retention record {}", item.id(), record.id());
        return new CreatedItem(item, record);
    }

    public Item getItem(String itemId) {
        return itemDao.getItem(itemId);
    }

    public RetentionRecord getRecord(String recordId) {
        return retentionRecordDao.getRecord(recordId);
    }

    public List<Item> loadAllItems() {
        return itemDao.loadAllItems();
    }

    public List<CardView> getDue(Instant now) {
        return retentionRecordDao.getDueCards(now);
    }

    public CardCounts counts(Instant now) {
        return retentionRecordDao.getCounts(now);
    }

    public RetentionRecord applyGrade(String recordId, Grade grade, Instant now) {
        if (!gradesInFlight.add(recordId)) {
            throw new ConflictException("A grade for record " + recordId + " is already in progress");
        }

        try {
            return transactionTemplate.execute(status -> {
                RetentionRecord current = retentionRecordDao.getRecord(recordId);
                if (current == null) {
                    throw new NotFoundException("Record " + recordId + " not found");
                }

                RetentionRecord next = retentionScheduler.transition(current, grade, now);
                if (retentionRecordDao.updateRecord(next) == 0) {
                    throw new ConflictException("Record " + recordId + " was modified concurrently");
                }

                ReviewEvent event = new ReviewEvent(UUID.randomUUID().toString(), recordId, grade, now);
                if (reviewEventDao.appendReviewEvent(event) != 1) {
                    throw new DaoException("Failed to append review event for record " + recordId);
                }

                log.debug("Graded record {} as {}, next due {}", recordId, grade, next.dueAt());
                return next.withVersion(current.version() + 1);
            });
        } finally {
            gradesInFlight.remove(recordId);
        }
    }

    public Item correctContent(String itemId, ContentCorrection correction) {
        Item current = itemDao.getItem(itemId);
        if (current == null) {
            throw new NotFoundException("Item " + itemId + " not found");
        }

        if (correction.isEmpty()) {
            return current;
        }

        if (correction.text().isSet() && (correction.text().getValue() == null || correction.text().getValue().isBlank())) {
            throw new ValidationException("Item text cannot be blank");
        }

        Item corrected = correction.applyTo(current);
        if (itemDao.updateContent(itemId, corrected.text(), corrected.translation()) == 0) {
            throw new NotFoundException("Item " + itemId + " not found");
        }

        return corrected;
    }

    public Item findDuplicate(String text, Language language) {
        return itemDao.findDuplicate(text, language);
    }

    public List<String> listChapters() {
        return itemDao.listChapters();
    }

    public String lastGroupForChapter(String chapter) {
        return itemDao.getLastGroupForChapter(chapter);
    }

    public void delete(String itemId) {
        transactionTemplate.executeWithoutResult(status -> {
            reviewEventDao.deleteReviewEventsForItem(itemId);
            retentionRecordDao.deleteRecordForItem(itemId);
            if (itemDao.deleteItem(itemId) == 0) {
                throw new NotFoundException("Item " + itemId + " not found");
            }
        });

        log.info("Deleted item {}", itemId);
    }

    public void deleteAll() {
        transactionTemplate.executeWithoutResult(status -> {
            reviewEventDao.deleteAllReviewEvents();
            retentionRecordDao.deleteAllRecords();
            itemDao.deleteAllItems();
        });
    }
}
