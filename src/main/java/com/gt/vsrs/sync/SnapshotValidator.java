package com.gt.vsrs.sync;

import com.gt.vsrs.card.RetentionRecordDao;
import com.gt.vsrs.exception.ValidationException;
import com.gt.vsrs.item.ItemDao;
import com.gt.vsrs.model.*;
import com.gt.vsrs.sync.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Parses and checks a data API snapshot against itself and the local store. Either every row is valid and the
 * converted snapshot is returned, or a {@link ValidationException} lists the rejected rows and nothing is applied.
 */
@Component
public class SnapshotValidator {

    private static final Logger log = LoggerFactory.getLogger(SnapshotValidator.class);

    private static final int MAX_REPORTED_ERRORS = 10;

    private final ItemDao itemDao;
    private final RetentionRecordDao retentionRecordDao;

    @Autowired
    public SnapshotValidator(ItemDao itemDao, RetentionRecordDao retentionRecordDao) {
        this.itemDao = itemDao;
        this.retentionRecordDao = retentionRecordDao;
    }

    public ValidatedSnapshot validate(DataApiSnapshot snapshot, Instant now) {
        List<String> errors = new ArrayList<>();

        List<Item> items = validateWords(snapshot.words(), now, errors);
        List<RetentionRecord> records = validateCards(snapshot.cards(), items, errors);
        List<ReviewEvent> reviews = validateReviews(snapshot.reviews(), records, errors);

        if (!errors.isEmpty()) {
            log.warn("Rejected snapshot with {} invalid rows", errors.size());
            throw new ValidationException("Invalid snapshot: " + errors.stream()
                    .limit(MAX_REPORTED_ERRORS)
                    .collect(Collectors.joining("; ")));
        }

        return new ValidatedSnapshot(items, records, reviews);
    }

    private List<Item> validateWords(List<WordRow> words, Instant now, List<String> errors) {
        List<Item> items = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (WordRow word : words) {
            if (word == null) {
                errors.add("null word row");
                continue;
            }
            if (isBlank(word.id())) {
                errors.add("word without id");
                continue;
            }
            if (!seenIds.add(word.id())) {
                errors.add("word " + word.id() + " appears more than once");
                continue;
            }
            if (isBlank(word.text())) {
                errors.add("word " + word.id() + " has no text");
                continue;
            }

            Language language;
            try {
                language = Language.fromName(word.language());
            } catch (IllegalArgumentException ex) {
                errors.add("word " + word.id() + " has unknown language " + word.language());
                continue;
            }

            Instant createdAt = now;
            if (!isBlank(word.createdAt())) {
                createdAt = parseTimestamp(word.createdAt());
                if (createdAt == null) {
                    errors.add("word " + word.id() + " has invalid created_at " + word.createdAt());
                    continue;
                }
            }

            items.add(new Item(word.id(), word.text(), word.translation(), language, word.chapter(), word.group(),
                    word.sentence(), createdAt));
        }

        return items;
    }

    private List<RetentionRecord> validateCards(List<CardRow> cards, List<Item> snapshotItems, List<String> errors) {
        List<RetentionRecord> records = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        Set<String> seenItemIds = new HashSet<>();

        Set<String> snapshotItemIds = snapshotItems.stream().map(Item::id).collect(Collectors.toSet());
        Set<String> referencedItemIds = cards.stream()
                .filter(Objects::nonNull)
                .map(CardRow::wordId)
                .filter(id -> !isBlank(id))
                .collect(Collectors.toSet());
        Set<String> localItemIds = itemDao.getItems(referencedItemIds).stream()
                .map(Item::id)
                .collect(Collectors.toSet());
        Map<String, RetentionRecord> localRecordsByItem = retentionRecordDao.getRecordsForItems(referencedItemIds).stream()
                .collect(Collectors.toMap(RetentionRecord::itemId, record -> record));
        Map<String, RetentionRecord> localRecordsById = retentionRecordDao.getRecords(cards.stream()
                        .filter(Objects::nonNull)
                        .map(CardRow::id)
                        .filter(id -> !isBlank(id))
                        .collect(Collectors.toSet())).stream()
                .collect(Collectors.toMap(RetentionRecord::id, record -> record));

        for (CardRow card : cards) {
            if (card == null) {
                errors.add("null card row");
                continue;
            }
            if (isBlank(card.id())) {
                errors.add("card without id");
                continue;
            }
            if (!seenIds.add(card.id())) {
                errors.add("card " + card.id() + " appears more than once");
                continue;
            }
            if (isBlank(card.wordId())) {
                errors.add("card " + card.id() + " has no word_id");
                continue;
            }
            if (!snapshotItemIds.contains(card.wordId()) && !localItemIds.contains(card.wordId())) {
                errors.add("card " + card.id() + " references unknown word " + card.wordId());
                continue;
            }
            if (!seenItemIds.add(card.wordId())) {
                errors.add("word " + card.wordId() + " has more than one card");
                continue;
            }

            RetentionRecord localForItem = localRecordsByItem.get(card.wordId());
            if (localForItem != null && !localForItem.id().equals(card.id())) {
                errors.add("card " + card.id() + " conflicts with local card " + localForItem.id() + " for word " + card.wordId());
                continue;
            }
            RetentionRecord localById = localRecordsById.get(card.id());
            if (localById != null && !localById.itemId().equals(card.wordId())) {
                errors.add("card " + card.id() + " is attached to word " + localById.itemId() + " locally");
                continue;
            }

            Instant dueAt = parseTimestamp(card.dueAt());
            if (dueAt == null) {
                errors.add("card " + card.id() + " has invalid due_at " + card.dueAt());
                continue;
            }
            if (card.intervalDays() == null || card.ease() == null || card.reps() == null || card.lapses() == null) {
                errors.add("card " + card.id() + " is missing scheduling fields");
                continue;
            }
            if (card.reps() < 0 || card.lapses() < 0) {
                errors.add("card " + card.id() + " has negative counts");
                continue;
            }
            if (!Double.isFinite(card.intervalDays()) || card.intervalDays() < 0) {
                errors.add("card " + card.id() + " has invalid interval_days " + card.intervalDays());
                continue;
            }
            if (!Double.isFinite(card.ease()) || card.ease() <= 0) {
                errors.add("card " + card.id() + " has invalid ease " + card.ease());
                continue;
            }

            records.add(new RetentionRecord(card.id(), card.wordId(), dueAt, card.intervalDays(), card.ease(),
                    card.reps(), card.lapses(), 0));
        }

        return records;
    }

    private List<ReviewEvent> validateReviews(List<ReviewRow> reviews, List<RetentionRecord> snapshotRecords, List<String> errors) {
        List<ReviewEvent> events = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        Set<String> snapshotRecordIds = snapshotRecords.stream().map(RetentionRecord::id).collect(Collectors.toSet());
        Set<String> localRecordIds = retentionRecordDao.getRecords(reviews.stream()
                        .filter(Objects::nonNull)
                        .map(ReviewRow::cardId)
                        .filter(id -> !isBlank(id) && !snapshotRecordIds.contains(id))
                        .collect(Collectors.toSet())).stream()
                .map(RetentionRecord::id)
                .collect(Collectors.toSet());

        for (ReviewRow review : reviews) {
            if (review == null) {
                errors.add("null review row");
                continue;
            }
            if (isBlank(review.id())) {
                errors.add("review without id");
                continue;
            }
            if (!seenIds.add(review.id())) {
                // Same event twice in one snapshot is harmless, the union skips it
                continue;
            }
            if (isBlank(review.cardId()) || (!snapshotRecordIds.contains(review.cardId()) && !localRecordIds.contains(review.cardId()))) {
                errors.add("review " + review.id() + " references unknown card " + review.cardId());
                continue;
            }
            if (review.grade() == null || review.grade() < 0) {
                errors.add("review " + review.id() + " has invalid grade " + review.grade());
                continue;
            }

            Instant reviewedAt = parseTimestamp(review.reviewedAt());
            if (reviewedAt == null) {
                errors.add("review " + review.id() + " has invalid reviewed_at " + review.reviewedAt());
                continue;
            }

            events.add(new ReviewEvent(review.id(), review.cardId(), Grade.fromQuality(review.grade()), reviewedAt));
        }

        return events;
    }

    static Instant parseTimestamp(String value) {
        if (isBlank(value)) {
            return null;
        }

        try {
            return OffsetDateTime.parse(value.strip()).toInstant();
        } catch (DateTimeParseException ex) {
            log.debug("Unparsable timestamp {}", value);
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
