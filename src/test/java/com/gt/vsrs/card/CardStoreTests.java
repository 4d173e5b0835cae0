package com.gt.vsrs.card;

import com.gt.vsrs.exception.ConflictException;
import com.gt.vsrs.exception.NotFoundException;
import com.gt.vsrs.exception.ValidationException;
import com.gt.vsrs.model.*;
import com.gt.vsrs.review.ReviewEventDao;
import com.gt.vsrs.util.TestUtils;
import com.gt.vsrs.util.TestUtils.TestStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.gt.vsrs.util.TestUtils.TEST_NOW;
import static com.gt.vsrs.util.TestUtils.dutchItem;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

public class CardStoreTests {

    private TestStore store;
    private CardStore cardStore;

    @BeforeEach
    public void setup() {
        store = TestUtils.createTestStore();
        cardStore = store.cardStore();
    }

    @Test
    public void testCreate() {
        CreatedItem created = cardStore.create(dutchItem("huis", "house"), TEST_NOW);

        assertEquals("huis", created.item().text());
        assertEquals("house", created.item().translation());
        assertEquals(created.item().id(), created.record().itemId());
        assertEquals(TEST_NOW, created.record().dueAt());
        assertEquals(2.5, created.record().ease(), 1e-9);
        assertEquals(0, created.record().reps());

        assertEquals(created.item(), cardStore.getItem(created.item().id()));
        assertEquals(created.record(), cardStore.getRecord(created.record().id()));
        assertEquals(new CardCounts(1, 1), cardStore.counts(TEST_NOW));
    }

    @Test
    public void testCreate_BlankText() {
        assertThrows(ValidationException.class, () -> cardStore.create(dutchItem("  ", "house"), TEST_NOW));
        assertEquals(new CardCounts(0, 0), cardStore.counts(TEST_NOW));
    }

    @Test
    public void testGetDue_OrderedAndNeverFuture() {
        RetentionRecord early1 = scheduleAt(cardStore.create(dutchItem("huis", "house"), TEST_NOW), TEST_NOW.minus(Duration.ofHours(2)));
        RetentionRecord early2 = scheduleAt(cardStore.create(dutchItem("boom", "tree"), TEST_NOW), TEST_NOW.minus(Duration.ofHours(2)));
        RetentionRecord exactlyNow = scheduleAt(cardStore.create(dutchItem("kat", "cat"), TEST_NOW), TEST_NOW);
        RetentionRecord earliest = scheduleAt(cardStore.create(dutchItem("hond", "dog"), TEST_NOW), TEST_NOW.minus(Duration.ofDays(1)));
        scheduleAt(cardStore.create(dutchItem("fiets", "bicycle"), TEST_NOW), TEST_NOW.plusMillis(1));

        List<CardView> due = cardStore.getDue(TEST_NOW);

        List<String> tied = early1.id().compareTo(early2.id()) < 0 ? List.of(early1.id(), early2.id()) : List.of(early2.id(), early1.id());
        assertEquals(List.of(earliest.id(), tied.get(0), tied.get(1), exactlyNow.id()), due.stream().map(CardView::recordId).toList());
        for (CardView card : due) {
            assertFalse(card.dueAt().isAfter(TEST_NOW));
        }

        assertEquals("hond", due.get(0).text());
        assertEquals("dog", due.get(0).translation());
        assertEquals(Language.Dutch, due.get(0).language());
        assertEquals(new CardCounts(4, 5), cardStore.counts(TEST_NOW));
    }

    @Test
    public void testApplyGrade() {
        CreatedItem created = cardStore.create(dutchItem("huis", "house"), TEST_NOW);
        String recordId = created.record().id();

        RetentionRecord graded = cardStore.applyGrade(recordId, Grade.Good, TEST_NOW);

        assertEquals(1, graded.reps());
        assertEquals(TEST_NOW.plus(Duration.ofDays(1)), graded.dueAt());
        assertEquals(1, graded.version());
        assertEquals(graded, cardStore.getRecord(recordId));

        List<ReviewEvent> reviews = store.reviewEventDao().loadReviewEventsForRecord(recordId);
        assertEquals(1, reviews.size());
        assertEquals(Grade.Good, reviews.get(0).grade());
        assertEquals(TEST_NOW, reviews.get(0).reviewedAt());
        assertEquals(new CardCounts(0, 1), cardStore.counts(TEST_NOW));
    }

    @Test
    public void testApplyGrade_RepeatedEasyStaysStorable() {
        String recordId = cardStore.create(dutchItem("huis", "house"), TEST_NOW).record().id();

        RetentionRecord graded = null;
        for (int i = 0; i < 30; i++) {
            graded = cardStore.applyGrade(recordId, Grade.Easy, TEST_NOW);

            assertTrue(graded.dueAt().isAfter(TEST_NOW), "repetition " + (i + 1));
            assertEquals(graded.dueAt(), cardStore.getRecord(recordId).dueAt(), "repetition " + (i + 1));
        }

        assertEquals(30, graded.reps());
        assertEquals(TEST_NOW.plus(Duration.ofDays(36500)), cardStore.getRecord(recordId).dueAt());
        assertTrue(cardStore.getDue(TEST_NOW).isEmpty());
    }

    @Test
    public void testApplyGrade_NotFound() {
        assertThrows(NotFoundException.class, () -> cardStore.applyGrade("missing", Grade.Good, TEST_NOW));
    }

    @Test
    public void testApplyGrade_StaleRecord() {
        CreatedItem created = cardStore.create(dutchItem("huis", "house"), TEST_NOW);
        String recordId = created.record().id();

        RetentionRecordDao staleRecordDao = spy(store.retentionRecordDao());
        doReturn(created.record().withVersion(5)).when(staleRecordDao).getRecord(recordId);
        CardStore staleStore = new CardStore(store.itemDao(), staleRecordDao, store.reviewEventDao(),
                store.retentionScheduler(), store.transactionTemplate());

        assertThrows(ConflictException.class, () -> staleStore.applyGrade(recordId, Grade.Good, TEST_NOW));

        assertEquals(created.record(), cardStore.getRecord(recordId));
        assertTrue(store.reviewEventDao().loadReviewEventsForRecord(recordId).isEmpty());
    }

    @Test
    public void testApplyGrade_ConcurrentGradeConflicts() throws Exception {
        CountDownLatch appendStarted = new CountDownLatch(1);
        CountDownLatch releaseAppend = new CountDownLatch(1);
        TestStore blockingStore = TestUtils.createTestStore(dao -> new ForwardingReviewEventDao(dao) {
            @Override
            public int appendReviewEvent(ReviewEvent event) {
                appendStarted.countDown();
                try {
                    releaseAppend.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                return super.appendReviewEvent(event);
            }
        });
        CardStore blockingCardStore = blockingStore.cardStore();
        String recordId = blockingCardStore.create(dutchItem("huis", "house"), TEST_NOW).record().id();

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<RetentionRecord> firstGrade = executor.submit(() -> blockingCardStore.applyGrade(recordId, Grade.Good, TEST_NOW));
            assertTrue(appendStarted.await(10, TimeUnit.SECONDS));

            assertThrows(ConflictException.class, () -> blockingCardStore.applyGrade(recordId, Grade.Easy, TEST_NOW));

            releaseAppend.countDown();
            RetentionRecord first = firstGrade.get(10, TimeUnit.SECONDS);
            assertEquals(1, first.reps());
        } finally {
            releaseAppend.countDown();
            executor.shutdownNow();
        }

        assertEquals(1, blockingStore.reviewEventDao().loadReviewEventsForRecord(recordId).size());
        assertEquals(2, blockingCardStore.applyGrade(recordId, Grade.Good, TEST_NOW.plus(Duration.ofDays(1))).version());
    }

    @Test
    public void testApplyGrade_FailureLeavesStoreUnchanged() {
        AtomicBoolean failAppend = new AtomicBoolean(false);
        TestStore faultyStore = TestUtils.createTestStore(dao -> new ForwardingReviewEventDao(dao) {
            @Override
            public int appendReviewEvent(ReviewEvent event) {
                if (failAppend.get()) {
                    throw new DataAccessResourceFailureException("disk full");
                }
                return super.appendReviewEvent(event);
            }
        });
        CardStore faultyCardStore = faultyStore.cardStore();
        String recordId = faultyCardStore.create(dutchItem("huis", "house"), TEST_NOW).record().id();
        faultyCardStore.applyGrade(recordId, Grade.Good, TEST_NOW);

        RetentionRecord before = faultyCardStore.getRecord(recordId);
        List<ReviewEvent> reviewsBefore = faultyStore.reviewEventDao().loadAllReviewEvents();
        CardCounts countsBefore = faultyCardStore.counts(TEST_NOW.plus(Duration.ofDays(2)));

        failAppend.set(true);
        Instant later = TEST_NOW.plus(Duration.ofDays(2));
        assertThrows(DataAccessResourceFailureException.class, () -> faultyCardStore.applyGrade(recordId, Grade.Again, later));

        assertEquals(before, faultyCardStore.getRecord(recordId));
        assertEquals(reviewsBefore, faultyStore.reviewEventDao().loadAllReviewEvents());
        assertEquals(countsBefore, faultyCardStore.counts(later));

        // The in-flight guard is released after a failure
        failAppend.set(false);
        assertEquals(1, faultyCardStore.applyGrade(recordId, Grade.Again, later).lapses());
    }

    @Test
    public void testCorrectContent() {
        CreatedItem created = cardStore.create(dutchItem("huis", "hous"), TEST_NOW);
        String itemId = created.item().id();
        RetentionRecord recordBefore = cardStore.getRecord(created.record().id());

        Item corrected = cardStore.correctContent(itemId, new ContentCorrection(FieldUpdate.unchanged(), FieldUpdate.set("house")));

        assertEquals("huis", corrected.text());
        assertEquals("house", corrected.translation());
        assertEquals(corrected, cardStore.getItem(itemId));
        assertEquals(recordBefore, cardStore.getRecord(created.record().id()));
    }

    @Test
    public void testCorrectContent_EmptyStringIsAValue() {
        String itemId = cardStore.create(dutchItem("huis", "house"), TEST_NOW).item().id();

        Item corrected = cardStore.correctContent(itemId, new ContentCorrection(FieldUpdate.unchanged(), FieldUpdate.set("")));

        assertEquals("", corrected.translation());
        assertEquals("", cardStore.getItem(itemId).translation());
    }

    @Test
    public void testCorrectContent_NoFieldsIsNoOp() {
        CreatedItem created = cardStore.create(dutchItem("huis", "house"), TEST_NOW);

        Item result = cardStore.correctContent(created.item().id(), ContentCorrection.NONE);

        assertEquals(created.item(), result);
        assertEquals(created.item(), cardStore.getItem(created.item().id()));
    }

    @Test
    public void testCorrectContent_Errors() {
        String itemId = cardStore.create(dutchItem("huis", "house"), TEST_NOW).item().id();

        assertThrows(NotFoundException.class, () -> cardStore.correctContent("missing", ContentCorrection.fromNullable("x", null)));
        assertThrows(ValidationException.class, () -> cardStore.correctContent(itemId, ContentCorrection.fromNullable(" ", null)));
        assertEquals("huis", cardStore.getItem(itemId).text());
    }

    @Test
    public void testDelete() {
        CreatedItem kept = cardStore.create(dutchItem("boom", "tree"), TEST_NOW);
        CreatedItem deleted = cardStore.create(dutchItem("huis", "house"), TEST_NOW);
        cardStore.applyGrade(deleted.record().id(), Grade.Good, TEST_NOW);
        cardStore.applyGrade(kept.record().id(), Grade.Good, TEST_NOW);

        cardStore.delete(deleted.item().id());

        assertNull(cardStore.getItem(deleted.item().id()));
        assertNull(cardStore.getRecord(deleted.record().id()));
        assertTrue(store.reviewEventDao().loadReviewEventsForRecord(deleted.record().id()).isEmpty());
        assertEquals(1, store.reviewEventDao().loadReviewEventsForRecord(kept.record().id()).size());
        assertEquals(new CardCounts(0, 1), cardStore.counts(TEST_NOW));

        assertThrows(NotFoundException.class, () -> cardStore.delete(deleted.item().id()));
    }

    @Test
    public void testDeleteAll() {
        CreatedItem created = cardStore.create(dutchItem("huis", "house"), TEST_NOW);
        cardStore.create(dutchItem("boom", "tree"), TEST_NOW);
        cardStore.applyGrade(created.record().id(), Grade.Hard, TEST_NOW);

        cardStore.deleteAll();

        assertEquals(new CardCounts(0, 0), cardStore.counts(TEST_NOW));
        assertTrue(cardStore.loadAllItems().isEmpty());
        assertTrue(store.reviewEventDao().loadAllReviewEvents().isEmpty());
    }

    @Test
    public void testFindDuplicate() {
        CreatedItem created = cardStore.create(dutchItem("Huis", "house"), TEST_NOW);

        assertEquals(created.item(), cardStore.findDuplicate("huis", Language.Dutch));
        assertEquals(created.item(), cardStore.findDuplicate(" HUIS ", Language.Dutch));
        assertNull(cardStore.findDuplicate("huis", Language.English));
        assertNull(cardStore.findDuplicate("huizen", Language.Dutch));
    }

    @Test
    public void testChaptersAndGroups() {
        cardStore.create(new ItemDefaults("huis", "house", Language.Dutch, "Hoofdstuk 2", "Wonen", null), TEST_NOW);
        cardStore.create(new ItemDefaults("kat", "cat", Language.Dutch, "Hoofdstuk 1", "Dieren", null), TEST_NOW);
        cardStore.create(new ItemDefaults("keuken", "kitchen", Language.Dutch, "Hoofdstuk 2", "Kamers", null), TEST_NOW.plusSeconds(5));
        cardStore.create(new ItemDefaults("hello", "hallo", Language.English, null, null, null), TEST_NOW);

        assertEquals(List.of("Hoofdstuk 1", "Hoofdstuk 2"), cardStore.listChapters());
        assertEquals("Kamers", cardStore.lastGroupForChapter("Hoofdstuk 2"));
        assertEquals("Dieren", cardStore.lastGroupForChapter("Hoofdstuk 1"));
        assertNull(cardStore.lastGroupForChapter("Hoofdstuk 9"));

        List<String> texts = cardStore.loadAllItems().stream().map(Item::text).toList();
        assertEquals(Set.of("hello", "kat", "huis", "keuken"), Set.copyOf(texts));
        assertTrue(texts.indexOf("kat") < texts.indexOf("keuken"));
        assertTrue(texts.indexOf("keuken") < texts.indexOf("huis"));
    }

    private RetentionRecord scheduleAt(CreatedItem created, Instant dueAt) {
        RetentionRecord record = created.record();
        RetentionRecord rescheduled = new RetentionRecord(record.id(), record.itemId(), dueAt, 1, record.ease(), 1, 0, record.version());
        assertEquals(1, store.retentionRecordDao().updateRecord(rescheduled));

        return rescheduled.withVersion(record.version() + 1);
    }

    private static class ForwardingReviewEventDao implements ReviewEventDao {

        private final ReviewEventDao delegate;

        ForwardingReviewEventDao(ReviewEventDao delegate) {
            this.delegate = delegate;
        }

        @Override
        public int appendReviewEvent(ReviewEvent event) {
            return delegate.appendReviewEvent(event);
        }

        @Override
        public Set<String> getExistingReviewEventIds(Collection<String> ids) {
            return delegate.getExistingReviewEventIds(ids);
        }

        @Override
        public List<ReviewEvent> loadReviewEventsForRecord(String recordId) {
            return delegate.loadReviewEventsForRecord(recordId);
        }

        @Override
        public List<ReviewEvent> loadAllReviewEvents() {
            return delegate.loadAllReviewEvents();
        }

        @Override
        public int deleteReviewEventsForItem(String itemId) {
            return delegate.deleteReviewEventsForItem(itemId);
        }

        @Override
        public void deleteAllReviewEvents() {
            delegate.deleteAllReviewEvents();
        }
    }
}
