package com.gt.vsrs.sync;

import com.gt.vsrs.card.RetentionRecordDao;
import com.gt.vsrs.exception.ValidationException;
import com.gt.vsrs.item.ItemDao;
import com.gt.vsrs.model.*;
import com.gt.vsrs.sync.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static com.gt.vsrs.util.TestUtils.TEST_NOW;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(SpringExtension.class)
public class SnapshotValidatorTests {

    @Mock private ItemDao itemDao;
    @Mock private RetentionRecordDao retentionRecordDao;

    private SnapshotValidator snapshotValidator;

    @BeforeEach
    public void setup() {
        snapshotValidator = new SnapshotValidator(itemDao, retentionRecordDao);
    }

    @Test
    public void testValidate() {
        DataApiSnapshot snapshot = new DataApiSnapshot(
                List.of(new WordRow("w1", "huis", "house", "Dutch", "Hoofdstuk 1", "Wonen", "Het huis.", "2024-02-01T10:00:00.123+01:00")),
                List.of(new CardRow("c1", "w1", "2024-02-28T10:00:00Z", 6.0, 2.5, 2, 0)),
                List.of(new ReviewRow("r1", "c1", 5, "2024-02-22T10:00:00Z"),
                        new ReviewRow("r2", "c1", 1, "2024-02-23T10:00:00Z")));

        ValidatedSnapshot validated = snapshotValidator.validate(snapshot, TEST_NOW);

        assertEquals(List.of(new Item("w1", "huis", "house", Language.Dutch, "Hoofdstuk 1", "Wonen", "Het huis.",
                Instant.parse("2024-02-01T09:00:00.123Z"))), validated.items());
        assertEquals(List.of(new RetentionRecord("c1", "w1", Instant.parse("2024-02-28T10:00:00Z"), 6.0, 2.5, 2, 0, 0)),
                validated.records());
        assertEquals(List.of(
                new ReviewEvent("r1", "c1", Grade.Easy, Instant.parse("2024-02-22T10:00:00Z")),
                new ReviewEvent("r2", "c1", Grade.Again, Instant.parse("2024-02-23T10:00:00Z"))), validated.reviews());
    }

    @Test
    public void testValidate_MissingCreatedAtDefaultsToNow() {
        DataApiSnapshot snapshot = new DataApiSnapshot(
                List.of(new WordRow("w1", "huis", "house", "Dutch", null, null, null, null)), List.of(), List.of());

        assertEquals(TEST_NOW, snapshotValidator.validate(snapshot, TEST_NOW).items().get(0).createdAt());
    }

    @Test
    public void testValidate_Empty() {
        ValidatedSnapshot validated = snapshotValidator.validate(DataApiSnapshot.EMPTY, TEST_NOW);

        assertTrue(validated.items().isEmpty());
        assertTrue(validated.records().isEmpty());
        assertTrue(validated.reviews().isEmpty());
    }

    @Test
    public void testValidate_InvalidWords() {
        assertRejected(new DataApiSnapshot(List.of(new WordRow(" ", "huis", null, "Dutch", null, null, null, null)), null, null));
        assertRejected(new DataApiSnapshot(List.of(new WordRow("w1", "", null, "Dutch", null, null, null, null)), null, null));
        assertRejected(new DataApiSnapshot(List.of(new WordRow("w1", "huis", null, "Klingon", null, null, null, null)), null, null));
        assertRejected(new DataApiSnapshot(List.of(new WordRow("w1", "huis", null, "Dutch", null, null, null, "yesterday")), null, null));
        assertRejected(new DataApiSnapshot(List.of(
                new WordRow("w1", "huis", null, "Dutch", null, null, null, null),
                new WordRow("w1", "boom", null, "Dutch", null, null, null, null)), null, null));
    }

    @Test
    public void testValidate_InvalidCards() {
        List<WordRow> words = List.of(new WordRow("w1", "huis", null, "Dutch", null, null, null, null));

        assertRejected(new DataApiSnapshot(words, List.of(new CardRow("c1", "missing", "2024-02-28T10:00:00Z", 1.0, 2.5, 1, 0)), null));
        assertRejected(new DataApiSnapshot(words, List.of(new CardRow("c1", null, "2024-02-28T10:00:00Z", 1.0, 2.5, 1, 0)), null));
        assertRejected(new DataApiSnapshot(words, List.of(new CardRow("c1", "w1", "not a date", 1.0, 2.5, 1, 0)), null));
        assertRejected(new DataApiSnapshot(words, List.of(new CardRow("c1", "w1", "2024-02-28T10:00:00Z", null, 2.5, 1, 0)), null));
        assertRejected(new DataApiSnapshot(words, List.of(new CardRow("c1", "w1", "2024-02-28T10:00:00Z", 1.0, 2.5, -1, 0)), null));
        assertRejected(new DataApiSnapshot(words, List.of(
                new CardRow("c1", "w1", "2024-02-28T10:00:00Z", 1.0, 2.5, 1, 0),
                new CardRow("c2", "w1", "2024-02-28T10:00:00Z", 1.0, 2.5, 1, 0)), null));
    }

    @Test
    public void testValidate_OutOfRangeScheduling() {
        List<WordRow> words = List.of(new WordRow("w1", "huis", null, "Dutch", null, null, null, null));

        assertRejected(new DataApiSnapshot(words, List.of(new CardRow("c1", "w1", "2024-02-28T10:00:00Z", -5.0, 2.5, 1, 0)), null));
        assertRejected(new DataApiSnapshot(words, List.of(new CardRow("c1", "w1", "2024-02-28T10:00:00Z", 1.0, -1.0, 1, 0)), null));
        assertRejected(new DataApiSnapshot(words, List.of(new CardRow("c1", "w1", "2024-02-28T10:00:00Z", 1.0, 0.0, 1, 0)), null));
        assertRejected(new DataApiSnapshot(words, List.of(new CardRow("c1", "w1", "2024-02-28T10:00:00Z", Double.POSITIVE_INFINITY, 2.5, 1, 0)), null));
        assertRejected(new DataApiSnapshot(words, List.of(new CardRow("c1", "w1", "2024-02-28T10:00:00Z", 1.0, Double.NaN, 1, 0)), null));
    }

    @Test
    public void testValidate_NullRows() {
        List<WordRow> words = List.of(new WordRow("w1", "huis", null, "Dutch", null, null, null, null));
        List<CardRow> cards = List.of(new CardRow("c1", "w1", "2024-02-28T10:00:00Z", 1.0, 2.5, 1, 0));

        ValidationException wordEx = assertThrows(ValidationException.class, () -> snapshotValidator.validate(
                new DataApiSnapshot(Arrays.asList((WordRow) null), null, null), TEST_NOW));
        assertTrue(wordEx.getMessage().contains("null word row"));

        ValidationException cardEx = assertThrows(ValidationException.class, () -> snapshotValidator.validate(
                new DataApiSnapshot(words, Arrays.asList(cards.get(0), null), null), TEST_NOW));
        assertTrue(cardEx.getMessage().contains("null card row"));

        ValidationException reviewEx = assertThrows(ValidationException.class, () -> snapshotValidator.validate(
                new DataApiSnapshot(words, cards, Arrays.asList((ReviewRow) null)), TEST_NOW));
        assertTrue(reviewEx.getMessage().contains("null review row"));
    }

    @Test
    public void testValidate_CardForLocalWord() {
        when(itemDao.getItems(any())).thenReturn(List.of(
                new Item("w9", "kat", "cat", Language.Dutch, null, null, null, TEST_NOW)));

        ValidatedSnapshot validated = snapshotValidator.validate(new DataApiSnapshot(null,
                List.of(new CardRow("c9", "w9", "2024-02-28T10:00:00Z", 1.0, 2.5, 1, 0)), null), TEST_NOW);

        assertEquals(1, validated.records().size());
    }

    @Test
    public void testValidate_CardConflictsWithLocalRecord() {
        when(itemDao.getItems(any())).thenReturn(List.of(
                new Item("w9", "kat", "cat", Language.Dutch, null, null, null, TEST_NOW)));
        when(retentionRecordDao.getRecordsForItems(any())).thenReturn(List.of(
                new RetentionRecord("local", "w9", TEST_NOW, 0, 2.5, 0, 0, 0)));

        assertRejected(new DataApiSnapshot(null,
                List.of(new CardRow("c9", "w9", "2024-02-28T10:00:00Z", 1.0, 2.5, 1, 0)), null));
    }

    @Test
    public void testValidate_InvalidReviews() {
        List<WordRow> words = List.of(new WordRow("w1", "huis", null, "Dutch", null, null, null, null));
        List<CardRow> cards = List.of(new CardRow("c1", "w1", "2024-02-28T10:00:00Z", 1.0, 2.5, 1, 0));

        assertRejected(new DataApiSnapshot(words, cards, List.of(new ReviewRow("r1", "missing", 4, "2024-02-22T10:00:00Z"))));
        assertRejected(new DataApiSnapshot(words, cards, List.of(new ReviewRow("r1", "c1", null, "2024-02-22T10:00:00Z"))));
        assertRejected(new DataApiSnapshot(words, cards, List.of(new ReviewRow("r1", "c1", -2, "2024-02-22T10:00:00Z"))));
        assertRejected(new DataApiSnapshot(words, cards, List.of(new ReviewRow("r1", "c1", 4, ""))));
        assertRejected(new DataApiSnapshot(words, cards, List.of(new ReviewRow(null, "c1", 4, "2024-02-22T10:00:00Z"))));
    }

    @Test
    public void testValidate_DuplicateReviewInSnapshot() {
        List<WordRow> words = List.of(new WordRow("w1", "huis", null, "Dutch", null, null, null, null));
        List<CardRow> cards = List.of(new CardRow("c1", "w1", "2024-02-28T10:00:00Z", 1.0, 2.5, 1, 0));
        ReviewRow review = new ReviewRow("r1", "c1", 4, "2024-02-22T10:00:00Z");

        ValidatedSnapshot validated = snapshotValidator.validate(new DataApiSnapshot(words, cards, List.of(review, review)), TEST_NOW);

        assertEquals(1, validated.reviews().size());
    }

    @Test
    public void testValidate_ReportsEveryRejectedRow() {
        DataApiSnapshot snapshot = new DataApiSnapshot(
                List.of(new WordRow("w1", "", null, "Dutch", null, null, null, null),
                        new WordRow("w2", "boom", null, "Latin", null, null, null, null)),
                null, null);

        ValidationException ex = assertThrows(ValidationException.class, () -> snapshotValidator.validate(snapshot, TEST_NOW));
        assertTrue(ex.getMessage().contains("w1"));
        assertTrue(ex.getMessage().contains("w2"));
    }

    @Test
    public void testParseTimestamp() {
        assertEquals(Instant.parse("2024-02-28T10:00:00Z"), SnapshotValidator.parseTimestamp("2024-02-28T10:00:00Z"));
        assertEquals(Instant.parse("2024-02-28T08:00:00Z"), SnapshotValidator.parseTimestamp(" 2024-02-28T10:00:00+02:00 "));
        assertNull(SnapshotValidator.parseTimestamp("2024-02-28"));
        assertNull(SnapshotValidator.parseTimestamp(null));
    }

    private void assertRejected(DataApiSnapshot snapshot) {
        assertThrows(ValidationException.class, () -> snapshotValidator.validate(snapshot, TEST_NOW));
    }
}
