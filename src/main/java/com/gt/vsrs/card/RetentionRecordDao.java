package com.gt.vsrs.card;

import com.gt.vsrs.model.CardCounts;
import com.gt.vsrs.model.CardView;
import com.gt.vsrs.model.RetentionRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface RetentionRecordDao {

    int createRecord(RetentionRecord record);

    RetentionRecord getRecord(String id);

    List<RetentionRecord> getRecords(Collection<String> ids);

    RetentionRecord getRecordForItem(String itemId);

    List<RetentionRecord> getRecordsForItems(Collection<String> itemIds);

    List<RetentionRecord> loadAllRecords();

    // Only succeeds when the stored version still matches record.version(). The stored version is incremented.
    int updateRecord(RetentionRecord record);

    List<CardView> getDueCards(Instant now);

    CardCounts getCounts(Instant now);

    int deleteRecordForItem(String itemId);

    void deleteAllRecords();
}
