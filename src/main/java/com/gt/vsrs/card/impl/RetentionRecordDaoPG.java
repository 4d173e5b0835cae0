package com.gt.vsrs.card.impl;

import com.gt.vsrs.card.RetentionRecordDao;
import com.gt.vsrs.model.CardCounts;
import com.gt.vsrs.model.CardView;
import com.gt.vsrs.model.Language;
import com.gt.vsrs.model.RetentionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class RetentionRecordDaoPG implements RetentionRecordDao {

    private static final Logger log = LoggerFactory.getLogger(RetentionRecordDaoPG.class);

    private static final String RECORD_QUERY_PREFIX =
            "SELECT id, word_id, due_at, interval_days, ease, reps, lapses, version FROM cards";
    private static final String RECORDS_QUERY_SQL = RECORD_QUERY_PREFIX + " WHERE id IN (:ids)";
    private static final String RECORDS_FOR_ITEMS_QUERY_SQL = RECORD_QUERY_PREFIX + " WHERE word_id IN (:itemIds)";
    private static final String ALL_RECORDS_QUERY_SQL = RECORD_QUERY_PREFIX + " ORDER BY due_at, id";

    private static final String CREATE_RECORD_SQL =
            "INSERT INTO cards (id, word_id, due_at, interval_days, ease, reps, lapses, version) " +
            "VALUES (:id, :itemId, :dueAt, :intervalDays, :ease, :reps, :lapses, :version)";
    private static final String UPDATE_RECORD_SQL =
            "UPDATE cards " +
            "SET due_at = :dueAt, interval_days = :intervalDays, ease = :ease, reps = :reps, lapses = :lapses, " +
                "version = version + 1 " +
            "WHERE id = :id AND version = :version";

    private static final String DUE_CARDS_QUERY_SQL =
            "SELECT c.id AS card_id, w.id AS word_id, w.text, w.translation, w.language, w.chapter, w.group_name, c.due_at " +
            "FROM cards c JOIN words w ON w.id = c.word_id " +
            "WHERE c.due_at <= :now " +
            "ORDER BY c.due_at ASC, c.id ASC";
    private static final String COUNTS_QUERY_SQL =
            "SELECT COALESCE(SUM(CASE WHEN due_at <= :now THEN 1 ELSE 0 END), 0) AS due_count, COUNT(*) AS total_count " +
            "FROM cards";

    private static final String DELETE_RECORD_FOR_ITEM_SQL = "DELETE FROM cards WHERE word_id = :itemId";
    private static final String DELETE_ALL_RECORDS_SQL = "DELETE FROM cards";

    private final NamedParameterJdbcTemplate template;

    public RetentionRecordDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public int createRecord(RetentionRecord record) {
        MapSqlParameterSource params = toParams(record);
        params.addValue("itemId", record.itemId());

        return template.update(CREATE_RECORD_SQL, params);
    }

    @Override
    public RetentionRecord getRecord(String id) {
        List<RetentionRecord> records = getRecords(List.of(id));
        return records.size() > 0 ? records.get(0) : null;
    }

    @Override
    public List<RetentionRecord> getRecords(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }

        return template.query(RECORDS_QUERY_SQL, Map.of("ids", ids), (rs, rowNum) -> mapRecordRow(rs));
    }

    @Override
    public RetentionRecord getRecordForItem(String itemId) {
        List<RetentionRecord> records = getRecordsForItems(List.of(itemId));
        return records.size() > 0 ? records.get(0) : null;
    }

    @Override
    public List<RetentionRecord> getRecordsForItems(Collection<String> itemIds) {
        if (itemIds.isEmpty()) {
            return List.of();
        }

        return template.query(RECORDS_FOR_ITEMS_QUERY_SQL, Map.of("itemIds", itemIds), (rs, rowNum) -> mapRecordRow(rs));
    }

    @Override
    public List<RetentionRecord> loadAllRecords() {
        return template.query(ALL_RECORDS_QUERY_SQL, (rs, rowNum) -> mapRecordRow(rs));
    }

    @Override
    public int updateRecord(RetentionRecord record) {
        return template.update(UPDATE_RECORD_SQL, toParams(record));
    }

    @Override
    public List<CardView> getDueCards(Instant now) {
        return template.query(DUE_CARDS_QUERY_SQL, Map.of("now", Timestamp.from(now)), (rs, rowNum) ->
                new CardView(
                        rs.getString("card_id"),
                        rs.getString("word_id"),
                        rs.getString("text"),
                        rs.getString("translation"),
                        Language.fromName(rs.getString("language")),
                        rs.getString("chapter"),
                        rs.getString("group_name"),
                        rs.getTimestamp("due_at").toInstant()));
    }

    @Override
    public CardCounts getCounts(Instant now) {
        return template.queryForObject(COUNTS_QUERY_SQL, Map.of("now", Timestamp.from(now)), (rs, rowNum) ->
                new CardCounts(rs.getInt("due_count"), rs.getInt("total_count")));
    }

    @Override
    public int deleteRecordForItem(String itemId) {
        return template.update(DELETE_RECORD_FOR_ITEM_SQL, Map.of("itemId", itemId));
    }

    @Override
    public void deleteAllRecords() {
        int deleted = template.update(DELETE_ALL_RECORDS_SQL, Map.of());
        log.info("Deleted {} retention records", deleted);
    }

    private static MapSqlParameterSource toParams(RetentionRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", record.id());
        params.addValue("dueAt", Timestamp.from(record.dueAt()));
        params.addValue("intervalDays", record.intervalDays());
        params.addValue("ease", record.ease());
        params.addValue("reps", record.reps());
        params.addValue("lapses", record.lapses());
        params.addValue("version", record.version());

        return params;
    }

    private static RetentionRecord mapRecordRow(ResultSet rs) throws SQLException {
        return new RetentionRecord(
                rs.getString("id"),
                rs.getString("word_id"),
                rs.getTimestamp("due_at").toInstant(),
                rs.getDouble("interval_days"),
                rs.getDouble("ease"),
                rs.getInt("reps"),
                rs.getInt("lapses"),
                rs.getLong("version"));
    }
}
