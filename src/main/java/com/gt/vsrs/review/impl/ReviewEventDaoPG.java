package com.gt.vsrs.review.impl;

import com.gt.vsrs.model.Grade;
import com.gt.vsrs.model.ReviewEvent;
import com.gt.vsrs.review.ReviewEventDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ReviewEventDaoPG implements ReviewEventDao {

    private static final Logger log = LoggerFactory.getLogger(ReviewEventDaoPG.class);

    private static final String INSERT_REVIEW_EVENT_SQL =
            "INSERT INTO reviews (id, card_id, grade, reviewed_at) VALUES (:id, :recordId, :grade, :reviewedAt)";

    private static final String EXISTING_REVIEW_EVENT_IDS_SQL = "SELECT id FROM reviews WHERE id IN (:ids)";

    private static final String REVIEW_EVENT_QUERY_PREFIX = "SELECT id, card_id, grade, reviewed_at FROM reviews";
    private static final String REVIEW_EVENTS_FOR_RECORD_SQL = REVIEW_EVENT_QUERY_PREFIX +
            " WHERE card_id = :recordId ORDER BY reviewed_at, id";
    private static final String ALL_REVIEW_EVENTS_SQL = REVIEW_EVENT_QUERY_PREFIX + " ORDER BY reviewed_at, id";

    private static final String DELETE_REVIEW_EVENTS_FOR_ITEM_SQL =
            "DELETE FROM reviews WHERE card_id IN (SELECT id FROM cards WHERE word_id = :itemId)";
    private static final String DELETE_ALL_REVIEW_EVENTS_SQL = "DELETE FROM reviews";

    private final NamedParameterJdbcTemplate template;

    public ReviewEventDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public int appendReviewEvent(ReviewEvent event) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", event.id());
        params.addValue("recordId", event.recordId());
        params.addValue("grade", event.grade().getQuality());
        params.addValue("reviewedAt", Timestamp.from(event.reviewedAt()));

        return template.update(INSERT_REVIEW_EVENT_SQL, params);
    }

    @Override
    public Set<String> getExistingReviewEventIds(Collection<String> ids) {
        if (ids.isEmpty()) {
            return Set.of();
        }

        return new HashSet<>(template.queryForList(EXISTING_REVIEW_EVENT_IDS_SQL, Map.of("ids", ids), String.class));
    }

    @Override
    public List<ReviewEvent> loadReviewEventsForRecord(String recordId) {
        return template.query(REVIEW_EVENTS_FOR_RECORD_SQL, Map.of("recordId", recordId), (rs, rowNum) -> mapReviewEventRow(rs));
    }

    @Override
    public List<ReviewEvent> loadAllReviewEvents() {
        return template.query(ALL_REVIEW_EVENTS_SQL, (rs, rowNum) -> mapReviewEventRow(rs));
    }

    @Override
    public int deleteReviewEventsForItem(String itemId) {
        return template.update(DELETE_REVIEW_EVENTS_FOR_ITEM_SQL, Map.of("itemId", itemId));
    }

    @Override
    public void deleteAllReviewEvents() {
        int deleted = template.update(DELETE_ALL_REVIEW_EVENTS_SQL, Map.of());
        log.info("Deleted {} review events", deleted);
    }

    private static ReviewEvent mapReviewEventRow(ResultSet rs) throws SQLException {
        return new ReviewEvent(
                rs.getString("id"),
                rs.getString("card_id"),
                Grade.fromQuality(rs.getInt("grade")),
                rs.getTimestamp("reviewed_at").toInstant());
    }
}
