package com.gt.vsrs.item.impl;

import com.gt.vsrs.item.ItemDao;
import com.gt.vsrs.model.Item;
import com.gt.vsrs.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class ItemDaoPG implements ItemDao {

    private static final Logger log = LoggerFactory.getLogger(ItemDaoPG.class);

    private static final String ITEM_QUERY_PREFIX =
            "SELECT id, text, translation, language, chapter, group_name, sentence, created_at FROM words";
    private static final String ITEMS_QUERY_SQL = ITEM_QUERY_PREFIX + " WHERE id IN (:ids)";
    private static final String ALL_ITEMS_QUERY_SQL = ITEM_QUERY_PREFIX + " ORDER BY chapter, group_name, created_at, id";
    private static final String DUPLICATE_QUERY_SQL = ITEM_QUERY_PREFIX +
            " WHERE LOWER(text) = LOWER(:text) AND language = :language ORDER BY created_at LIMIT 1";

    private static final String CREATE_ITEM_SQL =
            "INSERT INTO words (id, text, translation, language, chapter, group_name, sentence, created_at) " +
            "VALUES (:id, :text, :translation, :language, :chapter, :groupName, :sentence, :createdAt)";
    private static final String UPDATE_ITEM_SQL =
            "UPDATE words " +
            "SET text = :text, translation = :translation, language = :language, chapter = :chapter, " +
                "group_name = :groupName, sentence = :sentence " +
            "WHERE id = :id";
    private static final String UPDATE_CONTENT_SQL =
            "UPDATE words SET text = :text, translation = :translation WHERE id = :id";

    private static final String LIST_CHAPTERS_SQL =
            "SELECT DISTINCT chapter FROM words WHERE chapter IS NOT NULL ORDER BY chapter";
    private static final String LAST_GROUP_FOR_CHAPTER_SQL =
            "SELECT group_name FROM words " +
            "WHERE chapter = :chapter AND group_name IS NOT NULL " +
            "ORDER BY created_at DESC, id DESC LIMIT 1";

    private static final String DELETE_ITEM_SQL = "DELETE FROM words WHERE id = :id";
    private static final String DELETE_ALL_ITEMS_SQL = "DELETE FROM words";

    private final NamedParameterJdbcTemplate template;

    public ItemDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public int createItem(Item item) {
        return template.update(CREATE_ITEM_SQL, toParams(item));
    }

    @Override
    public Item getItem(String id) {
        List<Item> items = getItems(List.of(id));
        return items.size() > 0 ? items.get(0) : null;
    }

    @Override
    public List<Item> getItems(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }

        return template.query(ITEMS_QUERY_SQL, Map.of("ids", ids), (rs, rowNum) -> mapItemRow(rs));
    }

    @Override
    public List<Item> loadAllItems() {
        return template.query(ALL_ITEMS_QUERY_SQL, (rs, rowNum) -> mapItemRow(rs));
    }

    @Override
    public int updateItem(Item item) {
        return template.update(UPDATE_ITEM_SQL, toParams(item));
    }

    @Override
    public int updateContent(String id, String text, String translation) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", id);
        params.addValue("text", text);
        params.addValue("translation", translation);

        return template.update(UPDATE_CONTENT_SQL, params);
    }

    @Override
    public Item findDuplicate(String text, Language language) {
        List<Item> items = template.query(DUPLICATE_QUERY_SQL,
                Map.of("text", text.strip(), "language", language.name()),
                (rs, rowNum) -> mapItemRow(rs));

        return items.size() > 0 ? items.get(0) : null;
    }

    @Override
    public List<String> listChapters() {
        return template.queryForList(LIST_CHAPTERS_SQL, Map.of(), String.class);
    }

    @Override
    public String getLastGroupForChapter(String chapter) {
        List<String> groups = template.queryForList(LAST_GROUP_FOR_CHAPTER_SQL, Map.of("chapter", chapter), String.class);
        return groups.size() > 0 ? groups.get(0) : null;
    }

    @Override
    public int deleteItem(String id) {
        return template.update(DELETE_ITEM_SQL, Map.of("id", id));
    }

    @Override
    public void deleteAllItems() {
        int deleted = template.update(DELETE_ALL_ITEMS_SQL, Map.of());
        log.info("Deleted {} items", deleted);
    }

    private static MapSqlParameterSource toParams(Item item) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        params.addValue("id", item.id());
        params.addValue("text", item.text());
        params.addValue("translation", item.translation());
        params.addValue("language", item.language().name());
        params.addValue("chapter", item.chapter());
        params.addValue("groupName", item.group());
        params.addValue("sentence", item.sentence());
        params.addValue("createdAt", Timestamp.from(item.createdAt()));

        return params;
    }

    private static Item mapItemRow(ResultSet rs) throws SQLException {
        return new Item(
                rs.getString("id"),
                rs.getString("text"),
                rs.getString("translation"),
                Language.fromName(rs.getString("language")),
                rs.getString("chapter"),
                rs.getString("group_name"),
                rs.getString("sentence"),
                rs.getTimestamp("created_at").toInstant());
    }
}
