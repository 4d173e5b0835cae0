package com.gt.vsrs.item;

import com.gt.vsrs.model.Item;
import com.gt.vsrs.model.Language;

import java.util.Collection;
import java.util.List;

public interface ItemDao {

    int createItem(Item item);

    Item getItem(String id);

    List<Item> getItems(Collection<String> ids);

    List<Item> loadAllItems();

    int updateItem(Item item);

    int updateContent(String id, String text, String translation);

    Item findDuplicate(String text, Language language);

    List<String> listChapters();

    String getLastGroupForChapter(String chapter);

    int deleteItem(String id);

    void deleteAllItems();
}
