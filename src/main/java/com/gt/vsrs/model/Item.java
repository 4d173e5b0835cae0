package com.gt.vsrs.model;

import java.time.Instant;

public record Item(String id,
                   String text,
                   String translation,
                   Language language,
                   String chapter,
                   String group,
                   String sentence,
                   Instant createdAt) {

    public Item withContent(String text, String translation) {
        return new Item(id, text, translation, language, chapter, group, sentence, createdAt);
    }
}
