package com.gt.vsrs.sync.model;

import java.util.Collections;
import java.util.List;

// Remote copy of words, cards and reviews as returned by the data API
public record DataApiSnapshot(List<WordRow> words, List<CardRow> cards, List<ReviewRow> reviews) {

    public static final DataApiSnapshot EMPTY = new DataApiSnapshot(List.of(), List.of(), List.of());

    public DataApiSnapshot {
        words = words == null ? List.of() : Collections.unmodifiableList(words);
        cards = cards == null ? List.of() : Collections.unmodifiableList(cards);
        reviews = reviews == null ? List.of() : Collections.unmodifiableList(reviews);
    }
}
