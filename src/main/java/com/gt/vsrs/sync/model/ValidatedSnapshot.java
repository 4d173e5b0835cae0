package com.gt.vsrs.sync.model;

import com.gt.vsrs.model.Item;
import com.gt.vsrs.model.RetentionRecord;
import com.gt.vsrs.model.ReviewEvent;

import java.util.List;

public record ValidatedSnapshot(List<Item> items, List<RetentionRecord> records, List<ReviewEvent> reviews) { }
