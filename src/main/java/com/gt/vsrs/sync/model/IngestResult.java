package com.gt.vsrs.sync.model;

public record IngestResult(int itemsInserted,
                           int itemsUpdated,
                           int recordsInserted,
                           int recordsInitialized,
                           int reviewsInserted,
                           int reviewsSkipped) { }
