package com.gt.vsrs.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record IssueReport(@JsonProperty("card_id") String recordId,
                          @JsonProperty("word_id") String itemId,
                          String text,
                          String translation,
                          String note,
                          @JsonProperty("reported_at") Instant reportedAt) { }
