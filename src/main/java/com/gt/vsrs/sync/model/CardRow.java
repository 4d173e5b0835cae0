package com.gt.vsrs.sync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CardRow(String id,
                      @JsonProperty("word_id") String wordId,
                      @JsonProperty("due_at") String dueAt,
                      @JsonProperty("interval_days") Double intervalDays,
                      Double ease,
                      Integer reps,
                      Integer lapses) { }
