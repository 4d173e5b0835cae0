package com.gt.vsrs.sync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WordRow(String id,
                      String text,
                      String translation,
                      String language,
                      String chapter,
                      @JsonProperty("group_name") String group,
                      String sentence,
                      @JsonProperty("created_at") String createdAt) { }
