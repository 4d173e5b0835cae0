package com.gt.vsrs.sync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewRow(String id,
                        @JsonProperty("card_id") String cardId,
                        Integer grade,
                        @JsonProperty("reviewed_at") String reviewedAt) { }
