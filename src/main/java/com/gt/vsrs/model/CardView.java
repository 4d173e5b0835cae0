package com.gt.vsrs.model;

import java.time.Instant;

public record CardView(String recordId,
                       String itemId,
                       String text,
                       String translation,
                       Language language,
                       String chapter,
                       String group,
                       Instant dueAt) { }
