package com.gt.vsrs.model;

// Content for a new item. The retention record is always initialized by the scheduler.
public record ItemDefaults(String text,
                           String translation,
                           Language language,
                           String chapter,
                           String group,
                           String sentence) { }
