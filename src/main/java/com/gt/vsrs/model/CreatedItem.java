package com.gt.vsrs.model;

public record CreatedItem(Item item, RetentionRecord record) { }
