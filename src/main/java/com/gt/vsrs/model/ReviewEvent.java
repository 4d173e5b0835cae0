package com.gt.vsrs.model;

import java.time.Instant;

public record ReviewEvent(String id, String recordId, Grade grade, Instant reviewedAt) { }
