package com.gt.vsrs.model;

public record SessionStatus(SessionState state, int reviewedCount, int cap) { }
