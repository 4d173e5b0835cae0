package com.gt.vsrs.model;

public record CardCounts(int due, int total) { }
