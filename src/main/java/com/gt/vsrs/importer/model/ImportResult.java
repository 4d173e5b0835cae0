package com.gt.vsrs.importer.model;

public record ImportResult(int inserted, int skipped) {
    public static final ImportResult EMPTY = new ImportResult(0, 0);
}
