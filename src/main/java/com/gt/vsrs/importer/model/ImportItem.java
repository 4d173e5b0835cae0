package com.gt.vsrs.importer.model;

public record ImportItem(String text, String group) { }
