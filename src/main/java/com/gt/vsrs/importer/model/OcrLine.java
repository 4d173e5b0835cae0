package com.gt.vsrs.importer.model;

public record OcrLine(String text, OcrBoundingBox bbox, double confidence) { }
