package com.gt.vsrs.importer.model;

// Normalized to the page, origin at the bottom left
public record OcrBoundingBox(double x, double y, double w, double h) { }
