package com.gt.vsrs.importer;

import com.gt.vsrs.importer.model.ImportItem;
import com.gt.vsrs.importer.model.OcrLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Turns OCR lines from a photographed vocabulary page into grouped items.
 * <p>
 * Lines are clustered into columns by their left edge and read top to bottom, column by column from left to right.
 * A short capitalized line that is tall enough relative to the median line height starts a new group.
 */
@Component
public class OcrLayoutParser {

    private static final Logger log = LoggerFactory.getLogger(OcrLayoutParser.class);

    public static final String DEFAULT_GROUP = "Ungrouped";

    static final double COLUMN_THRESHOLD = 0.08;
    static final double MULTI_WORD_HEADING_HEIGHT_RATIO = 1.15;
    static final double SINGLE_WORD_HEADING_HEIGHT_RATIO = 0.8;

    public List<ImportItem> parse(List<OcrLine> lines, String initialGroup) {
        List<LineEntry> entries = new ArrayList<>();
        for (OcrLine line : lines) {
            String text = line.text() == null ? "" : line.text().strip();
            if (text.isEmpty() || looksLikeChapterLine(text) || looksLikePageNumber(text) || line.bbox() == null) {
                continue;
            }

            double yTop = 1.0 - (line.bbox().y() + line.bbox().h());
            entries.add(new LineEntry(text, line.bbox().x(), yTop, line.bbox().h()));
        }

        if (entries.isEmpty()) {
            return List.of();
        }

        double medianHeight = median(entries.stream().map(LineEntry::height).toList());

        String currentGroup = initialGroup;
        List<ImportItem> items = new ArrayList<>();
        for (List<LineEntry> column : splitIntoColumns(entries)) {
            column.sort(Comparator.comparingDouble(LineEntry::yTop));

            for (LineEntry entry : column) {
                String normalized = normalizeItemText(entry.text());
                if (normalized.isEmpty()) {
                    continue;
                }

                if (isHeading(entry, medianHeight)) {
                    currentGroup = normalizeHeading(normalized);
                    continue;
                }

                items.add(new ImportItem(normalized, currentGroup != null ? currentGroup : DEFAULT_GROUP));
            }
        }

        log.debug("Parsed {} items from {} OCR lines", items.size(), lines.size());
        return items;
    }

    static String normalizeItemText(String text) {
        String trimmed = text.strip();
        if (trimmed.startsWith("- ")) {
            trimmed = trimmed.substring(2);
        }

        return trimmed.strip().replace('.', ',');
    }

    static boolean looksLikeChapterLine(String text) {
        String lowered = text.toLowerCase(Locale.ROOT);
        if (lowered.contains("hoofdstuk") || lowered.contains("chapter") || lowered.contains("hoolastuk")) {
            return true;
        }

        // OCR regularly mangles the middle of "hoofdstuk"
        return lowered.startsWith("hoo") && lowered.contains("stuk");
    }

    static boolean looksLikePageNumber(String text) {
        String trimmed = text.strip();
        return !trimmed.isEmpty() && trimmed.chars().allMatch(c -> c >= '0' && c <= '9');
    }

    private static boolean isHeading(LineEntry entry, double medianHeight) {
        String text = entry.text().strip();
        if (text.isEmpty() || medianHeight <= 0) {
            return false;
        }
        if (text.contains(",") || text.contains("-") || text.contains("(") || text.contains(")")) {
            return false;
        }

        int first = text.codePointAt(0);
        if (!Character.isUpperCase(first)) {
            return false;
        }
        if (text.codePoints().skip(1).anyMatch(Character::isUpperCase)) {
            return false;
        }

        double ratio = text.contains(" ") ? MULTI_WORD_HEADING_HEIGHT_RATIO : SINGLE_WORD_HEADING_HEIGHT_RATIO;
        return entry.height() >= medianHeight * ratio;
    }

    private static String normalizeHeading(String text) {
        String heading = text;
        while (heading.endsWith(":")) {
            heading = heading.substring(0, heading.length() - 1);
        }

        return heading.strip();
    }

    private static List<List<LineEntry>> splitIntoColumns(List<LineEntry> entries) {
        List<ColumnBucket> columns = new ArrayList<>();

        List<LineEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingDouble(LineEntry::x));

        for (LineEntry entry : sorted) {
            ColumnBucket nearest = null;
            double nearestDistance = Double.MAX_VALUE;
            for (ColumnBucket column : columns) {
                double distance = Math.abs(entry.x() - column.center);
                if (distance < nearestDistance) {
                    nearestDistance = distance;
                    nearest = column;
                }
            }

            if (nearest != null && nearestDistance <= COLUMN_THRESHOLD) {
                nearest.add(entry);
            } else {
                columns.add(new ColumnBucket(entry));
            }
        }

        columns.sort(Comparator.comparingDouble(column -> column.center));
        return columns.stream().map(column -> column.lines).toList();
    }

    private static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.naturalOrder());

        int mid = sorted.size() / 2;
        return sorted.size() % 2 == 0 ? (sorted.get(mid - 1) + sorted.get(mid)) / 2 : sorted.get(mid);
    }

    private record LineEntry(String text, double x, double yTop, double height) { }

    private static class ColumnBucket {
        private double center;
        private final List<LineEntry> lines = new ArrayList<>();

        private ColumnBucket(LineEntry entry) {
            this.center = entry.x();
            this.lines.add(entry);
        }

        private void add(LineEntry entry) {
            int count = lines.size();
            center = (center * count + entry.x()) / (count + 1);
            lines.add(entry);
        }
    }
}
