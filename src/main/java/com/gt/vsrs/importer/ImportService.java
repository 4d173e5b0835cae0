package com.gt.vsrs.importer;

import com.gt.vsrs.card.CardStore;
import com.gt.vsrs.exception.ValidationException;
import com.gt.vsrs.importer.model.ImportItem;
import com.gt.vsrs.importer.model.ImportResult;
import com.gt.vsrs.importer.model.OcrLine;
import com.gt.vsrs.model.ItemDefaults;
import com.gt.vsrs.model.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Imports a photographed vocabulary page. OCR lines are parsed into grouped items, translated in batches and
 * created through the card store, which gives each item a fresh retention record. Items already present in the
 * same language are skipped.
 */
@Component
public class ImportService {

    private static final Logger log = LoggerFactory.getLogger(ImportService.class);

    static final int TRANSLATION_BATCH_SIZE = 25;

    private final OcrLayoutParser ocrLayoutParser;
    private final TranslationClient translationClient;
    private final CardStore cardStore;

    @Autowired
    public ImportService(OcrLayoutParser ocrLayoutParser, TranslationClient translationClient, CardStore cardStore) {
        this.ocrLayoutParser = ocrLayoutParser;
        this.translationClient = translationClient;
        this.cardStore = cardStore;
    }

    public ImportResult importLines(List<OcrLine> lines, String chapter, String initialGroup, Language language, Instant now) {
        if (chapter == null || chapter.isBlank()) {
            throw new ValidationException("Chapter is required for an import");
        }
        if (language == null) {
            throw new ValidationException("Language is required for an import");
        }

        String startGroup = initialGroup != null && !initialGroup.isBlank()
                ? initialGroup.strip()
                : cardStore.lastGroupForChapter(chapter);
        List<ImportItem> items = ocrLayoutParser.parse(lines, startGroup);
        if (items.isEmpty()) {
            return ImportResult.EMPTY;
        }

        int inserted = 0;
        int skipped = 0;
        for (int index = 0; index < items.size(); index += TRANSLATION_BATCH_SIZE) {
            List<ImportItem> batch = items.subList(index, Math.min(index + TRANSLATION_BATCH_SIZE, items.size()));
            List<String> translations = translationClient.translateBatch(
                    batch.stream().map(ImportItem::text).toList(),
                    language.getCode(),
                    language.getTranslationTarget().getCode());

            for (int i = 0; i < batch.size(); i++) {
                ImportItem item = batch.get(i);
                if (cardStore.findDuplicate(item.text(), language) != null) {
                    skipped++;
                    continue;
                }

                cardStore.create(new ItemDefaults(item.text(), translations.get(i), language, chapter, item.group(), null), now);
                inserted++;
            }
        }

        log.info("Imported {} items into chapter {}, skipped {} duplicates", inserted, chapter, skipped);
        return new ImportResult(inserted, skipped);
    }
}
