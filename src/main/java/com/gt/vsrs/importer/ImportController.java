package com.gt.vsrs.importer;

import com.gt.vsrs.exception.ValidationException;
import com.gt.vsrs.importer.model.ImportResult;
import com.gt.vsrs.importer.model.OcrLine;
import com.gt.vsrs.model.Language;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/rest/import")
public class ImportController {

    private final ImportService importService;

    public ImportController(ImportService importService) {
        this.importService = importService;
    }

    @PostMapping(value = "/ocr", consumes = "application/json", produces = "application/json")
    public ImportResult importOcrLines(@RequestBody OcrImportRequest request) {
        Language language;
        try {
            language = Language.fromName(request.language() == null ? Language.Dutch.name() : request.language());
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(ex.getMessage(), ex);
        }

        return importService.importLines(request.lines() == null ? List.of() : request.lines(),
                request.chapter(), request.initialGroup(), language, Instant.now());
    }

    private record OcrImportRequest(String chapter, String initialGroup, String language, List<OcrLine> lines) { }
}
