package com.gt.vsrs.issue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.vsrs.exception.DaoException;
import com.gt.vsrs.exception.ValidationException;
import com.gt.vsrs.model.IssueReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

// Appends learner feedback about a card to a JSON lines file. Reports never touch the card store.
@Component
public class IssueReportService {

    private static final Logger log = LoggerFactory.getLogger(IssueReportService.class);

    private final ObjectMapper objectMapper;
    private final Path issuesPath;

    @Autowired
    public IssueReportService(ObjectMapper objectMapper, @Value("${vsrs.issues.path:data/issues.jsonl}") String issuesPath) {
        this.objectMapper = objectMapper;
        this.issuesPath = Path.of(issuesPath);
    }

    public synchronized void reportIssue(IssueReport report) {
        if (report.recordId() == null || report.recordId().isBlank() || report.itemId() == null || report.itemId().isBlank()) {
            throw new ValidationException("Issue reports need a card and word id");
        }
        if (report.reportedAt() == null) {
            throw new ValidationException("Issue reports need a reported_at time");
        }

        try {
            String line = objectMapper.writeValueAsString(report) + System.lineSeparator();

            Path parent = issuesPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(issuesPath, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (JsonProcessingException ex) {
            throw new ValidationException("Issue report could not be serialized", ex);
        } catch (IOException ex) {
            throw new DaoException("Failed to write issue report to " + issuesPath, ex);
        }

        log.info("Recorded issue for card {}", report.recordId());
    }
}
