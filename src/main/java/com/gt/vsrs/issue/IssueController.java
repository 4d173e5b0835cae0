package com.gt.vsrs.issue;

import com.gt.vsrs.model.IssueReport;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/rest/issues")
public class IssueController {

    private final IssueReportService issueReportService;

    public IssueController(IssueReportService issueReportService) {
        this.issueReportService = issueReportService;
    }

    @PostMapping(consumes = "application/json")
    public void reportIssue(@RequestBody IssueReport report) {
        IssueReport toSave = report.reportedAt() != null
                ? report
                : new IssueReport(report.recordId(), report.itemId(), report.text(), report.translation(), report.note(), Instant.now());

        issueReportService.reportIssue(toSave);
    }
}
