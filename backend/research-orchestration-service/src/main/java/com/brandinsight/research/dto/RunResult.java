package com.brandinsight.research.dto;

import com.brandinsight.research.entity.AnalysisRecord;
import com.brandinsight.research.service.community.CommunityScanResult;
import com.brandinsight.research.service.quality.QualityScoreReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate outcome of one orchestration run. Always returned, never null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResult {

    private String jobId;

    private RunStatus status;

    /** Persisted competitors of the job, highest score first */
    @Builder.Default
    private List<CandidateCompetitor> competitors = new ArrayList<>();

    /** Answered analysis rows of the job */
    @Builder.Default
    private List<AnalysisRecord> analysisRecords = new ArrayList<>();

    /** Null when the community step was skipped or failed */
    private CommunityScanResult communityScan;

    @Builder.Default
    private List<QualityScoreReport> qualityReports = new ArrayList<>();

    @Builder.Default
    private List<StepError> errors = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    /** Discovery layers that produced results plus "&lt;STEP&gt;_SKIPPED_RESUME" tags */
    @Builder.Default
    private List<String> layersUsed = new ArrayList<>();

    @Builder.Default
    private List<String> degradedConnectors = new ArrayList<>();

    private LocalDateTime startedAt;

    private long durationMs;
}
