package me.golemcore.seeker.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Terminal outcome of a run. Every path, degraded or not, ends here with the
 * full evidence ledger and trace attached.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResearchResult {

    private String runId;
    private String question;
    private ResultKind kind;
    private FinalAnswer finalAnswer;
    private String rawSynthesisOutput;
    private String failureReason;
    private List<ReaderReport> evidence;
    private List<TraceEvent> trace;
    private int roundsCompleted;
    private Map<Integer, List<CandidateDocument>> candidatesByRound;
    private int llmCalls;
    private long totalTokens;

    public boolean isSuccessful() {
        return kind != ResultKind.SYNTHESIS_FAILED;
    }
}
