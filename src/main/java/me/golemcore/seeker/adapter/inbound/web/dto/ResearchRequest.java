package me.golemcore.seeker.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchRequest {
    private String question;
    @JsonProperty("round_cap")
    private Integer roundCap;
    @JsonProperty("concurrency_cap")
    private Integer concurrencyCap;
    @JsonProperty("per_round_result_cap")
    private Integer perRoundResultCap;
    @JsonProperty("per_round_selection_cap")
    private Integer perRoundSelectionCap;
}
