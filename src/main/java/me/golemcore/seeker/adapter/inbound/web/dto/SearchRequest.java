package me.golemcore.seeker.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.seeker.domain.model.Freshness;
import me.golemcore.seeker.domain.model.SearchQuery;

import java.util.List;

/**
 * Body of {@code POST /api/research/search}. Field names follow the search
 * message the planner emits.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {
    private String query;
    private Freshness when;
    private List<String> include;
    private List<String> exclude;
    @JsonProperty("allow_domains")
    private List<String> allowDomains;
    @JsonProperty("deny_domains")
    private List<String> denyDomains;
    @JsonProperty("max_results")
    private Integer maxResults;

    public SearchQuery toQuery() {
        return new SearchQuery(query, when, include, exclude, allowDomains, denyDomains, maxResults);
    }
}
