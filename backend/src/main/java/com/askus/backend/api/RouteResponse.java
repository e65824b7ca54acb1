package com.askus.backend.api;

import com.askus.backend.routing.model.Candidate;
import com.askus.backend.routing.model.ClarificationOption;
import com.askus.backend.routing.model.ConfidenceLabel;
import com.askus.backend.routing.model.RouteMode;
import com.askus.backend.routing.model.RouteResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Wire shape of a routing result. Route and clarification responses share
 * {@code mode} and {@code confidence}; absent fields are omitted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouteResponse(
        RouteMode mode,
        @JsonProperty("agent_id") String agentId,
        ConfidenceLabel confidence,
        String reason,
        List<CandidateView> candidates,
        @JsonProperty("clarifying_question") String clarifyingQuestion,
        List<ClarificationOption> options
) {
    public record CandidateView(@JsonProperty("agent_id") String agentId, double score, String text) {
        static CandidateView of(Candidate c) {
            return new CandidateView(c.agentId(), c.score(), c.exampleText());
        }
    }

    public static RouteResponse from(RouteResult r) {
        if (r.isClarification()) {
            return new RouteResponse(r.mode(), null, r.confidence(), null, null, r.question(), r.options());
        }
        List<CandidateView> candidates = r.topCandidates().stream().map(CandidateView::of).toList();
        return new RouteResponse(r.mode(), r.agentId(), r.confidence(), r.reason(), candidates, null, null);
    }
}
