package com.swisspairing.controller;

import com.swisspairing.dto.ClearResponse;
import com.swisspairing.dto.MatchRequests;
import com.swisspairing.dto.MatchResponses;
import com.swisspairing.mapper.SwissResponseMapper;
import com.swisspairing.model.Match;
import com.swisspairing.model.TournamentScope;
import com.swisspairing.service.ResultStore;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/matches")
public class MatchController {

    private final ResultStore resultStore;
    private final SwissResponseMapper swissResponseMapper;

    public MatchController(ResultStore resultStore, SwissResponseMapper swissResponseMapper) {
        this.resultStore = resultStore;
        this.swissResponseMapper = swissResponseMapper;
    }

    @PostMapping
    public ResponseEntity<MatchResponses.MatchDetail> reportMatch(
            @Valid @RequestBody MatchRequests.ReportMatchRequest request
    ) {
        Match match = resultStore.insertMatch(
                request.winnerId(),
                request.loserId(),
                TournamentScope.ofNullable(request.tournamentId())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(swissResponseMapper.toMatchDetailResponse(match));
    }

    @DeleteMapping
    public ResponseEntity<ClearResponse> clearMatches() {
        return ResponseEntity.ok(new ClearResponse(resultStore.clearMatches()));
    }
}
