package com.swisspairing.controller;

import com.swisspairing.dto.ClearResponse;
import com.swisspairing.dto.PlayerRequests;
import com.swisspairing.dto.PlayerResponses;
import com.swisspairing.mapper.SwissResponseMapper;
import com.swisspairing.model.TournamentScope;
import com.swisspairing.service.ResultStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/players")
public class PlayerController {

    private final ResultStore resultStore;
    private final SwissResponseMapper swissResponseMapper;

    public PlayerController(ResultStore resultStore, SwissResponseMapper swissResponseMapper) {
        this.resultStore = resultStore;
        this.swissResponseMapper = swissResponseMapper;
    }

    @PostMapping
    public ResponseEntity<PlayerResponses.PlayerDetail> registerPlayer(
            @Valid @RequestBody PlayerRequests.RegisterPlayerRequest request
    ) {
        PlayerResponses.PlayerDetail player =
                swissResponseMapper.toPlayerDetailResponse(resultStore.insertPlayer(request.name()));
        return ResponseEntity.status(HttpStatus.CREATED).body(player);
    }

    /**
     * Registered players, or the participants of a tournament once it has matches.
     */
    @GetMapping("/count")
    public ResponseEntity<PlayerResponses.PlayerCount> countPlayers(
            @RequestParam(required = false) @Positive Integer tournamentId
    ) {
        TournamentScope scope = TournamentScope.ofNullable(tournamentId);
        return ResponseEntity.ok(swissResponseMapper.toPlayerCountResponse(scope, resultStore.countPlayers(scope)));
    }

    @DeleteMapping
    public ResponseEntity<ClearResponse> clearPlayers() {
        return ResponseEntity.ok(new ClearResponse(resultStore.clearPlayers()));
    }
}
