package com.swisspairing.mapper;

import com.swisspairing.dto.MatchResponses;
import com.swisspairing.dto.PlayerResponses;
import com.swisspairing.model.Match;
import com.swisspairing.model.Player;
import com.swisspairing.model.TournamentScope;
import org.springframework.stereotype.Component;

@Component
public class SwissResponseMapper {

    public PlayerResponses.PlayerDetail toPlayerDetailResponse(Player player) {
        return new PlayerResponses.PlayerDetail(
                player.getId(),
                player.getName(),
                player.getCreatedAt()
        );
    }

    public PlayerResponses.PlayerCount toPlayerCountResponse(TournamentScope scope, long count) {
        return new PlayerResponses.PlayerCount(scope.tournamentId(), count);
    }

    public MatchResponses.MatchDetail toMatchDetailResponse(Match match) {
        return new MatchResponses.MatchDetail(
                match.getMatchId(),
                match.getTournamentId(),
                match.getWinnerId(),
                match.getLoserId(),
                match.getReportedAt()
        );
    }
}
