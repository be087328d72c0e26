package com.swisspairing.config;

import com.swisspairing.model.OpponentWinsMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "swiss")
public class SwissPairingProperties {

    private Store store = new Store();
    private Standings standings = new Standings();
    private Sample sample = new Sample();

    @Getter
    @Setter
    public static class Store {
        /**
         * Name of the dataset the result store connects to.
         */
        private String database = "tournament";
    }

    @Getter
    @Setter
    public static class Standings {
        private OpponentWinsMode opponentWinsMode = OpponentWinsMode.PER_MATCH;
    }

    @Getter
    @Setter
    public static class Sample {
        /**
         * Replays the reference tournament on startup. Wipes all stored records.
         */
        private boolean enabled = false;
        private int tournamentId = 16;
    }
}
