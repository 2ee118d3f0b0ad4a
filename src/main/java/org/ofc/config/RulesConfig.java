package org.ofc.config;

import lombok.extern.slf4j.Slf4j;
import org.ofc.model.Card;
import org.ofc.model.GameRules;
import org.ofc.model.RoyaltySchedule;
import org.ofc.model.Variant;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class RulesConfig {

    @Value("${ofc.variant:standard}")
    private String variant;

    @Value("${ofc.fantasy-land.enabled:true}")
    private boolean fantasyLandEnabled;

    @Value("${ofc.fantasy-land.entry-rank:Q}")
    private String fantasyLandEntryRank;

    @Value("${ofc.fantasy-land.extended-stay:true}")
    private boolean extendedStay;

    // blank: the variant's own table
    @Value("${ofc.royalties:}")
    private String royalties;

    @Bean
    public GameRules defaultGameRules() {
        Variant v = Variant.parse(variant);
        GameRules rules = GameRules.forVariant(v).toBuilder()
                .fantasyLandEnabled(fantasyLandEnabled)
                .fantasyLandEntryRank(Card.Rank.parse(fantasyLandEntryRank))
                .extendedFantasyLandStay(extendedStay)
                .royalties(royalties.isBlank() ? v.getRoyalties() : RoyaltySchedule.parse(royalties))
                .build();
        log.info("Default rules: {}", rules);
        return rules;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
