package com.crossvenue.arb.infra;

import com.crossvenue.arb.domain.MarketType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class InstrumentFilter {
    String category; // sport key, e.g. basketball_nba
    @Singular
    Set<MarketType> marketTypes;
    @Builder.Default
    boolean openOnly = true;

    public boolean accepts(MarketType type) {
        return marketTypes.isEmpty() || marketTypes.contains(type);
    }
}
