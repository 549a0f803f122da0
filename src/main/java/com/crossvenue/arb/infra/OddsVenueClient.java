package com.crossvenue.arb.infra;

import com.crossvenue.arb.domain.MarketType;
import com.crossvenue.arb.domain.OddsLine;

import java.util.List;

/**
 * Read side of the fixed-odds venues. One client may front several bookmakers; each returned
 * line carries the bookmaker as its venue id.
 */
public interface OddsVenueClient {

    String sourceId();

    List<OddsLine> getLines(String sport, List<String> regions, List<MarketType> marketTypes);
}
