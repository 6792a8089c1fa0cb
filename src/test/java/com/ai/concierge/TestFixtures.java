package com.ai.concierge;

import com.ai.concierge.config.ConciergeProperties;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Shared fixtures: a clock pinned to Saturday 2026-01-10 and a catalog
 * matching the shipped configuration.
 */
public final class TestFixtures {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-10T09:00:00Z"), ZoneOffset.UTC);

    private TestFixtures() {
    }

    public static ConciergeProperties properties() {
        ConciergeProperties properties = new ConciergeProperties();
        properties.getCottages().put("7", cottage(2, 0, 0, false, false, "https://www.airbnb.com/rooms/886682083069412842"));
        properties.getCottages().put("9", cottage(3, 33000, 38000, true, true, "https://www.airbnb.com/rooms/651168099240245080"));
        properties.getCottages().put("11", cottage(3, 26000, 32000, true, true, ""));
        return properties;
    }

    /** Same catalog with rates for cottage 7, for stays that need a full quote on it. */
    public static ConciergeProperties propertiesWithCottageSevenRates() {
        ConciergeProperties properties = properties();
        properties.getCottages().get("7").setWeekdayRate(20000);
        properties.getCottages().get("7").setWeekendRate(25000);
        return properties;
    }

    private static ConciergeProperties.Cottage cottage(int bedrooms, int weekday, int weekend,
                                                       boolean recommended, boolean shown, String url) {
        ConciergeProperties.Cottage c = new ConciergeProperties.Cottage();
        c.setBedrooms(bedrooms);
        c.setWeekdayRate(weekday);
        c.setWeekendRate(weekend);
        c.setDescription(bedrooms + "-bedroom cottage");
        c.setRecommended(recommended);
        c.setShowByDefault(shown);
        c.setListingUrl(url);
        return c;
    }
}
