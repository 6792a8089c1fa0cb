package com.ai.concierge.config;

import com.ai.concierge.conversation.Intent;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Business settings for the concierge, bound from the {@code concierge} prefix.
 * <p>
 * Defaults that decide how ambiguous input is treated (fallback intent, base
 * occupancy) live here rather than in code.
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "concierge", ignoreInvalidFields = true)
public class ConciergeProperties {

    private Defaults defaults = new Defaults();

    /** Cottage catalog keyed by cottage number ("7", "9", "11"). */
    private Map<String, Cottage> cottages = new LinkedHashMap<>();

    /** Number of cottages on the property, including ones not listed in the catalog. */
    private Integer totalCottages = 7;

    private Contact contact = new Contact();

    private Session session = new Session();

    private Retrieval retrieval = new Retrieval();

    private Completion completion = new Completion();

    @Data
    public static class Defaults {

        /** Intent returned when no rule and no completion fallback decides. */
        private Intent intent = Intent.FAQ_QUESTION;

        /** Guests assumed by pricing when none are given; rates cover up to this many. */
        private Integer baseOccupancy = 6;

        /** Largest group a single cottage takes with prior confirmation. */
        private Integer maxOccupancy = 9;
    }

    @Data
    public static class Cottage {

        private Integer bedrooms = 2;

        private Integer baseOccupancy = 6;

        private Integer maxOccupancy = 9;

        /** Nightly weekday rate in PKR, 0 when unknown. */
        private Integer weekdayRate = 0;

        /** Nightly weekend rate in PKR, 0 when unknown. */
        private Integer weekendRate = 0;

        private String description = "";

        private Boolean recommended = true;

        /** Hidden cottages are only listed when the guest asks for them. */
        private Boolean showByDefault = true;

        private String listingUrl = "";
    }

    @Data
    public static class Contact {

        private String website = "https://swisscottagesbhurban.com/contact-us/";

        private String managerName = "Abdullah";

        private String managerPhone = "+92 300 1218563";
    }

    @Data
    public static class Session {

        /** Question/answer turns kept per session for follow-up resolution. */
        private Integer historyLength = 2;
    }

    @Data
    public static class Retrieval {

        private Integer defaultK = 3;

        /** Pass an {intent, cottage_id} metadata filter to the retrieval service. */
        private Boolean intentFiltering = true;

        /** Retry with the raw question when the refined query returns nothing. */
        private Boolean fallbackToOriginalQuery = true;

        /** Let the completion service rewrite retrieval queries. */
        private Boolean completionRewrite = false;
    }

    @Data
    public static class Completion {

        private Integer classificationMaxTokens = 10;

        private Integer slotMaxTokens = 150;

        private Integer answerMaxTokens = 512;

        private Integer rewriteMaxTokens = 60;
    }
}
