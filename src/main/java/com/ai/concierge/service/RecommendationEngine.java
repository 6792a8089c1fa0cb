package com.ai.concierge.service;

import com.ai.concierge.config.ConciergeProperties;
import com.ai.concierge.conversation.ChatHistory;
import com.ai.concierge.conversation.ContextTracker;
import com.ai.concierge.conversation.ConversationState;
import com.ai.concierge.conversation.Intent;
import com.ai.concierge.conversation.SlotDefinitions;
import com.ai.concierge.conversation.SlotName;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Follow-up suggestions, tips and booking nudges appended to answers.
 */
@Service
public class RecommendationEngine {

    static final int MAX_SUGGESTIONS = 5;

    public enum Tier {
        INFORMATIONAL,
        EXPLORATORY,
        TRANSACTIONAL
    }

    private static final Map<ConversationState, List<Tier>> TIER_PRIORITY = new EnumMap<>(ConversationState.class);

    static {
        TIER_PRIORITY.put(ConversationState.BROWSING, List.of(Tier.INFORMATIONAL, Tier.EXPLORATORY, Tier.TRANSACTIONAL));
        TIER_PRIORITY.put(ConversationState.INQUIRING, List.of(Tier.EXPLORATORY, Tier.INFORMATIONAL, Tier.TRANSACTIONAL));
        TIER_PRIORITY.put(ConversationState.COMPARING, List.of(Tier.EXPLORATORY, Tier.TRANSACTIONAL, Tier.INFORMATIONAL));
        TIER_PRIORITY.put(ConversationState.READY_TO_BOOK, List.of(Tier.TRANSACTIONAL, Tier.EXPLORATORY, Tier.INFORMATIONAL));
        TIER_PRIORITY.put(ConversationState.BOOKING, List.of(Tier.TRANSACTIONAL, Tier.EXPLORATORY, Tier.INFORMATIONAL));
        TIER_PRIORITY.put(ConversationState.COMPLETED, List.of(Tier.INFORMATIONAL, Tier.EXPLORATORY, Tier.TRANSACTIONAL));
    }

    private static final Pattern IMAGE_WORDS = Pattern.compile(
            "\\b(?:images?|photos?|pictures?|show me|see|view|gallery|visual)\\b");
    private static final Pattern COTTAGE_WORD = Pattern.compile("\\bcottages?\\b");
    private static final Pattern KITCHEN = Pattern.compile("\\b(?:kitchen|cook|cooking|prepare food|make food|cook meals)\\b");
    private static final Pattern CHEF = Pattern.compile("\\b(?:chef|chief|cooking service|meal service)\\b");
    private static final Pattern WIFI = Pattern.compile("\\b(?:wifi|wi-fi|internet|network|connection|online)\\b");
    private static final Pattern PARKING = Pattern.compile("\\b(?:parking|park|car|vehicle|drive)\\b");
    private static final Pattern FOOD = Pattern.compile("\\b(?:food|dining|meal|eat|restaurant|dinner|lunch|breakfast)\\b");
    private static final Pattern BBQ = Pattern.compile("\\b(?:bbq|barbecue|grill|outdoor cooking)\\b");
    private static final Pattern GENERAL_FACILITIES = Pattern.compile("\\b(?:facility|facilities|amenity|amenities|what)\\b");

    private final CottageCatalog catalog;
    private final ConciergeProperties.Contact contact;
    private final int baseOccupancy;
    private final int maxOccupancy;

    public RecommendationEngine(CottageCatalog catalog, ConciergeProperties properties) {
        this.catalog = catalog;
        this.contact = properties.getContact();
        this.baseOccupancy = properties.getDefaults().getBaseOccupancy();
        this.maxOccupancy = properties.getDefaults().getMaxOccupancy();
    }

    /**
     * Up to five follow-up questions, ordered by the tier the conversation
     * state favours. Suggestions whose topic already came up in the recent
     * turns or in the current question are left out.
     */
    public List<String> generateContextualSuggestions(String query, Intent intent, ContextTracker context, ChatHistory history) {
        StringBuilder seen = new StringBuilder(StringUtils.defaultString(query).toLowerCase(Locale.ROOT));
        if (history != null) {
            history.turns().forEach(turn -> seen.append(' ').append(turn.question().toLowerCase(Locale.ROOT)));
        }
        String covered = seen.toString();
        ConversationState state = context == null ? ConversationState.BROWSING : context.getState();

        Set<String> out = new LinkedHashSet<>();
        for (Tier tier : TIER_PRIORITY.get(state)) {
            for (Suggestion suggestion : suggestions()) {
                if (suggestion.tier() != tier || suggestion.topic() == intent) continue;
                if (suggestion.keywords().stream().anyMatch(covered::contains)) continue;
                out.add(suggestion.text());
                if (out.size() == MAX_SUGGESTIONS) return new ArrayList<>(out);
            }
        }
        return new ArrayList<>(out);
    }

    private List<Suggestion> suggestions() {
        List<Suggestion> all = new ArrayList<>();
        all.add(new Suggestion(Tier.INFORMATIONAL, Intent.LOCATION, "What attractions are near Swiss Cottages Bhurban?",
                List.of("attraction", "nearby", "location", "where")));
        all.add(new Suggestion(Tier.INFORMATIONAL, Intent.SAFETY, "Is Swiss Cottages Bhurban safe for families?",
                List.of("safe", "security", "guard")));
        all.add(new Suggestion(Tier.INFORMATIONAL, Intent.FACILITIES, "What facilities do the cottages have?",
                List.of("facilit", "amenit", "kitchen", "wifi")));
        all.add(new Suggestion(Tier.EXPLORATORY, Intent.ROOMS, "Can I see photos of the cottages?",
                List.of("photo", "image", "picture")));
        all.add(new Suggestion(Tier.EXPLORATORY, Intent.ROOMS, "Which cottage suits my group size?",
                List.of("group", "guests", "people", "members", "capacity", "accommodate")));
        for (CottageCatalog.Cottage cottage : catalog.shownByDefault()) {
            all.add(new Suggestion(Tier.EXPLORATORY, Intent.ROOMS, "What does Cottage " + cottage.number() + " offer?",
                    List.of("cottage " + cottage.number())));
        }
        all.add(new Suggestion(Tier.TRANSACTIONAL, Intent.PRICING, "What would my stay cost for my dates?",
                List.of("price", "pricing", "cost", "rate", "pkr")));
        all.add(new Suggestion(Tier.TRANSACTIONAL, Intent.AVAILABILITY, "Are the cottages available on my dates?",
                List.of("available", "availability", "vacan")));
        all.add(new Suggestion(Tier.TRANSACTIONAL, Intent.BOOKING, "How do I book a cottage?",
                List.of("book", "reserv")));
        return all;
    }

    /** A short tip for pricing, rooms and safety answers. */
    public Optional<String> generateGentleRecommendation(Intent intent, Map<SlotName, Object> slots) {
        if (intent == null) return Optional.empty();
        return switch (intent) {
            case PRICING -> Optional.of(pricingTip(slots));
            case ROOMS -> Optional.of(roomsTip(slots));
            case SAFETY -> Optional.of("💡 **Tip:** Swiss Cottages Bhurban sits in a secure gated community with guards on site. "
                    + "If you have specific safety concerns, feel free to ask or contact our team directly.");
            default -> Optional.empty();
        };
    }

    private String pricingTip(Map<SlotName, Object> slots) {
        List<String> tips = new ArrayList<>();
        Object season = slots.get(SlotName.SEASON);
        if ("weekday".equals(season)) {
            tips.add("💡 **Tip:** Weekday rates are lower than weekend rates, making them a great value option.");
        } else if ("weekend".equals(season)) {
            tips.add("💡 **Tip:** Weekend rates are slightly higher, but you'll enjoy the full weekend experience.");
        } else if ("peak".equals(season)) {
            tips.add("💡 **Tip:** Peak season rates apply, so booking in advance is recommended.");
        }
        if (slots.get(SlotName.GUESTS) instanceof Integer guests) {
            if (guests <= baseOccupancy) {
                tips.add("💡 **Tip:** For groups of " + baseOccupancy + " or fewer, you can book at the base price.");
            } else if (guests <= maxOccupancy) {
                tips.add("💡 **Tip:** For groups of " + (baseOccupancy + 1) + "-" + maxOccupancy
                        + " guests, prior confirmation and adjusted pricing apply.");
            }
        }
        if (tips.isEmpty()) {
            tips.add("💡 **Tip:** Weekday rates are lower than weekend rates. Advance payment is required to confirm your booking.");
        }
        return String.join("\n", tips);
    }

    private String roomsTip(Map<SlotName, Object> slots) {
        Set<String> tips = new LinkedHashSet<>();
        Optional<CottageCatalog.Cottage> chosen = cottage(slots).flatMap(catalog::find);
        String larger = cottageNames(catalog.all().stream().filter(c -> c.bedrooms() >= 3).toList());

        chosen.ifPresent(c -> tips.add(c.bedrooms() >= 3
                ? "💡 **Tip:** Cottage " + c.number() + " has " + c.bedrooms() + " bedrooms, perfect for families or larger groups."
                : "💡 **Tip:** Cottage " + c.number() + " is a " + c.bedrooms() + "-bedroom cottage, ideal for smaller groups or couples."));

        if (slots.get(SlotName.GUESTS) instanceof Integer guests) {
            if (guests <= baseOccupancy) {
                if (chosen.isEmpty()) {
                    tips.add("💡 **Tip:** For groups of " + baseOccupancy + " or fewer, any cottage is suitable at base price.");
                }
                if (Boolean.TRUE.equals(slots.get(SlotName.FAMILY)) && !larger.isEmpty()) {
                    tips.add("💡 **Tip:** " + larger + " have more space, ideal for families.");
                }
            } else if (guests <= maxOccupancy) {
                tips.add("💡 **Tip:** All cottages can accommodate up to " + maxOccupancy + " guests with prior confirmation.");
            }
        }
        if (tips.isEmpty()) {
            tips.add("💡 **Tip:** All cottages offer comfortable accommodation."
                    + (larger.isEmpty() ? "" : " " + larger + " are 3-bedroom options with more space."));
        }
        return String.join("\n", tips);
    }

    /**
     * Booking nudge with contact details, once two of guests, dates and cottage
     * are known and the guest has shown booking or availability interest.
     */
    public Optional<String> generateBookingNudge(Map<SlotName, Object> slots, ContextTracker context, Intent intent) {
        if (context != null) {
            List<Intent> recent = context.getRecentIntents(5);
            boolean interested = intent == Intent.BOOKING || intent == Intent.AVAILABILITY
                    || recent.contains(Intent.BOOKING) || recent.contains(Intent.AVAILABILITY);
            if (!interested) return Optional.empty();
        }
        boolean guests = slots.containsKey(SlotName.GUESTS);
        boolean dates = slots.containsKey(SlotName.DATES);
        boolean cottage = slots.containsKey(SlotName.COTTAGE_ID);
        int known = (guests ? 1 : 0) + (dates ? 1 : 0) + (cottage ? 1 : 0);
        if (known < 2) return Optional.empty();

        StringBuilder sb = new StringBuilder("💡 **Ready to book?** ");
        if (known == 3) {
            sb.append("You have all the key information! Would you like to proceed with booking? ");
        } else if (guests && dates) {
            sb.append("You've shared your group size and dates. Would you like to explore booking options? ");
        } else if (guests) {
            sb.append("You've shared your group size and preferred cottage. Would you like to check availability? ");
        } else {
            sb.append("You've shared your dates and preferred cottage. Would you like to proceed with booking? ");
        }
        sb.append("I can help you with the booking process or answer any other questions you have.\n\n");
        sb.append("**To proceed with booking, you can:**\n");
        sb.append("- Contact us: ").append(contact.getWebsite()).append('\n');
        sb.append("- Cottage Manager (").append(contact.getManagerName()).append("): ").append(contact.getManagerPhone()).append('\n');
        String listing = cottage(slots)
                .flatMap(number -> catalog.listingUrl(number).map(url -> "- View Cottage " + number + " online: " + url + "\n"))
                .orElse("- Book online or contact us directly for assistance\n");
        sb.append(listing);
        if (context != null) context.markReadyToBook();
        return Optional.of(sb.toString());
    }

    /** Another cottage to consider when the chosen one may not be free. */
    public Optional<String> generateAlternativeSuggestion(Intent intent, Map<SlotName, Object> slots) {
        if (intent != Intent.AVAILABILITY) return Optional.empty();
        Optional<CottageCatalog.Cottage> chosen = cottage(slots).flatMap(catalog::find);
        if (chosen.isEmpty()) return Optional.empty();
        CottageCatalog.Cottage c = chosen.get();
        List<CottageCatalog.Cottage> others = catalog.all().stream()
                .filter(o -> !o.number().equals(c.number()) && o.bedrooms() != c.bedrooms())
                .toList();
        if (others.isEmpty()) {
            return Optional.of("💡 **Alternative:** Other cottages might be available. Would you like to check different dates?");
        }
        int bedrooms = others.get(0).bedrooms();
        return Optional.of("💡 **Alternative:** " + cottageNames(others) + " offer " + bedrooms
                + "-bedroom options that might be available for your dates.");
    }

    /** Offers photos when a cottage is being discussed and the guest has not asked for them yet. */
    public Optional<String> generateImageRecommendation(String query, Map<SlotName, Object> slots, Intent intent) {
        String q = StringUtils.defaultString(query).toLowerCase(Locale.ROOT);
        if (IMAGE_WORDS.matcher(q).find()) return Optional.empty();
        Object slot = slots.get(SlotName.COTTAGE_ID);
        String mention = null;
        if (SlotDefinitions.ANY_COTTAGE.equals(slot)) {
            mention = "the cottages";
        } else if (slot instanceof String number) {
            mention = "cottage " + number;
        }
        if (mention == null) return Optional.empty();
        boolean relevant = intent == Intent.ROOMS || intent == Intent.PRICING
                || (COTTAGE_WORD.matcher(q).find() && intent != Intent.BOOKING && intent != Intent.AVAILABILITY);
        if (!relevant) return Optional.empty();
        return Optional.of("📷 **Would you like to see images of " + mention + "?** Just ask and I can show you photos!");
    }

    /** Related services for facility questions, such as chef services for kitchen questions. */
    public Optional<String> generateCrossRecommendation(String query, Intent intent) {
        String q = StringUtils.defaultString(query).toLowerCase(Locale.ROOT);
        if (KITCHEN.matcher(q).find()) {
            return Optional.of("💡 **Related Service:** We also offer chef services at an additional cost for freshly "
                    + "prepared meals, perfect if you'd rather not cook yourself!");
        }
        if (CHEF.matcher(q).find()) {
            return Optional.of("💡 **Related Facility:** All cottages come with fully equipped kitchens, "
                    + "so you can also cook your own meals if you prefer.");
        }
        if (WIFI.matcher(q).find()) {
            return Optional.of("💡 **Related Amenities:** In addition to Wi-Fi, all cottages include a Smart TV with Netflix.");
        }
        if (PARKING.matcher(q).find()) {
            return Optional.of("💡 **Location Info:** Swiss Cottages is in a secure gated community in Bhurban, "
                    + "next to Pearl Continental (PC) Bhurban, with easy access to nearby attractions.");
        }
        if (FOOD.matcher(q).find()) {
            return Optional.of("💡 **Food Options:** Cook in the fully equipped kitchen, order from nearby restaurants, "
                    + "enjoy the BBQ facilities, or book chef services at an additional cost.");
        }
        if (BBQ.matcher(q).find()) {
            return Optional.of("💡 **Related Service:** If you'd prefer not to cook, chef services are available "
                    + "at an additional cost.");
        }
        if (intent == Intent.FACILITIES && GENERAL_FACILITIES.matcher(q).find()) {
            return Optional.of("💡 **Popular Amenities:** Fully equipped kitchens, Wi-Fi, Smart TV with Netflix, "
                    + "BBQ facilities, outdoor sitting areas and secure parking. Chef services are available at an additional cost.");
        }
        return Optional.empty();
    }

    /** Next step after pricing or availability questions that have not led to booking yet. */
    public Optional<String> generateProactiveSuggestion(ContextTracker context, Map<SlotName, Object> slots) {
        if (context == null) return Optional.empty();
        List<Intent> recent = context.getRecentIntents(3);
        boolean booking = recent.contains(Intent.BOOKING);
        if (booking) return Optional.empty();
        if (recent.contains(Intent.PRICING) && slots.containsKey(SlotName.GUESTS) && slots.containsKey(SlotName.DATES)) {
            return Optional.of("💡 **Next step:** Would you like to know more about the booking process or check availability?");
        }
        if (recent.contains(Intent.AVAILABILITY) && slots.containsKey(SlotName.DATES)) {
            return Optional.of("💡 **Next step:** Would you like to know about pricing for these dates or proceed with booking?");
        }
        return Optional.empty();
    }

    private static Optional<String> cottage(Map<SlotName, Object> slots) {
        return slots.get(SlotName.COTTAGE_ID) instanceof String c && !SlotDefinitions.ANY_COTTAGE.equals(c)
                ? Optional.of(c)
                : Optional.empty();
    }

    private static String cottageNames(List<CottageCatalog.Cottage> cottages) {
        List<String> names = cottages.stream().map(c -> "Cottage " + c.number()).toList();
        if (names.size() <= 1) return names.isEmpty() ? "" : names.get(0);
        return String.join(", ", names.subList(0, names.size() - 1)) + " and " + names.get(names.size() - 1);
    }

    record Suggestion(Tier tier, Intent topic, String text, List<String> keywords) {
    }
}
