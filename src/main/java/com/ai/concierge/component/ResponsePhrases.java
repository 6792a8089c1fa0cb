package com.ai.concierge.component;

import com.ai.concierge.config.ConciergeProperties;
import org.springframework.stereotype.Component;

@Component
public class ResponsePhrases {

    private static final String TOPICS_SHORT = "- Pricing and availability\n"
            + "- Facilities and amenities\n"
            + "- Location and nearby attractions\n"
            + "- Booking and payment information";

    private static final String TOPICS_DETAILED = "- **Pricing & Availability**: Rates, booking, availability\n"
            + "- **Facilities & Amenities**: What's available at the cottages\n"
            + "- **Location & Nearby**: Location details and nearby attractions\n"
            + "- **Booking & Payment**: How to book and payment methods";

    private final ConciergeProperties.Contact contact;

    public ResponsePhrases(ConciergeProperties properties) {
        this.contact = properties.getContact();
    }

    public String greeting() {
        return "Hi! 👋 How may I help you today?\n\n"
                + "I can help you with information about Swiss Cottages Bhurban, including:\n"
                + TOPICS_SHORT + "\n\n"
                + "What would you like to know?";
    }

    public String help() {
        return "I can help you with information about Swiss Cottages Bhurban! 🏡\n\n"
                + "Here's what I can assist you with:\n"
                + TOPICS_DETAILED + "\n\n"
                + "What would you like to know more about?";
    }

    public String affirmative(boolean offeredMore) {
        if (offeredMore) {
            return "Great! What would you like to know about Swiss Cottages Bhurban?\n\n"
                    + "I can help you with:\n" + TOPICS_DETAILED + "\n\n"
                    + "Just ask me any question, and I'll find the information for you!";
        }
        return "Great! What would you like to know about Swiss Cottages Bhurban?\n\n"
                + "I can help you with:\n" + TOPICS_SHORT;
    }

    public String negative(boolean offeredMore) {
        if (offeredMore) {
            return "Great! Feel free to reach out if you have any questions about Swiss Cottages Bhurban. Have a wonderful day! 😊";
        }
        return "No problem! If you need any information about Swiss Cottages Bhurban in the future, just ask. Have a great day! 😊";
    }

    public String thanks() {
        return "You're welcome! 😊 Is there anything else you'd like to know about Swiss Cottages Bhurban?";
    }

    public String clarify(String question) {
        return "To give you the most accurate answer, could you please clarify: **" + question + "**";
    }

    public String outOfScope(String question, String reason) {
        return "❌ **I don't have information about that in the knowledge base.**\n\n"
                + "**Your question:** " + question + "\n\n"
                + "**Issue:** " + reason + "\n\n"
                + "💡 **Note:** I only have information about Swiss Cottages Bhurban (in Pakistan). "
                + "I cannot answer questions about Swiss Cottages in other locations.\n\n"
                + "**Try asking about:**\n"
                + "- Swiss Cottages Bhurban\n"
                + "- Properties in Bhurban, Pakistan\n"
                + "- Swiss Cottages (the property in Pakistan)";
    }

    public String noDocuments() {
        return "I couldn't find information about that in the knowledge base. "
                + "Could you rephrase your question, or ask about pricing, facilities, location or booking?";
    }

    public String unavailable() {
        return "Sorry, I can't answer right now. Please try again in a moment, or contact us at "
                + contact.getWebsite() + " or " + contact.getManagerName() + " (" + contact.getManagerPhone() + ").";
    }

    public String emptyAnswer() {
        return "I didn't provide the answer; perhaps I can try again.";
    }

    public String bookingAcknowledgement() {
        return "I understand you'd like to book a cottage! 🏡\n\n"
                + "While I can't process bookings directly, I can help you with all the information you need to make a booking.\n\n"
                + "**Here's what I found about booking:**\n\n";
    }

    public String bookingNextSteps() {
        return "\n\n💡 **To proceed with booking, you can:**\n"
                + "- Contact the property: " + contact.getWebsite() + "\n"
                + "- Cottage Manager (" + contact.getManagerName() + "): " + contact.getManagerPhone() + "\n"
                + "- Ask me about availability, pricing, or any other details you need\n\n"
                + "Is there anything specific about the booking process you'd like to know more about?";
    }
}
