package com.phillippitts.agenthandoff.service.orchestration;

import com.phillippitts.agenthandoff.domain.AgentSpec;

import java.util.List;

/**
 * Fixed utterances spoken by the orchestrator itself, as opposed to the personas' own replies.
 */
final class ConversationScripts {

    static final List<String> FILLERS = List.of(
            "I'm still putting your agent together. Right now I'm setting up the tasks it will handle.",
            "Almost there! I'm fine-tuning how your agent will sound on the phone.");

    private ConversationScripts() {}

    static String greeting(String creatorName) {
        return "Hi, I'm " + creatorName + "! I'll help you design a custom voice agent for your business. "
                + "What's the name of your business, and what kind of business is it?";
    }

    static String ready(AgentSpec spec) {
        return "Great news! Your " + spec.agentType() + " is ready. Would you like to try a live demo now?";
    }

    static String synthesisApology(boolean timedOut) {
        if (timedOut) {
            return "I'm sorry, creating your agent is taking much longer than it should. "
                    + "Let's review your requirements and try again.";
        }
        return "I'm sorry, I ran into a problem while creating your agent. "
                + "Let's review your requirements and try again.";
    }

    static String farewellToTaskAgent(AgentSpec spec, String creatorName) {
        return "Perfect! I'm connecting you to your new " + spec.agentType() + " now. "
                + "When you're done testing, just ask to speak with " + creatorName + " again.";
    }

    static String taskAgentIntroduction(AgentSpec spec, String creatorName) {
        String business = spec.contextValue(AgentSpec.BUSINESS_NAME, "your business");
        return "Hello! I'm the new " + spec.agentType() + " for " + business + ". "
                + "Go ahead and talk to me like one of your customers would. "
                + "Whenever you want to go back to " + creatorName + ", just say so.";
    }

    static String farewellToCreator(String creatorName) {
        return "Thanks for testing me out! I'm connecting you back to " + creatorName + " now.";
    }

    static String creatorReturn(String creatorName, AgentSpec spec) {
        String name = spec == null ? "your" : spec.contextValue(AgentSpec.BUSINESS_NAME, "your");
        String intro = "Hi again, it's " + creatorName + ". ";
        if (spec == null) {
            return intro + "How did the demo go?";
        }
        return intro + "How did the demo of the " + spec.contextValue(AgentSpec.BUSINESS_TYPE, "custom")
                + " agent for " + name + " go? Tell me what you'd like to change, "
                + "or ask to try the demo again.";
    }

    static String handoffApology() {
        return "I'm sorry, I had trouble connecting you. I'm still here, so let's review your requirements "
                + "or try the demo again in a moment.";
    }

    static String goodbye(AgentSpec spec) {
        if (spec == null) {
            return "Thanks for talking with me. Goodbye!";
        }
        return "Thanks for building your " + spec.agentType() + " with me. Goodbye!";
    }
}
