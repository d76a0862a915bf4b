package com.salesanalytics.recommendation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Fixed catalogue of coaching nudges.
 *
 * The selection for a call is seeded by its id, so asking twice for the same call
 * returns the same nudges.
 */
@Component
public class CoachingNudgeCatalog {

    static final int NUDGES_PER_CALL = 3;

    private static final List<CoachingNudge> CATALOG = List.of(
            CoachingNudge.of("Active Listening", "Ask more follow-up questions to better understand customer needs."),
            CoachingNudge.of("Empathy Building", "Acknowledge customer frustrations before offering solutions."),
            CoachingNudge.of("Solution Focus", "Provide clear next steps and timeline for resolution."),
            CoachingNudge.of("Rapport Building", "Use customer's name and reference previous interactions."),
            CoachingNudge.of("Clarity Improvement", "Explain technical terms in simple customer language."),
            CoachingNudge.of("Problem Resolution", "Confirm understanding before proceeding with solutions."),
            CoachingNudge.of("Customer Satisfaction", "Check customer satisfaction before ending the call."),
            CoachingNudge.of("Professional Tone", "Maintain consistent professional tone throughout the conversation."),
            CoachingNudge.of("Call Control", "Guide the conversation while allowing customer to express concerns."),
            CoachingNudge.of("Follow-up", "Set clear expectations for follow-up actions and timeline.")
    );

    public List<CoachingNudge> nudgesFor(String callId) {
        List<CoachingNudge> shuffled = new ArrayList<>(CATALOG);
        Collections.shuffle(shuffled, new Random(callId.hashCode()));
        return List.copyOf(shuffled.subList(0, NUDGES_PER_CALL));
    }

    List<CoachingNudge> catalog() {
        return CATALOG;
    }
}
