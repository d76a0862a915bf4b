package com.salesanalytics.recommendation;

/**
 * Short coaching hint shown next to similar calls.
 */
public record CoachingNudge(String title, String suggestion) {

    static final int MAX_SUGGESTION_LENGTH = 100;

    /**
     * Nudge with the suggestion cut to {@value #MAX_SUGGESTION_LENGTH} characters, ending in "..." when cut.
     */
    public static CoachingNudge of(String title, String suggestion) {
        String text = suggestion == null ? "" : suggestion;
        if (text.length() > MAX_SUGGESTION_LENGTH) {
            text = text.substring(0, MAX_SUGGESTION_LENGTH - 3) + "...";
        }
        return new CoachingNudge(title, text);
    }
}
