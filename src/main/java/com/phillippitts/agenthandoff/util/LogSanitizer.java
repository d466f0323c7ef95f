package com.phillippitts.agenthandoff.util;

/** Utility for privacy-safe logging of user and persona utterances. */
public final class LogSanitizer {

    /** Default preview length for utterances in log lines. */
    public static final int PREVIEW_LENGTH = 60;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }

    /**
     * Truncates to {@link #PREVIEW_LENGTH} and flattens line breaks so one utterance stays one log line.
     */
    public static String preview(String s) {
        return truncate(s, PREVIEW_LENGTH).replace('\n', ' ').replace('\r', ' ');
    }
}
