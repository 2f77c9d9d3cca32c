package com.phillippitts.vinylscrobbler.util;

/** Keeps recognizer-supplied strings short and single-line in logs. */
public final class LogSanitizer {

    /** Longest artist or title printed in a log line. */
    public static final int MAX_FIELD_LENGTH = 80;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters and flatten line breaks; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        String flat = s.replace('\r', ' ').replace('\n', ' ');
        return flat.length() <= max ? flat : flat.substring(0, max) + "...";
    }

    /** "title by artist" with both parts truncated. */
    public static String track(String artist, String title) {
        return "'" + truncate(title, MAX_FIELD_LENGTH) + "' by '" + truncate(artist, MAX_FIELD_LENGTH) + "'";
    }
}
