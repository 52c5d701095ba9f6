package com.sandkev.redditclient.api;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class RedditIds {

    private static final List<Pattern> CONTEXT_PATTERNS = List.of(
            Pattern.compile("/r/[^/]*/comments/([^/]*)/.*")
    );

    private RedditIds() {}

    /** {@code t3_abc} split into its type prefix and id. */
    public record Fullname(String kind, String id) {
        static final Fullname EMPTY = new Fullname("", "");
    }

    /** Anything other than exactly one underscore yields two empty parts. */
    public static Fullname splitId(String fullname) {
        if (fullname == null) return Fullname.EMPTY;
        String[] parts = fullname.split("_", -1);
        return parts.length == 2 ? new Fullname(parts[0], parts[1]) : Fullname.EMPTY;
    }

    /** Post id out of a comment/message context link, or "" when there is none. */
    public static String postIdFromContext(String context) {
        if (context == null) return "";
        for (Pattern p : CONTEXT_PATTERNS) {
            Matcher m = p.matcher(context);
            if (m.find()) return m.group(1);
        }
        return "";
    }
}
