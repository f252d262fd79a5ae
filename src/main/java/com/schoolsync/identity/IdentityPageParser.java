package com.schoolsync.identity;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the numeric user id out of the identity service's profile page, which
 * embeds it in an inline script as {@code data:{user:{id:123456,...}}}.
 */
public final class IdentityPageParser {

    private static final Pattern PRIMARY = Pattern.compile("data:\\{user:\\{id:(\\d+),");
    private static final Pattern SCRIPT_BLOCK = Pattern.compile("<script[^>]*>(.*?)</script>",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern SCRIPT_USER_ID = Pattern.compile("user:\\{id:(\\d+),");

    private IdentityPageParser() {
    }

    public static String extractUserId(String html) {
        if (html == null || html.isEmpty()) {
            return null;
        }
        Matcher primary = PRIMARY.matcher(html);
        if (primary.find()) {
            return primary.group(1);
        }

        Matcher scripts = SCRIPT_BLOCK.matcher(html);
        while (scripts.find()) {
            String body = scripts.group(1);
            if (body != null && body.contains("user:{id:")) {
                Matcher match = SCRIPT_USER_ID.matcher(body);
                if (match.find()) {
                    return match.group(1);
                }
            }
        }
        return null;
    }
}
