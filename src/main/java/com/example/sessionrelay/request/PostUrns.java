package com.example.sessionrelay.request;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code urn:li:activity:N} or {@code urn:li:ugcPost:N} from the post URL shapes users paste.
 */
public final class PostUrns {

    private static final Pattern DIRECT = Pattern.compile("(urn:li:(?:activity|ugcPost):\\d+)");
    private static final Pattern COLON = Pattern.compile("(activity|ugcPost):(\\d+)");
    private static final Pattern HYPHEN = Pattern.compile("(activity|ugcPost)-(\\d+)");

    private PostUrns() {}

    public static Optional<String> parse(String postUrl) {
        if (postUrl == null || postUrl.isBlank()) return Optional.empty();

        Matcher m = DIRECT.matcher(postUrl);
        if (m.find()) return Optional.of(m.group(1));

        m = COLON.matcher(postUrl);
        if (m.find()) return Optional.of("urn:li:" + m.group(1) + ":" + m.group(2));

        // /posts/someone_title-activity-7383418571017842688-AbCd
        m = HYPHEN.matcher(postUrl);
        if (m.find()) return Optional.of("urn:li:" + m.group(1) + ":" + m.group(2));

        return Optional.empty();
    }
}
