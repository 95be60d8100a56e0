package com.example.sessionrelay.request;

import com.example.sessionrelay.exception.InvalidParametersException;
import com.example.sessionrelay.exception.UnsupportedEndpointException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.example.sessionrelay.request.RequestParams.Param.intWithDefault;
import static com.example.sessionrelay.request.RequestParams.Param.optionalString;
import static com.example.sessionrelay.request.RequestParams.Param.requiredString;
import static com.example.sessionrelay.request.VoyagerEncoding.encodeComponent;
import static com.example.sessionrelay.request.VoyagerEncoding.profileUrn;

/**
 * Upstream calls the gateway knows how to build. Query layout, including parameter order, is copied from what
 * the web client itself sends; the upstream rejects reordered but otherwise equivalent queries.
 */
public enum Endpoint {

    FEED("feed", "GET",
            intWithDefault("count", 10),
            intWithDefault("start", 0)) {
        @Override
        String url(String base, RequestParams p) {
            // the web client asks for one extra item
            return base + "/feed/updatesV2?count=" + (p.getInt("count") + 1) + "&start=" + p.getInt("start")
                    + "&q=feed&includeLongTermHistory=true&useCase=DEFAULT";
        }
    },

    COMMENTS("comments", "GET",
            requiredString("postUrl"),
            intWithDefault("start", 0),
            intWithDefault("count", 10),
            intWithDefault("numReplies", 1),
            optionalString("paginationToken")) {
        @Override
        String url(String base, RequestParams p) {
            String urn = postUrn(p);
            List<String> vars = new ArrayList<>();
            vars.add("count:" + p.getInt("count"));
            vars.add("numReplies:" + p.getInt("numReplies"));
            String token = p.optString("paginationToken");
            if (token != null) vars.add("paginationToken:" + encodeComponent(token));
            vars.add("socialDetailUrn:" + encodeComponent(
                    "urn:li:fsd_socialDetail:(" + urn + "," + urn + ",urn:li:highlightedReply:-)"));
            vars.add("sortOrder:RELEVANCE");
            vars.add("start:" + p.getInt("start"));
            return graphql(base) + "?variables=(" + String.join(",", vars) + ")"
                    + "&queryId=voyagerSocialDashComments.95ed44bc87596acce7c460c70934d0ff";
        }
    },

    REACTIONS("reactions", "GET",
            requiredString("postUrl"),
            intWithDefault("start", 0),
            intWithDefault("count", 10),
            optionalString("paginationToken")) {
        @Override
        String url(String base, RequestParams p) {
            List<String> vars = new ArrayList<>();
            vars.add("count:" + p.getInt("count"));
            vars.add("start:" + p.getInt("start"));
            vars.add("threadUrn:" + encodeComponent(postUrn(p)));
            String token = p.optString("paginationToken");
            if (token != null) vars.add("paginationToken:" + encodeComponent(token));
            return graphql(base) + "?includeWebMetadata=true&variables=(" + String.join(",", vars) + ")"
                    + "&queryId=voyagerSocialDashReactions.41ebf31a9f4c4a84e35a49d5abc9010b";
        }
    },

    USER_COMMENTS("user_comments", "GET",
            requiredString("profileId"),
            intWithDefault("start", 0),
            intWithDefault("count", 20),
            optionalString("paginationToken")) {
        @Override
        String url(String base, RequestParams p) {
            List<String> vars = new ArrayList<>();
            vars.add("count:" + p.getInt("count"));
            vars.add("start:" + p.getInt("start"));
            vars.add("profileUrn:" + profileUrn(p.getString("profileId")));
            String token = p.optString("paginationToken");
            if (token != null) vars.add("paginationToken:" + encodeComponent(token));
            return graphql(base) + "?variables=(" + String.join(",", vars) + ")"
                    + "&queryId=voyagerFeedDashProfileUpdates.8f05a4e5ad12d9cb2b56eaa22afbcab9";
        }
    },

    PROFILE_EXPERIENCES("profile_experiences", "GET", requiredString("profileId")) {
        @Override
        String url(String base, RequestParams p) {
            return graphql(base) + "?variables=(profileUrn:" + profileUrn(p.getString("profileId"))
                    + ",sectionType:experience,locale:en_US)"
                    + "&queryId=voyagerIdentityDashProfileComponents.c5d4db426a0f8247b8ab7bc1d660775a";
        }
    },

    PROFILE_IDENTITY("profile_identity", "GET", requiredString("profileId")) {
        @Override
        String url(String base, RequestParams p) {
            return graphql(base) + "?includeWebMetadata=true&variables=(profileUrn:" + profileUrn(p.getString("profileId")) + ")"
                    + "&queryId=voyagerIdentityDashProfileCards.c5c6ae006152475b00720b4f9b83f6ff";
        }
    },

    PROFILE_ABOUT_SKILLS("profile_about_skills", "GET", requiredString("profileId")) {
        @Override
        String url(String base, RequestParams p) {
            return graphql(base) + "?includeWebMetadata=true&variables=(profileUrn:" + profileUrn(p.getString("profileId")) + ")"
                    + "&queryId=voyagerIdentityDashProfileCards.f0415f0ff9d9968bab1cd89c0352f7c8";
        }
    },

    PROFILE_CONTACT("profile_contact", "GET", requiredString("memberIdentity")) {
        @Override
        String url(String base, RequestParams p) {
            return graphql(base) + "?includeWebMetadata=true"
                    + "&variables=(memberIdentity:" + encodeComponent(p.getString("memberIdentity")) + ")"
                    + "&queryId=voyagerIdentityDashProfiles.c7452e58fa37646d09dae4920fc5b4b9";
        }
    },

    /** Invitation, optionally with a note; the upstream treats both as the same action. */
    CONNECT("connect", "POST", requiredString("profileId"), optionalString("message")) {
        @Override
        String url(String base, RequestParams p) {
            return base + "/voyagerRelationshipsDashMemberRelationships?action=verifyQuotaAndCreateV2"
                    + "&decorationId=com.linkedin.voyager.dash.deco.relationships.InvitationCreationResultWithInvitee-2";
        }

        @Override
        String body(RequestParams p, ObjectMapper om) {
            ObjectNode root = om.createObjectNode();
            root.putObject("invitee")
                    .putObject("inviteeUnion")
                    .put("memberProfile", "urn:li:fsd_profile:" + p.getString("profileId"));
            String message = p.optString("message");
            if (message != null) root.put("customMessage", message);
            return write(om, root);
        }
    },

    POST_COMMENT("post_comment", "POST", requiredString("postUrl"), requiredString("text")) {
        @Override
        String url(String base, RequestParams p) {
            return normComments(base);
        }

        @Override
        String body(RequestParams p, ObjectMapper om) {
            return commentBody(om, p.getString("text"), postUrn(p));
        }
    },

    REPLY_COMMENT("reply_comment", "POST", requiredString("commentUrn"), requiredString("text")) {
        @Override
        String url(String base, RequestParams p) {
            return normComments(base);
        }

        @Override
        String body(RequestParams p, ObjectMapper om) {
            String commentUrn = p.getString("commentUrn");
            Matcher m = FSD_COMMENT.matcher(commentUrn);
            if (!m.matches()) {
                throw new InvalidParametersException("Could not parse comment URN: " + commentUrn);
            }
            // replies thread on urn:li:comment:(<postType>:<postId>,<commentId>)
            String threadUrn = "urn:li:comment:(" + m.group(2) + ":" + m.group(3) + "," + m.group(1) + ")";
            return commentBody(om, p.getString("text"), threadUrn);
        }
    },

    /**
     * Looks up whether a conversation with the profile already exists. The response's
     * {@code composeNavigationContext.existingConversationUrn} feeds {@code send_message}.
     */
    COMPOSE_OPTIONS("compose_options", "GET", requiredString("profileId")) {
        @Override
        String url(String base, RequestParams p) {
            // only the URN's colons and comma are escaped, parentheses stay literal
            return base + "/voyagerMessagingDashComposeOptions/urn%3Ali%3Afsd_composeOption%3A("
                    + encodeComponent(p.getString("profileId")) + "%2CNONE%2CEMPTY_CONTEXT_ENTITY_URN)";
        }

        @Override
        String accept() {
            return MESSAGING_ACCEPT;
        }
    },

    /**
     * Direct message. {@code originToken} and {@code trackingId} are caller-generated UUIDs so that the same
     * logical call always builds the same request; with {@code conversationUrn} the message is a reply into that
     * conversation, otherwise it opens a new one.
     */
    SEND_MESSAGE("send_message", "POST",
            requiredString("senderProfileId"),
            requiredString("recipientProfileId"),
            requiredString("text"),
            requiredString("originToken"),
            requiredString("trackingId"),
            optionalString("conversationUrn")) {
        @Override
        String url(String base, RequestParams p) {
            return base + "/voyagerMessagingDashMessengerMessages?action=createMessage";
        }

        @Override
        String body(RequestParams p, ObjectMapper om) {
            String mailboxUrn = "urn:li:fsd_profile:" + p.getString("senderProfileId");
            String conversationUrn = p.optString("conversationUrn");

            ObjectNode root = om.createObjectNode();
            ObjectNode message = root.putObject("message");
            ObjectNode body = message.putObject("body");
            body.putArray("attributes");
            body.put("text", p.getString("text"));
            if (conversationUrn != null) {
                String conversationId = conversationUrn.replace("urn:li:fsd_conversation:", "");
                message.putArray("renderContentUnions");
                message.put("conversationUrn", "urn:li:msg_conversation:(" + mailboxUrn + "," + conversationId + ")");
                message.put("originToken", p.getString("originToken"));
            } else {
                message.put("originToken", p.getString("originToken"));
                message.putArray("renderContentUnions");
            }
            root.put("mailboxUrn", mailboxUrn);
            root.put("trackingId", trackingBytes(p.getString("trackingId")));
            root.put("dedupeByClientGeneratedToken", false);
            if (conversationUrn == null) {
                root.putArray("hostRecipientUrns").add("urn:li:fsd_profile:" + p.getString("recipientProfileId"));
            }
            return write(om, root);
        }

        @Override
        String accept() {
            return MESSAGING_ACCEPT;
        }

        @Override
        String contentType() {
            return "text/plain;charset=UTF-8";
        }
    },

    /** The public post page; the URL must be a post on the upstream's own host. */
    POST_HTML("post_html", "GET", requiredString("postUrl")) {
        @Override
        String url(String base, RequestParams p) {
            String postUrl = p.getString("postUrl");
            postUrn(p); // only post pages
            URI target;
            URI upstream;
            try {
                target = new URI(postUrl);
                upstream = new URI(base);
            } catch (URISyntaxException e) {
                throw new InvalidParametersException("Malformed postUrl: " + postUrl);
            }
            if (!upstream.getScheme().equalsIgnoreCase(String.valueOf(target.getScheme()))
                    || !upstream.getHost().equalsIgnoreCase(String.valueOf(target.getHost()))) {
                throw new InvalidParametersException("postUrl must point at " + upstream.getHost());
            }
            return postUrl;
        }
    };

    static final String MESSAGING_ACCEPT = "*/*";

    private static final Pattern FSD_COMMENT =
            Pattern.compile("urn:li:fsd_comment:\\((\\d+),urn:li:(activity|ugcPost):(\\d+)\\)");

    private final String id;
    private final String method;
    private final List<RequestParams.Param> params;

    Endpoint(String id, String method, RequestParams.Param... params) {
        this.id = id;
        this.method = method;
        this.params = List.copyOf(Arrays.asList(params));
    }

    public String id() { return id; }
    public String method() { return method; }

    List<RequestParams.Param> params() { return params; }

    abstract String url(String base, RequestParams p);

    /** Null for body-less requests. */
    String body(RequestParams p, ObjectMapper om) {
        return null;
    }

    String accept() {
        return RequestTemplateEngine.ACCEPT;
    }

    /** Sent only with a body. */
    String contentType() {
        return "application/json";
    }

    public static Endpoint fromId(String id) {
        if (id != null) {
            for (Endpoint e : values()) {
                if (e.id.equals(id)) return e;
            }
        }
        throw new UnsupportedEndpointException(id);
    }

    private static String graphql(String base) {
        return base + "/graphql";
    }

    private static String normComments(String base) {
        return base + "/voyagerSocialDashNormComments?decorationId=com.linkedin.voyager.dash.deco.social.NormComment-43";
    }

    private static String commentBody(ObjectMapper om, String text, String threadUrn) {
        ObjectNode root = om.createObjectNode();
        ObjectNode commentary = root.putObject("commentary");
        commentary.put("text", text);
        commentary.putArray("attributesV2");
        commentary.put("$type", "com.linkedin.voyager.dash.common.text.TextViewModel");
        root.put("threadUrn", threadUrn);
        return write(om, root);
    }

    /** The 16 UUID bytes as ISO-8859-1 characters, which is how the web client sends {@code trackingId}. */
    static String trackingBytes(String uuid) {
        String hex = uuid.replace("-", "");
        if (hex.length() != 32 || !hex.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            throw new InvalidParametersException("trackingId must be a UUID: " + uuid);
        }
        byte[] bytes = new byte[16];
        for (int i = 0; i < 16; i++) {
            bytes[i] = (byte) Integer.parseInt(hex.substring(i * 2, i * 2 + 2), 16);
        }
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    private static String write(ObjectMapper om, ObjectNode root) {
        try {
            return om.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize request body", e);
        }
    }

    private static String postUrn(RequestParams p) {
        String postUrl = p.getString("postUrl");
        return PostUrns.parse(postUrl)
                .orElseThrow(() -> new InvalidParametersException("Could not parse post URN from URL: " + postUrl));
    }
}
