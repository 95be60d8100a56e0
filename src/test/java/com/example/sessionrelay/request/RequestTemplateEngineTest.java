package com.example.sessionrelay.request;

import com.example.sessionrelay.config.GatewayProperties;
import com.example.sessionrelay.exception.InvalidParametersException;
import com.example.sessionrelay.exception.UnsupportedEndpointException;
import com.example.sessionrelay.model.BuiltRequest;
import com.example.sessionrelay.model.CredentialSnapshot;
import com.example.sessionrelay.model.LogicalRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestTemplateEngineTest {

    private static final ObjectMapper OM = new ObjectMapper();

    private static final String BASE = "https://www.linkedin.com/voyager/api";
    private static final String POST_URL = "https://www.linkedin.com/feed/update/urn:li:activity:7383418571017842688/";

    private RequestTemplateEngine engine;
    private CredentialSnapshot full;

    @BeforeEach
    void setUp() {
        engine = new RequestTemplateEngine(new GatewayProperties());
        Map<String, String> cookies = new LinkedHashMap<>();
        cookies.put("bcookie", "v=2&abc");
        cookies.put("JSESSIONID", "\"ajax:123\"");
        cookies.put("li_at", "AQEDAR");
        cookies.put("liap", "true");
        full = new CredentialSnapshot("\"ajax:123\"", cookies, 1L);
    }

    @Test
    void feedUsesDefaultsAndAsksForOneExtraItem() {
        BuiltRequest r = engine.build("feed", Map.of(), full);

        assertThat(r.getMethod()).isEqualTo("GET");
        assertThat(r.getUrl()).isEqualTo(BASE + "/feed/updatesV2?count=11&start=0&q=feed&includeLongTermHistory=true&useCase=DEFAULT");
        assertThat(r.getBody()).isNull();
    }

    @Test
    void headersComeInFixedOrderWithNormalizedCredentials() {
        BuiltRequest r = engine.build("feed", Map.of("count", 5), full);

        assertThat(r.headerNames()).containsExactly("accept", "csrf-token", "x-restli-protocol-version", "cookie");
        assertThat(r.header("accept")).isEqualTo(RequestTemplateEngine.ACCEPT);
        assertThat(r.header("csrf-token")).isEqualTo("ajax:123");
        assertThat(r.header("x-restli-protocol-version")).isEqualTo("2.0.0");
        // only long-lived cookies, JSESSIONID quoted
        assertThat(r.header("cookie")).isEqualTo("li_at=AQEDAR; JSESSIONID=\"ajax:123\"; liap=true");
    }

    @Test
    void missingCredentialsDropTheirHeaders() {
        BuiltRequest r = engine.build("feed", Map.of(), CredentialSnapshot.empty());

        assertThat(r.headerNames()).containsExactly("accept", "x-restli-protocol-version");
    }

    @Test
    void sameInputBuildsByteIdenticalRequests() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("postUrl", POST_URL);
        a.put("count", 20);
        a.put("start", 40);
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("start", "40");
        b.put("count", 20);
        b.put("postUrl", POST_URL);

        BuiltRequest first = engine.build(new LogicalRequest("comments", a, "u1"), full);
        BuiltRequest second = engine.build(new LogicalRequest("comments", a, "u1"), full);
        BuiltRequest reordered = engine.build(new LogicalRequest("comments", b, "u1"), full);

        assertThat(second).isEqualTo(first);
        assertThat(second.toWireBytes()).isEqualTo(first.toWireBytes());
        assertThat(reordered.getUrl()).isEqualTo(first.getUrl());
    }

    @Test
    void serverAndDelegatedBuildsDifferOnlyInCookieHeader() {
        Map<String, Object> params = Map.of("profileId", "ACoAABCD");

        BuiltRequest server = engine.build("profile_identity", params, full);
        BuiltRequest delegated = engine.build("profile_identity", params, full.withoutCookies());

        assertThat(delegated.header("cookie")).isNull();
        assertThat(server.withoutHeader("cookie")).isEqualTo(delegated);
    }

    @Test
    void commentsQueryKeepsVariableOrderAndEncodesComposite() {
        BuiltRequest r = engine.build("comments", Map.of("postUrl", POST_URL), full);

        String urn = "urn%3Ali%3Aactivity%3A7383418571017842688";
        assertThat(r.getUrl()).isEqualTo(BASE + "/graphql?variables=(count:10,numReplies:1,socialDetailUrn:"
                + "urn%3Ali%3Afsd_socialDetail%3A%28" + urn + "%2C" + urn + "%2Curn%3Ali%3AhighlightedReply%3A-%29"
                + ",sortOrder:RELEVANCE,start:0)&queryId=voyagerSocialDashComments.95ed44bc87596acce7c460c70934d0ff");
    }

    @Test
    void paginationTokenIsEncodedAndPlacedBeforeSocialDetail() {
        BuiltRequest r = engine.build("comments", Map.of("postUrl", POST_URL, "paginationToken", "a b=="), full);

        assertThat(r.getUrl()).contains("numReplies:1,paginationToken:a%20b%3D%3D,socialDetailUrn:");
    }

    @Test
    void reactionsUseThreadUrn() {
        BuiltRequest r = engine.build("reactions", Map.of("postUrl", "https://www.linkedin.com/posts/jane_hello-ugcPost-42-AbCd", "count", 50), full);

        assertThat(r.getUrl()).isEqualTo(BASE + "/graphql?includeWebMetadata=true&variables=(count:50,start:0,"
                + "threadUrn:urn%3Ali%3AugcPost%3A42)&queryId=voyagerSocialDashReactions.41ebf31a9f4c4a84e35a49d5abc9010b");
    }

    @Test
    void profileEndpointsEmbedEncodedProfileUrn() {
        assertThat(engine.build("user_comments", Map.of("profileId", "ACoAABCD"), full).getUrl())
                .isEqualTo(BASE + "/graphql?variables=(count:20,start:0,profileUrn:urn%3Ali%3Afsd_profile%3AACoAABCD)"
                        + "&queryId=voyagerFeedDashProfileUpdates.8f05a4e5ad12d9cb2b56eaa22afbcab9");
        assertThat(engine.build("profile_experiences", Map.of("profileId", "ACoAABCD"), full).getUrl())
                .contains("profileUrn:urn%3Ali%3Afsd_profile%3AACoAABCD,sectionType:experience,locale:en_US");
        assertThat(engine.build("profile_contact", Map.of("memberIdentity", "jane-doe"), full).getUrl())
                .contains("variables=(memberIdentity:jane-doe)");
    }

    @Test
    void connectIsAPostWithJsonBody() {
        BuiltRequest r = engine.build("connect", Map.of("profileId", "ACoAABCD"), full);

        assertThat(r.getMethod()).isEqualTo("POST");
        assertThat(r.getUrl()).startsWith(BASE + "/voyagerRelationshipsDashMemberRelationships?action=verifyQuotaAndCreateV2");
        assertThat(r.getBody()).isEqualTo("{\"invitee\":{\"inviteeUnion\":{\"memberProfile\":\"urn:li:fsd_profile:ACoAABCD\"}}}");
        assertThat(r.headerNames()).containsExactly("accept", "csrf-token", "x-restli-protocol-version", "content-type", "cookie");
    }

    @Test
    void connectWithMessageAddsCustomMessage() {
        BuiltRequest r = engine.build("connect", Map.of("profileId", "ACoAABCD", "message", "Hi Jane"), full);

        assertThat(r.getBody()).isEqualTo("{\"invitee\":{\"inviteeUnion\":{\"memberProfile\":\"urn:li:fsd_profile:ACoAABCD\"}},"
                + "\"customMessage\":\"Hi Jane\"}");
    }

    @Test
    void postCommentThreadsOnPostUrn() {
        BuiltRequest r = engine.build("post_comment", Map.of("postUrl", POST_URL, "text", "Nice"), full);

        assertThat(r.getUrl()).isEqualTo(BASE + "/voyagerSocialDashNormComments?decorationId=com.linkedin.voyager.dash.deco.social.NormComment-43");
        assertThat(r.getBody()).isEqualTo("{\"commentary\":{\"text\":\"Nice\",\"attributesV2\":[],"
                + "\"$type\":\"com.linkedin.voyager.dash.common.text.TextViewModel\"},"
                + "\"threadUrn\":\"urn:li:activity:7383418571017842688\"}");
    }

    @Test
    void replyThreadsOnCommentUrnOfThePost() throws Exception {
        BuiltRequest r = engine.build("reply_comment",
                Map.of("commentUrn", "urn:li:fsd_comment:(7001,urn:li:ugcPost:42)", "text", "Thanks"), full);

        assertThat(OM.readTree(r.getBody()).path("threadUrn").asText()).isEqualTo("urn:li:comment:(ugcPost:42,7001)");
        assertThatThrownBy(() -> engine.build("reply_comment", Map.of("commentUrn", "urn:li:comment:1", "text", "x"), full))
                .isInstanceOf(InvalidParametersException.class);
    }

    @Test
    void composeOptionsKeepsParenthesesLiteralAndAcceptsAnything() {
        BuiltRequest r = engine.build("compose_options", Map.of("profileId", "ACoAABCD"), full);

        assertThat(r.getUrl()).isEqualTo(BASE + "/voyagerMessagingDashComposeOptions/"
                + "urn%3Ali%3Afsd_composeOption%3A(ACoAABCD%2CNONE%2CEMPTY_CONTEXT_ENTITY_URN)");
        assertThat(r.header("accept")).isEqualTo("*/*");
        assertThat(r.headerNames()).containsExactly("accept", "csrf-token", "x-restli-protocol-version", "cookie");
    }

    @Test
    void newConversationMessageAddressesRecipient() throws Exception {
        BuiltRequest r = engine.build("send_message", messageParams(null), full);

        assertThat(r.getMethod()).isEqualTo("POST");
        assertThat(r.getUrl()).isEqualTo(BASE + "/voyagerMessagingDashMessengerMessages?action=createMessage");
        assertThat(r.header("accept")).isEqualTo("*/*");
        assertThat(r.header("content-type")).isEqualTo("text/plain;charset=UTF-8");
        assertThat(r.headerNames()).containsExactly("accept", "csrf-token", "x-restli-protocol-version", "content-type", "cookie");

        JsonNode body = OM.readTree(r.getBody());
        assertThat(body.path("message").path("body").path("text").asText()).isEqualTo("Hello there");
        assertThat(body.path("message").path("originToken").asText()).isEqualTo("6f1c2a8e-0d3b-4c5e-9f7a-1b2c3d4e5f60");
        assertThat(body.path("message").has("conversationUrn")).isFalse();
        assertThat(body.path("mailboxUrn").asText()).isEqualTo("urn:li:fsd_profile:ME123");
        assertThat(body.path("hostRecipientUrns").get(0).asText()).isEqualTo("urn:li:fsd_profile:YOU456");
        assertThat(body.path("dedupeByClientGeneratedToken").asBoolean(true)).isFalse();
        assertThat(body.path("trackingId").asText()).isEqualTo(Endpoint.trackingBytes("00112233-4455-6677-8899-aabbccddeeff"));
    }

    @Test
    void replyMessageTargetsExistingConversation() throws Exception {
        BuiltRequest r = engine.build("send_message", messageParams("urn:li:fsd_conversation:2-abc"), full);

        JsonNode body = OM.readTree(r.getBody());
        assertThat(body.path("message").path("conversationUrn").asText())
                .isEqualTo("urn:li:msg_conversation:(urn:li:fsd_profile:ME123,2-abc)");
        assertThat(body.has("hostRecipientUrns")).isFalse();
    }

    @Test
    void messageBuildIsDeterministic() {
        assertThat(engine.build("send_message", messageParams(null), full).toWireBytes())
                .isEqualTo(engine.build("send_message", messageParams(null), full).toWireBytes());
    }

    @Test
    void trackingIdIsUuidBytesAsLatin1() {
        String s = Endpoint.trackingBytes("00112233-4455-6677-8899-aabbccddeeff");

        assertThat(s).hasSize(16);
        assertThat((int) s.charAt(0)).isEqualTo(0x00);
        assertThat((int) s.charAt(1)).isEqualTo(0x11);
        assertThat((int) s.charAt(15)).isEqualTo(0xff);
        assertThatThrownBy(() -> Endpoint.trackingBytes("not-a-uuid"))
                .isInstanceOf(InvalidParametersException.class);
    }

    @Test
    void postHtmlFetchesThePostPageOnUpstreamHostOnly() {
        BuiltRequest r = engine.build("post_html", Map.of("postUrl", POST_URL), full);

        assertThat(r.getMethod()).isEqualTo("GET");
        assertThat(r.getUrl()).isEqualTo(POST_URL);
        assertThatThrownBy(() -> engine.build("post_html",
                Map.of("postUrl", "https://evil.example/feed/update/urn:li:activity:1/"), full))
                .isInstanceOf(InvalidParametersException.class)
                .hasMessageContaining("www.linkedin.com");
    }

    private static Map<String, Object> messageParams(String conversationUrn) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("senderProfileId", "ME123");
        p.put("recipientProfileId", "YOU456");
        p.put("text", "Hello there");
        p.put("originToken", "6f1c2a8e-0d3b-4c5e-9f7a-1b2c3d4e5f60");
        p.put("trackingId", "00112233-4455-6677-8899-aabbccddeeff");
        if (conversationUrn != null) p.put("conversationUrn", conversationUrn);
        return p;
    }

    @Test
    void trailingSlashOnBaseUrlIsIgnored() {
        GatewayProperties props = new GatewayProperties();
        props.setUpstreamBaseUrl("http://localhost:9999/api/");

        BuiltRequest r = new RequestTemplateEngine(props).build("feed", Map.of(), full);

        assertThat(r.getUrl()).startsWith("http://localhost:9999/api/feed/updatesV2?");
    }

    @Test
    void unknownEndpointIsRejected() {
        assertThatThrownBy(() -> engine.build("messages", Map.of(), full))
                .isInstanceOf(UnsupportedEndpointException.class)
                .hasMessageContaining("messages");
    }

    @Test
    void badParametersAreRejected() {
        assertThatThrownBy(() -> engine.build("feed", Map.of("cnt", 1), full))
                .isInstanceOf(InvalidParametersException.class)
                .hasMessageContaining("cnt");
        assertThatThrownBy(() -> engine.build("feed", Map.of("count", -1), full))
                .isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> engine.build("feed", Map.of("count", "ten"), full))
                .isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> engine.build("feed", Map.of("count", 2.5), full))
                .isInstanceOf(InvalidParametersException.class);
        assertThatThrownBy(() -> engine.build("comments", Map.of(), full))
                .isInstanceOf(InvalidParametersException.class)
                .hasMessageContaining("postUrl");
        assertThatThrownBy(() -> engine.build("comments", Map.of("postUrl", "https://example.com/nothing"), full))
                .isInstanceOf(InvalidParametersException.class);
    }
}
