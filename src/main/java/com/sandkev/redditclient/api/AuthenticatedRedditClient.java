package com.sandkev.redditclient.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.sandkev.redditclient.error.EndpointErrorTable;
import com.sandkev.redditclient.model.ListingResponse;
import com.sandkev.redditclient.model.MeResponse;
import com.sandkev.redditclient.model.RefreshTokenResponse;
import com.sandkev.redditclient.model.SubredditResponse;
import com.sandkev.redditclient.model.UserResponse;
import com.sandkev.redditclient.shared.http.RedditRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;

import java.util.function.Function;

/**
 * Reddit endpoints called on behalf of one account. All methods throw
 * {@link com.sandkev.redditclient.error.RedditApiException} subclasses on failure.
 */
@Slf4j
public class AuthenticatedRedditClient {

    static final String ACCESS_TOKEN_PATH = "/api/v1/access_token";

    /** Byte length of Reddit's canned empty inbox listing. */
    static final int EMPTY_INBOX_BYTES = 122;

    private final RedditClient reddit;
    private final String accountId;
    private final String refreshToken;
    private final String accessToken;

    AuthenticatedRedditClient(RedditClient reddit, String accountId, String refreshToken, String accessToken) {
        this.reddit = reddit;
        this.accountId = accountId;
        this.refreshToken = refreshToken;
        this.accessToken = accessToken;
    }

    public String accountId() {
        return accountId;
    }

    /**
     * Trades the refresh token for a new access token. Reddit may omit the refresh token
     * in the answer, in which case the current one stays valid and is returned.
     *
     * @throws com.sandkev.redditclient.error.OauthRevokedException when Reddit answers 400
     */
    public RefreshTokenResponse refreshTokens() {
        log.info("refreshing reddit tokens for {}", accountId);
        RedditRequest req = RedditRequest.builder()
                .accountId(accountId)
                .method(HttpMethod.POST)
                .url(reddit.getAuthBaseUrl() + ACCESS_TOKEN_PATH)
                .tag("url:" + ACCESS_TOKEN_PATH)
                .formParam("grant_type", "refresh_token")
                .formParam("refresh_token", refreshToken)
                .basicAuth(reddit.getClientId(), reddit.getClientSecret())
                .errorTable(EndpointErrorTable.TOKEN_REFRESH)
                .retry(true)
                .build();

        RefreshTokenResponse tokens = request(req, RefreshTokenResponse::from, null);
        if (tokens.refreshToken().isEmpty()) {
            return tokens.withRefreshToken(refreshToken);
        }
        return tokens;
    }

    public ListingResponse aboutInfo(String fullname) {
        return aboutInfo(fullname, RequestOptions.none());
    }

    public ListingResponse aboutInfo(String fullname, RequestOptions opts) {
        RedditRequest req = read("/api/info", null, opts)
                .queryParam("id", fullname)
                .build();
        return request(req, ListingResponse::from, null);
    }

    public ListingResponse userPosts(String user) {
        return userPosts(user, RequestOptions.none());
    }

    public ListingResponse userPosts(String user, RequestOptions opts) {
        return request(read("/u/" + user + "/submitted", null, opts).build(), ListingResponse::from, null);
    }

    public UserResponse userAbout(String user) {
        return userAbout(user, RequestOptions.none());
    }

    public UserResponse userAbout(String user, RequestOptions opts) {
        return request(read("/u/" + user + "/about", null, opts).build(), UserResponse::from, null);
    }

    public SubredditResponse subredditAbout(String subreddit) {
        return subredditAbout(subreddit, RequestOptions.none());
    }

    public SubredditResponse subredditAbout(String subreddit, RequestOptions opts) {
        return request(read("/r/" + subreddit + "/about", null, opts).build(), SubredditResponse::from, null);
    }

    public ListingResponse subredditHot(String subreddit) {
        return subredditHot(subreddit, RequestOptions.none());
    }

    public ListingResponse subredditHot(String subreddit, RequestOptions opts) {
        return subredditPosts(subreddit, "hot", opts);
    }

    public ListingResponse subredditTop(String subreddit) {
        return subredditTop(subreddit, RequestOptions.none());
    }

    public ListingResponse subredditTop(String subreddit, RequestOptions opts) {
        return subredditPosts(subreddit, "top", opts);
    }

    public ListingResponse subredditNew(String subreddit) {
        return subredditNew(subreddit, RequestOptions.none());
    }

    public ListingResponse subredditNew(String subreddit, RequestOptions opts) {
        return subredditPosts(subreddit, "new", opts);
    }

    private ListingResponse subredditPosts(String subreddit, String sort, RequestOptions opts) {
        return request(read("/r/" + subreddit + "/" + sort, null, opts).build(), ListingResponse::from, null);
    }

    public ListingResponse messageInbox() {
        return messageInbox(RequestOptions.none());
    }

    public ListingResponse messageInbox(RequestOptions opts) {
        return messages("/message/inbox", "url:/api/v1/message/inbox", opts);
    }

    public ListingResponse messageUnread() {
        return messageUnread(RequestOptions.none());
    }

    public ListingResponse messageUnread(RequestOptions opts) {
        return messages("/message/unread", "url:/api/v1/message/unread", opts);
    }

    private ListingResponse messages(String path, String tag, RequestOptions opts) {
        RedditRequest req = read(path, tag, opts)
                .emptyResponseBytes(EMPTY_INBOX_BYTES)
                .errorTable(EndpointErrorTable.AUTHENTICATED_READ)
                .build();
        return request(req, ListingResponse::from, ListingResponse.EMPTY);
    }

    public MeResponse me() {
        RedditRequest req = read("/api/v1/me", "url:/api/v1/me", RequestOptions.none())
                .errorTable(EndpointErrorTable.AUTHENTICATED_READ)
                .build();
        return request(req, MeResponse::from, null);
    }

    // ---- helpers ----

    private RedditRequest.RedditRequestBuilder read(String path, String tag, RequestOptions opts) {
        var b = RedditRequest.builder()
                .accountId(accountId)
                .method(HttpMethod.GET)
                .url(reddit.getOauthBaseUrl() + path)
                .bearerToken(accessToken)
                .retry(opts.retry())
                .deadline(opts.deadline());
        if (tag != null) b.tag(tag);
        opts.query().forEach((k, v) -> { if (v != null) b.queryParam(k, String.valueOf(v)); });
        return b;
    }

    private <T> T request(RedditRequest req, Function<JsonNode, T> extractor, T empty) {
        byte[] body = reddit.getExecutor().execute(req);
        return reddit.getDispatcher().dispatch(body, extractor, empty, req.emptyResponseBytes());
    }
}
