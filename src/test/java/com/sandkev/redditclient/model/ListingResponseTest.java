package com.sandkev.redditclient.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListingResponseTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void messageBodyFallsBackToSelftextForPosts() throws Exception {
        var listing = ListingResponse.from(om.readTree("""
                {"kind":"Listing","data":{"after":null,"children":[
                  {"kind":"t4","data":{"id":"m1","name":"t4_m1","author":"bob","body":"hi there","created_utc":1700000000}},
                  {"kind":"t3","data":{"id":"p1","name":"t3_p1","selftext":"self post"}}
                ]}}"""));

        assertThat(listing.after()).isNull();
        assertThat(listing.children()).extracting(Thing::body).containsExactly("hi there", "self post");
        assertThat(listing.children().get(0).kind()).isEqualTo("t4");
    }

    @Test
    void emptyChildrenIsEmpty() throws Exception {
        var listing = ListingResponse.from(om.readTree("{\"kind\":\"Listing\",\"data\":{\"children\":[]}}"));

        assertThat(listing.isEmpty()).isTrue();
        assertThat(ListingResponse.EMPTY.isEmpty()).isTrue();
    }

    @Test
    void rejectsOtherKinds() throws Exception {
        assertThatThrownBy(() -> ListingResponse.from(om.readTree("{\"kind\":\"t2\",\"data\":{}}")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kind=t2");
    }

    @Test
    void refreshResponseRequiresAccessToken() throws Exception {
        assertThatThrownBy(() -> RefreshTokenResponse.from(om.readTree("{\"error\":\"invalid_grant\"}")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
