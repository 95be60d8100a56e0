package com.example.sessionrelay.request;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VoyagerEncodingTest {

    @Test
    void unreservedCharactersPassThrough() {
        assertThat(VoyagerEncoding.encodeComponent("AZaz09-._~")).isEqualTo("AZaz09-._~");
    }

    @Test
    void everythingElseIsPercentEncodedUpperCase() {
        assertThat(VoyagerEncoding.encodeComponent("(a,b):c d/e")).isEqualTo("%28a%2Cb%29%3Ac%20d%2Fe");
        assertThat(VoyagerEncoding.encodeComponent("ü")).isEqualTo("%C3%BC");
        assertThat(VoyagerEncoding.encodeComponent("+=&")).isEqualTo("%2B%3D%26");
    }

    @Test
    void profileUrn() {
        assertThat(VoyagerEncoding.profileUrn("ACoAA")).isEqualTo("urn%3Ali%3Afsd_profile%3AACoAA");
    }
}
