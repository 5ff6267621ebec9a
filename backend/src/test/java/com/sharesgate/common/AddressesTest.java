package com.sharesgate.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AddressesTest {

    @Test
    void normalize_stripsPrefixAndLowerCases() {
        assertThat(Addresses.normalize(" 0xAbCd ")).isEqualTo("abcd");
        assertThat(Addresses.normalize("ABCD")).isEqualTo("abcd");
        assertThat(Addresses.normalize(null)).isNull();
    }

    @Test
    void withPrefix_addsSinglePrefix() {
        assertThat(Addresses.withPrefix("0xAB")).isEqualTo("0xab");
        assertThat(Addresses.withPrefix("ab")).isEqualTo("0xab");
    }

    @Test
    void isHex_checksLengthAndDigits() {
        String address = "0x" + "a".repeat(40);
        assertThat(Addresses.isHex(address, 40)).isTrue();
        assertThat(Addresses.isHex("0x" + "g".repeat(40), 40)).isFalse();
        assertThat(Addresses.isHex("0xabc", 40)).isFalse();
        assertThat(Addresses.isHex(null, 40)).isFalse();
    }

    @Test
    void toWord_leftPadsTo64() {
        String word = Addresses.toWord("0x" + "1".repeat(40));
        assertThat(word).hasSize(64).startsWith("0".repeat(24)).endsWith("1".repeat(40));
    }
}
