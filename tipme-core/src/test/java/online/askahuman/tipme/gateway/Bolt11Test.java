package online.askahuman.tipme.gateway;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Bolt11 amount Tests")
class Bolt11Test {

    @Test
    @DisplayName("applies each multiplier to the prefix amount")
    void shouldApplyMultipliers() {
        assertEquals(OptionalLong.of(48_000), Bolt11.amountMsats("lnbc480n1pjqq0sdpp5holder"));
        assertEquals(OptionalLong.of(250_000_000), Bolt11.amountMsats("lnbc2500u1pvjluezpp5qqq"));
        assertEquals(OptionalLong.of(2_000_000_000L), Bolt11.amountMsats("lntb20m1pvjluezhp5qqq"));
        assertEquals(OptionalLong.of(100_000_000_000L), Bolt11.amountMsats("lnbcrt11pvjluez"));
        assertEquals(OptionalLong.of(1), Bolt11.amountMsats("lnbc10p1pvjluez"));
    }

    @Test
    @DisplayName("is case-insensitive")
    void shouldIgnoreCase() {
        assertEquals(OptionalLong.of(48_000), Bolt11.amountMsats("LNBC480N1PJQQ0SDPP5HOLDER"));
    }

    @Test
    @DisplayName("an invoice without an amount yields empty")
    void shouldReportAmountless() {
        assertTrue(Bolt11.amountMsats("lnbc1pvjluezpp5qqqsyqcyq5rqwzqfqqq").isEmpty());
    }

    @Test
    @DisplayName("rejects strings that are not invoices")
    void shouldRejectMalformed() {
        assertThrows(IllegalArgumentException.class, () -> Bolt11.amountMsats(""));
        assertThrows(IllegalArgumentException.class, () -> Bolt11.amountMsats("lnbcsurplus"));
        assertThrows(IllegalArgumentException.class, () -> Bolt11.amountMsats("bc1qar0srrr7xfkvy5l643lydnw9re59gtzzwf5mdq"));
        assertThrows(IllegalArgumentException.class, () -> Bolt11.amountMsats("lnbc010n1pvjluez"));
        assertThrows(IllegalArgumentException.class, () -> Bolt11.amountMsats("lnbcn1pvjluez"));
    }

    @Test
    @DisplayName("rejects sub-millisatoshi and overflowing amounts")
    void shouldRejectUnrepresentable() {
        assertThrows(IllegalArgumentException.class, () -> Bolt11.amountMsats("lnbc15p1pvjluez"));
        assertThrows(IllegalArgumentException.class, () -> Bolt11.amountMsats("lnbc99999999999999999991pvjluez"));
        assertThrows(IllegalArgumentException.class, () -> Bolt11.amountMsats("lnbc9999999999999m1pvjluez"));
    }
}
