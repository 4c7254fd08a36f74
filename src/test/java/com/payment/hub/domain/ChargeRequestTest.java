package com.payment.hub.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChargeRequestTest {

    @Test
    void normalizesCurrencyAndScale() {
        ChargeRequest request = valid().currency(" usd ").amount(new BigDecimal("10.005")).build();

        assertThat(request.getCurrency()).isEqualTo("USD");
        assertThat(request.getAmount()).isEqualByComparingTo("10.01");
        assertThat(request.getAmountInMinorUnits()).isEqualTo(1001L);
    }

    @Test
    void minorUnitsFollowCurrencyExponent() {
        assertThat(valid().currency("JPY").amount(new BigDecimal("1500")).build().getAmountInMinorUnits()).isEqualTo(1500L);
        assertThat(valid().currency("KWD").amount(new BigDecimal("1.25")).build().getAmountInMinorUnits()).isEqualTo(1250L);
        assertThat(valid().currency("NGN").amount(new BigDecimal("100.50")).build().getAmountInMinorUnits()).isEqualTo(10050L);
    }

    @Test
    void rejectsInvalidInput() {
        assertThatThrownBy(() -> valid().amount(BigDecimal.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("greater than zero");
        assertThatThrownBy(() -> valid().amount(new BigDecimal("1000000000")).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maximum");
        assertThatThrownBy(() -> valid().currency("NAIRA").build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("3-letter");
        assertThatThrownBy(() -> valid().email("buyer.example.com").build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("email");
    }

    @Test
    void amountRoundingToZeroIsRejected() {
        assertThatThrownBy(() -> valid().amount(new BigDecimal("0.004")).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("greater than zero");
        assertThat(valid().amount(new BigDecimal("0.005")).build().getAmount()).isEqualByComparingTo("0.01");
    }

    @Test
    void nullChannelEntryIsRejected() {
        List<String> channels = new ArrayList<>();
        channels.add("card");
        channels.add(null);

        assertThatThrownBy(() -> valid().channels(channels).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Channels");
    }

    @Test
    void blankOptionalsBecomeNullAndMetadataIsNeverNull() {
        ChargeRequest request = valid().reference(" ").idempotencyKey("").build();

        assertThat(request.getReference()).isNull();
        assertThat(request.getIdempotencyKey()).isNull();
        assertThat(request.getMetadata()).isEmpty();
        assertThat(request.hasChannels()).isFalse();
    }

    @Test
    void collectionsAreCopied() {
        Map<String, Object> metadata = new HashMap<>(Map.of("order", "42"));
        List<String> channels = new ArrayList<>(List.of("card"));
        ChargeRequest request = valid().metadata(metadata).channels(channels).build();

        metadata.put("order", "43");
        channels.add("ussd");

        assertThat(request.getMetadata()).containsEntry("order", "42");
        assertThat(request.getChannels()).containsExactly("card");
    }

    private static ChargeRequest.ChargeRequestBuilder valid() {
        return ChargeRequest.builder()
                .amount(new BigDecimal("100.00"))
                .currency("NGN")
                .email("buyer@example.com");
    }
}
