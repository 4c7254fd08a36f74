package com.payment.hub.core;

import com.payment.hub.domain.PaymentChannel;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Translates canonical channel values ({@link PaymentChannel}) into each provider's own
 * vocabulary. Providers are looked up in an explicit registry; one with no entry gets the
 * channels unchanged, and one registered as "omit" never receives a channel field.
 */
@Slf4j
public class ChannelMapper {

    /** Mapping function for one provider. */
    @FunctionalInterface
    public interface ProviderChannelMapping {
        MappedChannels map(List<String> channels);
    }

    private final Map<String, ProviderChannelMapping> mappings = new ConcurrentHashMap<>();

    public ChannelMapper() {
        register("paystack", translating(
                Map.of(
                        PaymentChannel.CARD, "card",
                        PaymentChannel.BANK_TRANSFER, "bank_transfer",
                        PaymentChannel.USSD, "ussd",
                        PaymentChannel.MOBILE_MONEY, "mobile_money",
                        PaymentChannel.QR_CODE, "qr"),
                UnaryOperator.identity(),
                null));
        register("monnify", translating(
                Map.of(
                        PaymentChannel.CARD, "CARD",
                        PaymentChannel.BANK_TRANSFER, "ACCOUNT_TRANSFER",
                        PaymentChannel.USSD, "USSD",
                        PaymentChannel.MOBILE_MONEY, "PHONE_NUMBER"),
                ChannelMapper::upper,
                Set.of("CARD", "ACCOUNT_TRANSFER", "USSD", "PHONE_NUMBER")));
        register("flutterwave", translating(
                Map.of(
                        PaymentChannel.CARD, "card",
                        PaymentChannel.BANK_TRANSFER, "banktransfer",
                        PaymentChannel.USSD, "ussd",
                        PaymentChannel.MOBILE_MONEY, "mobilemoneyghana",
                        PaymentChannel.QR_CODE, "nqr"),
                ChannelMapper::lower,
                Set.of("card", "account", "banktransfer", "ussd", "mpesa",
                        "mobilemoneyghana", "mobilemoneyfranco", "mobilemoneyuganda",
                        "mobilemoneyrwanda", "mobilemoneyzambia", "mobilemoneytanzania",
                        "nqr", "barter", "credit", "opay")));
        register("stripe", translating(
                Map.of(
                        PaymentChannel.CARD, "card",
                        PaymentChannel.BANK_TRANSFER, "us_bank_account"),
                ChannelMapper::lower,
                Set.of("card", "us_bank_account", "link", "affirm", "klarna", "cashapp", "paypal")));
        register("square", translating(
                Map.of(
                        PaymentChannel.CARD, "CARD",
                        PaymentChannel.BANK_TRANSFER, "OTHER"),
                ChannelMapper::upper,
                Set.of("CARD", "CASH", "OTHER", "SQUARE_GIFT_CARD")));
        register("opay", translating(
                Map.of(
                        PaymentChannel.CARD, "CARD",
                        PaymentChannel.BANK_TRANSFER, "BANK_ACCOUNT",
                        PaymentChannel.USSD, "OPAY_ACCOUNT",
                        PaymentChannel.MOBILE_MONEY, "OPAY_ACCOUNT",
                        PaymentChannel.QR_CODE, "OPAY_QRCODE"),
                ChannelMapper::upper,
                Set.of("CARD", "BANK_ACCOUNT", "OPAY_ACCOUNT", "OPAY_QRCODE", "BALANCE", "OTHERS")));
        register("mollie", translating(
                Map.of(
                        PaymentChannel.CARD, "creditcard",
                        PaymentChannel.BANK_TRANSFER, "banktransfer",
                        PaymentChannel.MOBILE_MONEY, "paypal"),
                ChannelMapper::lower,
                Set.of("creditcard", "ideal", "bancontact", "sofort", "giropay",
                        "eps", "klarnapaylater", "klarnasliceit", "paypal",
                        "applepay", "banktransfer", "giftcard", "przelewy24",
                        "kbc", "belfius", "mybank", "in3")));
        register("paypal", channels -> MappedChannels.omit());
    }

    /**
     * Maps canonical channels for {@code provider}. Null or empty input always yields
     * {@link MappedChannels#omit()}; so does a mapping that filters every entry away.
     */
    public MappedChannels mapChannels(List<String> channels, String provider) {
        if (channels == null || channels.isEmpty()) {
            return MappedChannels.omit();
        }
        ProviderChannelMapping mapping = provider == null ? null : mappings.get(provider.toLowerCase(Locale.ROOT));
        if (mapping == null) {
            return MappedChannels.of(channels);
        }
        MappedChannels mapped = mapping.map(channels);
        if (!mapped.isOmitted() && mapped.getChannels().size() < channels.size()) {
            log.debug("Dropped channels with no provider equivalent: provider={}, requested={}, mapped={}",
                    provider, channels, mapped.getChannels());
        }
        return mapped;
    }

    /** True when the provider accepts a channel restriction at all. */
    public boolean supportsChannels(String provider) {
        ProviderChannelMapping mapping = provider == null ? null : mappings.get(provider.toLowerCase(Locale.ROOT));
        return mapping != null && !mapping.map(List.of(PaymentChannel.CARD.getValue())).isOmitted();
    }

    public ChannelMapper register(String provider, ProviderChannelMapping mapping) {
        mappings.put(provider.toLowerCase(Locale.ROOT), mapping);
        return this;
    }

    /**
     * Known canonical values are translated; anything else is passed through
     * {@code fallback}. When {@code validTokens} is given, results outside it are dropped.
     */
    static ProviderChannelMapping translating(Map<PaymentChannel, String> table,
                                              Function<String, String> fallback,
                                              Set<String> validTokens) {
        Map<String, String> byValue = table.entrySet().stream()
                .collect(Collectors.toMap(e -> e.getKey().getValue(), Map.Entry::getValue));
        return channels -> MappedChannels.of(channels.stream()
                .filter(Objects::nonNull)
                .map(channel -> {
                    String translated = byValue.get(lower(channel));
                    return translated != null ? translated : fallback.apply(channel);
                })
                .filter(token -> token != null && !token.isBlank())
                .filter(token -> validTokens == null || validTokens.contains(token))
                .distinct()
                .collect(Collectors.toList()));
    }

    private static String upper(String value) {
        return value.trim().toUpperCase(Locale.ROOT);
    }

    private static String lower(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
