package com.payment.hub.core;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of channel mapping: either provider-side channel tokens, or {@link #omit()},
 * meaning the channel field is left out of the outgoing payload so the provider uses its
 * defaults.
 */
public final class MappedChannels {

    private static final MappedChannels OMIT = new MappedChannels(null);

    private final List<String> channels;

    private MappedChannels(List<String> channels) {
        this.channels = channels;
    }

    public static MappedChannels omit() {
        return OMIT;
    }

    public static MappedChannels of(List<String> channels) {
        return channels == null || channels.isEmpty() ? OMIT : new MappedChannels(List.copyOf(channels));
    }

    public boolean isOmitted() {
        return channels == null;
    }

    /** @throws IllegalStateException when the channels are omitted */
    public List<String> getChannels() {
        if (channels == null) {
            throw new IllegalStateException("Channels are omitted");
        }
        return channels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MappedChannels)) {
            return false;
        }
        return Objects.equals(channels, ((MappedChannels) o).channels);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(channels);
    }

    @Override
    public String toString() {
        return isOmitted() ? "MappedChannels[omit]" : "MappedChannels" + channels;
    }
}
