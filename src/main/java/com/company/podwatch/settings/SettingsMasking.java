package com.company.podwatch.settings;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Secrets never leave the service: reads are masked, and a masked or missing secret in an
 * update keeps the stored value.
 */
public final class SettingsMasking {

    public static final String MASK = "******";

    private SettingsMasking() {
    }

    public static PodWatchSettings mask(PodWatchSettings settings) {
        PodWatchSettings masked = SettingsCodec.copy(settings);
        if (masked.getMonitoring() != null) {
            masked.getMonitoring().setAdminPasswordHash(MASK);
        }
        DestinationSettings destinations = masked.getDestinations();
        if (destinations != null) {
            if (destinations.getEmail() != null) {
                destinations.getEmail().setPassword(maskValue(destinations.getEmail().getPassword()));
            }
            maskToken(destinations.getChatApi());
            maskToken(destinations.getSms());
            maskToken(destinations.getBot());
        }
        return masked;
    }

    /**
     * Copies secrets from {@code current} into {@code incoming} wherever the incoming value is
     * null or still masked. Mutates and returns {@code incoming}.
     */
    public static PodWatchSettings retainSecrets(PodWatchSettings incoming, PodWatchSettings current) {
        if (incoming.getMonitoring() != null && current.getMonitoring() != null) {
            retain(incoming.getMonitoring(), current.getMonitoring(),
                    MonitoringSettings::getAdminPasswordHash, MonitoringSettings::setAdminPasswordHash);
        }
        DestinationSettings in = incoming.getDestinations();
        DestinationSettings cur = current.getDestinations();
        if (in != null && cur != null) {
            if (in.getEmail() != null && cur.getEmail() != null) {
                retain(in.getEmail(), cur.getEmail(), EmailTransport::getPassword, EmailTransport::setPassword);
            }
            retainToken(in.getChatApi(), cur.getChatApi());
            retainToken(in.getSms(), cur.getSms());
            retainToken(in.getBot(), cur.getBot());
        }
        return incoming;
    }

    private static void maskToken(HttpChannelTransport transport) {
        if (transport != null) {
            transport.setApiToken(maskValue(transport.getApiToken()));
        }
    }

    private static void retainToken(HttpChannelTransport incoming, HttpChannelTransport current) {
        if (incoming != null && current != null) {
            retain(incoming, current, HttpChannelTransport::getApiToken, HttpChannelTransport::setApiToken);
        }
    }

    private static String maskValue(String value) {
        return value == null || value.isEmpty() ? value : MASK;
    }

    private static <T> void retain(T incoming, T current, Function<T, String> getter, BiConsumer<T, String> setter) {
        String value = getter.apply(incoming);
        if (value == null || MASK.equals(value)) {
            setter.accept(incoming, getter.apply(current));
        }
    }
}
