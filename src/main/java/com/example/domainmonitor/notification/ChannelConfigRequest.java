package com.example.domainmonitor.notification;

import com.example.domainmonitor.domain.ChannelConfig;

import java.util.Set;

/**
 * Fields of a channel config to create or update. On update, null fields are left unchanged.
 */
public record ChannelConfigRequest(ChannelConfig.ChannelType channelType,
                                   String address,
                                   String displayName,
                                   String language,
                                   Boolean active,
                                   Boolean notifyOnDown,
                                   Boolean notifyOnUp,
                                   Set<String> regions) {

    public static ChannelConfigRequest of(ChannelConfig.ChannelType channelType, String address) {
        return new ChannelConfigRequest(channelType, address, null, null, null, null, null, null);
    }
}
