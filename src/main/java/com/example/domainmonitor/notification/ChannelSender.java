package com.example.domainmonitor.notification;

import com.example.domainmonitor.domain.ChannelConfig;

/**
 * Physical delivery to one kind of channel.
 */
public interface ChannelSender {

    ChannelConfig.ChannelType channelType();

    /**
     * Delivers the message or throws.
     *
     * @param address chat id or email address
     * @throws NotificationException if delivery failed
     */
    void send(String address, NotificationMessage message);
}
