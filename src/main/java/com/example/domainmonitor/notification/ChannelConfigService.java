package com.example.domainmonitor.notification;

import com.example.domainmonitor.domain.ChannelConfig;
import com.example.domainmonitor.region.RegionTables;
import com.example.domainmonitor.repository.ChannelConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Management of a user's notification endpoints.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChannelConfigService {

    private static final String DEFAULT_LANGUAGE = "en";

    private final ChannelConfigRepository configRepository;

    public List<ChannelConfig> listConfigs(String userId) {
        return configRepository.findByUserId(userId);
    }

    public ChannelConfig addConfig(String userId, ChannelConfigRequest request) {
        if (request.channelType() == null) {
            throw new IllegalArgumentException("Channel type is required");
        }
        ChannelConfig config = ChannelConfig.builder()
                .userId(userId)
                .channelType(request.channelType())
                .address(validAddress(request.channelType(), request.address()))
                .displayName(request.displayName())
                .language(language(request.language()))
                .active(request.active() == null || request.active())
                .notifyOnDown(request.notifyOnDown() == null || request.notifyOnDown())
                .notifyOnUp(request.notifyOnUp() == null || request.notifyOnUp())
                .regions(validRegions(request.regions()))
                .build();
        ChannelConfig saved = configRepository.save(config);
        log.info("Added {} config {} ({}) for user {}", saved.getChannelType(), saved.getId(), saved.label(), userId);
        return saved;
    }

    public ChannelConfig updateConfig(String userId, String configId, ChannelConfigRequest update) {
        ChannelConfig config = getConfig(userId, configId);
        if (update.address() != null) {
            config.setAddress(validAddress(config.getChannelType(), update.address()));
        }
        if (update.displayName() != null) {
            config.setDisplayName(update.displayName());
        }
        if (update.language() != null) {
            config.setLanguage(language(update.language()));
        }
        if (update.active() != null) {
            config.setActive(update.active());
        }
        if (update.notifyOnDown() != null) {
            config.setNotifyOnDown(update.notifyOnDown());
        }
        if (update.notifyOnUp() != null) {
            config.setNotifyOnUp(update.notifyOnUp());
        }
        if (update.regions() != null) {
            config.setRegions(validRegions(update.regions()));
        }
        return configRepository.save(config);
    }

    public void deleteConfig(String userId, String configId) {
        ChannelConfig config = getConfig(userId, configId);
        configRepository.delete(config);
        log.info("Deleted {} config {} of user {}", config.getChannelType(), configId, userId);
    }

    public ChannelConfig getConfig(String userId, String configId) {
        return configRepository.findByIdAndUserId(configId, userId)
                .orElseThrow(() -> new IllegalArgumentException("Channel config not found: " + configId));
    }

    private static String validAddress(ChannelConfig.ChannelType type, String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Address is required");
        }
        String trimmed = address.trim();
        if (type == ChannelConfig.ChannelType.EMAIL && !trimmed.matches("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$")) {
            throw new IllegalArgumentException("Invalid email address: " + address);
        }
        return trimmed;
    }

    private static Set<String> validRegions(Set<String> regions) {
        Set<String> codes = new HashSet<>();
        if (regions == null) {
            return codes;
        }
        for (String region : regions) {
            codes.add(RegionTables.canonicalCode(region)
                    .orElseThrow(() -> new IllegalArgumentException("Unsupported region: " + region)));
        }
        return codes;
    }

    private static String language(String language) {
        return language == null || language.isBlank() ? DEFAULT_LANGUAGE : language.trim();
    }
}
