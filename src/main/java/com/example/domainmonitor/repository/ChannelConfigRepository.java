package com.example.domainmonitor.repository;

import com.example.domainmonitor.domain.ChannelConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface ChannelConfigRepository extends JpaRepository<ChannelConfig, String> {

    List<ChannelConfig> findByUserIdAndChannelType(String userId, ChannelConfig.ChannelType channelType);

    List<ChannelConfig> findByUserId(String userId);

    Optional<ChannelConfig> findByIdAndUserId(String id, String userId);

    /** Rewrites the address of every config pointing at a chat that moved. */
    @Modifying
    @Transactional
    @Query("UPDATE ChannelConfig c SET c.address = :newAddress WHERE c.channelType = :channelType "
            + "AND c.address = :oldAddress")
    int updateAddress(ChannelConfig.ChannelType channelType, String oldAddress, String newAddress);
}
