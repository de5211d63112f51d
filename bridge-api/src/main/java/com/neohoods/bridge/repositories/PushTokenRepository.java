package com.neohoods.bridge.repositories;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.repository.CrudRepository;

import com.neohoods.bridge.entities.PushTokenEntity;

public interface PushTokenRepository extends CrudRepository<PushTokenEntity, UUID> {
    Optional<PushTokenEntity> findBySelector(String selector);

    Optional<PushTokenEntity> findFirstByTokenMsgsOrTokenCalls(String tokenMsgs, String tokenCalls);

    List<PushTokenEntity> findAllByOrderByUpdatedAtDesc();
}
