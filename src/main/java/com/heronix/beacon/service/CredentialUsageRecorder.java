package com.heronix.beacon.service;

import java.time.LocalDateTime;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import com.heronix.beacon.repository.AgentCredentialRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Records credential usage off the request thread.
 *
 * The timestamp is advisory: a failed write is logged and dropped, and a write
 * landing after a concurrent revoke is accepted. Nothing authorization-relevant
 * may be written through here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialUsageRecorder {

    private final AgentCredentialRepository credentialRepository;

    @Async
    public void recordUsage(Long credentialId) {
        try {
            credentialRepository.touchLastUsed(credentialId, LocalDateTime.now());
        } catch (RuntimeException e) {
            log.warn("Failed to record usage of credential {}: {}", credentialId, e.getMessage());
        }
    }
}
