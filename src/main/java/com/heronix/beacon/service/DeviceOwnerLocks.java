package com.heronix.beacon.service;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import com.heronix.beacon.model.domain.DeviceOwnerLock;
import com.heronix.beacon.repository.DeviceOwnerLockRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Serializes device writes per owner.
 *
 * Sync and registration both read the owner's devices and then insert or
 * delete by hardware address. Holding the owner's lock row for the whole
 * transaction keeps at most one device per hardware address.
 */
@Service
@Slf4j
public class DeviceOwnerLocks {

    private final DeviceOwnerLockRepository lockRepository;
    private final TransactionTemplate separateTransaction;

    public DeviceOwnerLocks(DeviceOwnerLockRepository lockRepository,
                            PlatformTransactionManager transactionManager) {
        this.lockRepository = lockRepository;
        this.separateTransaction = new TransactionTemplate(transactionManager);
        this.separateTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Lock the owner's devices until the current transaction completes,
     * creating the owner's lock row first if needed.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void acquire(String ownerPrincipalId) {
        if (lockRepository.lockByOwner(ownerPrincipalId).isPresent()) {
            return;
        }

        try {
            // committed on its own so that concurrent callers block on the same row
            separateTransaction.executeWithoutResult(status ->
                    lockRepository.saveAndFlush(new DeviceOwnerLock(ownerPrincipalId)));
            log.debug("Created device lock row for owner {}", ownerPrincipalId);
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            log.debug("Device lock row for owner {} was created concurrently", ownerPrincipalId);
        }

        lockRepository.lockByOwner(ownerPrincipalId)
                .orElseThrow(() -> new IllegalStateException("Device lock row missing for owner " + ownerPrincipalId));
    }

    /**
     * Remove the owner's lock row. Only used when all of the owner's data is deleted.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void release(String ownerPrincipalId) {
        lockRepository.deleteByOwner(ownerPrincipalId);
    }
}
