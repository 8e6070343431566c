package com.example.awardcertificates.service.identity;

import com.example.awardcertificates.exception.StateException;
import com.example.awardcertificates.model.Identity;

import java.util.Optional;

/**
 * Read-only view of the accounts that may submit certificates.
 */
public interface AccountDirectory {

    Optional<Identity> findByAccountId(String accountId);

    /**
     * @throws StateException with kind {@code FORBIDDEN} for unknown accounts
     */
    default Identity require(String accountId) {
        return findByAccountId(accountId)
                .orElseThrow(() -> StateException.forbidden(null, "Unknown account '" + accountId + "'"));
    }
}
