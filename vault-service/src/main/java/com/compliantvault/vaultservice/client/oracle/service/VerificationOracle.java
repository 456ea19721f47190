package com.compliantvault.vaultservice.client.oracle.service;

import com.compliantvault.vaultservice.client.oracle.dto.VerificationRequest;

/**
 * External service that runs the compliance check and later calls back with
 * exactly one outcome per request, or never.
 */
public interface VerificationOracle {

    /**
     * @return the oracle-assigned request id, unique across all requests
     */
    String dispatch(VerificationRequest request);
}
