package com.compliantvault.vaultservice.service;

import java.math.BigInteger;

public interface VaultService {

    /**
     * Escrows {@code amount} for {@code requester} and asks the oracle to verify it.
     *
     * @return the oracle request id
     */
    String requestDeposit(String requester, BigInteger amount);

    /**
     * Asks the oracle to verify a withdrawal. Nothing is debited until it is approved.
     *
     * @return the oracle request id
     */
    String requestWithdrawal(String requester, BigInteger amount);

    BigInteger balanceOf(String principal);

    BigInteger escrowedTotal();
}
