package com.distributedsystems.archon.client;

/**
 * Reads the local node's bonded channel balance from its ledger.
 */
public interface ChannelBalanceClient {

    /**
     * @throws BalanceQueryException when the ledger cannot be queried or its reply is unusable
     */
    long totalBondedSats(String nodePubkey) throws BalanceQueryException;

    class BalanceQueryException extends Exception {
        public BalanceQueryException(String message) {
            super(message);
        }

        public BalanceQueryException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
