package net.cadence.core.spi;

import java.util.concurrent.Callable;

/**
 * Transaction demarcation for repository calls. Adapters bind the connection to the calling
 * thread for the duration of {@code body}.
 */
public interface TxRunner {
    /** Joins the current transaction, or starts one. */
    <T> T required(Callable<T> body) throws Exception;

    /** Always starts a new transaction, suspending the current one if any. */
    <T> T requiresNew(Callable<T> body) throws Exception;
}
