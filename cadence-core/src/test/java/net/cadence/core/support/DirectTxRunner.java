package net.cadence.core.support;

import net.cadence.core.spi.TxRunner;

import java.util.concurrent.Callable;

/** No transactions at all; counts how often a body ran. */
public final class DirectTxRunner implements TxRunner {
    public int calls;

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        calls++;
        return body.call();
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        calls++;
        return body.call();
    }
}
