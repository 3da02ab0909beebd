package com.tabrelay.gateway.runtime;

import com.tabrelay.browser.relay.CommandCorrelator;
import com.tabrelay.browser.relay.TabTransportManager;
import com.tabrelay.gateway.server.BrokerServer;
import com.tabrelay.gateway.session.ClientSessionManager;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Broker graceful shutdown.
 *
 * <p>
 * Runs in order:
 * 1. Stop accepting connections
 * 2. Reject pending tab commands
 * 3. Close tab agent connections
 * 4. Close client sessions and stop the idle sweep
 * 5. Shut the event loops down
 *
 * A failing step is logged and the next one still runs.
 */
@Slf4j
public class BrokerShutdown {

    private final BrokerServer server;
    private final CommandCorrelator correlator;
    private final TabTransportManager tabTransport;
    private final ClientSessionManager sessions;
    private final List<? extends EventExecutorGroup> eventLoops;
    private final long timeoutMs;
    private final AtomicBoolean done = new AtomicBoolean();

    public BrokerShutdown(BrokerServer server, CommandCorrelator correlator, TabTransportManager tabTransport,
                          ClientSessionManager sessions, List<? extends EventExecutorGroup> eventLoops,
                          long timeoutMs) {
        this.server = server;
        this.correlator = correlator;
        this.tabTransport = tabTransport;
        this.sessions = sessions;
        this.eventLoops = eventLoops;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Execute graceful shutdown. Only the first call does anything.
     *
     * @param reason human-readable shutdown reason
     * @return false if shutdown had already run
     */
    public boolean shutdown(String reason) {
        if (!done.compareAndSet(false, true)) {
            return false;
        }
        String effectiveReason = reason != null && !reason.isBlank() ? reason.trim() : "broker stopping";
        log.info("broker shutdown: {}", effectiveReason);

        step("stop accepting", server::stopAccepting);
        step("reject pending commands", correlator::cleanup);
        step("close tab connections", tabTransport::closeAll);
        step("close client sessions", sessions::stop);
        for (EventExecutorGroup group : eventLoops) {
            step("stop event loop", () -> group.shutdownGracefully(0, timeoutMs, TimeUnit.MILLISECONDS)
                    .awaitUninterruptibly(timeoutMs));
        }

        log.info("broker shutdown complete");
        return true;
    }

    public boolean isShutDown() {
        return done.get();
    }

    private static void step(String name, Runnable action) {
        try {
            action.run();
        } catch (Exception e) {
            log.warn("error during shutdown ({}): {}", name, e.getMessage());
        }
    }
}
