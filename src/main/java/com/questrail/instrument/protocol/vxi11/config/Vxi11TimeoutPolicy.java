package com.questrail.instrument.protocol.vxi11.config;

import java.time.Duration;

/**
 * Vxi11TimeoutPolicy
 * -----------------------------------------------------------------------------
 * The two independent VXI-11 timeout budgets, in milliseconds as carried on
 * the wire, and the socket timeout derived from them.
 *
 * <h2>Blocking</h2>
 * The wire format only carries a bounded 32-bit millisecond value, so
 * "wait forever" is represented by {@link #BLOCKING_MILLIS} (one day).
 *
 * <h2>Socket timeout</h2>
 * <pre>
 *   socket timeout = 1 s + io_timeout + lock_timeout
 * </pre>
 * The extra second covers RPC round-trip latency so the client socket does not
 * expire before the server has had the chance to report its own timeout.
 *
 * @param ioTimeoutMillis   time the server may spend completing device I/O
 * @param lockTimeoutMillis time the server may wait to acquire the device lock
 */
public record Vxi11TimeoutPolicy(long ioTimeoutMillis, long lockTimeoutMillis)
{
    /** One day: the stand-in for an infinite timeout. */
    public static final long BLOCKING_MILLIS = 86_400_000L;

    public static final Duration BLOCKING = Duration.ofMillis(BLOCKING_MILLIS);

    /** Slack added on top of the VXI-11 timeouts for the socket timeout. */
    public static final long SOCKET_SLACK_MILLIS = 1_000L;

    public Vxi11TimeoutPolicy {
        if (ioTimeoutMillis < 0 || ioTimeoutMillis > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("ioTimeoutMillis out of range: " + ioTimeoutMillis);
        }
        if (lockTimeoutMillis < 0 || lockTimeoutMillis > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("lockTimeoutMillis out of range: " + lockTimeoutMillis);
        }
    }

    /**
     * Builds a policy from optional durations.
     *
     * @param ioTimeout   {@code null} or negative for blocking
     * @param lockTimeout {@code null} or negative for blocking
     */
    public static Vxi11TimeoutPolicy of(Duration ioTimeout, Duration lockTimeout)
    {
        return new Vxi11TimeoutPolicy(toMillis(ioTimeout), toMillis(lockTimeout));
    }

    /**
     * Blocking I/O and no waiting for locks.
     */
    public static Vxi11TimeoutPolicy defaults()
    {
        return new Vxi11TimeoutPolicy(BLOCKING_MILLIS, 0);
    }

    public Vxi11TimeoutPolicy withIoTimeout(Duration ioTimeout)
    {
        return new Vxi11TimeoutPolicy(toMillis(ioTimeout), lockTimeoutMillis);
    }

    public Vxi11TimeoutPolicy withLockTimeout(Duration lockTimeout)
    {
        return new Vxi11TimeoutPolicy(ioTimeoutMillis, toMillis(lockTimeout));
    }

    public int ioTimeout()
    {
        return (int) ioTimeoutMillis;
    }

    public int lockTimeout()
    {
        return (int) lockTimeoutMillis;
    }

    /**
     * True if calls should carry {@code WAITLOCK}.
     */
    public boolean waitsForLock()
    {
        return lockTimeoutMillis > 0;
    }

    public Duration socketTimeout()
    {
        return Duration.ofMillis(SOCKET_SLACK_MILLIS + ioTimeoutMillis + lockTimeoutMillis);
    }

    private static long toMillis(Duration timeout)
    {
        if (timeout == null || timeout.isNegative()) {
            return BLOCKING_MILLIS;
        }
        return Math.min(timeout.toMillis(), Integer.MAX_VALUE);
    }
}
