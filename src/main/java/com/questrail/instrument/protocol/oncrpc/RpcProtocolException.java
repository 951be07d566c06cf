package com.questrail.instrument.protocol.oncrpc;

import com.questrail.instrument.api.InstrumentException;
import com.questrail.instrument.protocol.oncrpc.model.AuthStatus;
import com.questrail.instrument.protocol.oncrpc.model.RpcReply;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * RpcProtocolException
 * -----------------------------------------------------------------------------
 * A fatal ONC RPC reply: wrong message type, a denied call, or an accepted
 * call whose status is not {@code SUCCESS}.
 *
 * <p>Carries the {@link RpcFailure} sub-kind and, where the reply supplies
 * them, the supported {@code (low, high)} version bounds or the raw
 * {@code auth_stat}. These indicate a server-compatibility fault and are
 * never retried.</p>
 */
public final class RpcProtocolException extends InstrumentException
{
    private static final long ABSENT = -1L;

    private final RpcFailure failure;
    private final long low;
    private final long high;
    private final int authStatus;

    private RpcProtocolException(RpcFailure failure, String message, long low, long high, int authStatus)
    {
        super(Category.PROTOCOL, message);
        this.failure = Objects.requireNonNull(failure, "failure");
        this.low = low;
        this.high = high;
        this.authStatus = authStatus;
    }

    public static RpcProtocolException of(RpcFailure failure)
    {
        return new RpcProtocolException(failure, failure.description(), ABSENT, ABSENT, (int) ABSENT);
    }

    public static RpcProtocolException of(RpcFailure failure, String detail)
    {
        return new RpcProtocolException(failure, failure.description() + ", " + detail,
            ABSENT, ABSENT, (int) ABSENT);
    }

    public static RpcProtocolException versionMismatch(RpcFailure failure, long low, long high)
    {
        return new RpcProtocolException(failure,
            failure.description() + ": low=" + low + ", high=" + high, low, high, (int) ABSENT);
    }

    public static RpcProtocolException authError(int authStatus)
    {
        String name = AuthStatus.fromCode(authStatus)
            .map(Enum::name)
            .orElse(Integer.toString(authStatus));
        return new RpcProtocolException(RpcFailure.AUTH_ERROR,
            RpcFailure.AUTH_ERROR.description() + ": " + name, ABSENT, ABSENT, authStatus);
    }

    /**
     * Converts a fatal reply variant into its exception.
     *
     * @throws IllegalArgumentException for {@link RpcReply.Accepted}, which is not a failure
     */
    public static RpcProtocolException from(RpcReply reply)
    {
        if (reply instanceof RpcReply.AcceptedProgUnavailable) {
            return of(RpcFailure.PROG_UNAVAIL);
        }
        if (reply instanceof RpcReply.AcceptedMismatch m) {
            return versionMismatch(RpcFailure.PROG_MISMATCH, m.low(), m.high());
        }
        if (reply instanceof RpcReply.AcceptedProcUnavailable) {
            return of(RpcFailure.PROC_UNAVAIL);
        }
        if (reply instanceof RpcReply.AcceptedGarbageArgs) {
            return of(RpcFailure.GARBAGE_ARGS);
        }
        if (reply instanceof RpcReply.AcceptedSystemError) {
            return of(RpcFailure.SYSTEM_ERR);
        }
        if (reply instanceof RpcReply.DeniedRpcMismatch m) {
            return versionMismatch(RpcFailure.RPC_MISMATCH, m.low(), m.high());
        }
        if (reply instanceof RpcReply.DeniedAuthError a) {
            return authError(a.authStatus());
        }
        throw new IllegalArgumentException("Not a failed reply: " + reply);
    }

    public RpcFailure failure()
    {
        return failure;
    }

    public OptionalLong low()
    {
        return low == ABSENT ? OptionalLong.empty() : OptionalLong.of(low);
    }

    public OptionalLong high()
    {
        return high == ABSENT ? OptionalLong.empty() : OptionalLong.of(high);
    }

    public OptionalInt authStatusCode()
    {
        return authStatus == ABSENT ? OptionalInt.empty() : OptionalInt.of(authStatus);
    }

    public Optional<AuthStatus> authStatus()
    {
        return authStatus == ABSENT ? Optional.empty() : AuthStatus.fromCode(authStatus);
    }
}
