package com.questrail.instrument.protocol.oncrpc;

/**
 * Sub-kind of a fatal {@link RpcProtocolException}.
 */
public enum RpcFailure
{
    WRONG_MESSAGE_TYPE("RPC message type is not REPLY"),
    UNKNOWN_REPLY_STATUS("RPC reply is not MSG_ACCEPTED nor MSG_DENIED"),

    RPC_MISMATCH("RPC call failed: RPC_MISMATCH"),
    AUTH_ERROR("RPC authentication failed"),
    UNKNOWN_REJECT_STATUS("RPC MSG_DENIED reply status is not RPC_MISMATCH nor AUTH_ERROR"),

    PROG_UNAVAIL("RPC call failed: PROG_UNAVAIL"),
    PROG_MISMATCH("RPC call failed: PROG_MISMATCH"),
    PROC_UNAVAIL("RPC call failed: PROC_UNAVAIL"),
    GARBAGE_ARGS("RPC call failed: GARBAGE_ARGS"),
    SYSTEM_ERR("RPC call failed: SYSTEM_ERR"),
    UNKNOWN_ACCEPT_STATUS("RPC call failed: unknown accept status");

    private final String description;

    RpcFailure(String description)
    {
        this.description = description;
    }

    public String description()
    {
        return description;
    }
}
