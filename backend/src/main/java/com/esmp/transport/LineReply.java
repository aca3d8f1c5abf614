package com.esmp.transport;

import com.esmp.envelope.Address;
import com.esmp.error.EsmpException;
import com.esmp.message.Acceptance;
import com.esmp.message.LogPosition;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Set;

/** One reply line on the TCP listener; exactly one is written per input line. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LineReply(
        String status,
        List<LogPosition> positions,
        Set<Address> recipients,
        String error,
        String message
) {

    static final String INTERNAL = "INTERNAL";

    public static LineReply accepted(Acceptance acceptance) {
        return new LineReply("accepted", acceptance.positions(), acceptance.recipients(), null, null);
    }

    public static LineReply rejected(EsmpException e) {
        return rejected(e.kind().name(), e.getMessage());
    }

    public static LineReply rejected(String error, String message) {
        return new LineReply("rejected", null, null, error, message);
    }
}
