package io.tupla.runtime;

import io.tupla.core.Actor;
import io.tupla.core.TableRef;

/**
 * Ownership offer posted to the recipient's mailbox.
 * <p>
 * A request goes stale when the table is deleted, the sender no longer owns it, or a later give
 * away supersedes it; {@link OwnershipProtocol#accept} discards stale requests.
 *
 * @param table      the offered table
 * @param from       the sender, or the terminated owner for an inheritance
 * @param gift       payload chosen by the sender, or the heir payload
 * @param transferId the table's transfer id at the time of the offer
 * @param inherited  true when the recipient already owns the table as its heir
 */
public record TransferRequest(TableRef table, Actor from, Object gift, long transferId, boolean inherited) {

    public TransferRequest {
        if (table == null) {
            throw new IllegalArgumentException("table required");
        }
        if (from == null) {
            throw new IllegalArgumentException("from required");
        }
    }
}
