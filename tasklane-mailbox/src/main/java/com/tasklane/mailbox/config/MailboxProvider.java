package com.tasklane.mailbox.config;

import com.tasklane.mailbox.Mailbox;

/**
 * Supplies mailboxes to newly spawned actors.
 * Implementations decide which queue backs a given configuration.
 *
 * @param <M> The element type
 */
public interface MailboxProvider<M> {

    /**
     * @param config the requested configuration, or null for the defaults
     * @return a new, empty mailbox
     */
    Mailbox<M> createMailbox(MailboxConfig config);
}
