package com.tasklane.mailbox.config;

import com.tasklane.mailbox.Mailbox;

/**
 * Creates a mailbox for one {@link MailboxType}.
 *
 * @param <M> The element type
 */
@FunctionalInterface
public interface MailboxCreationStrategy<M> {

    /**
     * @param config the mailbox configuration
     * @return a new, empty mailbox
     */
    Mailbox<M> createMailbox(MailboxConfig config);
}
