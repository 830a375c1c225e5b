package com.tasklane.mailbox.config;

import com.tasklane.mailbox.Mailbox;
import com.tasklane.mailbox.MpscMailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates unbounded {@link MpscMailbox} instances.
 *
 * @param <M> The element type
 */
public class MpscStrategy<M> implements MailboxCreationStrategy<M> {
    private static final Logger logger = LoggerFactory.getLogger(MpscStrategy.class);

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        logger.debug("Creating MpscMailbox with chunk size: {}", config.getChunkSize());
        return new MpscMailbox<>(config.getChunkSize());
    }
}
