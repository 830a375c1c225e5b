package com.tasklane.mailbox.config;

import com.tasklane.mailbox.LinkedMailbox;
import com.tasklane.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates {@link LinkedMailbox} instances, bounded when the configuration asks for a capacity.
 *
 * @param <M> The element type
 */
public class LinkedStrategy<M> implements MailboxCreationStrategy<M> {
    private static final Logger logger = LoggerFactory.getLogger(LinkedStrategy.class);

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        if (config.isBounded()) {
            logger.debug("Creating bounded LinkedMailbox with capacity: {}", config.getCapacity());
            return new LinkedMailbox<>(config.getCapacity());
        }
        logger.debug("Creating unbounded LinkedMailbox");
        return new LinkedMailbox<>();
    }
}
