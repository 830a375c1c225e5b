package com.tasklane.mailbox.config;

import com.tasklane.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Picks a {@link MailboxCreationStrategy} by {@link MailboxType}.
 * <p>
 * An {@link MailboxType#MPSC} request with a bounded capacity cannot be honoured, since the MPSC
 * queue never fills. The provider logs a warning and falls back to {@link MailboxType#LINKED}
 * so the capacity, and with it backpressure, is preserved.
 *
 * @param <M> The element type
 */
public class DefaultMailboxProvider<M> implements MailboxProvider<M> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMailboxProvider.class);

    private final Map<MailboxType, MailboxCreationStrategy<M>> strategies;
    private final MailboxCreationStrategy<M> defaultStrategy;

    public DefaultMailboxProvider() {
        this.strategies = new EnumMap<>(MailboxType.class);
        this.defaultStrategy = new LinkedStrategy<>();
        this.strategies.put(MailboxType.LINKED, defaultStrategy);
        this.strategies.put(MailboxType.MPSC, new MpscStrategy<>());
    }

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        MailboxConfig effectiveConfig = (config != null) ? config : new MailboxConfig();
        MailboxType type = effectiveConfig.getMailboxType();

        if (type == MailboxType.MPSC && effectiveConfig.isBounded()) {
            logger.warn("MPSC mailboxes are unbounded; using LINKED to honour capacity {}",
                    effectiveConfig.getCapacity());
            return defaultStrategy.createMailbox(effectiveConfig);
        }

        return strategies.getOrDefault(type, defaultStrategy).createMailbox(effectiveConfig);
    }
}
