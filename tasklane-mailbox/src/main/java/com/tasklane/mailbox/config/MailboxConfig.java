package com.tasklane.mailbox.config;

/**
 * Settings used to create an actor's mailbox.
 */
public class MailboxConfig {
    /** Capacity value meaning "no bound". */
    public static final int UNBOUNDED = 0;
    public static final int DEFAULT_CHUNK_SIZE = 128;
    public static final MailboxType DEFAULT_MAILBOX_TYPE = MailboxType.LINKED;

    private int capacity = UNBOUNDED;
    private int chunkSize = DEFAULT_CHUNK_SIZE;
    private MailboxType mailboxType = DEFAULT_MAILBOX_TYPE;

    /**
     * Creates an unbounded {@link MailboxType#LINKED} configuration.
     */
    public MailboxConfig() {
    }

    /**
     * Shortcut for a bounded {@link MailboxType#LINKED} mailbox.
     *
     * @param capacity the maximum number of queued tasks
     * @return a new configuration
     */
    public static MailboxConfig bounded(int capacity) {
        return new MailboxConfig().setCapacity(capacity);
    }

    /**
     * Sets the capacity. Zero or a negative value means unbounded.
     *
     * @param capacity the maximum number of queued tasks
     * @return This MailboxConfig instance
     */
    public MailboxConfig setCapacity(int capacity) {
        this.capacity = Math.max(UNBOUNDED, capacity);
        return this;
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isBounded() {
        return capacity > UNBOUNDED;
    }

    /**
     * Sets the array chunk size used by {@link MailboxType#MPSC} mailboxes.
     *
     * @param chunkSize the chunk size, rounded up to a power of two by the mailbox
     * @return This MailboxConfig instance
     */
    public MailboxConfig setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
        return this;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * @param mailboxType the queue implementation, null restores the default
     * @return This MailboxConfig instance
     */
    public MailboxConfig setMailboxType(MailboxType mailboxType) {
        this.mailboxType = mailboxType != null ? mailboxType : DEFAULT_MAILBOX_TYPE;
        return this;
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    public MailboxConfig copy() {
        return new MailboxConfig()
                .setCapacity(capacity)
                .setChunkSize(chunkSize)
                .setMailboxType(mailboxType);
    }

    @Override
    public String toString() {
        return "MailboxConfig{type=" + mailboxType
                + ", capacity=" + (isBounded() ? String.valueOf(capacity) : "unbounded")
                + ", chunkSize=" + chunkSize + "}";
    }
}
