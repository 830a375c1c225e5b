package com.tasklane.mailbox.config;

import com.tasklane.mailbox.LinkedMailbox;
import com.tasklane.mailbox.Mailbox;
import com.tasklane.mailbox.MpscMailbox;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DefaultMailboxProviderTest {

    private final DefaultMailboxProvider<String> provider = new DefaultMailboxProvider<>();

    @Test
    void nullConfigYieldsUnboundedLinkedMailbox() {
        Mailbox<String> mailbox = provider.createMailbox(null);

        assertInstanceOf(LinkedMailbox.class, mailbox);
        assertFalse(mailbox.isBounded());
    }

    @Test
    void boundedConfigYieldsBoundedLinkedMailbox() {
        Mailbox<String> mailbox = provider.createMailbox(MailboxConfig.bounded(3));

        assertInstanceOf(LinkedMailbox.class, mailbox);
        assertEquals(3, mailbox.capacity());
    }

    @Test
    void mpscTypeYieldsMpscMailbox() {
        Mailbox<String> mailbox = provider.createMailbox(
                new MailboxConfig().setMailboxType(MailboxType.MPSC).setChunkSize(32));

        MpscMailbox<String> mpsc = assertInstanceOf(MpscMailbox.class, mailbox);
        assertEquals(32, mpsc.getChunkSize());
    }

    @Test
    void boundedMpscFallsBackToLinkedToKeepCapacity() {
        Mailbox<String> mailbox = provider.createMailbox(
                new MailboxConfig().setMailboxType(MailboxType.MPSC).setCapacity(5));

        assertInstanceOf(LinkedMailbox.class, mailbox);
        assertEquals(5, mailbox.capacity());
    }

    @Test
    void configNormalisesCapacityAndType() {
        MailboxConfig config = new MailboxConfig().setCapacity(-7).setMailboxType(null);

        assertEquals(MailboxConfig.UNBOUNDED, config.getCapacity());
        assertFalse(config.isBounded());
        assertEquals(MailboxType.LINKED, config.getMailboxType());
    }

    @Test
    void copyIsIndependent() {
        MailboxConfig original = MailboxConfig.bounded(4);
        MailboxConfig copy = original.copy().setCapacity(9);

        assertEquals(4, original.getCapacity());
        assertEquals(9, copy.getCapacity());
    }
}
