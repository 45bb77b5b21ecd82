package info.isaksson.erland.errnumgen.registry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IdentifierCounterTest {

    @Test
    void startsAtOneWithoutRecoveredNumbers() {
        IdentifierCounter c = new IdentifierCounter();
        assertEquals(0, c.current());
        assertEquals(1, c.next());
        assertEquals(2, c.next());
        assertEquals(2, c.issued());
        assertEquals(0, c.recovered());
    }

    @Test
    void continuesAfterTheHighestRecoveredNumber() {
        IdentifierCounter c = new IdentifierCounter();
        c.recover(4);
        c.recover(9);
        c.recover(2);
        assertEquals(9, c.recovered());
        assertEquals(9, c.current());
        assertEquals(10, c.next());
        assertEquals(11, c.next());
        assertEquals(2, c.issued());
    }

    @Test
    void recoveryIsClosedOnceNumbersAreIssued() {
        IdentifierCounter c = new IdentifierCounter();
        c.recover(3);
        c.next();
        assertThrows(IllegalStateException.class, () -> c.recover(1));
        assertThrows(IllegalArgumentException.class, () -> new IdentifierCounter().recover(-1));
    }
}
