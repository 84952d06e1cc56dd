package ru.perminov.ledger.config;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.perminov.ledger.LedgerTestSupport;
import ru.perminov.ledger.service.HoldingService;

import static org.junit.jupiter.api.Assertions.*;

class LoggingLevelTest extends LedgerTestSupport {

    @Test
    void testLedgerLogsOnlyWarningsUnderTestProfile() {
        Logger log = LoggerFactory.getLogger(HoldingService.class);

        assertFalse(log.isInfoEnabled());
        assertTrue(log.isWarnEnabled());
        assertFalse(LoggerFactory.getLogger("org.hibernate.SQL").isInfoEnabled());
    }
}
