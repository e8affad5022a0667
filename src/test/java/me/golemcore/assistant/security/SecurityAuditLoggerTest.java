package me.golemcore.assistant.security;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SecurityAuditLoggerTest {

    private final SecurityAuditLogger auditLogger = new SecurityAuditLogger();
    private Logger logger;
    private Level previousLevel;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(SecurityAuditLogger.LOGGER_NAME);
        previousLevel = logger.getLevel();
        logger.setLevel(Level.INFO);
        appender = new ListAppender<>() {
            @Override
            protected void append(ILoggingEvent event) {
                // MDC is read lazily and is already cleared once the call returns
                event.prepareForDeferredProcessing();
                super.append(event);
            }
        };
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        logger.setLevel(previousLevel);
    }

    @Test
    void shouldTagEventsWithSessionActionAndResource() {
        auditLogger.toolCall("s1", "write_file", true);

        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertEquals("Tool call requested: write_file, confirmed=true", event.getFormattedMessage());
        assertEquals(Map.of("user", "s1", "action", "tool_call", "resource", "write_file"),
                event.getMDCPropertyMap());
    }

    @Test
    void shouldDescribeMessagesWithoutContent() {
        auditLogger.messageAdded("s1", "c1", "user", 42);
        auditLogger.sessionEnded("s1", "idle timeout");

        assertEquals("Message added: role=user, length=42", appender.list.get(0).getFormattedMessage());
        assertEquals("conversation:c1", appender.list.get(0).getMDCPropertyMap().get("resource"));
        assertEquals("Session ended: idle timeout", appender.list.get(1).getFormattedMessage());
    }

    @Test
    void shouldClearMdcAfterEachEvent() {
        auditLogger.toolResult("s1", "read_file", false, 12);

        assertEquals("Tool finished: read_file, success=false, duration=12ms",
                appender.list.get(0).getFormattedMessage());
        assertNull(MDC.get("action"));
        assertNull(MDC.get("user"));
    }
}
