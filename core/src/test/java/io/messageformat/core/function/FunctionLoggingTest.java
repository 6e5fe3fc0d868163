package io.messageformat.core.function;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.messageformat.core.spi.FunctionContext;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Error reports and registry changes are logged at DEBUG. */
@DisplayName("FunctionLoggingTest")
class FunctionLoggingTest {

    private ListAppender<ILoggingEvent> appender;
    private Logger contextLogger;
    private Logger registryLogger;

    @BeforeEach
    void setUp() {
        appender = new ListAppender<>();
        appender.start();
        contextLogger = (Logger) LoggerFactory.getLogger(FunctionContext.class);
        registryLogger = (Logger) LoggerFactory.getLogger(FunctionRegistry.class);
        contextLogger.addAppender(appender);
        registryLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        contextLogger.detachAppender(appender);
        registryLogger.detachAppender(appender);
        appender.stop();
    }

    @Test
    @DisplayName("bad option → one DEBUG entry naming error type and source")
    void badOptionIsLogged() {
        FunctionContext ctx = FunctionContext.builder().source("$count").build();

        new NumberFunction().call(ctx, Map.of("minimumFractionDigits", "foo"), 42);

        List<ILoggingEvent> events = appender.list.stream()
                .filter(e -> e.getLoggerName().equals(FunctionContext.class.getName()))
                .toList();
        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.getLevel()).isEqualTo(Level.DEBUG);
            assertThat(e.getFormattedMessage())
                    .isEqualTo("bad-option in $count: Value foo is not valid for :number option minimumFractionDigits");
        });
    }

    @Test
    @DisplayName("clean call → no log entries")
    void cleanCallIsSilent() {
        new NumberFunction().call(FunctionContext.builder().build(), Map.of(), 1);

        assertThat(appender.list).isEmpty();
    }

    @Test
    void registrationIsLogged() {
        FunctionRegistry registry = FunctionRegistry.empty();
        registry.register("custom", (ctx, options, operand) -> BuiltinFunctions.fallback(ctx.source(), ""));

        assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Registered function :custom");
    }
}
