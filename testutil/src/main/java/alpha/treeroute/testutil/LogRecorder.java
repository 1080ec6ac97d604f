package alpha.treeroute.testutil;

import alpha.treeroute.Site;

import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.Predicate;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static alpha.treeroute.testutil.LogRecords.rec;
import static alpha.treeroute.testutil.LogRecords.toJUL;
import static java.util.Comparator.comparing;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Stream.of;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * A utility for asserting log records.<p>
 * 
 * Many methods in this class accept arguments for matching a record. Each
 * observed record's values are compared with the arguments accordingly:
 * 
 * <ul>
 *   <li>{@code getLevel()} must be equal to {@code level}</li>
 *   <li>{@code getMessage()} must be equal to {@code message}</li>
 *   <li>{@code getMessage().}{@link String#startsWith(String) startsWith}{@code ()}
 *       must return {@code true} given {@code messageStartsWith}</li>
 * </ul>
 * 
 * Methods with an "assert" prefix throw an {@code AssertionError} if the
 * record can not be found.<p>
 * 
 * Methods with "remove" in their name will remove the earliest record which
 * is a match, meaning that the matched record will not be matched again. The
 * purpose is to limit subsequent assertions to what is left behind:
 * 
 * <pre>{@code
 *   // The test provoked an expected record...
 *   recorder.assertRemove(DEBUG, "Not found: /a")
 *   // ...but no other problems are expected
 *           .assertNoProblem();
 * }</pre>
 * 
 * While recording, the level of each targeted logger is set to {@code ALL}.
 * The previous level is restored by {@link #stopRecording()}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class LogRecorder
{
    /**
     * Starts recording all records of the library.<p>
     * 
     * An invocation of this method behaves in exactly the same way as the
     * invocation
     * <pre>
     *     LogRecorder.{@link #startRecording(Class, Class[])
     *       startRecording}(Site.class);
     * </pre>
     * 
     * @return a new log recorder
     */
    public static LogRecorder startRecording() {
        return startRecording(Site.class);
    }
    
    /**
     * Starts recording log records from the loggers of the packages that the
     * given components belong to.<p>
     * 
     * Recording should eventually be stopped using {@link #stopRecording()}.
     * 
     * @param firstComponent at least one
     * @param more may be provided
     * 
     * @return a new log recorder
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    public static LogRecorder startRecording(Class<?> firstComponent, Class<?>... more) {
        RecordHandler[] h = Stream.concat(of(firstComponent), of(more))
                .map(RecordHandler::new)
                .toArray(RecordHandler[]::new);
        return new LogRecorder(h);
    }
    
    private final RecordHandler[] handlers;
    
    private LogRecorder(RecordHandler[] handlers) {
        this.handlers = handlers;
    }
    
    /**
     * Removes the matched record.
     * 
     * @param level record's level predicate
     * @param messageStartsWith record's message predicate
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if a match could not be found
     */
    public LogRecorder assertRemove(System.Logger.Level level, String messageStartsWith) {
        var jul = toJUL(level);
        requireNonNull(messageStartsWith);
        assertRemoveIf(r ->
                r.getLevel().equals(jul) &&
                r.getMessage().startsWith(messageStartsWith));
        return this;
    }
    
    /**
     * Asserts that no record has a throwable nor a level greater than
     * {@code INFO}.
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws AssertionError
     *             if a record has a throwable
     *             or a level greater than {@code INFO}
     */
    public LogRecorder assertNoProblem() {
        assertThat(records())
            .noneMatch(v -> v.getLevel().intValue() > Level.INFO.intValue())
            .noneMatch(v -> v.getThrown() != null);
        return this;
    }
    
    /**
     * Asserts that only one record has the given values.
     * 
     * @param level record's level predicate
     * @param message record's message predicate
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws AssertionError
     *             if not exactly one record is found
     */
    public LogRecorder assertContainsOnlyOnce(System.Logger.Level level, String message) {
        assertThat(records())
            .extracting(
                LogRecord::getLevel,
                LogRecord::getMessage)
            .containsOnlyOnce(rec(level, message));
        return this;
    }
    
    /**
     * Asserts that no record's message starts with the given string.
     * 
     * @param messageStartsWith record's message predicate
     * 
     * @return this (for chaining/fluency)
     * 
     * @throws NullPointerException
     *             if {@code messageStartsWith} is {@code null}
     * @throws AssertionError
     *             if a record is found
     */
    public LogRecorder assertNone(String messageStartsWith) {
        requireNonNull(messageStartsWith);
        assertThat(records())
            .noneMatch(r -> r.getMessage().startsWith(messageStartsWith));
        return this;
    }
    
    /**
     * Stops recording log records.
     */
    public void stopRecording() {
        Stream.of(handlers).forEach(RecordHandler::uninstall);
    }
    
    private Stream<LogRecord> records() {
        return Stream.of(handlers)
                .flatMap(h -> h.records().stream())
                .sorted(comparing(LogRecord::getInstant));
    }
    
    private void assertRemoveIf(Predicate<LogRecord> test) {
        for (var h : handlers) {
            var it = h.records().iterator();
            while (it.hasNext()) {
                if (test.test(it.next())) {
                    it.remove();
                    return;
                }
            }
        }
        throw new AssertionError("No record matched. Observed: " +
                records().map(LogRecords::toString).toList());
    }
    
    private static final class RecordHandler extends Handler {
        private final Logger logger;
        private final Level oldLevel;
        private final Deque<LogRecord> deq;
        
        RecordHandler(Class<?> component) {
            deq = new ConcurrentLinkedDeque<>();
            logger = Logging.logger(component);
            oldLevel = logger.getLevel();
            super.setLevel(Level.ALL);
            logger.setLevel(Level.ALL);
            logger.addHandler(this);
        }
        
        void uninstall() {
            logger.removeHandler(this);
            logger.setLevel(oldLevel);
        }
        
        Deque<LogRecord> records() {
            return deq;
        }
        
        @Override
        public void publish(LogRecord record) {
            deq.add(record);
        }
        
        @Override
        public void flush() {
            // Empty
        }
        
        @Override
        public void close() {
            // Empty
        }
    }
}
