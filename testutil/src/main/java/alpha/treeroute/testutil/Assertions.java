package alpha.treeroute.testutil;

import alpha.treeroute.NotFoundException;
import org.assertj.core.api.AbstractThrowableAssert;
import org.assertj.core.api.ObjectAssert;

import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Assertion utils for the stages returned by a site.<p>
 * 
 * Each method waits at most 3 seconds for the stage to complete.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Assertions
{
    private Assertions() {
        // Empty
    }
    
    /**
     * Awaits the result of a stage expected to complete normally.
     * 
     * @param stage to await
     * 
     * @return the result (may be {@code null})
     * 
     * @throws InterruptedException
     *             if interrupted while waiting
     * @throws TimeoutException
     *             if the stage did not complete in time
     * @throws AssertionError
     *             if the stage completed exceptionally
     */
    public static Object result(CompletionStage<?> stage)
            throws InterruptedException, TimeoutException {
        try {
            return stage.toCompletableFuture().get(3, SECONDS);
        } catch (ExecutionException e) {
            throw new AssertionError("Expected a result, got: " + e.getCause(), e.getCause());
        }
    }
    
    /**
     * {@return an {@code ObjectAssert} of the result of the given stage}
     * 
     * @param stage to await
     * 
     * @throws InterruptedException
     *             if interrupted while waiting
     * @throws TimeoutException
     *             if the stage did not complete in time
     * @throws AssertionError
     *             if the stage completed exceptionally
     */
    public static ObjectAssert<Object> assertResult(CompletionStage<?> stage)
            throws InterruptedException, TimeoutException {
        return assertThat(result(stage));
    }
    
    /**
     * {@return a {@code ThrowableAssert} of the exception the given stage
     * completed with}<p>
     * 
     * The exception is the one given to {@code completeExceptionally}, not the
     * {@code ExecutionException} thrown by {@code Future.get()}.
     * 
     * @param stage to await
     * 
     * @throws InterruptedException
     *             if interrupted while waiting
     * @throws TimeoutException
     *             if the stage did not complete in time
     * @throws AssertionError
     *             if the stage completed normally
     */
    public static AbstractThrowableAssert<?, ? extends Throwable> assertFailure(
            CompletionStage<?> stage) throws InterruptedException, TimeoutException {
        final Object v;
        try {
            v = stage.toCompletableFuture().get(3, SECONDS);
        } catch (ExecutionException e) {
            return assertThat(e.getCause());
        }
        throw new AssertionError("Expected a failure, got: " + v);
    }
    
    /**
     * {@return a {@code ThrowableAssert} of the {@code NotFoundException} the
     * given stage completed with}
     * 
     * @param stage to await
     * 
     * @throws InterruptedException
     *             if interrupted while waiting
     * @throws TimeoutException
     *             if the stage did not complete in time
     * @throws AssertionError
     *             if the stage did not complete with a {@code NotFoundException}
     */
    public static AbstractThrowableAssert<?, ? extends Throwable> assertNotFound(
            CompletionStage<?> stage) throws InterruptedException, TimeoutException {
        return assertFailure(stage).isExactlyInstanceOf(NotFoundException.class);
    }
}
