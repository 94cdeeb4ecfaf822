package de.entwicklertraining.capi.cancellation;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void testNoneIsNeverCancelled() {
        CancellationToken token = CancellationToken.none();
        token.cancel();

        assertFalse(token.isCancelled());
        assertTrue(token.remaining().isEmpty());
        assertDoesNotThrow(token::throwIfCancelled);
    }

    @Test
    void testSourceCancelsToken() {
        CancellationTokenSource source = CancellationTokenSource.create();
        CancellationToken token = source.getToken();
        assertFalse(token.isCancelled());

        source.cancel();

        assertTrue(source.isCancellationRequested());
        assertTrue(token.isCancelled());
        CancellationException e = assertThrows(CancellationException.class, token::throwIfCancelled);
        assertEquals("Operation was cancelled", e.getMessage());
    }

    @Test
    void testFromCompletableFuture() {
        CompletableFuture<String> future = new CompletableFuture<>();
        CancellationToken token = CancellationToken.fromCompletableFuture(future);
        assertFalse(token.isCancelled());

        future.cancel(true);

        assertTrue(token.isCancelled());
    }

    @Test
    void testFromSupplier() {
        boolean[] flag = {false};
        CancellationToken token = CancellationToken.fromSupplier(() -> flag[0]);
        assertFalse(token.isCancelled());

        flag[0] = true;

        assertTrue(token.isCancelled());
    }

    @Test
    void testTimeoutTokenExpires() throws InterruptedException {
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(50));
        assertFalse(token.isCancelled());
        assertTrue(token.remaining().isPresent());

        Thread.sleep(100);

        assertTrue(token.isCancelled());
        assertTrue(token.isDeadlineExceeded());
        assertEquals(Duration.ZERO, token.remaining().get());
        CancellationException e = assertThrows(CancellationException.class, token::throwIfCancelled);
        assertEquals("Operation deadline exceeded", e.getMessage());
    }

    @Test
    void testLinkedChildFollowsParent() {
        CancellationTokenSource parent = CancellationTokenSource.create();
        CancellationToken child = parent.getToken().withTimeoutLinked(Duration.ofMinutes(1));
        assertFalse(child.isCancelled());

        parent.cancel();

        assertTrue(child.isCancelled());
        assertFalse(child.isDeadlineExceeded());
    }

    @Test
    void testLinkedChildKeepsEarlierParentDeadline() {
        CancellationToken parent = CancellationToken.withTimeout(Duration.ofMillis(200));
        CancellationToken child = parent.withTimeoutLinked(Duration.ofMinutes(5));

        assertEquals(parent.getDeadline(), child.getDeadline());
    }

    @Test
    void testCancellingChildLeavesParentAlone() {
        CancellationTokenSource parent = CancellationTokenSource.create();
        CancellationTokenSource child = CancellationTokenSource.linkedTo(parent.getToken());

        child.cancel();

        assertTrue(child.getToken().isCancelled());
        assertFalse(parent.getToken().isCancelled());
    }
}
