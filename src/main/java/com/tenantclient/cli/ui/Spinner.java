package com.tenantclient.cli.ui;

import java.io.PrintWriter;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jline.terminal.Terminal;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Displays a spinning cursor in the console while a request is in flight, and hands back its result.
 */
@Component
public class Spinner {

    private final Terminal terminal;
    private final char[] spinnerChars = new char[]{'|', '/', '-', '\\'};

    public Spinner(Terminal terminal) {
        this.terminal = terminal;
    }

    /**
     * Subscribes to the task and waits for it, redrawing the spinner every 100ms.
     *
     * @param task The asynchronous task.
     * @param <T>  The type of the result.
     * @return the emitted value, or {@code null} if the task completed empty.
     * @throws RuntimeException the task's own failure, unwrapped.
     */
    public <T> T await(Mono<T> task) {
        CompletableFuture<T> future = task.toFuture();
        PrintWriter writer = terminal.writer();
        int spinnerIndex = 0;

        try {
            while (true) {
                try {
                    T result = future.get(100, TimeUnit.MILLISECONDS);
                    clearSpinnerLine(writer);
                    return result;
                } catch (TimeoutException e) {
                    writer.print("\r\u001B[33mWaiting for server... " + spinnerChars[spinnerIndex++ % spinnerChars.length] + "\u001B[0m");
                    writer.flush();
                }
            }
        } catch (ExecutionException e) {
            clearSpinnerLine(writer);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException(cause);
        } catch (InterruptedException e) {
            clearSpinnerLine(writer);
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the server", e);
        }
    }

    private void clearSpinnerLine(PrintWriter writer) {
        writer.print("\r" + " ".repeat(30) + "\r");
        writer.flush();
    }
}
