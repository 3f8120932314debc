package com.oslira.bulk.service.batch;

import com.oslira.bulk.exception.ItemProcessingException;
import com.oslira.bulk.model.ErrorKind;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Decides once, per failed attempt, which {@link ErrorKind} a processor failure belongs to.
 *
 * <ul>
 *   <li>{@link ItemProcessingException} - the kind the processor attached</li>
 *   <li>timeouts and I/O errors - {@link ErrorKind#TRANSIENT}</li>
 *   <li>anything else - {@link ErrorKind#UNKNOWN} (retried)</li>
 * </ul>
 */
@Component
public class ErrorClassifier {

    public ErrorKind classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof ItemProcessingException tagged) {
            return tagged.getKind() != null ? tagged.getKind() : ErrorKind.UNKNOWN;
        }
        if (cause instanceof TimeoutException || cause instanceof IOException) {
            return ErrorKind.TRANSIENT;
        }
        return ErrorKind.UNKNOWN;
    }

    /**
     * Message to report for a failure; falls back to the exception type when the message is empty.
     */
    public String describe(Throwable error) {
        Throwable cause = unwrap(error);
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return message;
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException
                || current instanceof ExecutionException
                || current instanceof UndeclaredThrowableException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
