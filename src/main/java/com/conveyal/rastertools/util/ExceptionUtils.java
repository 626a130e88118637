package com.conveyal.rastertools.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;

/**
 * Convenience functions for working with exceptions (or more generally throwables).
 */
public abstract class ExceptionUtils {

    /**
     * Short-form exception summary that includes the chain of causality, reversed such that the root cause comes first.
     */
    public static String shortCauseString (Throwable throwable) {
        List<String> items = new ArrayList<>();
        Set<Throwable> seen = new HashSet<>(); // Bail out if there are cycles in the cause chain
        while (throwable != null && !seen.contains(throwable)) {
            String item = throwable.getClass().getSimpleName();
            if (throwable.getMessage() != null) {
                item += ": " + throwable.getMessage();
            }
            items.add(item);
            seen.add(throwable);
            throwable = throwable.getCause();
        }
        Collections.reverse(items);
        return String.join(", caused ", items);
    }

    /**
     * Exceptions thrown inside a worker reach the caller wrapped in an ExecutionException. Return the throwable that
     * was actually thrown by the task, or the given throwable itself if it has no cause.
     */
    public static Throwable unwrap (Throwable throwable) {
        if (throwable instanceof ExecutionException && throwable.getCause() != null) {
            return throwable.getCause();
        }
        return throwable;
    }

}
