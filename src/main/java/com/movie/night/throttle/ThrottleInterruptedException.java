package com.movie.night.throttle;

/**
 * Runtime exception thrown when a thread is interrupted while waiting on a rate limiter.
 */
public class ThrottleInterruptedException extends RuntimeException {

    public ThrottleInterruptedException(String message) {
        super(message);
    }

    public ThrottleInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
