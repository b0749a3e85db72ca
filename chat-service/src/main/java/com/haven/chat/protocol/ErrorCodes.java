package com.haven.chat.protocol;

/**
 * Codes carried by {@code error} frames.
 */
public final class ErrorCodes {

    public static final String AUTH_REQUIRED = "AUTH_REQUIRED";
    public static final String AUTH_FAILED = "AUTH_FAILED";
    public static final String NOT_AUTHENTICATED = "NOT_AUTHENTICATED";
    public static final String ROOM_ACCESS_DENIED = "ROOM_ACCESS_DENIED";
    public static final String VALIDATION_FAILED = "VALIDATION_FAILED";
    public static final String UNKNOWN_EVENT = "UNKNOWN_EVENT";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private ErrorCodes() {
    }
}
