package org.coursesched.exceptions;

public class ScheduleExportException extends RuntimeException {
    public ScheduleExportException(String message) {
        super(message);
    }

    public ScheduleExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
