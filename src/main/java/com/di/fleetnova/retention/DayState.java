package com.di.fleetnova.retention;

/**
 * Retention-window state of a run, decided by whether today's daily partition exists.
 */
public enum DayState {
    /** Today's daily partition already exists; it is loaded and tagged {@code today}. */
    SAME_DAY,
    /** First run of the calendar day; yesterday's daily partition is folded into history. */
    NEW_DAY
}
