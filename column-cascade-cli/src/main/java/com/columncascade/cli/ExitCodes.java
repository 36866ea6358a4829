package com.columncascade.cli;

/**
 * Process exit codes shared by all commands.
 */
public final class ExitCodes {

    /** Command completed. */
    public static final int OK = 0;

    /** Command failed or found errors. */
    public static final int FAILURE = 1;

    /** The workbook store was locked, missing or unreadable. */
    public static final int STORE_UNAVAILABLE = 2;

    private ExitCodes() {
        // Constants class
    }
}
