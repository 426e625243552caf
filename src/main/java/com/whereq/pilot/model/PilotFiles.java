package com.whereq.pilot.model;

/**
 * Well-known file names inside a pilot submit directory
 */
public final class PilotFiles {

    public static final String LOADER = "loader.sh";

    /**
     * Serialized dataset config handed to the pilot
     */
    public static final String CONFIG = "config.json";

    public static final String CREDENTIAL = "pilot.token";

    public static final String STDLOG = "pilot_log";

    public static final String STDERR = "pilot_err";

    public static final String STDOUT = "pilot_out";

    private PilotFiles() {
    }

    /**
     * Compressed variant the pilot writes with --gzip-logs
     */
    public static String gzipped(String name) {
        return name + ".gz";
    }
}
