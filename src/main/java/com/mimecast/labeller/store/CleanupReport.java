package com.mimecast.labeller.store;

/**
 * Rows removed by a cleanup pass.
 */
public class CleanupReport {

    private final int runs;
    private final int sessions;
    private final int folders;

    public CleanupReport(int runs, int sessions, int folders) {
        this.runs = runs;
        this.sessions = sessions;
        this.folders = folders;
    }

    public int getRuns() {
        return runs;
    }

    public int getSessions() {
        return sessions;
    }

    public int getFolders() {
        return folders;
    }

    @Override
    public String toString() {
        return "CleanupReport{runs=" + runs + ", sessions=" + sessions + ", folders=" + folders + "}";
    }
}
