package org.cadsync.console.queue;

/**
 * Outcome of one replay pass over the queue.
 */
public final class ReplayResult {

    /**
     * Why a pass stopped before draining the queue.
     */
    public enum StopReason {
        NETWORK,
        SERVER,
        AUTH
    }

    private final int delivered;
    private final int failed;
    private final int remaining;
    private final StopReason stopReason;
    private final boolean skipped;

    private ReplayResult(int delivered, int failed, int remaining, StopReason stopReason, boolean skipped) {
        this.delivered = delivered;
        this.failed = failed;
        this.remaining = remaining;
        this.stopReason = stopReason;
        this.skipped = skipped;
    }

    static ReplayResult completed(int delivered, int failed) {
        return new ReplayResult(delivered, failed, 0, null, false);
    }

    static ReplayResult stopped(int delivered, int failed, int remaining, StopReason reason) {
        return new ReplayResult(delivered, failed, remaining, reason, false);
    }

    static ReplayResult skipped(int remaining) {
        return new ReplayResult(0, 0, remaining, null, true);
    }

    public int getDelivered() {
        return delivered;
    }

    public int getFailed() {
        return failed;
    }

    /**
     * Entries still pending after this pass.
     */
    public int getRemaining() {
        return remaining;
    }

    /**
     * @return why the pass stopped early, or {@code null} if it drained the queue or was skipped
     */
    public StopReason getStopReason() {
        return stopReason;
    }

    public boolean isInterrupted() {
        return stopReason != null;
    }

    /**
     * True when another pass was already running and this one did nothing.
     */
    public boolean isSkipped() {
        return skipped;
    }

    @Override
    public String toString() {
        return "ReplayResult{" +
                "delivered=" + delivered +
                ", failed=" + failed +
                ", remaining=" + remaining +
                ", stopReason=" + stopReason +
                ", skipped=" + skipped +
                '}';
    }
}
