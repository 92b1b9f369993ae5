package in.indicatorhub.domain.indicator;

/**
 * Where an indicator snapshot came from.
 */
public enum SnapshotSource {
    LIVE,       // single-symbol provider calls
    BATCH,      // multi-symbol bulk call
    FALLBACK;   // synthesized neutral values

    public String code() {
        return name().toLowerCase();
    }
}
