package tech.yump.rotation.store.local;

/**
 * Per-class pointer document of the local store: the active version and the version number counter.
 */
public record LocalClassState(
        String activeVersionId,
        long lastVersionNumber
) {

    static LocalClassState empty() {
        return new LocalClassState(null, 0);
    }
}
