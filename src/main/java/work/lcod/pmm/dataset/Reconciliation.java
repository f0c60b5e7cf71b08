package work.lcod.pmm.dataset;

import java.util.List;

/**
 * What a reconciliation pass changed in the metadata.
 */
public record Reconciliation(List<String> added, List<String> removed, boolean reordered, boolean recounted) {
    public Reconciliation {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
    }

    public boolean isNoop() {
        return added.isEmpty() && removed.isEmpty() && !reordered && !recounted;
    }
}
