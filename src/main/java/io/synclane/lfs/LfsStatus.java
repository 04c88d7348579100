package io.synclane.lfs;

import java.nio.file.Path;
import java.util.List;

public record LfsStatus(
        boolean enabled,
        List<String> patterns,
        int pointerCount,
        List<String> missingPayloads,
        List<String> corruptPointers
) {
    public LfsStatus {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        missingPayloads = missingPayloads == null ? List.of() : List.copyOf(missingPayloads);
        corruptPointers = corruptPointers == null ? List.of() : List.copyOf(corruptPointers);
    }

    public static LfsStatus of(Path repoDir, LargeObjectReconciler.PayloadScan scan) {
        return new LfsStatus(
                LfsAttributes.isLfsEnabled(repoDir),
                LfsAttributes.patterns(repoDir),
                scan.pointerCount(),
                List.copyOf(scan.missing().keySet()),
                scan.corrupt()
        );
    }
}
