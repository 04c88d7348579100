package io.synclane.sync;

import io.synclane.lfs.PointerFiles;
import io.synclane.model.Conflict;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Three-way comparison of tree listings (path to blob id). A path diverges when both sides moved
 * away from the merge base and did not land on the same content.
 */
public final class ConflictDetector {
    private ConflictDetector() {
    }

    public static List<DivergentPath> divergentPaths(
            Map<String, String> base,
            Map<String, String> ours,
            Map<String, String> theirs
    ) {
        TreeSet<String> paths = new TreeSet<>(ours.keySet());
        paths.addAll(theirs.keySet());
        paths.addAll(base.keySet());
        List<DivergentPath> out = new ArrayList<>();
        for (String path : paths) {
            String baseId = base.get(path);
            String oursId = ours.get(path);
            String theirsId = theirs.get(path);
            if (Objects.equals(oursId, theirsId)) {
                continue;
            }
            if (Objects.equals(oursId, baseId) || Objects.equals(theirsId, baseId)) {
                continue;
            }
            out.add(new DivergentPath(path, baseId, oursId, theirsId));
        }
        return out;
    }

    /**
     * Builds the reported conflict. Missing sides are given as {@code null} and reported as empty text.
     *
     * @param lfsPath whether the path is tracked as a large-object pointer by layout or attributes
     */
    public static Conflict toConflict(DivergentPath divergent, byte[] ours, byte[] theirs, byte[] base, boolean lfsPath) {
        String oursText = text(ours);
        String theirsText = text(theirs);
        boolean isLfs = lfsPath || PointerFiles.isPointer(oursText) || PointerFiles.isPointer(theirsText);
        return new Conflict(
                divergent.path(),
                oursText,
                theirsText,
                base == null ? null : text(base),
                divergent.isNew(),
                isLfs
        );
    }

    private static String text(byte[] raw) {
        return raw == null ? "" : new String(raw, StandardCharsets.UTF_8);
    }

    public record DivergentPath(String path, String baseId, String oursId, String theirsId) {
        public boolean isNew() {
            return baseId == null;
        }

        public boolean isDeleteModify() {
            return oursId == null || theirsId == null;
        }
    }
}
