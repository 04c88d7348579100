package io.synclane.lfs;

import io.synclane.model.PointerRecord;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PointerFilesTest {
    private static final String OID = "4d7a214614ab2935c943f9e0ff69d22eadbb8f32b1258daaa5e2ca24d17e2393";

    @Test
    void formatWritesCanonicalThreeLines() {
        String text = PointerFiles.format(new PointerRecord(OID, 12345L));
        assertEquals("version https://git-lfs.github.com/spec/v1\noid sha256:" + OID + "\nsize 12345\n", text);
    }

    @Test
    void parseAcceptsCrlfAndExtensionKeys() {
        String text = "version https://git-lfs.github.com/spec/v1\r\next-0-foo sha256:abc\r\noid sha256:"
                + OID.toUpperCase() + "\r\nsize 7\r\n";
        Optional<PointerRecord> parsed = PointerFiles.parse(text);
        assertTrue(parsed.isPresent());
        assertEquals(OID, parsed.get().oid());
        assertEquals(7L, parsed.get().size());
    }

    @Test
    void parseRejectsNonPointers() {
        assertFalse(PointerFiles.parse(new byte[0]).isPresent());
        assertFalse(PointerFiles.isPointer("hello world\n"));
        assertFalse(PointerFiles.isPointer("version https://git-lfs.github.com/spec/v1\noid sha256:abc\nsize 1\n"));
        assertFalse(PointerFiles.isPointer("version https://git-lfs.github.com/spec/v1\noid sha256:" + OID + "\nsize -1\n"));
        byte[] large = new byte[2048];
        assertFalse(PointerFiles.parse(large).isPresent());
        assertFalse(PointerFiles.parse(("version https://git-lfs.github.com/spec/v1\noid sha256:" + OID + "\n")
                .getBytes(StandardCharsets.UTF_8)).isPresent());
    }
}
