package com.coderag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ContentHasherTest {

    @Test
    void shouldProduceSixteenHexCharsOfSha256() {
        // sha256("hello") = 2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824
        assertEquals("2cf24dba5fb0a30e", ContentHasher.fingerprint("hello"));
    }

    @Test
    void shouldChangeWithContent() {
        String first = ContentHasher.fingerprint("def a():\n    pass\n");
        String second = ContentHasher.fingerprint("def a():\n    return 1\n");

        assertNotEquals(first, second);
        assertEquals(first, ContentHasher.fingerprint("def a():\n    pass\n"));
        assertTrue(first.matches("[0-9a-f]{16}"));
    }

    @Test
    void shouldBuildChunkIdsFromPathHashAndOrdinal() {
        String id = ChunkIds.forChunk("src/app.py", 3);

        assertTrue(id.matches("[0-9a-f]{8}_3"));
        assertEquals(id.substring(0, 8), ChunkIds.forChunk("src/app.py", 0).substring(0, 8));
        assertNotEquals(id.substring(0, 8), ChunkIds.forChunk("src/other.py", 3).substring(0, 8));
    }
}
