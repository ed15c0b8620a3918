package service;

import org.junit.jupiter.api.Test;
import org.lite.ai.service.ChunkingService;
import org.lite.ai.service.ChunkingService.ChunkResult;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChunkingServiceTest {

    private final ChunkingService chunkingService = new ChunkingService();

    @Test
    void testBlankTextProducesNoChunks() {
        assertTrue(chunkingService.chunk("", 100, 10).isEmpty());
        assertTrue(chunkingService.chunk("   \n\n  ", 100, 10).isEmpty());
        assertTrue(chunkingService.chunk(null, 100, 10).isEmpty());
    }

    @Test
    void testInvalidSizesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> chunkingService.chunk("text", 0, 0));
        assertThrows(IllegalArgumentException.class, () -> chunkingService.chunk("text", 10, 10));
        assertThrows(IllegalArgumentException.class, () -> chunkingService.chunk("text", 10, -1));
    }

    @Test
    void testShortTextIsSingleChunk() {
        // Given
        String text = "  The login page must support SSO.  ";

        // When
        List<ChunkResult> chunks = chunkingService.chunk(text, 200, 20);

        // Then
        assertEquals(1, chunks.size());
        assertEquals("The login page must support SSO.", chunks.get(0).getText());
        assertEquals(0, chunks.get(0).getChunkIndex());
        assertEquals(2, chunks.get(0).getStartPosition());
    }

    @Test
    void testParagraphsThatDoNotFitTogetherAreSplit() {
        // Given
        String text = "Para one.\n\nPara two.";

        // When
        List<ChunkResult> chunks = chunkingService.chunk(text, 12, 0);

        // Then
        assertEquals(2, chunks.size());
        assertEquals("Para one.", chunks.get(0).getText());
        assertEquals("Para two.", chunks.get(1).getText());
        assertEquals(11, chunks.get(1).getStartPosition());
        assertEquals(1, chunks.get(1).getChunkIndex());
    }

    @Test
    void testNextChunkCarriesTrailingSentenceAsOverlap() {
        // Given
        String text = "One one. Two two. Three three.";

        // When
        List<ChunkResult> chunks = chunkingService.chunk(text, 22, 10);

        // Then
        assertEquals(2, chunks.size());
        assertEquals("One one. Two two.", chunks.get(0).getText());
        assertEquals("Two two. Three three.", chunks.get(1).getText());
    }

    @Test
    void testOversizedSentenceIsHardCutWithOverlap() {
        // Given
        String text = "a".repeat(25);

        // When
        List<ChunkResult> chunks = chunkingService.chunk(text, 10, 2);

        // Then
        assertEquals(3, chunks.size());
        assertEquals(0, chunks.get(0).getStartPosition());
        assertEquals(8, chunks.get(1).getStartPosition());
        assertEquals(16, chunks.get(2).getStartPosition());
        assertEquals(25, chunks.get(2).getEndPosition());
    }

    @Test
    void testChunksRespectMaxSizeAndMatchSourceOffsets() {
        // Given
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < 40; i++) {
            builder.append("Requirement ").append(i).append(" covers the export of audit reports to CSV. ");
            if (i % 5 == 4) {
                builder.append("\n\n");
            }
        }
        String text = builder.toString();

        // When
        List<ChunkResult> chunks = chunkingService.chunk(text, 300, 60);

        // Then
        assertTrue(chunks.size() > 1);
        for (int i = 0; i < chunks.size(); i++) {
            ChunkResult chunk = chunks.get(i);
            assertEquals(i, chunk.getChunkIndex());
            assertTrue(chunk.getText().length() <= 300, "Chunk " + i + " exceeds max size");
            assertEquals(text.substring(chunk.getStartPosition(), chunk.getEndPosition()), chunk.getText());
            if (i > 0) {
                assertTrue(chunk.getStartPosition() > chunks.get(i - 1).getStartPosition(), "Chunks advance");
            }
        }
        assertEquals(text.stripTrailing().length(), chunks.get(chunks.size() - 1).getEndPosition());
    }

    @Test
    void testChunkingIsDeterministic() {
        String text = "First sentence here. Second sentence there!\n\nAnother paragraph? Yes, indeed.";
        assertEquals(chunkingService.chunk(text, 30, 5), chunkingService.chunk(text, 30, 5));
    }
}
