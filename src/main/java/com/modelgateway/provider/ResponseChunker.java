package com.modelgateway.provider;

import com.modelgateway.model.InferenceResult;
import com.modelgateway.model.StreamChunk;

import java.util.ArrayList;
import java.util.List;

/**
 * Replays a complete result as stream chunks, for providers or payloads
 * without native streaming. Deterministic: the same output always produces
 * the same chunks.
 */
final class ResponseChunker {

    static final int CHUNK_SIZE = 8;

    // How far past the nominal chunk end to look for a word boundary
    private static final int BOUNDARY_LOOKAHEAD = 3;

    private ResponseChunker() {
    }

    static List<StreamChunk> chunk(InferenceResult result) {
        List<StreamChunk> chunks = new ArrayList<>();
        int index = 0;
        for (String piece : split(result.getOutput() == null ? "" : result.getOutput())) {
            chunks.add(StreamChunk.builder()
                    .modelId(result.getModelId())
                    .provider(result.getProvider())
                    .index(index++)
                    .contentDelta(piece)
                    .build());
        }
        chunks.add(StreamChunk.builder()
                .modelId(result.getModelId())
                .provider(result.getProvider())
                .index(index)
                .finalChunk(true)
                .finishReason("stop")
                .outputTokens(result.getOutputTokens())
                .build());
        return chunks;
    }

    /**
     * Split into chunks of about {@link #CHUNK_SIZE} characters, preferring to
     * end a chunk just after whitespace.
     */
    static List<String> split(String content) {
        List<String> pieces = new ArrayList<>();
        int pos = 0;
        while (pos < content.length()) {
            int end = Math.min(pos + CHUNK_SIZE, content.length());
            if (end < content.length()) {
                for (int i = end; i < Math.min(end + BOUNDARY_LOOKAHEAD, content.length()); i++) {
                    if (Character.isWhitespace(content.charAt(i))) {
                        end = i + 1;
                        break;
                    }
                }
            }
            pieces.add(content.substring(pos, end));
            pos = end;
        }
        return pieces;
    }
}
