package com.phillippitts.phiredaction.service.buffer;

import com.phillippitts.phiredaction.domain.Chunk;
import com.phillippitts.phiredaction.exception.ChunkValidationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only, session-scoped concatenation of transcript chunks.
 *
 * <p>Text is only ever appended at the end, so an offset computed against version N stays valid
 * for every later version. Consecutive chunks are joined by a separator; the base offset
 * reported for a chunk is the offset of its first character, not of the separator.
 *
 * <p>Thread-safe: all methods synchronize on the buffer instance.
 */
public final class ChunkBuffer {

    /**
     * Placement of one chunk's text in the buffer.
     */
    public record ChunkSpan(Chunk chunk, int start, int end) {}

    private final String sessionId;
    private final String separator;
    private final StringBuilder text = new StringBuilder();
    private final List<ChunkSpan> spans = new ArrayList<>();
    private long version = 0;
    private Instant lastIngest;

    public ChunkBuffer(String sessionId, String separator) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.separator = separator == null ? "" : separator;
    }

    /**
     * Appends a chunk at the current end of the buffer.
     *
     * @param chunk chunk whose fields have already passed {@link ChunkValidator}
     * @return new version and the chunk's offsets
     * @throws ChunkValidationException if the chunk belongs to another session or its ingest
     *         timestamp is older than the last appended chunk
     */
    public synchronized AppendResult append(Chunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        if (!sessionId.equals(chunk.sessionId())) {
            throw new ChunkValidationException(sessionId, chunk.chunkId(),
                    "Chunk belongs to session " + chunk.sessionId());
        }
        if (lastIngest != null && chunk.ingestTimestamp().isBefore(lastIngest)) {
            throw new ChunkValidationException(sessionId, chunk.chunkId(),
                    "Out-of-order chunk: ingest timestamp " + chunk.ingestTimestamp()
                            + " is older than last appended " + lastIngest);
        }
        if (!text.isEmpty()) {
            text.append(separator);
        }
        int start = text.length();
        text.append(chunk.text());
        int end = text.length();
        spans.add(new ChunkSpan(chunk, start, end));
        lastIngest = chunk.ingestTimestamp();
        version++;
        return new AppendResult(version, start, end);
    }

    public synchronized long version() {
        return version;
    }

    public synchronized int length() {
        return text.length();
    }

    /**
     * Copy-on-read view of the whole buffer at its current version.
     */
    public synchronized BufferView view() {
        return new BufferView(text.toString(), version);
    }

    /**
     * Returns whether the first {@code prefix.length()} characters of the buffer equal {@code prefix}.
     * Used to verify that a snapshot still describes this buffer.
     */
    public synchronized boolean startsWith(String prefix) {
        if (prefix.length() > text.length()) {
            return false;
        }
        for (int i = 0; i < prefix.length(); i++) {
            if (text.charAt(i) != prefix.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Finds the chunk whose text contains {@code offset}.
     */
    public synchronized Optional<ChunkSpan> chunkAt(int offset) {
        int lo = 0;
        int hi = spans.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            ChunkSpan s = spans.get(mid);
            if (offset < s.start()) {
                hi = mid - 1;
            } else if (offset >= s.end()) {
                lo = mid + 1;
            } else {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    public String sessionId() {
        return sessionId;
    }
}
