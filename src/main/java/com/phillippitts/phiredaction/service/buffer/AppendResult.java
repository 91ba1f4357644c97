package com.phillippitts.phiredaction.service.buffer;

/**
 * Outcome of appending a chunk to a session buffer.
 *
 * @param version    buffer version after the append
 * @param baseOffset offset of the chunk's first character in the buffer
 * @param endOffset  exclusive end offset of the chunk text
 */
public record AppendResult(long version, int baseOffset, int endOffset) {}
