package com.phillippitts.phiredaction.service.buffer;

import java.util.Objects;

/**
 * Read-only copy of a buffer taken at a specific version.
 *
 * @param text    buffer content at {@code version}
 * @param version buffer version the copy was taken at
 */
public record BufferView(String text, long version) {

    public BufferView {
        Objects.requireNonNull(text, "text");
    }

    public int length() {
        return text.length();
    }
}
