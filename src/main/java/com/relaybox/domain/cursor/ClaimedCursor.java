package com.relaybox.domain.cursor;

/**
 * Cursor state read back by a successful lock claim, together with the retry count
 * the row carried at that moment.
 */
public record ClaimedCursor(CursorState state, int retryCount) {
}
