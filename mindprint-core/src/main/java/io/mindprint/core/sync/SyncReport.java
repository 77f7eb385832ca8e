package io.mindprint.core.sync;

import java.nio.file.Path;

/**
 * @param redistilled {@code true} when memory sources were present and the document was rebuilt from them
 */
public record SyncReport(String sellerUserId, Path document, int bullets, boolean redistilled) {
}
