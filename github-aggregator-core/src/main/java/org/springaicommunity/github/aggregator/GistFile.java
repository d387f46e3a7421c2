package org.springaicommunity.github.aggregator;

import org.jspecify.annotations.Nullable;

/**
 * One file of a gist. File content is not carried; the list endpoint truncates it.
 *
 * @param filename the file name
 * @param type the MIME type reported by GitHub
 * @param language the detected language
 * @param rawUrl URL of the raw file content
 * @param size file size in bytes
 */
public record GistFile(String filename, @Nullable String type, @Nullable String language, @Nullable String rawUrl,
		long size) {
}
