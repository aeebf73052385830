package io.taskmaster.scan;

import java.net.URLConnection;
import java.util.Locale;
import java.util.Map;

public final class MimeTypes {
    private static final Map<String, String> BY_EXT = Map.ofEntries(
            Map.entry(".pdf", "application/pdf"),
            Map.entry(".docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
            Map.entry(".xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
            Map.entry(".pptx", "application/vnd.openxmlformats-officedocument.presentationml.presentation"),
            Map.entry(".txt", "text/plain"),
            Map.entry(".md", "text/markdown"),
            Map.entry(".csv", "text/csv"),
            Map.entry(".json", "application/json"),
            Map.entry(".jpg", "image/jpeg"),
            Map.entry(".jpeg", "image/jpeg"),
            Map.entry(".png", "image/png"),
            Map.entry(".tif", "image/tiff"),
            Map.entry(".tiff", "image/tiff"),
            Map.entry(".webp", "image/webp"),
            Map.entry(".mp3", "audio/mpeg"),
            Map.entry(".m4a", "audio/mp4"),
            Map.entry(".wav", "audio/wav"),
            Map.entry(".flac", "audio/flac"),
            Map.entry(".mp4", "video/mp4"),
            Map.entry(".mov", "video/quicktime"),
            Map.entry(".mkv", "video/x-matroska"),
            Map.entry(".avi", "video/x-msvideo")
    );

    private MimeTypes() {
    }

    public static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * Guess from the file name only; never reads content. Null when unknown.
     */
    public static String guess(String fileName) {
        String known = BY_EXT.get(extensionOf(fileName));
        if (known != null) {
            return known;
        }
        return URLConnection.guessContentTypeFromName(fileName);
    }
}
