package io.taskmaster.parser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks the {@code %PDF-} header and estimates page count from page objects.
 */
public final class PdfSignatureParser implements Parser {
    private static final byte[] SIGNATURE = "%PDF-".getBytes(StandardCharsets.US_ASCII);
    private static final int MAX_SCAN_BYTES = 8 * 1024 * 1024;
    private static final Pattern VERSION = Pattern.compile("^%PDF-(\\d\\.\\d)");
    private static final Pattern PAGE_OBJECT = Pattern.compile("/Type\\s*/Page(?![a-zA-Z])");

    @Override
    public String id() {
        return "pdf";
    }

    @Override
    public boolean supports(Path path) {
        return Extensions.hasAny(path, Set.of(".pdf"));
    }

    @Override
    public ValidationResult quickValidate(Path path) throws IOException {
        byte[] head = new byte[SIGNATURE.length];
        int read;
        try (InputStream in = Files.newInputStream(path)) {
            read = in.readNBytes(head, 0, head.length);
        }
        if (read < SIGNATURE.length) {
            return ValidationResult.invalid("invalid_pdf_signature");
        }
        for (int i = 0; i < SIGNATURE.length; i++) {
            if (head[i] != SIGNATURE[i]) {
                return ValidationResult.invalid("invalid_pdf_signature");
            }
        }
        return ValidationResult.ok();
    }

    @Override
    public Map<String, Object> extractIndexMetadata(Path path) throws IOException {
        byte[] bytes;
        try (InputStream in = Files.newInputStream(path)) {
            bytes = in.readNBytes(MAX_SCAN_BYTES);
        }
        // Latin-1 keeps a one-to-one byte mapping for binary streams.
        String text = new String(bytes, StandardCharsets.ISO_8859_1);
        Map<String, Object> fields = new LinkedHashMap<>();
        Matcher version = VERSION.matcher(text);
        fields.put("pdf_version", version.find() ? version.group(1) : null);
        int pages = 0;
        Matcher page = PAGE_OBJECT.matcher(text);
        while (page.find()) {
            pages++;
        }
        fields.put("page_count_estimate", pages);
        fields.put("scan_truncated", bytes.length >= MAX_SCAN_BYTES);
        return fields;
    }
}
