package io.taskmaster.parser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class PlainTextParser implements Parser {
    static final int SAMPLE_BYTES = 4096;
    private static final int PREVIEW_CHARS = 200;
    private static final Set<String> EXTS = Set.of(".txt", ".md", ".csv", ".json");

    @Override
    public String id() {
        return "text";
    }

    @Override
    public boolean supports(Path path) {
        return Extensions.hasAny(path, EXTS);
    }

    @Override
    public ValidationResult quickValidate(Path path) throws IOException {
        byte[] sample = sample(path);
        for (byte b : sample) {
            if (b == 0) {
                return ValidationResult.invalid("binary_content_in_text_file");
            }
        }
        return ValidationResult.ok();
    }

    @Override
    public Map<String, Object> extractIndexMetadata(Path path) throws IOException {
        byte[] sample = sample(path);
        long size = Files.size(path);
        String encoding = "utf-8";
        String text;
        try {
            text = decodeUtf8(sample, size <= sample.length);
        } catch (CharacterCodingException e) {
            encoding = "iso-8859-1";
            text = new String(sample, StandardCharsets.ISO_8859_1);
        }
        long lines = 0;
        try (InputStream in = Files.newInputStream(path)) {
            byte[] buf = new byte[64 * 1024];
            int n;
            boolean any = false;
            int last = -1;
            while ((n = in.read(buf)) > 0) {
                any = true;
                for (int i = 0; i < n; i++) {
                    if (buf[i] == '\n') {
                        lines++;
                    }
                }
                last = buf[n - 1];
            }
            if (any && last != '\n') {
                lines++;
            }
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("encoding", encoding);
        fields.put("line_count", lines);
        fields.put("preview", text.length() > PREVIEW_CHARS ? text.substring(0, PREVIEW_CHARS) : text);
        fields.put("sampled_bytes", sample.length);
        fields.put("size_bytes", size);
        return fields;
    }

    /**
     * Strict UTF-8 decode. Unless the sample is the whole file, an incomplete sequence at its end
     * is left undecoded instead of being reported as malformed.
     */
    static String decodeUtf8(byte[] sample, boolean wholeFile) throws CharacterCodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        CharBuffer out = CharBuffer.allocate(sample.length);
        CoderResult result = decoder.decode(ByteBuffer.wrap(sample), out, wholeFile);
        if (result.isError()) {
            result.throwException();
        }
        if (wholeFile) {
            result = decoder.flush(out);
            if (result.isError()) {
                result.throwException();
            }
        }
        out.flip();
        return out.toString();
    }

    private static byte[] sample(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return in.readNBytes(SAMPLE_BYTES);
        }
    }
}
