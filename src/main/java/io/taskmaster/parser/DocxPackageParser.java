package io.taskmaster.parser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * A DOCX is valid when it opens as a ZIP package containing {@code word/document.xml}.
 */
public final class DocxPackageParser implements Parser {
    private static final String MAIN_PART = "word/document.xml";
    private static final String CORE_PROPERTIES = "docProps/core.xml";
    private static final Pattern TITLE = Pattern.compile("<dc:title>(.*?)</dc:title>", Pattern.DOTALL);

    @Override
    public String id() {
        return "docx";
    }

    @Override
    public boolean supports(Path path) {
        return Extensions.hasAny(path, Set.of(".docx"));
    }

    @Override
    public ValidationResult quickValidate(Path path) throws IOException {
        try (ZipFile zip = new ZipFile(path.toFile())) {
            return zip.getEntry(MAIN_PART) == null
                    ? ValidationResult.invalid("invalid_docx_zip")
                    : ValidationResult.ok();
        } catch (ZipException e) {
            return ValidationResult.invalid("invalid_docx_zip");
        }
    }

    @Override
    public Map<String, Object> extractIndexMetadata(Path path) throws IOException {
        Map<String, Object> fields = new LinkedHashMap<>();
        try (ZipFile zip = new ZipFile(path.toFile())) {
            fields.put("entry_count", zip.size());
            ZipEntry core = zip.getEntry(CORE_PROPERTIES);
            String title = null;
            if (core != null) {
                try (InputStream in = zip.getInputStream(core)) {
                    String xml = new String(in.readNBytes(256 * 1024), StandardCharsets.UTF_8);
                    Matcher m = TITLE.matcher(xml);
                    if (m.find()) {
                        title = m.group(1).trim();
                    }
                }
            }
            fields.put("title", title);
        }
        return fields;
    }
}
