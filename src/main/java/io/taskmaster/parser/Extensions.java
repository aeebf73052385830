package io.taskmaster.parser;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

final class Extensions {
    private Extensions() {
    }

    static boolean hasAny(Path path, Set<String> exts) {
        Path name = path.getFileName();
        if (name == null) {
            return false;
        }
        String n = name.toString().toLowerCase(Locale.ROOT);
        int dot = n.lastIndexOf('.');
        return dot > 0 && exts.contains(n.substring(dot));
    }
}
