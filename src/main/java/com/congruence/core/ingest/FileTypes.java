package com.congruence.core.ingest;

import java.util.Locale;
import java.util.Map;

/**
 * Extension and language lookup for mined file paths.
 */
public final class FileTypes {

    static final String NO_EXTENSION = "no_ext";

    private static final Map<String, String> LANGUAGES = Map.ofEntries(
            Map.entry("java", "Java"),
            Map.entry("kt", "Kotlin"),
            Map.entry("scala", "Scala"),
            Map.entry("py", "Python"),
            Map.entry("js", "JavaScript"),
            Map.entry("jsx", "JavaScript"),
            Map.entry("ts", "TypeScript"),
            Map.entry("tsx", "TypeScript"),
            Map.entry("go", "Go"),
            Map.entry("rs", "Rust"),
            Map.entry("c", "C"),
            Map.entry("h", "C"),
            Map.entry("cpp", "C++"),
            Map.entry("cc", "C++"),
            Map.entry("hpp", "C++"),
            Map.entry("cs", "C#"),
            Map.entry("rb", "Ruby"),
            Map.entry("php", "PHP"),
            Map.entry("swift", "Swift")
    );

    private FileTypes() {}

    /**
     * Lower-case text after the last {@code .} of the file name, or {@code no_ext}.
     */
    public static String extension(String path) {
        if (path == null) {
            return NO_EXTENSION;
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return NO_EXTENSION;
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Language name for known source extensions, null otherwise.
     */
    public static String language(String path) {
        return LANGUAGES.get(extension(path));
    }
}
