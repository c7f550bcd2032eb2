package com.kbsearch.common.constants;

import java.util.Locale;
import java.util.Set;

public final class FileTypes {
    public static final Set<String> PDF_TYPES = Set.of("pdf");
    public static final Set<String> TEXT_TYPES = Set.of("txt", "md");
    
    private FileTypes() {}
    
    public static boolean isText(String extension) {
        return extension != null && TEXT_TYPES.contains(normalize(extension));
    }
    
    public static boolean isPdf(String extension) {
        return extension != null && PDF_TYPES.contains(normalize(extension));
    }
    
    public static String normalize(String extension) {
        String ext = extension.trim().toLowerCase(Locale.ROOT);
        return ext.startsWith(".") ? ext.substring(1) : ext;
    }
}
