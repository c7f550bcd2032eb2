package com.kbsearch.common.constants;

import java.util.Set;

/**
 * Allowed values of {@code knowledge_documents.category}.
 */
public final class DocumentCategories {
    public static final String SPEC_SHEET = "spec-sheet";
    public static final String INSTALLATION_GUIDE = "installation-guide";
    public static final String TROUBLESHOOTING = "troubleshooting";
    public static final String TRAINING = "training";
    public static final String TECHNICAL_BULLETIN = "technical-bulletin";
    public static final String USER_MANUAL = "user-manual";
    public static final String QUICK_REFERENCE = "quick-reference";
    public static final String OTHER = "other";
    
    public static final Set<String> ALL = Set.of(
        SPEC_SHEET, INSTALLATION_GUIDE, TROUBLESHOOTING, TRAINING,
        TECHNICAL_BULLETIN, USER_MANUAL, QUICK_REFERENCE, OTHER
    );
    
    private DocumentCategories() {}
    
    public static boolean isValid(String category) {
        return category != null && ALL.contains(category);
    }
}
