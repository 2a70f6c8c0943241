package com.coderag.chunking;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class LanguageDetectors {
    private static final Pattern ANNOTATION_LINE = Pattern.compile("@(?!interface\\b)[\\w.]+");

    private static final Pattern PYTHON_DECL = Pattern.compile("(?:class|def|async\\s+def)\\s+(\\w+)");

    private static final Pattern KOTLIN_DECL = Pattern.compile(
            "(?:(?:public|private|protected|internal|abstract|open|final|data|sealed|inline|value|annotation|enum"
                    + "|override|suspend|const|tailrec|operator|infix|external|expect|actual|fun)\\s+)*"
                    + "(?:class|interface|object|fun|val|var)\\b"
                    + "(?:\\s+(?:<[^>]*>\\s*)?(?:\\w+(?:<[^>]*>)?\\.)?(\\w+))?");

    private static final Pattern JAVA_DECL = Pattern.compile(
            "(?:(?:public|protected|private|abstract|final|static|sealed|non-sealed|strictfp)\\s+)*"
                    + "(?:class|interface|enum|record|@interface)\\s+(\\w+)");

    private static final Pattern JS_TS_DECL = Pattern.compile(
            "(?:export\\s+)?(?:default\\s+)?(?:declare\\s+)?(?:abstract\\s+)?(?:async\\s+)?"
                    + "(?:function\\b\\*?\\s*(\\w+)?"
                    + "|class\\s+(\\w+)"
                    + "|(?:const|let|var)\\s+(?!enum\\b)(\\w+)\\s*[=:]"
                    + "|interface\\s+(\\w+)"
                    + "|type\\s+(\\w+)"
                    + "|(?:const\\s+)?enum\\s+(\\w+))");

    private static final Pattern SQL_STATEMENT = Pattern.compile(
            "(CREATE|ALTER|DROP|INSERT|UPDATE|DELETE|SELECT|WITH|GRANT|REVOKE|BEGIN|COMMIT|MERGE)\\b"
                    + "(?:\\s+OR\\s+REPLACE)?"
                    + "(?:\\s+(?:TABLE|VIEW|FUNCTION|PROCEDURE|INDEX|TYPE|TRIGGER|SCHEMA|SEQUENCE))?"
                    + "(?:\\s+IF\\s+(?:NOT\\s+)?EXISTS)?"
                    + "(?:\\s+(?:INTO|FROM))?"
                    + "(?:\\s+([\\w.]+))?",
            Pattern.CASE_INSENSITIVE);

    private LanguageDetectors() {
    }

    public static BoundaryDetector python() {
        return new PatternBoundaryDetector("python", PYTHON_DECL, matcher -> matcher.group(1), false, ANNOTATION_LINE);
    }

    public static BoundaryDetector kotlin() {
        return new PatternBoundaryDetector("kotlin", KOTLIN_DECL, matcher -> matcher.group(1), true, ANNOTATION_LINE);
    }

    public static BoundaryDetector java() {
        return new PatternBoundaryDetector("java", JAVA_DECL, matcher -> matcher.group(1), true, ANNOTATION_LINE);
    }

    public static BoundaryDetector javascript() {
        return new PatternBoundaryDetector("javascript", JS_TS_DECL, LanguageDetectors::firstGroup, true, ANNOTATION_LINE);
    }

    public static BoundaryDetector typescript() {
        return new PatternBoundaryDetector("typescript", JS_TS_DECL, LanguageDetectors::firstGroup, true, ANNOTATION_LINE);
    }

    public static BoundaryDetector sql() {
        return new PatternBoundaryDetector("sql", SQL_STATEMENT, LanguageDetectors::sqlName, false, null);
    }

    private static String sqlName(Matcher statement) {
        String keyword = statement.group(1).toUpperCase(Locale.ROOT);
        return statement.group(2) == null ? keyword : keyword + " " + statement.group(2);
    }

    private static String firstGroup(Matcher matcher) {
        for (int i = 1; i <= matcher.groupCount(); i++) {
            if (matcher.group(i) != null) {
                return matcher.group(i);
            }
        }
        return null;
    }
}
