package com.ryuqq.testops.adapter.runner;

import java.util.Locale;
import java.util.Optional;

/**
 * 파일 확장자 기반 실행 버킷.
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public enum FileKind {

    JAVA("Java", "java"),
    PYTHON("Python", "python"),

    /**
     * .ts / .js. 브라우저 스위트로 한 번에 실행됩니다.
     */
    BROWSER("Playwright", null);

    private final String label;
    private final String language;

    FileKind(String label, String language) {
        this.label = label;
        this.language = language;
    }

    /**
     * 파일 이름으로 분류. 알 수 없는 확장자는 empty.
     */
    public static Optional<FileKind> of(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toLowerCase(Locale.ROOT);
        if (name.endsWith(".java")) {
            return Optional.of(JAVA);
        }
        if (name.endsWith(".py")) {
            return Optional.of(PYTHON);
        }
        if (name.endsWith(".ts") || name.endsWith(".js")) {
            return Optional.of(BROWSER);
        }
        return Optional.empty();
    }

    public String label() {
        return label;
    }

    /**
     * CodeExecutor에 넘길 언어 이름. BROWSER는 null.
     */
    public String language() {
        return language;
    }
}
