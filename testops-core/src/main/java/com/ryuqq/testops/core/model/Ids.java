package com.ryuqq.testops.core.model;

import java.security.SecureRandom;
import java.util.UUID;

/**
 * ID 생성 유틸리티.
 *
 * <ul>
 *   <li>짧은 ID: 10자, URL-safe 영숫자 (프로젝트, 스케줄, Suite, 임시 파일명)</li>
 *   <li>Run ID: UUID</li>
 * </ul>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public final class Ids {

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final int SHORT_ID_LENGTH = 10;
    private static final SecureRandom RANDOM = new SecureRandom();

    private Ids() {
    }

    public static String shortId() {
        StringBuilder sb = new StringBuilder(SHORT_ID_LENGTH);
        for (int i = 0; i < SHORT_ID_LENGTH; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    public static String runId() {
        return UUID.randomUUID().toString();
    }
}
