/**
 * 실행자 SPI.
 *
 * <p>실제 스크립트 실행(서브프로세스, 브라우저 드라이버)은 이 패키지의 인터페이스 뒤에 숨겨집니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.testops.core.executor.CodeExecutor} - 파일 단위 실행</li>
 *   <li>{@link com.ryuqq.testops.core.executor.BrowserSuiteRunner} - 브라우저 스위트 일괄 실행</li>
 * </ul>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
package com.ryuqq.testops.core.executor;
