package io.github.hongjungwan.responsemask.api.exception;

/**
 * 마스킹 실패 최상위 예외. 실패 시 해당 호출 전체가 중단되며 원본 데이터는 변경되지 않음.
 */
public class MaskingException extends RuntimeException {

    public MaskingException(String message) {
        super(message);
    }

    public MaskingException(String message, Throwable cause) {
        super(message, cause);
    }
}
