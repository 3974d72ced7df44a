package net.jobclaim.core.error;

/** 저장소 접근 실패. VERSION 충돌(0 rows)은 여기 해당하지 않는다 */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
