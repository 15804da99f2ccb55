package com.ryuqq.loadguard.core.task;

/**
 * Task 실패 정보.
 *
 * <p>작업 예외는 제출 경로로 다시 던져지지 않고 이 형태로 핸들에 기록됩니다.</p>
 *
 * @param errorCode 오류 코드 (예: TASK-ERROR, TASK-CANCELLED, TASK-ABORTED)
 * @param message 오류 메시지
 * @param cause 원인 예외 (취소/종료 시 null)
 * @author LoadGuard Team
 * @since 1.0.0
 */
public record TaskFailure(String errorCode, String message, Throwable cause) {

    /** 작업 자체가 예외를 던진 경우. */
    public static final String TASK_ERROR = "TASK-ERROR";

    /** 시작 전 취소된 경우. */
    public static final String TASK_CANCELLED = "TASK-CANCELLED";

    /** 실행기 종료로 시작하지 못한 경우. */
    public static final String TASK_ABORTED = "TASK-ABORTED";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public TaskFailure {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * 작업 예외로부터 실패 정보 생성.
     *
     * <p>메시지는 "예외클래스: 메시지" 형식입니다.</p>
     *
     * @param throwable 작업이 던진 예외
     * @return TaskFailure (errorCode=TASK-ERROR)
     * @throws IllegalArgumentException throwable이 null인 경우
     */
    public static TaskFailure fromThrowable(Throwable throwable) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        String message = throwable.getMessage() == null
            ? throwable.getClass().getName()
            : throwable.getClass().getName() + ": " + throwable.getMessage();
        return new TaskFailure(TASK_ERROR, message, throwable);
    }

    /**
     * 취소 실패 정보.
     *
     * @return TaskFailure (errorCode=TASK-CANCELLED)
     */
    public static TaskFailure cancelled() {
        return new TaskFailure(TASK_CANCELLED, "Task was cancelled before it started", null);
    }

    /**
     * 실행기 종료 실패 정보.
     *
     * @return TaskFailure (errorCode=TASK-ABORTED)
     */
    public static TaskFailure aborted() {
        return new TaskFailure(TASK_ABORTED, "Executor shut down before the task started", null);
    }
}
