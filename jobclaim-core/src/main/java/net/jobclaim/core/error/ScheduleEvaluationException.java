package net.jobclaim.core.error;

/** 표현식으로 평가 시점 이후의 due 를 구하지 못함 */
public class ScheduleEvaluationException extends Exception {
    private final String expression;

    public ScheduleEvaluationException(String expression, String message, Throwable cause) {
        super(message, cause);
        this.expression = expression;
    }

    public ScheduleEvaluationException(String expression, String message) {
        this(expression, message, null);
    }

    public String getExpression() {
        return expression;
    }
}
