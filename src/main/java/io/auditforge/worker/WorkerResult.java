package io.auditforge.worker;

public record WorkerResult(
        boolean success,
        String output,
        String error
) {
    public static WorkerResult ok(String output) {
        return new WorkerResult(true, output, null);
    }

    public static WorkerResult fail(String error) {
        return new WorkerResult(false, null, error);
    }
}
