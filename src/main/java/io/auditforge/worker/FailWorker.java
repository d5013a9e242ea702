package io.auditforge.worker;

public final class FailWorker implements Worker {
    @Override
    public String id() {
        return "fail";
    }

    @Override
    public WorkerResult execute(WorkerContext context) {
        return WorkerResult.fail("intentional failure from fail worker");
    }
}
