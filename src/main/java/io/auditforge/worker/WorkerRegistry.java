package io.auditforge.worker;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class WorkerRegistry {
    private final Map<String, Worker> workers = new ConcurrentHashMap<>();

    public void register(Worker worker) {
        workers.put(worker.id(), worker);
    }

    public Optional<Worker> findById(String workerClass) {
        return Optional.ofNullable(workers.get(workerClass));
    }

    public Collection<String> listWorkerIds() {
        return List.copyOf(workers.keySet()).stream().sorted().toList();
    }
}
