package io.qlogic.core.editor;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/// Outstanding persistence operations owned by one editor.
///
/// Every save, create and delete the editor starts is tracked here, so closing the editor
/// can wait until nothing is left in flight. Work started while waiting is awaited too.
///
/// @implNote Thread-safe. Failures are not rethrown: each operation records its own outcome
/// in the editor's save status.
final class PendingSaves {

    private final Set<CompletableFuture<?>> outstanding = ConcurrentHashMap.newKeySet();

    /// Tracks an operation until it completes.
    ///
    /// @param operation future of the operation, not null
    /// @return the same future
    <T> CompletableFuture<T> track(CompletableFuture<T> operation) {
        outstanding.add(operation);
        operation.whenComplete((result, error) -> outstanding.remove(operation));
        return operation;
    }

    /// Blocks until no tracked operation is left, including operations tracked meanwhile.
    void awaitAll() {
        while (true) {
            outstanding.removeIf(CompletableFuture::isDone);
            List<CompletableFuture<?>> snapshot = List.copyOf(outstanding);
            if (snapshot.isEmpty()) {
                return;
            }
            CompletableFuture.allOf(snapshot.toArray(CompletableFuture[]::new))
                    .handle((result, error) -> null)
                    .join();
        }
    }

    /// Returns the number of operations still in flight.
    ///
    /// @return outstanding count
    int size() {
        outstanding.removeIf(CompletableFuture::isDone);
        return outstanding.size();
    }
}
