package ai.pipestream.workspace.node;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Consistency boundary for the node tree and its grants.
 * <p>
 * Readers (resolution, listings) share the lock; structural and grant mutations hold it
 * exclusively. An authorization decision and the action it guards run inside one
 * exclusive section, so the ancestor chain and grants the decision observed cannot
 * change before the action completes.
 * <p>
 * Every section is also a database transaction. The outermost section begins it and
 * commits before the lock is released, so the next holder always reads committed rows;
 * nested sections join it. A runtime exception thrown anywhere in the section rolls the
 * whole transaction back.
 */
@ApplicationScoped
public class TreeLock {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Run a task while holding the shared side of the lock.
     */
    public <T> T read(Supplier<T> task) {
        ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
        readLock.lock();
        try {
            return inTransaction(task);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Run a task while holding the exclusive side of the lock.
     * <p>
     * A thread holding only the shared side cannot upgrade; callers that may write must
     * enter through this method first.
     */
    public <T> T write(Supplier<T> task) {
        if (lock.getReadHoldCount() > 0 && !lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("Cannot upgrade a read section to a write section");
        }
        ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            return inTransaction(task);
        } finally {
            writeLock.unlock();
        }
    }

    public boolean isWriteLockedByCurrentThread() {
        return lock.isWriteLockedByCurrentThread();
    }

    private static <T> T inTransaction(Supplier<T> task) {
        return QuarkusTransaction.joiningExisting().call(task::get);
    }
}
