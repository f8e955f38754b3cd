package express.mvp.myra.shutdown;

import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Registry of pending waiter futures with slot reuse.
 *
 * <p>Each pending waiter owns one slot. Deregistering frees the slot for the next registration,
 * and free slots at the end of the list are trimmed, so the list never holds more slots than the
 * highest occupied index. {@link #drain()} hands out every pending waiter and clears the list;
 * keys from before a drain no longer match anything and deregistering them is a no-op.
 *
 * <p>Waiters are held weakly. A waiter whose future became unreachable was abandoned by its
 * caller; its slot is freed on the next registration, count or drain.
 *
 * <p>Not thread-safe. {@link ShutdownState} guards every instance with its lock.
 *
 * @param <V> the value type the waiters complete with
 */
final class WaiterList<V> {

    /** Registrations by slot index; null marks a free slot. */
    private final List<Key<V>> slots = new ArrayList<>();

    /** Indexes of free slots below {@code slots.size()}. */
    private final BitSet freeSlots = new BitSet();

    /** Registrations whose waiter was garbage collected. */
    private final ReferenceQueue<CompletableFuture<V>> collected = new ReferenceQueue<>();

    /** Number of occupied slots. */
    private int live;

    /**
     * Registers a waiter.
     *
     * @param waiter the future to complete on the next drain
     * @return the key for deregistering the waiter
     */
    Key<V> register(CompletableFuture<V> waiter) {
        expungeCollected();
        live++;
        int free = freeSlots.nextSetBit(0);
        if (free >= 0) {
            freeSlots.clear(free);
            Key<V> key = new Key<>(waiter, collected, free);
            slots.set(free, key);
            return key;
        }
        Key<V> key = new Key<>(waiter, collected, slots.size());
        slots.add(key);
        return key;
    }

    /**
     * Removes a waiter so the next drain does not hand it out.
     *
     * @param key the key returned by {@link #register(CompletableFuture)}
     * @return true if the waiter was still registered
     */
    boolean deregister(Key<V> key) {
        if (!free(key)) {
            return false;
        }
        key.clear();
        return true;
    }

    /**
     * Removes and returns every registered waiter that is still reachable.
     *
     * <p>The caller completes the returned futures after releasing the lock.
     *
     * @return the waiters that were registered
     */
    List<CompletableFuture<V>> drain() {
        expungeCollected();
        List<CompletableFuture<V>> waiters = new ArrayList<>(live);
        for (Key<V> key : slots) {
            if (key == null) {
                continue;
            }
            CompletableFuture<V> waiter = key.get();
            if (waiter != null) {
                waiters.add(waiter);
            }
            key.clear();
        }
        slots.clear();
        freeSlots.clear();
        live = 0;
        return waiters;
    }

    /**
     * Returns the number of registered waiters.
     *
     * @return live registrations
     */
    int size() {
        expungeCollected();
        return live;
    }

    /**
     * Returns the number of slots, including free ones.
     *
     * @return total slots
     */
    int totalSlots() {
        expungeCollected();
        return slots.size();
    }

    /** Frees the slots of waiters that were garbage collected. */
    @SuppressWarnings("unchecked")
    private void expungeCollected() {
        Key<V> key;
        while ((key = (Key<V>) collected.poll()) != null) {
            free(key);
        }
    }

    private boolean free(Key<V> key) {
        int index = key.index();
        if (index >= slots.size() || slots.get(index) != key) {
            return false;
        }
        slots.set(index, null);
        freeSlots.set(index);
        live--;
        trimTrailingFreeSlots();
        return true;
    }

    private void trimTrailingFreeSlots() {
        int size = slots.size();
        while (size > 0 && slots.get(size - 1) == null) {
            size--;
            slots.remove(size);
            freeSlots.clear(size);
        }
    }

    /**
     * One registration: a weak reference to the waiter plus its slot index.
     *
     * <p>Keys match by identity, so a key whose slot was freed and reused never frees the new
     * occupant.
     *
     * @param <V> the value type the waiter completes with
     */
    static final class Key<V> extends WeakReference<CompletableFuture<V>> {

        private final int index;

        Key(CompletableFuture<V> waiter, ReferenceQueue<CompletableFuture<V>> queue, int index) {
            super(waiter, queue);
            this.index = index;
        }

        int index() {
            return index;
        }
    }
}
