package io.messageformat.core.function;

import io.messageformat.core.config.FormatConfig;
import io.messageformat.core.error.MessageResolutionException;
import io.messageformat.core.spi.MessageFunction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Functions by name. Lookup is exact and case-sensitive.
 *
 * <p>Thread-safe: {@link #register} and {@link #merge} take the write lock, lookups share the
 * read lock. Registries are independent of each other; {@link #copy()} never shares state.
 */
public final class FunctionRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionRegistry.class);

    private final Map<String, MessageFunction> functions;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private FunctionRegistry(Map<String, MessageFunction> functions) {
        this.functions = new HashMap<>(functions);
    }

    /** A registry without any functions. */
    public static FunctionRegistry empty() {
        return new FunctionRegistry(Map.of());
    }

    /** A registry with the stable built-in functions. */
    public static FunctionRegistry withDefaults() {
        return new FunctionRegistry(BuiltinFunctions.STABLE);
    }

    /** A registry with the stable and the draft built-in functions. */
    public static FunctionRegistry withDraft() {
        FunctionRegistry registry = withDefaults();
        registry.functions.putAll(BuiltinFunctions.DRAFT);
        return registry;
    }

    /** {@link #withDraft()} or {@link #withDefaults()}, as configured. */
    public static FunctionRegistry forConfig(FormatConfig config) {
        return config.draftFunctions() ? withDraft() : withDefaults();
    }

    /**
     * Registers a function, replacing any function of the same name.
     *
     * @throws NullPointerException if name or function is null
     * @throws IllegalArgumentException if name is empty
     */
    public void register(String name, MessageFunction function) {
        if (name == null) {
            throw new NullPointerException("name must not be null");
        }
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        if (function == null) {
            throw new NullPointerException("function must not be null");
        }
        lock.writeLock().lock();
        try {
            functions.put(name, function);
        } finally {
            lock.writeLock().unlock();
        }
        LOG.debug("Registered function :{}", name);
    }

    /** Looks up a function by name. */
    public Optional<MessageFunction> get(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(functions.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Looks up a function by name, throwing if it is not registered.
     *
     * @throws MessageResolutionException with type {@code unknown-function}
     */
    public MessageFunction require(String name) {
        return get(name).orElseThrow(() -> MessageResolutionException.unknownFunction(name, ":" + name));
    }

    /** Registered names, sorted. */
    public List<String> list() {
        List<String> names;
        lock.readLock().lock();
        try {
            names = new ArrayList<>(functions.keySet());
        } finally {
            lock.readLock().unlock();
        }
        Collections.sort(names);
        return names;
    }

    public boolean contains(String name) {
        lock.readLock().lock();
        try {
            return functions.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return functions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** An independent copy: later changes to either registry do not affect the other. */
    public FunctionRegistry copy() {
        lock.readLock().lock();
        try {
            return new FunctionRegistry(functions);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Adds every function of {@code other}; on a name collision the function of {@code other} wins. */
    public void merge(FunctionRegistry other) {
        if (other == this) {
            return;
        }
        Map<String, MessageFunction> snapshot;
        other.lock.readLock().lock();
        try {
            snapshot = new HashMap<>(other.functions);
        } finally {
            other.lock.readLock().unlock();
        }
        lock.writeLock().lock();
        try {
            functions.putAll(snapshot);
        } finally {
            lock.writeLock().unlock();
        }
        LOG.debug("Merged {} functions", snapshot.size());
    }
}
