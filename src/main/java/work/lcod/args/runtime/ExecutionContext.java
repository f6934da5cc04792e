package work.lcod.args.runtime;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-request context handed to resolvers. Carries request attributes and the cancellation flag.
 */
public final class ExecutionContext {
    private final CancellationToken cancellationToken;
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    public ExecutionContext() {
        this(new CancellationToken());
    }

    public ExecutionContext(CancellationToken token) {
        this.cancellationToken = token == null ? new CancellationToken() : token;
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public void setAttribute(String key, Object value) {
        if (value == null) {
            attributes.remove(key);
        } else {
            attributes.put(key, value);
        }
    }

    public void ensureNotCancelled() {
        if (cancellationToken.isCancelled()) {
            throw new ExecutionCancelledException("Execution cancelled");
        }
    }

    public void cancel() {
        cancellationToken.cancel();
    }

    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }

    public static final class CancellationToken {
        private volatile boolean cancelled = false;

        public void cancel() {
            this.cancelled = true;
        }

        public boolean isCancelled() {
            return cancelled;
        }
    }

    public static final class ExecutionCancelledException extends RuntimeException {
        public ExecutionCancelledException(String message) {
            super(message);
        }
    }
}
