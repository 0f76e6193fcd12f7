package fleet.orchestrator;

import fleet.FleetException;
import fleet.session.SessionHandle;
import fleet.task.BrowserTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes submitted tasks in parallel across sessions and strictly in
 * submission order within each session.
 *
 * <p>Submissions are grouped into one chain per session index before any
 * worker starts. Each chain is a single job on a bounded pool, so one worker
 * owns one session for the whole chain and no two workers ever touch the same
 * {@link SessionHandle}. {@link #run} returns only after every chain finished.
 *
 * <p>A failing task is logged, never retried, and is not reported to the
 * {@link SuccessListener}. Whether the rest of its chain still runs is
 * decided by the {@link ErrorPolicy}.
 */
public class ChainScheduler {

    private static final Logger log = LoggerFactory.getLogger(ChainScheduler.class);

    /** Called on the worker thread after a task returned normally. */
    @FunctionalInterface
    public interface SuccessListener {
        void onSuccess(BrowserTask task, int sessionIndex);
    }

    private final int maxWorkers;
    private final ErrorPolicy errorPolicy;
    private final AtomicInteger threadCounter = new AtomicInteger();

    public ChainScheduler(int maxWorkers, ErrorPolicy errorPolicy) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1, got " + maxWorkers);
        }
        this.maxWorkers  = maxWorkers;
        this.errorPolicy = errorPolicy != null ? errorPolicy : ErrorPolicy.CONTINUE;
    }

    /**
     * Runs every submission and waits for all chains to finish.
     *
     * @param submissions tasks in submission order
     * @param sessions    live handles by session index
     * @param listener    notified after each successful task, on the worker thread
     * @return one outcome per submission, grouped by session in execution order
     * @throws FleetException if the calling thread is interrupted while waiting
     */
    public List<TaskOutcome> run(List<Submission> submissions,
                                 Map<Integer, SessionHandle> sessions,
                                 SuccessListener listener) {
        Map<Integer, List<BrowserTask>> chains = partition(submissions);
        if (chains.isEmpty()) {
            return List.of();
        }

        int workers = Math.min(chains.size(), maxWorkers);
        log.info("Running {} task(s) in {} session chain(s) on {} worker(s), policy={}",
                submissions.size(), chains.size(), workers, errorPolicy);

        List<Callable<List<TaskOutcome>>> jobs = new ArrayList<>();
        chains.forEach((index, chain) ->
                jobs.add(() -> runChain(index, sessions.get(index), chain, listener)));

        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "session-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<TaskOutcome> outcomes = new ArrayList<>(submissions.size());
            for (Future<List<TaskOutcome>> f : pool.invokeAll(jobs)) {
                outcomes.addAll(f.get());
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FleetException("Interrupted while waiting for session chains to finish", e);
        } catch (ExecutionException e) {
            throw new FleetException("Session chain crashed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    /** Groups submissions by session index, preserving submission order inside each group. */
    static Map<Integer, List<BrowserTask>> partition(List<Submission> submissions) {
        Map<Integer, List<BrowserTask>> chains = new LinkedHashMap<>();
        for (Submission s : submissions) {
            chains.computeIfAbsent(s.sessionIndex(), k -> new ArrayList<>()).add(s.task());
        }
        return chains;
    }

    private List<TaskOutcome> runChain(int index, SessionHandle handle, List<BrowserTask> chain,
                                       SuccessListener listener) {
        List<TaskOutcome> outcomes = new ArrayList<>(chain.size());
        log.debug("Session {} chain started ({} task(s))", index, chain.size());
        boolean skipRest = false;

        for (BrowserTask task : chain) {
            if (skipRest || Thread.currentThread().isInterrupted()) {
                log.warn("Session {}: skipping task '{}'", index, task.getName());
                outcomes.add(new TaskOutcome(index, task.getName(), TaskOutcome.Status.SKIPPED, null, null));
                continue;
            }
            if (handle == null) {
                String reason = "no live session with index " + index;
                log.error("Session {}: task '{}' failed: {}", index, task.getName(), reason);
                outcomes.add(new TaskOutcome(index, task.getName(), TaskOutcome.Status.FAILED, reason, null));
                skipRest = errorPolicy == ErrorPolicy.ABORT_CHAIN;
                continue;
            }

            try {
                task.execute(handle);
            } catch (RuntimeException e) {
                log.error("Session {}: task '{}' failed: {}", index, task.getName(), e.getMessage(), e);
                outcomes.add(new TaskOutcome(index, task.getName(), TaskOutcome.Status.FAILED,
                        e.getMessage(), task.getElapsed()));
                skipRest = errorPolicy == ErrorPolicy.ABORT_CHAIN;
                continue;
            }

            outcomes.add(new TaskOutcome(index, task.getName(), TaskOutcome.Status.SUCCEEDED,
                    null, task.getElapsed()));
            if (listener != null) {
                try {
                    listener.onSuccess(task, index);
                } catch (RuntimeException e) {
                    log.error("Session {}: could not record task '{}': {}", index, task.getName(), e.getMessage(), e);
                }
            }
        }

        log.debug("Session {} chain finished", index);
        return outcomes;
    }
}
