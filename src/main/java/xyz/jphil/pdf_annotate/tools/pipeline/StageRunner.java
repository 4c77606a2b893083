package xyz.jphil.pdf_annotate.tools.pipeline;

import lombok.RequiredArgsConstructor;
import xyz.jphil.pdf_annotate.tools.ProgressAwareLogFormatter;
import xyz.jphil.pdf_annotate.tools.ProgressTracker;
import xyz.jphil.pdf_annotate.tools.exec.BoundedTaskScheduler;
import xyz.jphil.pdf_annotate.tools.exec.ToolInvocationException;
import xyz.jphil.pdf_annotate.tools.exec.WorkItem;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies a per-artifact transformation to a list of artifacts on the bounded scheduler.
 * The output list has the order of the input list, whatever order the tasks finish in.
 */
@RequiredArgsConstructor
public class StageRunner {

    private final BoundedTaskScheduler scheduler;
    private final ProgressAwareLogFormatter log;
    private final boolean showProgress;

    @FunctionalInterface
    public interface Transform {
        void apply(Artifact source, Artifact target) throws Exception;
    }

    /**
     * One task per input; each writes the input's {@code target} stage artifact.
     */
    public List<Artifact> mapEach(Stage target, String verb, List<Artifact> inputs, Transform transform) {
        var outputs = new ArrayList<Artifact>(inputs.size());
        var items = new ArrayList<WorkItem>(inputs.size());
        for (Artifact source : inputs) {
            Artifact out = source.advance(target);
            outputs.add(out);
            items.add(WorkItem.of(verb + " " + source.identity(), () -> {
                log.info(target.name(), verb + " " + source.identity() + "...");
                transform.apply(source, out);
                requireOutput(out);
            }));
        }
        runAll(target.name(), items);
        return List.copyOf(outputs);
    }

    /**
     * Runs prepared work items as one tracked batch.
     */
    public void runAll(String name, List<WorkItem> items) {
        if (!items.isEmpty()) {
            log.step(name, items.size() + " tasks");
        }
        try (var tracker = newTracker(name, items.size())) {
            log.attach(tracker);
            try {
                tracker.start();
                scheduler.run(items, tracker);
                tracker.done();
            } finally {
                log.detach();
            }
        }
    }

    ProgressTracker newTracker(String name, int size) {
        return new ProgressTracker(name, size, showProgress);
    }

    static void requireOutput(Artifact artifact) {
        if (!Files.isRegularFile(artifact.path())) {
            throw new ToolInvocationException("expected output " + artifact.path() + " was not produced");
        }
    }
}
